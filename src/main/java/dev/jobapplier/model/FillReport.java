package dev.jobapplier.model;

import java.util.List;

/**
 * Result of one fill pass over a form.
 */
public record FillReport(List<FieldFillResult> fields) {

    public FillReport {
        fields = List.copyOf(fields);
    }

    public long count(FillStatus status) {
        return fields.stream().filter(f -> f.status() == status).count();
    }

    public long filledCount() {
        return count(FillStatus.FILLED);
    }

    public long failedCount() {
        return count(FillStatus.FAILED);
    }

    /**
     * Fields that were reported rather than filled because they carry no label at all.
     */
    public List<FieldFillResult> unlabeled() {
        return fields.stream()
                .filter(f -> FormFillReasons.NO_LABEL.equals(f.reason()))
                .toList();
    }
}
