package dev.jobapplier.model;

/**
 * Per-field line of a {@link FillReport}.
 *
 * @param fieldKey   display key of the field
 * @param fieldType  detected type
 * @param status     what happened
 * @param matchedKey answers-map key used, null when nothing matched
 * @param score      best match score
 * @param reason     short machine-readable reason for skips and failures
 */
public record FieldFillResult(
        String fieldKey,
        FieldType fieldType,
        FillStatus status,
        String matchedKey,
        double score,
        String reason) {

    public static FieldFillResult filled(String fieldKey, FieldType type, String matchedKey, double score) {
        return new FieldFillResult(fieldKey, type, FillStatus.FILLED, matchedKey, score, null);
    }

    public static FieldFillResult failed(String fieldKey, FieldType type, String matchedKey, double score,
            String reason) {
        return new FieldFillResult(fieldKey, type, FillStatus.FAILED, matchedKey, score, reason);
    }

    public static FieldFillResult skipped(String fieldKey, FieldType type, double score, String reason) {
        return new FieldFillResult(fieldKey, type, FillStatus.SKIPPED, null, score, reason);
    }
}
