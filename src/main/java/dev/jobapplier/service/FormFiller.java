package dev.jobapplier.service;

import dev.jobapplier.config.MatchingConfig;
import dev.jobapplier.metrics.AutomationMetrics;
import dev.jobapplier.model.AnswerCandidate;
import dev.jobapplier.model.FieldDescriptor;
import dev.jobapplier.model.FieldFillResult;
import dev.jobapplier.model.FieldType;
import dev.jobapplier.model.FillReport;
import dev.jobapplier.model.FormFillReasons;
import dev.jobapplier.model.WriteResult;
import dev.jobapplier.util.TextSimilarity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.SearchContext;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.IntConsumer;

/**
 * Fills a form from an answers map. Field failures are recorded in the {@link FillReport}; they never abort
 * the rest of the form.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FormFiller {

    private final FieldDetector fieldDetector;
    private final FieldWriter fieldWriter;
    private final QuestionMatcher questionMatcher;
    private final MatchingConfig matchingConfig;
    private final AutomationMetrics metrics;

    public FillReport fillForm(SearchContext form, Map<String, String> answers) {
        return fillForm(form, answers, null);
    }

    /**
     * Detect and fill every field of the form.
     *
     * @param form             form element or driver
     * @param answers          answers keyed by label or question text
     * @param progressListener receives the completed percentage after each field, may be null
     * @return one result per detected field
     */
    public FillReport fillForm(SearchContext form, Map<String, String> answers, IntConsumer progressListener) {
        List<FieldDescriptor> fields = fieldDetector.detectFields(form);
        List<FieldFillResult> results = new ArrayList<>(fields.size());

        for (int i = 0; i < fields.size(); i++) {
            FieldFillResult result = fillField(fields.get(i), i, answers);
            results.add(result);
            metrics.recordField(result.status());
            if (progressListener != null) {
                progressListener.accept((i + 1) * 100 / fields.size());
            }
        }

        FillReport report = new FillReport(results);
        log.info("Filled {}/{} fields ({} failed, {} unlabeled)",
                report.filledCount(), fields.size(), report.failedCount(), report.unlabeled().size());
        return report;
    }

    /**
     * File inputs whose label candidates mention a resume keyword.
     */
    public List<FieldDescriptor> findResumeFields(SearchContext form) {
        return fieldDetector.detectFields(form).stream()
                .filter(f -> f.getFieldType() == FieldType.FILE)
                .filter(f -> isResumeLike(f.getLabelCandidates()))
                .toList();
    }

    FieldFillResult fillField(FieldDescriptor field, int index, Map<String, String> answers) {
        String key = field.displayKey(index);
        FieldType type = field.getFieldType();

        if (!field.isMatchable()) {
            log.warn("Field {} has no label, reporting it unfilled", key);
            return FieldFillResult.skipped(key, type, 0.0, FormFillReasons.NO_LABEL);
        }

        Optional<AnswerCandidate> match = type == FieldType.FILE
                ? matchFile(field, answers)
                : questionMatcher.bestMatch(field.getLabelCandidates(), answers);
        if (match.isEmpty()) {
            return FieldFillResult.skipped(key, type, 0.0, FormFillReasons.NO_ANSWER);
        }

        AnswerCandidate candidate = match.get();
        if (candidate.score() <= matchingConfig.getFieldMatchThreshold()) {
            log.debug("No confident answer for field {} (best '{}' scored {})", key, candidate.key(), candidate.score());
            return FieldFillResult.skipped(key, type, candidate.score(), FormFillReasons.LOW_CONFIDENCE);
        }

        WriteResult write;
        try {
            write = fieldWriter.write(field.getElement(), type, candidate.value());
        } catch (RuntimeException e) {
            log.warn("Failed to fill field {}: {}", key, e.getMessage());
            write = WriteResult.failed(FormFillReasons.FILL_FAILED);
        }

        if (write.isOtherOption()) {
            log.debug("Left radio {} unchecked, answer '{}' belongs to another option", key, candidate.value());
            return FieldFillResult.skipped(key, type, candidate.score(), write.reason());
        }
        if (!write.success()) {
            return FieldFillResult.failed(key, type, candidate.key(), candidate.score(), write.reason());
        }
        log.debug("Filled field {} from '{}'", key, candidate.key());
        return FieldFillResult.filled(key, type, candidate.key(), candidate.score());
    }

    // resume inputs take the first resume-like answer key; other file inputs match by label
    private Optional<AnswerCandidate> matchFile(FieldDescriptor field, Map<String, String> answers) {
        if (isResumeLike(field.getLabelCandidates())) {
            for (Map.Entry<String, String> entry : answers.entrySet()) {
                if (entry.getValue() != null && isResumeLike(List.of(entry.getKey()))) {
                    return Optional.of(new AnswerCandidate(entry.getKey(), entry.getValue(), 1.0));
                }
            }
        }
        return questionMatcher.bestMatch(field.getLabelCandidates(), answers);
    }

    private boolean isResumeLike(Collection<String> texts) {
        for (String text : texts) {
            for (String keyword : matchingConfig.getResumeKeywords()) {
                if (TextSimilarity.containsKeyword(text, keyword)) {
                    return true;
                }
            }
        }
        return false;
    }
}
