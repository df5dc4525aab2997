package dev.jobapplier.config;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Static answers configured by the applicant, keyed by question or field label.
 */
@Data
public class AnswerBook {
    private Map<String, String> answers = new LinkedHashMap<>();
    private String resumePath;

    /**
     * Answers plus the resume path under the "resume" key, ready for form filling.
     */
    public Map<String, String> asFormAnswers() {
        Map<String, String> all = new LinkedHashMap<>(answers);
        if (resumePath != null && !resumePath.isBlank()) {
            all.putIfAbsent("resume", resumePath);
        }
        return all;
    }
}
