package dev.jobapplier.model;

import dev.jobapplier.util.TextSimilarity;

/**
 * A free-text application question with its normalized form and the job it was asked for.
 */
public record Question(String text, String normalizedText, JobContext context) {

    public static Question of(String text, JobContext context) {
        String raw = text == null ? "" : text.trim();
        return new Question(raw, TextSimilarity.normalize(raw), context == null ? JobContext.empty() : context);
    }
}
