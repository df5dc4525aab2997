package dev.jobapplier.model;

/**
 * Best answers-map entry for a question, with its similarity score in [0, 1].
 */
public record AnswerCandidate(String key, String value, double score) {
}
