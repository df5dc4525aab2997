package dev.jobapplier.model;

public enum AnswerSource {
    LEARNED,
    GENERATED,
    STATIC,
    SKIPPED
}
