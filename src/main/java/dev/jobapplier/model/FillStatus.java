package dev.jobapplier.model;

public enum FillStatus {
    FILLED,
    SKIPPED,
    FAILED
}
