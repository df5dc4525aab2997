package dev.jobapplier.model;

/**
 * How an option of a {@code <select>} was chosen.
 */
public enum SelectStrategy {
    VISIBLE_TEXT,
    VALUE
}
