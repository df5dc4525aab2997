package dev.jobapplier.model;

import dev.jobapplier.entity.LearnedEntry;

/**
 * A learned entry found for a question, with the similarity that selected it (1.0 for an exact match).
 */
public record LearnedMatch(LearnedEntry entry, double similarity) {
}
