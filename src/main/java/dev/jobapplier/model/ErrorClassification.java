package dev.jobapplier.model;

import java.time.Instant;

/**
 * Result of inspecting the session after a failed attempt.
 */
public record ErrorClassification(ErrorKind kind, String message, Instant detectedAt) {

    public static ErrorClassification of(ErrorKind kind) {
        return new ErrorClassification(kind, kind.getDefaultMessage(), Instant.now());
    }

    public static ErrorClassification of(ErrorKind kind, String message) {
        String text = (message == null || message.isBlank()) ? kind.getDefaultMessage() : message;
        return new ErrorClassification(kind, text, Instant.now());
    }

    public static ErrorClassification none() {
        return of(ErrorKind.NONE);
    }

    public boolean isError() {
        return kind != ErrorKind.NONE;
    }
}
