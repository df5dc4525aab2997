package dev.jobapplier.model;

/**
 * Outcome of {@code attemptWithRecovery}: {@code success} and {@code errorMessage} form the pair handed back to
 * the caller, {@code errorKind} and {@code attempts} are there for logging and skip/stop decisions.
 * {@code stopped} is set when the caller cancelled the session; {@code errorKind} is then {@link ErrorKind#NONE}.
 */
public record RecoveryResult(boolean success, String errorMessage, ErrorKind errorKind, int attempts,
        boolean stopped) {

    public static RecoveryResult succeeded(int attempts) {
        return new RecoveryResult(true, null, ErrorKind.NONE, attempts, false);
    }

    public static RecoveryResult failed(ErrorKind kind, String message, int attempts) {
        return new RecoveryResult(false, message, kind, attempts, false);
    }

    public static RecoveryResult stopped(String message, int attempts) {
        return new RecoveryResult(false, message, ErrorKind.NONE, attempts, true);
    }

    /**
     * The current item should be skipped but the session can continue.
     */
    public boolean isSkippable() {
        return !success && errorKind == ErrorKind.FORM_NOT_FOUND;
    }

    public boolean requiresReauthentication() {
        return !success && errorKind.isFatal();
    }
}
