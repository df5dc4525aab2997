package dev.jobapplier.model;

/**
 * Classified failure of a session step.
 */
public enum ErrorKind {
    CAPTCHA("CAPTCHA detected - manual verification required"),
    RATE_LIMIT("Rate limit or throttling detected"),
    SESSION_TIMEOUT("Session timeout - re-login required"),
    NETWORK_ERROR("Network error detected"),
    FORM_NOT_FOUND("Application form not found"),
    LOGIN_REQUIRED("Login required - re-login required"),
    UNKNOWN("Unknown error"),
    NONE("No error detected");

    private final String defaultMessage;

    ErrorKind(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    /**
     * Kinds that end the current action immediately and require the caller to re-authenticate.
     */
    public boolean isFatal() {
        return this == SESSION_TIMEOUT || this == LOGIN_REQUIRED;
    }

    /**
     * Kinds retried automatically with exponential backoff.
     */
    public boolean isRecoverable() {
        return this == RATE_LIMIT || this == NETWORK_ERROR;
    }
}
