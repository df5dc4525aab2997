package dev.jobapplier.model;

import lombok.Data;

/**
 * Mutable backoff bookkeeping for one {@code attemptWithRecovery} call.
 */
@Data
public class RetryState {

    private int attempt;
    private double currentBackoffSeconds;
    private int consecutiveRateLimitCount;
    private int unknownRetryCount;
    private int captchaPauseCount;
    private int maxRetries;

    public RetryState(double initialBackoffSeconds, int maxRetries) {
        this.currentBackoffSeconds = initialBackoffSeconds;
        this.maxRetries = maxRetries;
    }
}
