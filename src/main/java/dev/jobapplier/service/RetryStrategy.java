package dev.jobapplier.service;

import dev.jobapplier.config.RecoveryConfig;
import dev.jobapplier.model.ErrorKind;
import dev.jobapplier.model.RetryState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Per-kind retry decisions and exponential backoff.
 * <ul>
 *   <li>CAPTCHA: never retried automatically, needs a human</li>
 *   <li>Rate limit / network error: retried with backoff; rate limits give up after
 *   {@code rateLimitMaxConsecutive} in a row</li>
 *   <li>Session timeout / login required: never retried</li>
 *   <li>Form not found: never retried, the item is skipped</li>
 *   <li>Unknown: retried at most {@code unknownMaxRetries} times</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetryStrategy {

    private final RecoveryConfig config;

    public RetryState newState() {
        return newState(config.getMaxRetries());
    }

    public RetryState newState(int maxRetries) {
        return new RetryState(config.getInitialBackoffSeconds(), maxRetries);
    }

    /**
     * Decide whether a failure of the given kind should be retried. Updates the consecutive rate-limit and
     * unknown-retry counters in {@code state}.
     */
    public boolean shouldRetry(ErrorKind kind, RetryState state) {
        if (kind != ErrorKind.RATE_LIMIT) {
            state.setConsecutiveRateLimitCount(0);
        }

        switch (kind) {
            case RATE_LIMIT:
                state.setConsecutiveRateLimitCount(state.getConsecutiveRateLimitCount() + 1);
                if (state.getConsecutiveRateLimitCount() >= config.getRateLimitMaxConsecutive()) {
                    log.warn("Max consecutive rate limits ({}) reached", config.getRateLimitMaxConsecutive());
                    return false;
                }
                return hasRetriesLeft(state);
            case NETWORK_ERROR:
                return hasRetriesLeft(state);
            case UNKNOWN:
                if (state.getUnknownRetryCount() >= config.getUnknownMaxRetries() || !hasRetriesLeft(state)) {
                    return false;
                }
                state.setUnknownRetryCount(state.getUnknownRetryCount() + 1);
                return true;
            case CAPTCHA:
            case SESSION_TIMEOUT:
            case LOGIN_REQUIRED:
            case FORM_NOT_FOUND:
            case NONE:
            default:
                return false;
        }
    }

    /**
     * Returns the wait before the next attempt and advances the backoff:
     * {@code backoff = min(backoff * multiplier, maxBackoff)}. Also counts the retry.
     *
     * @return seconds to wait
     */
    public double nextBackoff(RetryState state) {
        double wait = Math.min(state.getCurrentBackoffSeconds(), config.getMaxBackoffSeconds());
        state.setCurrentBackoffSeconds(Math.min(
                state.getCurrentBackoffSeconds() * config.getBackoffMultiplier(),
                config.getMaxBackoffSeconds()));
        state.setAttempt(state.getAttempt() + 1);
        return wait;
    }

    /**
     * Back to the initial backoff after a success.
     */
    public void reset(RetryState state) {
        state.setAttempt(0);
        state.setCurrentBackoffSeconds(config.getInitialBackoffSeconds());
        state.setConsecutiveRateLimitCount(0);
        state.setUnknownRetryCount(0);
        state.setCaptchaPauseCount(0);
    }

    private boolean hasRetriesLeft(RetryState state) {
        return state.getAttempt() < state.getMaxRetries();
    }
}
