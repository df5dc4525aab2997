package dev.jobapplier.service;

import dev.jobapplier.config.RecoveryConfig;
import dev.jobapplier.metrics.AutomationMetrics;
import dev.jobapplier.model.ErrorClassification;
import dev.jobapplier.model.ErrorKind;
import dev.jobapplier.model.RecoveryResult;
import dev.jobapplier.model.RetryState;
import dev.jobapplier.session.SessionContext;
import dev.jobapplier.session.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Runs a session step, classifies its failures and retries the recoverable ones.
 * <p>
 * One instance per browser session, created by {@link ErrorRecoveryManagerFactory}. Attempts within one call
 * are strictly sequential; waits are blocking sleeps. Never throws: every failure is reported in the returned
 * {@link RecoveryResult}.
 */
@Slf4j
public class ErrorRecoveryManager {

    static final String STOPPED_MESSAGE = "Stopped by user";

    private static final Logger CAPTCHA_EVENTS = LoggerFactory.getLogger("captcha-events");

    private final SessionContext session;
    private final ErrorDetector detector;
    private final RetryStrategy retryStrategy;
    private final RecoveryConfig config;
    private final AutomationMetrics metrics;
    private final Sleeper sleeper;

    private final Semaphore resumeSignal = new Semaphore(0);
    private volatile Consumer<String> captchaPauseListener = message -> {
    };

    public ErrorRecoveryManager(
            SessionContext session,
            ErrorDetector detector,
            RetryStrategy retryStrategy,
            RecoveryConfig config,
            AutomationMetrics metrics,
            Sleeper sleeper) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.detector = detector;
        this.retryStrategy = retryStrategy;
        this.config = config;
        this.metrics = metrics;
        this.sleeper = sleeper;
    }

    public RecoveryResult attemptWithRecovery(BooleanSupplier action, String actionName) {
        return attemptWithRecovery(action, actionName, config.getMaxRetries());
    }

    /**
     * Execute {@code action} until it succeeds, a non-retryable error is detected, retries run out or a stop
     * is requested.
     *
     * @param action     step to run, returns true on success
     * @param actionName name used in logs
     * @param maxRetries retry budget for this call only
     * @return success flag and, on failure, a human-readable message
     */
    public RecoveryResult attemptWithRecovery(BooleanSupplier action, String actionName, int maxRetries) {
        RetryState state = retryStrategy.newState(maxRetries);
        int attempts = 0;

        while (true) {
            if (session.isStopRequested()) {
                log.info("{} stopped before attempt {}", actionName, attempts + 1);
                return finish(RecoveryResult.stopped(STOPPED_MESSAGE, attempts));
            }

            attempts++;
            metrics.recordAttempt();
            log.info("Attempting {} (attempt {})...", actionName, attempts);

            String exceptionMessage = null;
            boolean succeeded;
            try {
                succeeded = action.getAsBoolean();
            } catch (RuntimeException e) {
                log.warn("Exception during {}: {}", actionName, e.getMessage());
                exceptionMessage = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                succeeded = false;
            }

            if (succeeded) {
                retryStrategy.reset(state);
                log.info("{} succeeded", actionName);
                return finish(RecoveryResult.succeeded(attempts));
            }

            ErrorClassification error = classifyFailure(exceptionMessage);
            metrics.recordError(error.kind());

            if (error.kind() == ErrorKind.CAPTCHA) {
                if (!config.isCaptchaBlockingWait() || state.getCaptchaPauseCount() >= state.getMaxRetries()) {
                    log.warn("{} blocked by CAPTCHA. Returning control for manual intervention.", actionName);
                    CAPTCHA_EVENTS.warn("detected url={} note={}", currentUrlOrBlank(), error.message());
                    return finish(RecoveryResult.failed(ErrorKind.CAPTCHA,
                            "CAPTCHA detected: " + error.message(), attempts));
                }
                if (!awaitCaptchaResume(error, state)) {
                    return finish(RecoveryResult.failed(ErrorKind.CAPTCHA,
                            "CAPTCHA timeout: " + error.message(), attempts));
                }
                continue;
            }

            if (retryStrategy.shouldRetry(error.kind(), state)) {
                double seconds = retryStrategy.nextBackoff(state);
                log.warn("{} failed: {} - {}. Waiting {} seconds before retry...",
                        actionName, error.kind(), error.message(), String.format("%.0f", seconds));
                if (!sleepBackoff(seconds)) {
                    return finish(RecoveryResult.failed(error.kind(),
                            "Interrupted while waiting to retry " + actionName, attempts));
                }
                continue;
            }

            return finish(giveUp(actionName, error, attempts));
        }
    }

    /**
     * One-shot check of the current page without running an action.
     *
     * @return the classification, {@link ErrorKind#NONE} when the page looks healthy
     */
    public ErrorClassification checkForError() {
        ErrorClassification error = detector.detectError(session);
        if (error.isError()) {
            log.warn("Error detected: {} - {}", error.kind(), error.message());
        }
        return error;
    }

    /**
     * Releases a blocked CAPTCHA wait. Safe to call from another thread.
     */
    public void resume() {
        resumeSignal.release();
        CAPTCHA_EVENTS.info("resume_requested url={}", currentUrlOrBlank());
        log.info("Resume requested (captcha)");
    }

    /**
     * Called with the CAPTCHA message when a blocking wait starts.
     */
    public void setCaptchaPauseListener(Consumer<String> listener) {
        this.captchaPauseListener = listener == null ? message -> {
        } : listener;
    }

    public SessionContext getSession() {
        return session;
    }

    private ErrorClassification classifyFailure(String exceptionMessage) {
        ErrorClassification error = detector.detectError(session);
        if (error.kind() != ErrorKind.NONE) {
            return error;
        }
        String message = exceptionMessage != null
                ? exceptionMessage
                : "Action reported failure without a detectable error";
        return ErrorClassification.of(ErrorKind.UNKNOWN, message);
    }

    private RecoveryResult giveUp(String actionName, ErrorClassification error, int attempts) {
        ErrorKind kind = error.kind();
        if (kind == ErrorKind.FORM_NOT_FOUND) {
            log.info("{} skipped: {}", actionName, error.message());
            return RecoveryResult.failed(kind, error.message(), attempts);
        }
        if (kind.isFatal()) {
            log.error("{} stopped: {}", actionName, error.message());
            return RecoveryResult.failed(kind, error.message(), attempts);
        }
        if (attempts > 1) {
            log.error("{} failed after {} attempts: {}", actionName, attempts, error.message());
            return RecoveryResult.failed(kind,
                    error.message() + " (gave up after " + attempts + " attempts)", attempts);
        }
        log.error("{} failed: {}", actionName, error.message());
        return RecoveryResult.failed(kind, error.message(), attempts);
    }

    private boolean awaitCaptchaResume(ErrorClassification error, RetryState state) {
        state.setCaptchaPauseCount(state.getCaptchaPauseCount() + 1);
        resumeSignal.drainPermits();
        CAPTCHA_EVENTS.warn("paused url={} note={}", currentUrlOrBlank(), error.message());
        log.warn("CAPTCHA detected. Pausing automation for up to {} seconds. Solve it and resume.",
                config.getCaptchaMaxWaitSeconds());
        try {
            captchaPauseListener.accept(error.message());
        } catch (RuntimeException e) {
            log.warn("CAPTCHA pause listener failed: {}", e.getMessage());
        }

        try {
            if (!resumeSignal.tryAcquire(config.getCaptchaMaxWaitSeconds(), TimeUnit.SECONDS)) {
                CAPTCHA_EVENTS.error("timeout url={} note={}", currentUrlOrBlank(), error.message());
                log.error("CAPTCHA wait timed out");
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("CAPTCHA wait interrupted");
            return false;
        }
        CAPTCHA_EVENTS.info("resumed url={}", currentUrlOrBlank());
        log.info("Resuming after CAPTCHA by user action");
        return true;
    }

    private boolean sleepBackoff(double seconds) {
        Duration wait = Duration.ofMillis(Math.round(seconds * 1000));
        try {
            sleeper.sleep(wait);
            metrics.recordBackoff(wait);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Backoff wait interrupted");
            return false;
        }
    }

    private RecoveryResult finish(RecoveryResult result) {
        metrics.recordOutcome(result.success());
        return result;
    }

    private String currentUrlOrBlank() {
        try {
            String url = session.currentUrl();
            return url == null ? "" : url;
        } catch (RuntimeException e) {
            log.debug("Current URL unavailable: {}", e.getMessage());
            return "";
        }
    }
}
