package dev.jobapplier.service;

import dev.jobapplier.config.RecoveryConfig;
import dev.jobapplier.metrics.AutomationMetrics;
import dev.jobapplier.session.SessionContext;
import dev.jobapplier.session.Sleeper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds one {@link ErrorRecoveryManager} per browser session.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ErrorRecoveryManagerFactory {

    private final ErrorDetector errorDetector;
    private final RetryStrategy retryStrategy;
    private final RecoveryConfig recoveryConfig;
    private final AutomationMetrics metrics;

    public ErrorRecoveryManager create(SessionContext session) {
        log.debug("Creating error recovery manager (max retries {}, backoff {}s..{}s)",
                recoveryConfig.getMaxRetries(), recoveryConfig.getInitialBackoffSeconds(),
                recoveryConfig.getMaxBackoffSeconds());
        return new ErrorRecoveryManager(session, errorDetector, retryStrategy, recoveryConfig, metrics,
                Sleeper.SYSTEM);
    }
}
