package dev.jobapplier.metrics;

import dev.jobapplier.model.AnswerSource;
import dev.jobapplier.model.ErrorKind;
import dev.jobapplier.model.FillStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Micrometer metrics for recovery, form filling and question answering.
 */
@Component
public class AutomationMetrics {

    private static final String TAG_KIND = "kind";
    private static final String TAG_OUTCOME = "outcome";
    private static final String TAG_SOURCE = "source";
    private static final String TAG_STATUS = "status";

    private final MeterRegistry registry;

    private final Counter attemptsCounter;
    private final Timer backoffTimer;

    public AutomationMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.attemptsCounter = Counter.builder("job_applier_recovery_attempts_total")
                .description("Total action attempts made under error recovery")
                .register(registry);

        this.backoffTimer = Timer.builder("job_applier_backoff_wait")
                .description("Time spent waiting between retries")
                .register(registry);
    }

    /**
     * Record one execution of a wrapped action.
     */
    public void recordAttempt() {
        attemptsCounter.increment();
    }

    /**
     * Record the final outcome of an attemptWithRecovery call.
     */
    public void recordOutcome(boolean success) {
        Counter.builder("job_applier_recovery_outcomes_total")
                .tag(TAG_OUTCOME, success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    /**
     * Record a classified error.
     */
    public void recordError(ErrorKind kind) {
        Counter.builder("job_applier_recovery_errors_total")
                .tag(TAG_KIND, tagValue(kind))
                .register(registry)
                .increment();
    }

    public void recordBackoff(Duration wait) {
        backoffTimer.record(wait);
    }

    /**
     * Record where an answer came from.
     */
    public void recordAnswer(AnswerSource source) {
        Counter.builder("job_applier_answers_total")
                .tag(TAG_SOURCE, tagValue(source))
                .register(registry)
                .increment();
    }

    /**
     * Record the fill status of a form field.
     */
    public void recordField(FillStatus status) {
        Counter.builder("job_applier_fields_total")
                .tag(TAG_STATUS, tagValue(status))
                .register(registry)
                .increment();
    }

    private String tagValue(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
