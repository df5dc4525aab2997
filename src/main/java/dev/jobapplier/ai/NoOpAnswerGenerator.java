package dev.jobapplier.ai;

import dev.jobapplier.model.JobContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * No-op implementation of AnswerGenerator.
 * Used when no AI provider is configured; questions fall through to the static answers.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "none", matchIfMissing = true)
public class NoOpAnswerGenerator implements AnswerGenerator {

    public NoOpAnswerGenerator() {
        log.info("AI answer generation disabled - using no-op generator");
    }

    @Override
    public Mono<String> generateAnswer(String question, JobContext context) {
        return Mono.empty();
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
