package dev.jobapplier.ai;

import dev.jobapplier.model.JobContext;
import reactor.core.publisher.Mono;

/**
 * External answer generation for application questions.
 * Implementations are selected with {@code app.ai.provider}.
 */
public interface AnswerGenerator {

    /**
     * Generate an answer for a question.
     *
     * @param question the question as shown on the form
     * @param context  the job being applied to
     * @return the answer, or an empty Mono when nothing usable came back. Never signals an error for
     *         remote failures.
     */
    Mono<String> generateAnswer(String question, JobContext context);

    /**
     * Check if generation is available.
     *
     * @return true if the provider is configured
     */
    boolean isEnabled();
}
