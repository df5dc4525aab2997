package dev.jobapplier.service;

import dev.jobapplier.ai.AnswerGenerator;
import dev.jobapplier.config.AnswerBook;
import dev.jobapplier.config.MatchingConfig;
import dev.jobapplier.metrics.AutomationMetrics;
import dev.jobapplier.model.AnswerSource;
import dev.jobapplier.model.AnsweredQuestion;
import dev.jobapplier.model.FormFillReasons;
import dev.jobapplier.model.JobContext;
import dev.jobapplier.model.LearnedMatch;
import dev.jobapplier.model.Question;
import dev.jobapplier.model.QuestionOutcome;
import dev.jobapplier.util.Elements;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.WebElement;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Resolves free-text questions through an ordered fallback: learned answers, the answer generator, the static
 * answer book, then a skip.
 * <p>
 * A failing step falls through to the next one; nothing here throws for a single question.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnswerCascade {

    private final LearnedAnswerStore learnedAnswerStore;
    private final AnswerGenerator answerGenerator;
    private final QuestionMatcher questionMatcher;
    private final AnswerBook answerBook;
    private final MatchingConfig matchingConfig;
    private final AutomationMetrics metrics;

    public AnsweredQuestion answerQuestion(String question, JobContext context) {
        return answerQuestion(question, context, matchingConfig.getQuestionMinScore());
    }

    /**
     * Answer a question.
     *
     * @param text     the question text
     * @param context  the job being applied to, may be null
     * @param minScore confidence gate; answers below it are skipped
     * @return the answer with its source and confidence
     */
    public AnsweredQuestion answerQuestion(String text, JobContext context, double minScore) {
        Question question = Question.of(text, context);
        AnsweredQuestion answered = resolve(question, minScore);
        metrics.recordAnswer(answered.source());
        if (answered.isSkipped()) {
            log.warn("Skipped question '{}': {}", question.text(), answered.reason());
        } else {
            log.info("Answered '{}' from {} ({})", question.text(), answered.source(),
                    String.format("%.2f", answered.confidenceScore()));
        }
        return answered;
    }

    /**
     * Answer a question widget on the page and write the answer into its input.
     */
    public QuestionOutcome answerQuestionElement(WebElement questionElement, JobContext context, double minScore) {
        String text = Elements.text(questionElement);
        if (text.isBlank()) {
            return QuestionOutcome.skipped(
                    AnsweredQuestion.skipped(Question.of("", context), 0.0, FormFillReasons.NO_TEXT));
        }
        return questionMatcher.applyToElement(questionElement, answerQuestion(text, context, minScore));
    }

    /**
     * Count the learned entries behind submitted answers as successful. Skipped answers are ignored.
     *
     * @return number of learned entries updated
     */
    public int markSubmitted(List<AnsweredQuestion> submitted) {
        int updated = 0;
        for (AnsweredQuestion answered : submitted) {
            if (answered.isSkipped() || answered.source() == AnswerSource.STATIC) {
                continue;
            }
            try {
                if (learnedAnswerStore.recordSuccess(answered.question().text())) {
                    updated++;
                }
            } catch (RuntimeException e) {
                log.warn("Could not record success for '{}': {}", answered.question().text(), e.getMessage());
            }
        }
        return updated;
    }

    private AnsweredQuestion resolve(Question question, double minScore) {
        if (question.normalizedText().isEmpty()) {
            return AnsweredQuestion.skipped(question, 0.0, FormFillReasons.NO_TEXT);
        }

        Optional<AnsweredQuestion> learned = fromLearned(question, minScore);
        if (learned.isPresent()) {
            return learned.get();
        }

        Optional<AnsweredQuestion> generated = fromGenerator(question, minScore);
        if (generated.isPresent()) {
            return generated.get();
        }

        return fromAnswerBook(question, minScore);
    }

    private Optional<AnsweredQuestion> fromLearned(Question question, double minScore) {
        try {
            Optional<LearnedMatch> match = learnedAnswerStore.findMatch(
                    question.text(), matchingConfig.getLearnedReuseThreshold());
            if (match.isEmpty() || match.get().entry().getAnswer() == null
                    || match.get().entry().getAnswer().isBlank()) {
                return Optional.empty();
            }
            if (match.get().similarity() < minScore) {
                return Optional.empty();
            }
            learnedAnswerStore.recordUsage(match.get().entry().getId());
            return Optional.of(AnsweredQuestion.answered(question, match.get().entry().getAnswer(),
                    AnswerSource.LEARNED, match.get().similarity()));
        } catch (RuntimeException e) {
            log.warn("Learned answer lookup failed for '{}': {}", question.text(), e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<AnsweredQuestion> fromGenerator(Question question, double minScore) {
        if (!answerGenerator.isEnabled() || matchingConfig.getGeneratedConfidence() < minScore) {
            return Optional.empty();
        }

        String answer;
        try {
            answer = answerGenerator.generateAnswer(question.text(), question.context())
                    .block(Duration.ofSeconds(matchingConfig.getGeneratorTimeoutSeconds()));
        } catch (RuntimeException e) {
            log.warn("Answer generator failed for '{}': {}", question.text(), e.getMessage());
            return Optional.empty();
        }
        if (answer == null || answer.isBlank()) {
            return Optional.empty();
        }

        try {
            learnedAnswerStore.upsert(question.text(), answer, question.context());
        } catch (RuntimeException e) {
            log.warn("Could not store generated answer for '{}': {}", question.text(), e.getMessage());
        }
        return Optional.of(AnsweredQuestion.answered(question, answer.trim(), AnswerSource.GENERATED,
                matchingConfig.getGeneratedConfidence()));
    }

    private AnsweredQuestion fromAnswerBook(Question question, double minScore) {
        try {
            return questionMatcher.answerQuestion(question, answerBook.getAnswers(), minScore);
        } catch (RuntimeException e) {
            log.warn("Static answer lookup failed for '{}': {}", question.text(), e.getMessage());
            return AnsweredQuestion.skipped(question, 0.0, FormFillReasons.NO_ANSWER);
        }
    }
}
