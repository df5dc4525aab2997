package dev.jobapplier.service;

import dev.jobapplier.config.MatchingConfig;
import dev.jobapplier.model.AnswerCandidate;
import dev.jobapplier.model.AnswerSource;
import dev.jobapplier.model.AnsweredQuestion;
import dev.jobapplier.model.FillStatus;
import dev.jobapplier.model.FormFillReasons;
import dev.jobapplier.model.JobContext;
import dev.jobapplier.model.Question;
import dev.jobapplier.model.QuestionOutcome;
import dev.jobapplier.model.WriteResult;
import dev.jobapplier.util.Elements;
import dev.jobapplier.util.TextSimilarity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.WebElement;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Matches question text and field labels against the configured answers.
 * <p>
 * Scoring: 1.0 when both sides normalize to the same text, otherwise the Jaccard similarity of their token sets.
 * Answers below the confidence gate are skipped instead of guessed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QuestionMatcher {

    private final FieldWriter fieldWriter;
    private final MatchingConfig matchingConfig;

    /**
     * Best answers-map entry for the question.
     *
     * @return the highest scoring entry, empty only when there is nothing to match against
     */
    public Optional<AnswerCandidate> matchAnswer(String question, Map<String, String> answers) {
        return bestMatch(List.of(question == null ? "" : question), answers);
    }

    /**
     * Best entry over several texts describing the same thing (e.g. every label candidate of a field).
     * On equal scores the earlier key wins.
     */
    public Optional<AnswerCandidate> bestMatch(Collection<String> texts, Map<String, String> answers) {
        AnswerCandidate best = null;
        for (Map.Entry<String, String> entry : answers.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                continue;
            }
            for (String text : texts) {
                double score = score(text, entry.getKey());
                if (best == null || score > best.score()) {
                    best = new AnswerCandidate(entry.getKey(), entry.getValue(), score);
                }
            }
        }
        return Optional.ofNullable(best);
    }

    public AnsweredQuestion answerQuestion(String text, Map<String, String> answers) {
        return answerQuestion(Question.of(text, JobContext.empty()), answers, matchingConfig.getQuestionMinScore());
    }

    public AnsweredQuestion answerQuestion(String text, Map<String, String> answers, double minScore) {
        return answerQuestion(Question.of(text, JobContext.empty()), answers, minScore);
    }

    /**
     * Static answer for the question, or a skip with reason {@code low_confidence} / {@code no_answer}.
     */
    public AnsweredQuestion answerQuestion(Question question, Map<String, String> answers, double minScore) {
        Optional<AnswerCandidate> match = matchAnswer(question.text(), answers);
        if (match.isEmpty()) {
            log.info("No configured answer for question '{}'", question.text());
            return AnsweredQuestion.skipped(question, 0.0, FormFillReasons.NO_ANSWER);
        }

        AnswerCandidate candidate = match.get();
        if (candidate.score() < minScore) {
            log.warn("Skipping question '{}': {} (best '{}' scored {})", question.text(),
                    FormFillReasons.LOW_CONFIDENCE, candidate.key(), String.format("%.2f", candidate.score()));
            return AnsweredQuestion.skipped(question, candidate.score(), FormFillReasons.LOW_CONFIDENCE);
        }

        log.debug("Matched '{}' to '{}' ({})", question.text(), candidate.key(), candidate.score());
        return AnsweredQuestion.answered(question, candidate.value(), AnswerSource.STATIC, candidate.score());
    }

    /**
     * Reads the question text of a container element, resolves it against the answers and writes the result
     * into the container's input.
     */
    public QuestionOutcome answerQuestionElement(WebElement questionElement, Map<String, String> answers,
            double minScore) {
        String text = Elements.text(questionElement);
        if (text.isBlank()) {
            return QuestionOutcome.skipped(
                    AnsweredQuestion.skipped(Question.of("", JobContext.empty()), 0.0, FormFillReasons.NO_TEXT));
        }
        return applyToElement(questionElement, answerQuestion(text, answers, minScore));
    }

    public List<QuestionOutcome> answerQuestionElements(List<WebElement> questionElements,
            Map<String, String> answers, double minScore) {
        List<QuestionOutcome> outcomes = new ArrayList<>();
        for (WebElement element : questionElements) {
            try {
                outcomes.add(answerQuestionElement(element, answers, minScore));
            } catch (RuntimeException e) {
                log.warn("Failed to answer question element: {}", e.getMessage());
            }
        }
        long filled = outcomes.stream().filter(o -> o.status() == FillStatus.FILLED).count();
        log.info("Answered {}/{} questions", filled, questionElements.size());
        return outcomes;
    }

    /**
     * Writes an answer decision into the element. Skipped answers are never written.
     */
    public QuestionOutcome applyToElement(WebElement questionElement, AnsweredQuestion answered) {
        if (answered.isSkipped()) {
            return QuestionOutcome.skipped(answered);
        }
        WriteResult write = fieldWriter.applyAnswer(questionElement, answered.answer());
        if (!write.success()) {
            log.warn("Could not write answer for '{}': {}", answered.question().text(), write.reason());
            return new QuestionOutcome(answered, FillStatus.FAILED, write.reason(), null);
        }
        if (write.selectStrategy() != null) {
            log.debug("Selected answer for '{}' by {}", answered.question().text(), write.selectStrategy());
        }
        return new QuestionOutcome(answered, FillStatus.FILLED, null, write.selectStrategy());
    }

    static double score(String text, String key) {
        if (TextSimilarity.sameNormalized(text, key)) {
            return 1.0;
        }
        return TextSimilarity.jaccard(text, key);
    }
}
