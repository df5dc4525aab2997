package dev.jobapplier;

import dev.jobapplier.entity.LearnedEntry;
import dev.jobapplier.model.AnsweredQuestion;
import dev.jobapplier.model.JobContext;
import dev.jobapplier.service.AnswerCascade;
import dev.jobapplier.service.LearnedAnswerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Command-line entry into the question bank: reports what has been learned so far and answers the questions
 * passed as arguments.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QuestionBankRunner {

    private static final String SEPARATOR = "========================================";

    private final LearnedAnswerStore learnedAnswerStore;
    private final AnswerCascade answerCascade;

    @Value("${app.report-top-entries:10}")
    private int reportTopEntries;

    /**
     * Logs the learned store summary, then resolves each argument as a question.
     *
     * @param questions free-text questions, may be empty
     * @return number of questions that got an answer
     */
    public int execute(String... questions) {
        log.info(SEPARATOR);
        log.info("Job Applier question bank: {} learned answers", learnedAnswerStore.count());
        log.info(SEPARATOR);

        List<LearnedEntry> top = learnedAnswerStore.topEntries(reportTopEntries);
        for (LearnedEntry entry : top) {
            log.info("[{} uses, {} submitted] {}", entry.getTimesUsed(), entry.getSuccessCount(), entry.getQuestion());
        }

        int answered = 0;
        for (String question : questions) {
            if (question == null || question.isBlank() || question.startsWith("--")) {
                continue;
            }
            AnsweredQuestion result = answerCascade.answerQuestion(question, JobContext.empty());
            if (result.isSkipped()) {
                log.info("Q: {} -> skipped ({})", question, result.reason());
            } else {
                answered++;
                log.info("Q: {} -> {} [{}]", question, result.answer(), result.source());
            }
        }
        return answered;
    }
}
