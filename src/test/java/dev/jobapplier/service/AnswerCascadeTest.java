package dev.jobapplier.service;

import dev.jobapplier.ai.AnswerGenerator;
import dev.jobapplier.config.AnswerBook;
import dev.jobapplier.config.MatchingConfig;
import dev.jobapplier.entity.LearnedEntry;
import dev.jobapplier.metrics.AutomationMetrics;
import dev.jobapplier.model.AnswerSource;
import dev.jobapplier.model.AnsweredQuestion;
import dev.jobapplier.model.FillStatus;
import dev.jobapplier.model.FormFillReasons;
import dev.jobapplier.model.JobContext;
import dev.jobapplier.model.LearnedMatch;
import dev.jobapplier.model.Question;
import dev.jobapplier.model.QuestionOutcome;
import dev.jobapplier.model.WriteResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.openqa.selenium.WebElement;
import org.springframework.dao.DataAccessResourceFailureException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnswerCascadeTest {

    private static final JobContext JOB = JobContext.builder()
            .jobTitle("Senior Java Developer")
            .company("Acme")
            .build();

    @Mock
    private LearnedAnswerStore learnedAnswerStore;

    @Mock
    private AnswerGenerator answerGenerator;

    @Mock
    private FieldWriter fieldWriter;

    private AnswerBook answerBook;
    private SimpleMeterRegistry meterRegistry;
    private AnswerCascade cascade;

    @BeforeEach
    void setUp() {
        MatchingConfig matchingConfig = new MatchingConfig();
        answerBook = new AnswerBook();
        answerBook.getAnswers().put("years of experience", "5");
        meterRegistry = new SimpleMeterRegistry();
        cascade = new AnswerCascade(learnedAnswerStore, answerGenerator,
                new QuestionMatcher(fieldWriter, matchingConfig), answerBook, matchingConfig,
                new AutomationMetrics(meterRegistry));
    }

    private LearnedEntry learned(String normalized, String answer) {
        return LearnedEntry.builder().id(11L).questionNormalized(normalized).answer(answer).build();
    }

    @Nested
    @DisplayName("Learned answers")
    class LearnedTests {

        @Test
        @DisplayName("Should reuse a learned answer without calling the generator")
        void shouldReuseLearnedAnswer() {
            LearnedEntry entry = learned("why do you want to work here", "I admire the product");
            when(learnedAnswerStore.findMatch("Why do you want to work here?", 0.8))
                    .thenReturn(Optional.of(new LearnedMatch(entry, 1.0)));

            AnsweredQuestion answered = cascade.answerQuestion("Why do you want to work here?", JOB, 0.45);

            assertThat(answered.source()).isEqualTo(AnswerSource.LEARNED);
            assertThat(answered.answer()).isEqualTo("I admire the product");
            verify(learnedAnswerStore).recordUsage(11L);
            verify(answerGenerator, never()).generateAnswer(anyString(), any());
            assertThat(meterRegistry.counter("job_applier_answers_total", "source", "learned").count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should fall through when the store fails")
        void shouldFallThroughOnStoreFailure() {
            when(learnedAnswerStore.findMatch(anyString(), anyDouble()))
                    .thenThrow(new DataAccessResourceFailureException("database is locked"));
            when(answerGenerator.isEnabled()).thenReturn(false);

            AnsweredQuestion answered = cascade.answerQuestion("Years of experience?", JOB, 0.45);

            assertThat(answered.source()).isEqualTo(AnswerSource.STATIC);
            assertThat(answered.answer()).isEqualTo("5");
        }
    }

    @Nested
    @DisplayName("Generated answers")
    class GeneratedTests {

        @Test
        @DisplayName("Should generate, store and return an answer")
        void shouldGenerateAndStore() {
            when(learnedAnswerStore.findMatch(anyString(), anyDouble())).thenReturn(Optional.empty());
            when(answerGenerator.isEnabled()).thenReturn(true);
            when(answerGenerator.generateAnswer("Describe a challenging project", JOB))
                    .thenReturn(Mono.just("  Migrated a monolith to services.  "));

            AnsweredQuestion answered = cascade.answerQuestion("Describe a challenging project", JOB, 0.45);

            assertThat(answered.source()).isEqualTo(AnswerSource.GENERATED);
            assertThat(answered.answer()).isEqualTo("Migrated a monolith to services.");
            assertThat(answered.confidenceScore()).isEqualTo(0.9);
            verify(learnedAnswerStore).upsert("Describe a challenging project",
                    "  Migrated a monolith to services.  ", JOB);
        }

        @Test
        @DisplayName("Should fall back to static answers when the generator returns nothing")
        void shouldFallBackOnEmptyGeneration() {
            when(learnedAnswerStore.findMatch(anyString(), anyDouble())).thenReturn(Optional.empty());
            when(answerGenerator.isEnabled()).thenReturn(true);
            when(answerGenerator.generateAnswer(anyString(), eq(JOB))).thenReturn(Mono.empty());

            AnsweredQuestion answered = cascade.answerQuestion("Years of experience?", JOB, 0.45);

            assertThat(answered.source()).isEqualTo(AnswerSource.STATIC);
            verify(learnedAnswerStore, never()).upsert(anyString(), anyString(), any());
        }

        @Test
        @DisplayName("Should fall back when the generator errors")
        void shouldFallBackOnGeneratorError() {
            when(learnedAnswerStore.findMatch(anyString(), anyDouble())).thenReturn(Optional.empty());
            when(answerGenerator.isEnabled()).thenReturn(true);
            when(answerGenerator.generateAnswer(anyString(), any()))
                    .thenReturn(Mono.error(new IllegalStateException("boom")));

            AnsweredQuestion answered = cascade.answerQuestion("Years of experience?", JOB, 0.45);

            assertThat(answered.source()).isEqualTo(AnswerSource.STATIC);
        }
    }

    @Test
    @DisplayName("Should skip with an empty answer when every step comes up short")
    void shouldSkipWhenNothingMatches() {
        when(learnedAnswerStore.findMatch(anyString(), anyDouble())).thenReturn(Optional.empty());
        when(answerGenerator.isEnabled()).thenReturn(false);

        AnsweredQuestion answered = cascade.answerQuestion("Totally unrelated text", JOB, 0.45);

        assertThat(answered.source()).isEqualTo(AnswerSource.SKIPPED);
        assertThat(answered.answer()).isEmpty();
        assertThat(answered.reason()).isEqualTo(FormFillReasons.LOW_CONFIDENCE);
    }

    @Test
    @DisplayName("Should answer a question widget and write into its input")
    void shouldAnswerQuestionElement() {
        WebElement widget = WebElementMocks.withText("Years of experience?");
        when(learnedAnswerStore.findMatch(anyString(), anyDouble())).thenReturn(Optional.empty());
        when(answerGenerator.isEnabled()).thenReturn(false);
        when(fieldWriter.applyAnswer(widget, "5")).thenReturn(WriteResult.ok());

        QuestionOutcome outcome = cascade.answerQuestionElement(widget, JOB, 0.45);

        assertThat(outcome.status()).isEqualTo(FillStatus.FILLED);
        assertThat(outcome.answered().source()).isEqualTo(AnswerSource.STATIC);
    }

    @Test
    @DisplayName("Should record success only for learned and generated answers")
    void shouldMarkSubmitted() {
        Question generated = Question.of("Describe a challenging project", JOB);
        Question fromBook = Question.of("Years of experience?", JOB);
        when(learnedAnswerStore.recordSuccess("Describe a challenging project")).thenReturn(true);

        int updated = cascade.markSubmitted(List.of(
                AnsweredQuestion.answered(generated, "Migration", AnswerSource.GENERATED, 0.9),
                AnsweredQuestion.answered(fromBook, "5", AnswerSource.STATIC, 1.0),
                AnsweredQuestion.skipped(fromBook, 0.1, FormFillReasons.LOW_CONFIDENCE)));

        assertThat(updated).isEqualTo(1);
        verify(learnedAnswerStore, never()).recordSuccess("Years of experience?");
    }
}
