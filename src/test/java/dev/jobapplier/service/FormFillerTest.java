package dev.jobapplier.service;

import dev.jobapplier.config.MatchingConfig;
import dev.jobapplier.metrics.AutomationMetrics;
import dev.jobapplier.model.FieldDescriptor;
import dev.jobapplier.model.FieldFillResult;
import dev.jobapplier.model.FieldType;
import dev.jobapplier.model.FillReport;
import dev.jobapplier.model.FillStatus;
import dev.jobapplier.model.FormFillReasons;
import dev.jobapplier.model.WriteResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.openqa.selenium.By;
import org.openqa.selenium.SearchContext;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static dev.jobapplier.service.WebElementMocks.input;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FormFillerTest {

    @Mock
    private FieldDetector fieldDetector;

    @Mock
    private FieldWriter fieldWriter;

    @Mock
    private SearchContext form;

    private SimpleMeterRegistry meterRegistry;
    private FormFiller formFiller;
    private Map<String, String> answers;

    @BeforeEach
    void setUp() {
        MatchingConfig matchingConfig = new MatchingConfig();
        meterRegistry = new SimpleMeterRegistry();
        formFiller = new FormFiller(fieldDetector, fieldWriter, new QuestionMatcher(fieldWriter, matchingConfig),
                matchingConfig, new AutomationMetrics(meterRegistry));

        answers = new LinkedHashMap<>();
        answers.put("years of experience", "5");
        answers.put("phone number", "555-0100");
        answers.put("resume", "/home/me/resume.pdf");
    }

    private FieldDescriptor field(FieldType type, String... labels) {
        return FieldDescriptor.builder()
                .element(mock(WebElement.class))
                .labelCandidates(List.of(labels))
                .fieldType(type)
                .build();
    }

    @Nested
    @DisplayName("Matching")
    class MatchingTests {

        @Test
        @DisplayName("Should fill a field whose label normalizes to an answer key")
        void shouldFillExactMatch() {
            FieldDescriptor years = field(FieldType.TEXT, "years_experience", "Years of experience?");
            when(fieldDetector.detectFields(form)).thenReturn(List.of(years));
            when(fieldWriter.write(years.getElement(), FieldType.TEXT, "5")).thenReturn(WriteResult.ok());

            FillReport report = formFiller.fillForm(form, answers);

            FieldFillResult result = report.fields().get(0);
            assertThat(result.status()).isEqualTo(FillStatus.FILLED);
            assertThat(result.fieldKey()).isEqualTo("years_experience");
            assertThat(result.matchedKey()).isEqualTo("years of experience");
            assertThat(result.score()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should fill a close fuzzy match above the threshold")
        void shouldFillFuzzyMatch() {
            FieldDescriptor phone = field(FieldType.TEXT, "mobile phone number");
            when(fieldDetector.detectFields(form)).thenReturn(List.of(phone));
            when(fieldWriter.write(phone.getElement(), FieldType.TEXT, "555-0100")).thenReturn(WriteResult.ok());

            FieldFillResult result = formFiller.fillForm(form, answers).fields().get(0);

            assertThat(result.status()).isEqualTo(FillStatus.FILLED);
            assertThat(result.score()).isGreaterThan(0.6);
        }

        @Test
        @DisplayName("Should not fill a field scoring exactly at the threshold")
        void shouldRequireScoreAboveThreshold() {
            FieldDescriptor name = field(FieldType.TEXT, "first middle last");
            when(fieldDetector.detectFields(form)).thenReturn(List.of(name));

            FieldFillResult result = formFiller.fillForm(form, Map.of("first middle last name suffix", "Ada"))
                    .fields().get(0);

            assertThat(result.status()).isEqualTo(FillStatus.SKIPPED);
            assertThat(result.reason()).isEqualTo(FormFillReasons.LOW_CONFIDENCE);
            verify(fieldWriter, never()).write(any(), any(), anyString());
        }

        @Test
        @DisplayName("Should report unlabeled fields without filling them")
        void shouldReportUnlabeledFields() {
            FieldDescriptor unlabeled = field(FieldType.TEXT);
            when(fieldDetector.detectFields(form)).thenReturn(List.of(unlabeled));

            FillReport report = formFiller.fillForm(form, answers);

            assertThat(report.unlabeled()).hasSize(1);
            assertThat(report.unlabeled().get(0).fieldKey()).isEqualTo("field_0");
            verify(fieldWriter, never()).write(any(), any(), anyString());
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Should keep filling after a field fails")
        void shouldContinueAfterFailure() {
            FieldDescriptor years = field(FieldType.TEXT, "Years of experience");
            FieldDescriptor phone = field(FieldType.TEXT, "Phone number");
            when(fieldDetector.detectFields(form)).thenReturn(List.of(years, phone));
            when(fieldWriter.write(years.getElement(), FieldType.TEXT, "5"))
                    .thenThrow(new WebDriverException("stale element reference"));
            when(fieldWriter.write(phone.getElement(), FieldType.TEXT, "555-0100")).thenReturn(WriteResult.ok());

            FillReport report = formFiller.fillForm(form, answers);

            assertThat(report.fields()).extracting(FieldFillResult::status)
                    .containsExactly(FillStatus.FAILED, FillStatus.FILLED);
            assertThat(report.fields().get(0).reason()).isEqualTo(FormFillReasons.FILL_FAILED);
            assertThat(report.failedCount()).isEqualTo(1);
            assertThat(report.filledCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should record the writer's reason for a rejected value")
        void shouldRecordWriterReason() {
            FieldDescriptor country = field(FieldType.SELECT, "Phone number");
            when(fieldDetector.detectFields(form)).thenReturn(List.of(country));
            when(fieldWriter.write(country.getElement(), FieldType.SELECT, "555-0100"))
                    .thenReturn(WriteResult.failed(FormFillReasons.SELECT_FAILED));

            FieldFillResult result = formFiller.fillForm(form, answers).fields().get(0);

            assertThat(result.status()).isEqualTo(FillStatus.FAILED);
            assertThat(result.reason()).isEqualTo(FormFillReasons.SELECT_FAILED);
        }
    }

    @Nested
    @DisplayName("Resume uploads")
    class ResumeTests {

        @Test
        @DisplayName("Should route a resume input to the resume answer")
        void shouldUseResumeAnswer() {
            FieldDescriptor upload = field(FieldType.FILE, "Upload your CV (PDF)");
            when(fieldDetector.detectFields(form)).thenReturn(List.of(upload));
            when(fieldWriter.write(upload.getElement(), FieldType.FILE, "/home/me/resume.pdf"))
                    .thenReturn(WriteResult.failed(FormFillReasons.FILE_NOT_FOUND));

            FieldFillResult result = formFiller.fillForm(form, answers).fields().get(0);

            assertThat(result.matchedKey()).isEqualTo("resume");
            assertThat(result.status()).isEqualTo(FillStatus.FAILED);
            assertThat(result.reason()).isEqualTo(FormFillReasons.FILE_NOT_FOUND);
        }

        @Test
        @DisplayName("Should find only file inputs that mention a resume")
        void shouldFindResumeFields() {
            FieldDescriptor resume = field(FieldType.FILE, "resume-upload");
            FieldDescriptor cover = field(FieldType.FILE, "Cover letter");
            FieldDescriptor headline = field(FieldType.TEXT, "Resume headline");
            when(fieldDetector.detectFields(form)).thenReturn(List.of(resume, cover, headline));

            assertThat(formFiller.findResumeFields(form)).containsExactly(resume);
        }
    }

    @Nested
    @DisplayName("Radio groups")
    class RadioGroupTests {

        private final By fields = By.xpath(".//input|.//select|.//textarea");

        private FormFiller filler;

        @BeforeEach
        void setUpDetectorAndWriter() {
            MatchingConfig matchingConfig = new MatchingConfig();
            FieldWriter writer = new FieldWriter();
            filler = new FormFiller(new FieldDetector(), writer, new QuestionMatcher(writer, matchingConfig),
                    matchingConfig, new AutomationMetrics(meterRegistry));
        }

        @Test
        @DisplayName("Should check only the option matching an affirmative answer")
        void shouldCheckOnlyMatchingOption() {
            WebElement yes = input("radio", Map.of("name", "work_authorization", "value", "Yes"));
            WebElement no = input("radio", Map.of("name", "work_authorization", "value", "No"));
            when(form.findElements(fields)).thenReturn(List.of(yes, no));

            FillReport report = filler.fillForm(form, Map.of("work authorization", "Yes"));

            verify(yes).click();
            verify(no, never()).click();
            assertThat(report.fields()).extracting(FieldFillResult::status)
                    .containsExactly(FillStatus.FILLED, FillStatus.SKIPPED);
            assertThat(report.fields().get(1).reason()).isEqualTo(FormFillReasons.OTHER_OPTION);
            assertThat(report.failedCount()).isZero();
        }

        @Test
        @DisplayName("Should check the negative option for a negative answer")
        void shouldCheckNegativeOption() {
            WebElement yes = input("radio", Map.of("name", "sponsorship", "value", "Yes"));
            WebElement no = input("radio", Map.of("name", "sponsorship", "value", "No"));
            when(form.findElements(fields)).thenReturn(List.of(yes, no));

            FillReport report = filler.fillForm(form, Map.of("sponsorship", "No"));

            verify(yes, never()).click();
            verify(no).click();
            assertThat(report.filledCount()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("Should report progress after each field and count fields in metrics")
    void shouldReportProgress() {
        FieldDescriptor years = field(FieldType.TEXT, "Years of experience");
        FieldDescriptor other = field(FieldType.TEXT, "Favourite colour");
        when(fieldDetector.detectFields(form)).thenReturn(List.of(years, other));
        when(fieldWriter.write(years.getElement(), FieldType.TEXT, "5")).thenReturn(WriteResult.ok());
        List<Integer> progress = new ArrayList<>();

        formFiller.fillForm(form, answers, progress::add);

        assertThat(progress).containsExactly(50, 100);
        assertThat(meterRegistry.counter("job_applier_fields_total", "status", "filled").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("job_applier_fields_total", "status", "skipped").count()).isEqualTo(1.0);
    }
}
