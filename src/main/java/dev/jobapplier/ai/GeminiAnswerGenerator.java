package dev.jobapplier.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.jobapplier.model.JobContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * AnswerGenerator that uses the Google AI Studio (Gemini) REST API with API key authentication.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "gemini")
public class GeminiAnswerGenerator implements AnswerGenerator {

    private final WebClient webClient;
    private final String apiKey;
    private final String model;
    private final String geminiPath;

    public GeminiAnswerGenerator(
            @Value("${app.ai.gemini.api-key:}") String apiKey,
            @Value("${app.ai.gemini.model:gemini-flash-latest}") String model,
            @Value("${app.ai.gemini.base-url:https://generativelanguage.googleapis.com}") String baseUrl,
            @Value("${app.ai.gemini.path:/v1beta/models/%s:generateContent}") String geminiPath) {
        this.apiKey = apiKey;
        this.model = model;
        this.geminiPath = Objects.requireNonNull(geminiPath);

        this.webClient = WebClient.builder()
                .baseUrl(Objects.requireNonNull(baseUrl))
                .defaultHeader("Content-Type", "application/json")
                .build();

        if (apiKey == null || apiKey.isBlank()) {
            log.warn("Gemini API Key is missing! Answer generation is disabled.");
        } else {
            log.info("Gemini answer generation enabled with model: {}", this.model);
        }
    }

    @Override
    public Mono<String> generateAnswer(String question, JobContext context) {
        if (question == null || question.isBlank() || !isEnabled()) {
            return Mono.empty();
        }

        GeminiRequest request = new GeminiRequest(
                List.of(new GeminiRequest.Content(List.of(
                        new GeminiRequest.Part(AnswerPrompt.SYSTEM_MESSAGE + "\n\n"
                                + AnswerPrompt.build(question, context))))),
                new GeminiRequest.GenerationConfig(0.7, 200));
        String uri = String.format(geminiPath, model) + "?key=" + apiKey;

        return webClient.post()
                .uri(uri)
                .contentType(Objects.requireNonNull(MediaType.APPLICATION_JSON))
                .bodyValue(request)
                .retrieve()
                .bodyToMono(GeminiResponse.class)
                .timeout(Duration.ofSeconds(30))
                .retryWhen(Retry.backoff(2, Duration.ofSeconds(2))
                        .filter(this::isRetryableError)
                        .doBeforeRetry(signal -> log.info("Retrying answer generation for '{}' (Attempt {})",
                                question, signal.totalRetries() + 1)))
                .flatMap(response -> Mono.justOrEmpty(extractContent(response)))
                .map(AnswerPrompt::clean)
                .filter(answer -> !answer.isBlank())
                .onErrorResume(e -> {
                    log.warn("Gemini answer generation failed for '{}': {}", question, e.getMessage());
                    return Mono.empty();
                });
    }

    @Override
    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    private String extractContent(GeminiResponse response) {
        if (response == null || response.candidates() == null || response.candidates().isEmpty()) {
            log.warn("Gemini returned no candidates");
            return null;
        }
        var candidate = response.candidates().get(0);
        if (candidate.finishReason() != null && !candidate.finishReason().equals("STOP")) {
            log.warn("Gemini finish reason: {}", candidate.finishReason());
        }
        if (candidate.content() == null || candidate.content().parts() == null
                || candidate.content().parts().isEmpty()) {
            return null;
        }
        return candidate.content().parts().get(0).text();
    }

    private boolean isRetryableError(Throwable e) {
        if (!(e instanceof WebClientResponseException)) {
            return false;
        }
        int status = ((WebClientResponseException) e).getStatusCode().value();
        return status == 429 || status == 503;
    }

    // Request DTOs
    record GeminiRequest(
            List<Content> contents,
            @JsonProperty("generationConfig") GenerationConfig generationConfig) {
        record Content(List<Part> parts) {
        }

        record Part(String text) {
        }

        record GenerationConfig(double temperature, int maxOutputTokens) {
        }
    }

    // Response DTOs
    @JsonIgnoreProperties(ignoreUnknown = true)
    record GeminiResponse(List<Candidate> candidates) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Candidate(Content content, String finishReason) {
            @JsonIgnoreProperties(ignoreUnknown = true)
            record Content(List<Part> parts) {
                @JsonIgnoreProperties(ignoreUnknown = true)
                record Part(String text) {
                }
            }
        }
    }
}
