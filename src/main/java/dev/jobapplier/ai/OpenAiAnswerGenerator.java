package dev.jobapplier.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
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
 * AnswerGenerator for any OpenAI-compatible chat completions endpoint (OpenAI, DeepSeek, a local Ollama).
 * Local endpoints work without an API key.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "openai")
public class OpenAiAnswerGenerator implements AnswerGenerator {

    static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
    private static final String CHAT_PATH = "/chat/completions";

    private final WebClient webClient;
    private final String apiKey;
    private final String model;
    private final String baseUrl;

    public OpenAiAnswerGenerator(
            @Value("${app.ai.openai.api-key:}") String apiKey,
            @Value("${app.ai.openai.model:gpt-3.5-turbo}") String model,
            @Value("${app.ai.openai.base-url:" + DEFAULT_BASE_URL + "}") String baseUrl) {
        this.apiKey = apiKey;
        this.model = model;
        this.baseUrl = Objects.requireNonNull(baseUrl);

        WebClient.Builder builder = WebClient.builder()
                .baseUrl(this.baseUrl)
                .defaultHeader("Content-Type", "application/json");
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader("Authorization", "Bearer " + apiKey);
        }
        this.webClient = builder.build();

        if (!isEnabled()) {
            log.warn("OpenAI API Key is missing! Answer generation is disabled.");
        } else {
            log.info("OpenAI-compatible answer generation enabled with model: {} at {}", model, this.baseUrl);
        }
    }

    @Override
    public Mono<String> generateAnswer(String question, JobContext context) {
        if (question == null || question.isBlank() || !isEnabled()) {
            return Mono.empty();
        }

        ChatRequest request = new ChatRequest(model, List.of(
                new ChatRequest.Message("system", AnswerPrompt.SYSTEM_MESSAGE),
                new ChatRequest.Message("user", AnswerPrompt.build(question, context))),
                0.7, 200);

        return webClient.post()
                .uri(CHAT_PATH)
                .contentType(Objects.requireNonNull(MediaType.APPLICATION_JSON))
                .bodyValue(request)
                .retrieve()
                .bodyToMono(ChatResponse.class)
                .timeout(Duration.ofSeconds(30))
                .retryWhen(Retry.backoff(2, Duration.ofSeconds(2)).filter(this::isRetryableError))
                .flatMap(response -> Mono.justOrEmpty(extractContent(response)))
                .map(AnswerPrompt::clean)
                .filter(answer -> !answer.isBlank())
                .doOnNext(answer -> log.debug("Generated answer for '{}'", question))
                .onErrorResume(e -> {
                    log.warn("Answer generation failed for '{}': {}", question, e.getMessage());
                    return Mono.empty();
                });
    }

    @Override
    public boolean isEnabled() {
        return (apiKey != null && !apiKey.isBlank()) || !DEFAULT_BASE_URL.equals(baseUrl);
    }

    private String extractContent(ChatResponse response) {
        if (response != null && response.choices() != null && !response.choices().isEmpty()
                && response.choices().get(0).message() != null) {
            return response.choices().get(0).message().content();
        }
        return null;
    }

    private boolean isRetryableError(Throwable e) {
        if (!(e instanceof WebClientResponseException)) {
            return false;
        }
        int status = ((WebClientResponseException) e).getStatusCode().value();
        return status == 429 || status == 503;
    }

    // DTOs
    record ChatRequest(String model, List<Message> messages, double temperature, int max_tokens) {
        record Message(String role, String content) {
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatResponse(List<Choice> choices) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Choice(Message message) {
            @JsonIgnoreProperties(ignoreUnknown = true)
            record Message(String content) {
            }
        }
    }
}
