package com.ainotes.client;

import com.ainotes.exception.EnrichmentException;
import com.ainotes.model.entity.Note;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * {@link EnrichmentClient} for an OpenAI-compatible HTTP API.
 * Tags come from the chat completions endpoint, vectors from the embeddings endpoint.
 */
@Slf4j
@Component
public class OpenAiEnrichmentClient implements EnrichmentClient {

    static final String TAG_SYSTEM_PROMPT = "You are a helpful assistant that generates relevant tags for notes. " +
            "Generate 3-5 relevant, specific tags that categorize the content. " +
            "Return ONLY the tags as a comma-separated list with no extra text. " +
            "Use lowercase, keep tags concise (1-3 words each).";

    private final WebClient webClient;
    private final String chatModel;
    private final String embeddingModel;
    private final double temperature;
    private final int maxTagTokens;
    private final Duration timeout;

    public OpenAiEnrichmentClient(
            WebClient aiWebClient,
            @Value("${ainotes.ai.chat-model:gpt-4o-mini}") String chatModel,
            @Value("${ainotes.ai.embedding-model:text-embedding-3-small}") String embeddingModel,
            @Value("${ainotes.ai.tag-temperature:0.3}") double temperature,
            @Value("${ainotes.ai.max-tag-tokens:50}") int maxTagTokens,
            @Value("${ainotes.ai.timeout:30s}") Duration timeout) {
        this.webClient = aiWebClient;
        this.chatModel = chatModel;
        this.embeddingModel = embeddingModel;
        this.temperature = temperature;
        this.maxTagTokens = maxTagTokens;
        this.timeout = timeout;
    }

    @Override
    public Mono<String> generateTags(String title, String content) {
        if (isBlank(title) && isBlank(content)) {
            return Mono.error(new EnrichmentException("nothing to tag"));
        }

        Map<String, Object> requestBody = Map.of(
                "model", chatModel,
                "temperature", temperature,
                "max_tokens", maxTagTokens,
                "messages", List.of(
                        Map.of("role", "system", "content", TAG_SYSTEM_PROMPT),
                        Map.of("role", "user", "content",
                                "Generate tags for this note:\n\nTitle: " + title + "\n\nContent: " + content)
                )
        );

        return post("/chat/completions", requestBody)
                .map(this::extractTags)
                .onErrorMap(this::toEnrichmentException)
                .doOnError(error -> log.warn("Tag generation failed: {}", error.getMessage()));
    }

    @Override
    public Mono<float[]> generateEmbedding(String title, String content) {
        String text = (title == null ? "" : title) + "\n\n" + (content == null ? "" : content);
        if (text.isBlank()) {
            return Mono.error(new EnrichmentException("nothing to embed"));
        }

        Map<String, Object> requestBody = Map.of(
                "model", embeddingModel,
                "input", text,
                "encoding_format", "float"
        );

        return post("/embeddings", requestBody)
                .map(this::extractEmbedding)
                .onErrorMap(this::toEnrichmentException)
                .doOnError(error -> log.warn("Embedding generation failed: {}", error.getMessage()));
    }

    @SuppressWarnings("rawtypes")
    private Mono<Map> post(String uri, Map<String, Object> body) {
        return webClient.post()
                .uri(uri)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(Map.class)
                .switchIfEmpty(Mono.error(new EnrichmentException("malformed response: empty body")))
                .timeout(timeout);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private String extractTags(Map response) {
        List<Map<String, Object>> choices = (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new EnrichmentException("malformed response: no choices");
        }
        Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
        Object text = message == null ? null : message.get("content");
        if (!(text instanceof String)) {
            throw new EnrichmentException("malformed response: no message content");
        }

        String tags = ((String) text).replace("\"", "").replace("'", "").trim();
        if (tags.isEmpty()) {
            throw new EnrichmentException("malformed response: empty tags");
        }
        if (tags.length() > Note.TAGS_MAX_LENGTH) {
            throw new EnrichmentException("malformed response: tags exceed " + Note.TAGS_MAX_LENGTH + " characters");
        }
        return tags;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private float[] extractEmbedding(Map response) {
        List<Map<String, Object>> data = (List<Map<String, Object>>) response.get("data");
        if (data == null || data.isEmpty()) {
            throw new EnrichmentException("malformed response: no embedding data");
        }
        Object raw = data.get(0).get("embedding");
        if (!(raw instanceof List) || ((List<?>) raw).isEmpty()) {
            throw new EnrichmentException("malformed response: no embedding vector");
        }

        List<?> values = (List<?>) raw;
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            Object value = values.get(i);
            if (!(value instanceof Number)) {
                throw new EnrichmentException("malformed response: non-numeric embedding value");
            }
            vector[i] = ((Number) value).floatValue();
        }
        return vector;
    }

    private Throwable toEnrichmentException(Throwable error) {
        if (error instanceof EnrichmentException) {
            return error;
        }
        if (error instanceof TimeoutException) {
            return new EnrichmentException("timeout", error);
        }
        if (error instanceof WebClientResponseException) {
            int status = ((WebClientResponseException) error).getStatusCode().value();
            return new EnrichmentException("service unavailable (HTTP " + status + ")", error);
        }
        if (error instanceof WebClientRequestException) {
            return new EnrichmentException("service unavailable: " + error.getMessage(), error);
        }
        return new EnrichmentException("malformed response: " + error.getMessage(), error);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
