package com.prowl.kgindex.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prowl.kgindex.configuration.AppProperties;
import com.prowl.kgindex.configuration.EmbeddingProperties;
import com.prowl.kgindex.configuration.ExtractionProperties;
import com.prowl.kgindex.exception.EmbeddingException;
import com.prowl.kgindex.exception.ExtractionException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.BiFunction;

/**
 * OpenAI-compatible client for OpenRouter: {@code /chat/completions} and {@code /embeddings}.
 *
 * Each call is bounded by the configured timeout and attempted exactly once; the caller
 * decides what to do on failure.
 */
@Slf4j
@RequiredArgsConstructor
public class OpenRouterClient implements LLMProvider {

    private final AppProperties props;
    private final ObjectMapper objectMapper;

    private WebClient chatWebClient;
    private WebClient embeddingWebClient;

    @PostConstruct
    public void init() {
        this.chatWebClient = buildWebClient(props.getExtraction().getBaseUrl(), props.getExtraction().getApiKey());
        this.embeddingWebClient = buildWebClient(props.getEmbedding().getBaseUrl(), props.getEmbedding().getApiKey());
    }

    private WebClient buildWebClient(String baseUrl, String apiKey) {
        WebClient.Builder builder = WebClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                        .build());
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        return builder.build();
    }

    @Override
    public String getProviderName() {
        return "OpenRouter (" + props.getExtraction().getModel() + ", " + props.getEmbedding().getModel() + ")";
    }

    @Override
    public String chat(String systemPrompt, String userPrompt, Double temperature) {
        ExtractionProperties extraction = props.getExtraction();
        log.debug("🔵 [LLM REQUEST] Model={}, PromptLength={}", extraction.getModel(), userPrompt.length());

        Map<String, Object> body = Map.of(
                "model", extraction.getModel(),
                "messages", List.of(
                        Map.of("role", "system", "content", systemPrompt),
                        Map.of("role", "user", "content", userPrompt)
                ),
                "temperature", temperature != null ? temperature : extraction.getTemperature()
        );

        long startTime = System.currentTimeMillis();
        String raw;
        try {
            raw = chatWebClient.post()
                    .uri("/chat/completions")
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(extraction.getTimeout())
                    .block();
        } catch (Exception e) {
            throw new ExtractionException("Chat completion failed: " + describe(e), e);
        }

        JsonNode root = readJson(raw, ExtractionException::new);
        if (root.hasNonNull("error")) {
            throw new ExtractionException("Chat completion rejected: " + root.path("error").path("message").asText(root.path("error").toString()));
        }

        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual() || content.asText().isBlank()) {
            throw new ExtractionException("Chat completion returned no message content");
        }

        log.debug("🟢 [LLM RESPONSE] Latency={}ms, ResponseLength={}",
                System.currentTimeMillis() - startTime, content.asText().length());
        return content.asText();
    }

    @Override
    public JsonNode embed(String text) {
        EmbeddingProperties embedding = props.getEmbedding();
        log.debug("🔵 [EMBEDDING REQUEST] Model={}, TextLength={}", embedding.getModel(), text.length());

        // Models with adjustable output size otherwise return their native dimension
        Map<String, Object> body = Map.of(
                "model", embedding.getModel(),
                "input", text,
                "dimensions", props.getKnowledgeGraph().getEmbeddingDimension()
        );

        String raw;
        try {
            raw = embeddingWebClient.post()
                    .uri("/embeddings")
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(embedding.getTimeout())
                    .block();
        } catch (Exception e) {
            throw new EmbeddingException("Embedding request failed: " + describe(e), e);
        }

        return readJson(raw, EmbeddingException::new);
    }

    private <E extends RuntimeException> JsonNode readJson(String raw, BiFunction<String, Throwable, E> failure) {
        if (raw == null || raw.isBlank()) {
            throw failure.apply("Empty response body", null);
        }
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            String preview = raw.substring(0, Math.min(120, raw.length()));
            throw failure.apply("Response is not JSON: " + preview, e);
        }
    }

    private static String describe(Throwable e) {
        Throwable cause = e;
        // block() wraps checked exceptions such as TimeoutException
        if (cause.getCause() != null && !(cause instanceof WebClientResponseException)) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            return "timed out";
        }
        if (cause instanceof WebClientResponseException webEx) {
            return "HTTP " + webEx.getStatusCode().value();
        }
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }
}
