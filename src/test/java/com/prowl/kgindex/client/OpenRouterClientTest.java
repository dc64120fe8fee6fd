package com.prowl.kgindex.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prowl.kgindex.configuration.AppProperties;
import com.prowl.kgindex.core.EmbeddingResult;
import com.prowl.kgindex.knowledge.impl.RemoteEmbeddingProvider;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Request bodies sent by the OpenRouter client, checked against a local HTTP server.
 */
@DisplayName("OpenRouter Client Tests")
class OpenRouterClientTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HttpServer server;
    private final AtomicReference<String> requestBody = new AtomicReference<>();
    private final AtomicReference<String> authorization = new AtomicReference<>();

    @BeforeEach
    void startServer() throws IOException {
        String vector = String.join(",", Collections.nCopies(384, "0.5"));
        byte[] reply = ("{\"object\":\"list\",\"data\":[{\"embedding\":[" + vector + "],\"index\":0}]}")
                .getBytes(StandardCharsets.UTF_8);

        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext("/embeddings", exchange -> {
            requestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(200, reply.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(reply);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private OpenRouterClient client() {
        AppProperties props = new AppProperties();
        props.getEmbedding().setApiKey("test-key");
        props.getEmbedding().setBaseUrl("http://localhost:" + server.getAddress().getPort());
        props.getEmbedding().setModel("text-embedding-3-small");
        props.getEmbedding().setTimeout(Duration.ofSeconds(5));
        props.getKnowledgeGraph().setEmbeddingDimension(384);
        OpenRouterClient client = new OpenRouterClient(props, MAPPER);
        client.init();
        return client;
    }

    @Test
    @DisplayName("Embedding request asks for the configured dimension")
    void embed_shouldSendConfiguredDimensions() throws Exception {
        // Given
        OpenRouterClient client = client();

        // When
        client.embed("Python is a programming language.");

        // Then
        JsonNode sent = MAPPER.readTree(requestBody.get());
        assertEquals(384, sent.path("dimensions").asInt());
        assertEquals("text-embedding-3-small", sent.path("model").asText());
        assertEquals("Python is a programming language.", sent.path("input").asText());
        assertEquals("Bearer test-key", authorization.get());
    }

    @Test
    @DisplayName("Vector returned for the requested dimension passes the remote provider's check")
    void embed_throughRemoteProvider_shouldAcceptVector() {
        // Given
        RemoteEmbeddingProvider provider = new RemoteEmbeddingProvider(client(), 384);

        // When
        EmbeddingResult result = provider.embed("Docker runs containers.");

        // Then
        assertEquals(384, result.getVector().size());
        assertFalse(result.isDegraded());
    }
}
