package com.williamcallahan.corpussync.indexing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.williamcallahan.corpussync.support.TransientErrorClassifier;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;

/**
 * Verifies batching, index ordering and error translation against a local HTTP server.
 */
class RemoteEmbeddingClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ExecutorService serverExecutor;
    private HttpServer httpServer;
    private String baseUrl;

    @BeforeEach
    void startServer() throws IOException {
        serverExecutor = Executors.newSingleThreadExecutor();
        httpServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        httpServer.setExecutor(serverExecutor);
        baseUrl = "http://" + httpServer.getAddress().getHostString() + ":" + httpServer.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        httpServer.stop(0);
        serverExecutor.shutdownNow();
    }

    @Test
    void batchesRequestsAndOrdersVectorsByIndex() {
        AtomicInteger requests = new AtomicInteger();
        List<Integer> batchSizes = new CopyOnWriteArrayList<>();
        List<String> authorizations = new CopyOnWriteArrayList<>();
        httpServer.createContext("/v1/embeddings", exchange -> {
            int requestIndex = requests.getAndIncrement();
            JsonNode request = objectMapper.readTree(exchange.getRequestBody().readAllBytes());
            batchSizes.add(request.path("input").size());
            authorizations.add(exchange.getRequestHeaders().getFirst("Authorization"));
            if (requestIndex == 0) {
                respondJson(exchange, 200,
                        "{\"data\":[{\"index\":1,\"embedding\":[9.0,9.0]},{\"index\":0,\"embedding\":[1.0,1.0]}]}");
                return;
            }
            respondJson(exchange, 200, "{\"data\":[{\"index\":0,\"embedding\":[7.0,7.0]}]}");
        });
        httpServer.start();

        RemoteEmbeddingClient client = new RemoteEmbeddingClient(
                baseUrl + "/", "test-model", "secret", 2, 2, Duration.ofSeconds(5), new RestTemplateBuilder());
        List<float[]> vectors = client.embed(List.of("alpha", "beta", "gamma"));

        assertEquals(List.of(2, 1), batchSizes);
        assertEquals(List.of("Bearer secret", "Bearer secret"), authorizations);
        assertEquals(1.0f, vectors.get(0)[0]);
        assertEquals(9.0f, vectors.get(1)[0]);
        assertEquals(7.0f, vectors.get(2)[0]);
    }

    @Test
    void dimensionMismatchIsReported() {
        httpServer.createContext("/v1/embeddings",
                exchange -> respondJson(exchange, 200, "{\"data\":[{\"index\":0,\"embedding\":[1.0,2.0]}]}"));
        httpServer.start();

        RemoteEmbeddingClient client = new RemoteEmbeddingClient(
                baseUrl, "test-model", "", 3, 8, Duration.ofSeconds(5), new RestTemplateBuilder());

        EmbeddingServiceUnavailableException failure =
                assertThrows(EmbeddingServiceUnavailableException.class, () -> client.embed(List.of("alpha")));
        assertTrue(failure.getMessage().contains("dimension mismatch"));
    }

    @Test
    void serverErrorsCarryStatusAndStayRetryable() {
        httpServer.createContext("/v1/embeddings",
                exchange -> respondJson(exchange, 503, "{\"error\":\"model loading\"}"));
        httpServer.start();

        RemoteEmbeddingClient client = new RemoteEmbeddingClient(
                baseUrl, "test-model", "", 2, 8, Duration.ofSeconds(5), new RestTemplateBuilder());

        EmbeddingServiceUnavailableException failure =
                assertThrows(EmbeddingServiceUnavailableException.class, () -> client.embed(List.of("alpha")));
        assertTrue(failure.getMessage().contains("HTTP 503"));
        assertTrue(TransientErrorClassifier.isTransient(failure));
    }

    private static void respondJson(HttpExchange exchange, int statusCode, String responseJson) throws IOException {
        byte[] jsonBytes = responseJson.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, jsonBytes.length);
        try (OutputStream outputStream = exchange.getResponseBody()) {
            outputStream.write(jsonBytes);
        }
    }
}
