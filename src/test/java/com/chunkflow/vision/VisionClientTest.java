package com.chunkflow.vision;

import com.chunkflow.core.batch.DataContractException;
import com.chunkflow.core.model.FrameItem;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class VisionClientTest {

    @TempDir
    Path dir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private HttpServer server;
    private final AtomicReference<String> lastRequestBody = new AtomicReference<>();
    private final AtomicReference<String> lastContentType = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String responseBody = "{\"results\":[]}";

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/vision/batch", exchange -> {
            lastRequestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            lastContentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
            byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            exchange.getResponseBody().write(bytes);
            exchange.close();
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private VisionClient client() {
        URI endpoint = URI.create("http://" + server.getAddress().getHostString() + ":"
                + server.getAddress().getPort() + "/vision/batch");
        return new VisionClient(endpoint, Duration.ofSeconds(5), "describe", objectMapper);
    }

    private List<FrameItem> frames(int count) throws IOException {
        var frames = new ArrayList<FrameItem>();
        for (int i = 0; i < count; i++) {
            Path jpeg = Files.write(dir.resolve("frame_" + i + ".jpg"), new byte[] {(byte) 0xFF, (byte) 0xD8, (byte) i});
            frames.add(FrameItem.sampled(i, 0.5, jpeg));
        }
        return frames;
    }

    @Nested
    @DisplayName("send")
    class Send {

        @Test
        @DisplayName("posts the batch payload and returns the results array")
        void postsPayload() throws Exception {
            responseBody = "{\"results\":[{\"frame_index\":1,\"caption\":\"shelf\"},{\"frame_index\":0,\"caption\":\"door\"}]}";

            List<JsonNode> results = client().send(frames(2));

            assertEquals(2, results.size());
            assertEquals("shelf", results.get(0).get("caption").asText());
            assertEquals("application/json", lastContentType.get());

            JsonNode request = objectMapper.readTree(lastRequestBody.get());
            assertEquals("describe", request.get("prompt").asText());
            assertEquals(2, request.get("images_b64").size());
            assertEquals(1, request.get("meta").get(1).get("frame_index").asInt());
            assertEquals(2.0, request.get("meta").get(1).get("timestamp_s").asDouble());
        }

        @Test
        @DisplayName("non-2xx status raises a client error with the status code")
        void errorStatus() throws Exception {
            status = 503;
            responseBody = "{\"error\":\"overloaded\"}";

            var ex = assertThrows(VisionClientException.class, () -> client().send(frames(1)));
            assertEquals(503, ex.getStatusCode());
            assertTrue(ex.getMessage().contains("overloaded"));
        }

        @Test
        @DisplayName("response without a results array violates the data contract")
        void missingResults() throws Exception {
            responseBody = "{\"items\":[]}";
            assertThrows(DataContractException.class, () -> client().send(frames(1)));
        }

        @Test
        @DisplayName("unreachable endpoint raises a client error without status")
        void unreachable() throws Exception {
            var frames = frames(1);
            server.stop(0);

            var ex = assertThrows(VisionClientException.class, () -> client().send(frames));
            assertEquals(-1, ex.getStatusCode());
        }
    }

    @Nested
    @DisplayName("parseResults")
    class ParseResults {

        @Test
        @DisplayName("non-JSON body is a data contract violation")
        void notJson() {
            assertThrows(DataContractException.class, () -> client().parseResults("<html>oops</html>"));
        }

        @Test
        @DisplayName("results that are not an array are rejected")
        void resultsNotArray() {
            assertThrows(DataContractException.class, () -> client().parseResults("{\"results\":{}}"));
        }

        @Test
        @DisplayName("empty results array is accepted")
        void emptyResults() {
            assertTrue(client().parseResults("{\"results\":[]}").isEmpty());
        }
    }
}
