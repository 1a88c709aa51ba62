package com.chunkflow.vision;

import com.chunkflow.core.batch.BatchDispatcher;
import com.chunkflow.core.model.ChunkSegment;
import com.chunkflow.core.model.FrameItem;
import com.chunkflow.media.FrameExtractor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ChunkAnalyzerFactoryTest {

    @TempDir
    Path dir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private FrameExtractor frameExtractor;
    private HttpServer server;

    @BeforeEach
    void setUp() throws IOException {
        frameExtractor = mock(FrameExtractor.class);
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/vision/batch", exchange -> {
            exchange.getRequestBody().readAllBytes();
            byte[] bytes = "{\"results\":[{\"frame_index\":1,\"caption\":\"shelf\"},{\"frame_index\":0,\"caption\":\"door\"}]}"
                    .getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(200, bytes.length);
            exchange.getResponseBody().write(bytes);
            exchange.close();
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private AnalysisSettings settings() {
        String endpoint = "http://" + server.getAddress().getHostString() + ":"
                + server.getAddress().getPort() + "/vision/batch";
        return new AnalysisSettings(endpoint, Duration.ofSeconds(5), "describe", 0.5, 2, 1, dir);
    }

    @Test
    @DisplayName("created analyzer sends frames to the endpoint and orders results by frame index")
    void analyzerOrdersByFrameIndex() throws Exception {
        Path first = Files.write(dir.resolve("frame_00001.jpg"), new byte[] {(byte) 0xFF, (byte) 0xD8, 0});
        Path second = Files.write(dir.resolve("frame_00002.jpg"), new byte[] {(byte) 0xFF, (byte) 0xD8, 1});
        when(frameExtractor.extract(any(), any(), anyDouble())).thenReturn(List.of(
                FrameItem.sampled(0, 0.5, first),
                FrameItem.sampled(1, 0.5, second)));

        var factory = new ChunkAnalyzerFactory(frameExtractor, new BatchDispatcher(), objectMapper);
        List<JsonNode> results = factory.create(settings())
                .execute(new ChunkSegment(0, 0.0, 30.0, "/videos/chunk_00000.mp4"));

        assertEquals(List.of("door", "shelf"), results.stream().map(r -> r.get("caption").asText()).toList());
    }

    @Test
    @DisplayName("a chunk without frames yields no results")
    void noFrames() throws Exception {
        when(frameExtractor.extract(any(), any(), anyDouble())).thenReturn(List.of());

        var factory = new ChunkAnalyzerFactory(frameExtractor, new BatchDispatcher(), objectMapper);

        assertTrue(factory.create(settings())
                .execute(new ChunkSegment(3, 90.0, 120.0, "/videos/chunk_00003.mp4")).isEmpty());
    }
}
