package com.chunkflow.vision;

import com.chunkflow.core.batch.BatchSender;
import com.chunkflow.core.batch.DataContractException;
import com.chunkflow.core.model.FrameItem;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * HTTP client for a remote vision processor that describes batches of frames.
 *
 * <p>Each batch is POSTed as JSON (see {@link BatchPayloadBuilder}); the response must be
 * an object with a {@code results} array holding one record per frame, each carrying
 * the {@code frame_index} it answers. The request timeout bounds every send, since the
 * dispatcher itself never cancels an in-flight call.
 */
public class VisionClient implements BatchSender<FrameItem, JsonNode> {

    private static final Logger log = LoggerFactory.getLogger(VisionClient.class);

    private final URI endpoint;
    private final Duration timeout;
    private final String prompt;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final BatchPayloadBuilder payloadBuilder;

    public VisionClient(URI endpoint, Duration timeout, String prompt, ObjectMapper objectMapper) {
        this(endpoint, timeout, prompt, objectMapper, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    VisionClient(URI endpoint, Duration timeout, String prompt, ObjectMapper objectMapper, HttpClient httpClient) {
        this.endpoint = endpoint;
        this.timeout = timeout;
        this.prompt = prompt;
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
        this.payloadBuilder = new BatchPayloadBuilder(objectMapper);
    }

    @Override
    public List<JsonNode> send(List<FrameItem> batch) throws InterruptedException {
        String body = payloadBuilder.build(batch, prompt).toString();
        HttpRequest request = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new VisionClientException("POST " + endpoint + " failed: " + e.getMessage(), e);
        }
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new VisionClientException("POST " + endpoint + " returned HTTP " + response.statusCode()
                    + ": " + truncate(response.body(), 500), response.statusCode());
        }
        return parseResults(response.body());
    }

    List<JsonNode> parseResults(String responseBody) {
        JsonNode data;
        try {
            data = objectMapper.readTree(responseBody);
        } catch (IOException e) {
            throw new DataContractException("Vision response is not JSON: " + truncate(responseBody, 200), e);
        }
        JsonNode results = data == null ? null : data.get("results");
        if (results == null || !results.isArray()) {
            throw new DataContractException("Unexpected response format: " + truncate(responseBody, 200));
        }
        var records = new ArrayList<JsonNode>(results.size());
        results.forEach(records::add);
        log.debug("Vision processor returned {} record(s)", records.size());
        return records;
    }

    public URI getEndpoint() {
        return endpoint;
    }

    private static String truncate(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}
