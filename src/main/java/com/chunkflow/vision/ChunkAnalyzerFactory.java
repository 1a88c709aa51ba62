package com.chunkflow.vision;

import com.chunkflow.core.batch.BatchDispatcher;
import com.chunkflow.core.batch.BatchPipeline;
import com.chunkflow.core.model.FrameItem;
import com.chunkflow.media.FrameExtractor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.net.URI;

/**
 * Wires a {@link ChunkAnalyzer} against a {@link VisionClient} for one analysis run.
 */
@Component
public class ChunkAnalyzerFactory {

    private final FrameExtractor frameExtractor;
    private final BatchDispatcher dispatcher;
    private final ObjectMapper objectMapper;

    public ChunkAnalyzerFactory(FrameExtractor frameExtractor, BatchDispatcher dispatcher, ObjectMapper objectMapper) {
        this.frameExtractor = frameExtractor;
        this.dispatcher = dispatcher;
        this.objectMapper = objectMapper;
    }

    public ChunkAnalyzer create(AnalysisSettings settings) {
        var client = new VisionClient(URI.create(settings.endpointUrl()), settings.timeout(),
                settings.prompt(), objectMapper);
        BatchPipeline<FrameItem, JsonNode> pipeline = new BatchPipeline<>(dispatcher, FrameResults.FRAME_INDEX);
        return new ChunkAnalyzer(frameExtractor, pipeline, client, settings);
    }
}
