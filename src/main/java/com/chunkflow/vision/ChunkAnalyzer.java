package com.chunkflow.vision;

import com.chunkflow.core.batch.BatchPipeline;
import com.chunkflow.core.batch.BatchSender;
import com.chunkflow.core.engine.JobHandler;
import com.chunkflow.core.logging.MdcContext;
import com.chunkflow.core.model.ChunkSegment;
import com.chunkflow.core.model.FrameItem;
import com.chunkflow.media.FrameExtractor;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Analyzes one chunk end to end: samples frames, sends them to the vision processor
 * in batches and returns the per-frame results in frame order.
 *
 * <p>Also serves as the {@link JobHandler} for chunk work items, so a failing chunk is
 * retried and quarantined by the job engine without affecting other chunks.
 */
public class ChunkAnalyzer implements JobHandler<ChunkSegment, List<JsonNode>> {

    private static final Logger log = LoggerFactory.getLogger(ChunkAnalyzer.class);

    private final FrameExtractor frameExtractor;
    private final BatchPipeline<FrameItem, JsonNode> pipeline;
    private final BatchSender<FrameItem, JsonNode> sender;
    private final AnalysisSettings settings;

    public ChunkAnalyzer(FrameExtractor frameExtractor, BatchPipeline<FrameItem, JsonNode> pipeline,
                         BatchSender<FrameItem, JsonNode> sender, AnalysisSettings settings) {
        if (settings.batchSize() <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0, got " + settings.batchSize());
        }
        this.frameExtractor = frameExtractor;
        this.pipeline = pipeline;
        this.sender = sender;
        this.settings = settings;
    }

    @Override
    public List<JsonNode> execute(ChunkSegment segment) {
        MdcContext.setChunk(segment.index());
        Path framesDir = settings.framesDir().resolve(String.format("chunk_%05d", segment.index()));
        return analyze(Path.of(segment.path()), framesDir);
    }

    public List<JsonNode> analyze(Path chunk, Path framesDir) {
        List<FrameItem> frames = frameExtractor.extract(chunk, framesDir, settings.fps());
        List<JsonNode> results = pipeline.run(frames, settings.batchSize(), settings.parallelism(), sender);
        log.info("Chunk {} produced {} result(s) from {} frame(s)", chunk.getFileName(), results.size(), frames.size());
        return results;
    }
}
