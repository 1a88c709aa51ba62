package com.chunkflow.vision;

import com.chunkflow.config.ChunkflowProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Per-run settings for chunk analysis, seeded from {@link ChunkflowProperties}
 * and overridable from the command line.
 *
 * @param endpointUrl vision processor URL
 * @param timeout     per-batch HTTP timeout
 * @param prompt      instruction sent with every batch
 * @param fps         frame sampling rate
 * @param batchSize   frames per batch
 * @param parallelism batches in flight per chunk
 * @param framesDir   root directory for extracted frames (one subdirectory per chunk)
 */
public record AnalysisSettings(
    String endpointUrl,
    Duration timeout,
    String prompt,
    double fps,
    int batchSize,
    int parallelism,
    Path framesDir
) {

    public static AnalysisSettings from(ChunkflowProperties properties, Path framesDir) {
        return new AnalysisSettings(
                properties.getVision().getEndpointUrl(),
                Duration.ofSeconds(properties.getVision().getTimeoutSeconds()),
                properties.getVision().getPrompt(),
                properties.getMedia().getFps(),
                properties.getBatch().getSize(),
                properties.getBatch().getMaxParallel(),
                framesDir);
    }
}
