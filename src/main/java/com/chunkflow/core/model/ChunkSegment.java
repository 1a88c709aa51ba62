package com.chunkflow.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of a chunk manifest produced by video segmentation.
 *
 * @param index        zero-based chunk position
 * @param startSeconds chunk start in the source video
 * @param endSeconds   chunk end in the source video
 * @param path         absolute location of the chunk file
 */
public record ChunkSegment(
    @JsonProperty("index") int index,
    @JsonProperty("start_s") double startSeconds,
    @JsonProperty("end_s") double endSeconds,
    @JsonProperty("path") String path
) {

    /** Stable work item identity for this chunk, e.g. {@code chunk-00003}. */
    public String jobId() {
        return String.format("chunk-%05d", index);
    }
}
