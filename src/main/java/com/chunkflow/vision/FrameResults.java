package com.chunkflow.vision;

import com.chunkflow.core.batch.SequenceIndexExtractor;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Accessors for per-frame result records returned by the vision processor.
 */
public final class FrameResults {

    public static final String FRAME_INDEX_FIELD = "frame_index";

    /** Reads the integer {@code frame_index} field; null when absent or not an integer. */
    public static final SequenceIndexExtractor<JsonNode> FRAME_INDEX = record -> {
        if (record == null) {
            return null;
        }
        JsonNode index = record.get(FRAME_INDEX_FIELD);
        return index != null && index.canConvertToInt() && index.isIntegralNumber() ? index.intValue() : null;
    };

    private FrameResults() {}
}
