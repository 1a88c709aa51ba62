package com.chunkflow.core.model;

import java.nio.file.Path;

/**
 * A frame extracted from a chunk. The frame index defines global ordering.
 *
 * @param frameIndex       dense, zero-based position within the chunk
 * @param timestampSeconds offset into the chunk, derived from index and sampling rate
 * @param jpegPath         extracted image file
 */
public record FrameItem(
    int frameIndex,
    double timestampSeconds,
    Path jpegPath
) {

    /**
     * Builds a frame whose timestamp is {@code index / fps}, rounded to milliseconds.
     * A non-positive sampling rate yields a zero timestamp.
     */
    public static FrameItem sampled(int frameIndex, double fps, Path jpegPath) {
        double ts = fps > 0 ? Math.round(frameIndex / fps * 1000.0) / 1000.0 : 0.0;
        return new FrameItem(frameIndex, ts, jpegPath);
    }
}
