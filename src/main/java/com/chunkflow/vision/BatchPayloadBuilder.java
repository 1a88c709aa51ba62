package com.chunkflow.vision;

import com.chunkflow.core.model.FrameItem;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.util.Base64;
import java.util.List;

/**
 * Builds the JSON request body for one batch of frames:
 * {@code {"prompt", "images_b64": [...], "meta": [{"frame_index", "timestamp_s"}]}}.
 * Images and meta entries are index-aligned.
 */
public class BatchPayloadBuilder {

    private final ObjectMapper objectMapper;

    public BatchPayloadBuilder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode build(List<FrameItem> frames, String prompt) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("prompt", prompt);
        ArrayNode images = body.putArray("images_b64");
        ArrayNode meta = body.putArray("meta");
        for (FrameItem frame : frames) {
            images.add(encode(frame));
            ObjectNode entry = meta.addObject();
            entry.put(FrameResults.FRAME_INDEX_FIELD, frame.frameIndex());
            entry.put("timestamp_s", frame.timestampSeconds());
        }
        return body;
    }

    private static String encode(FrameItem frame) {
        try {
            return Base64.getEncoder().encodeToString(Files.readAllBytes(frame.jpegPath()));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read frame " + frame.jpegPath(), e);
        }
    }
}
