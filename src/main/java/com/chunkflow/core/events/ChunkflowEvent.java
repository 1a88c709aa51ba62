package com.chunkflow.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by the job engine or the batch pipeline.
 *
 * @param eventType event type (e.g. "job.completed", "job.failed", "batch.completed")
 * @param source    name of the runner or dispatcher that emitted it
 * @param subjectId work item id or batch index the event relates to (nullable)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record ChunkflowEvent(
    String eventType,
    String source,
    String subjectId,
    Map<String, Object> payload,
    Instant timestamp
) {

    public static ChunkflowEvent of(String eventType, String source, String subjectId,
                                    Map<String, Object> payload) {
        return new ChunkflowEvent(eventType, source, subjectId, payload, Instant.now());
    }
}
