package com.chunkflow.core.batch;

/**
 * Reads the sequence index a result record carries back from its originating item.
 */
@FunctionalInterface
public interface SequenceIndexExtractor<R> {

    /**
     * @return the index, or null when the record does not carry one
     */
    Integer sequenceIndex(R record);
}
