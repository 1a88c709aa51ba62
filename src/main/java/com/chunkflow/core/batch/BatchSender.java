package com.chunkflow.core.batch;

import java.util.List;

/**
 * Sends one batch to a remote processor and returns its result records.
 * <p>
 * Each record is expected to carry back the sequence index of the item it answers
 * so that {@link ResultReassembler} can restore global order. Implementations are
 * called concurrently and must bound their own call duration.
 */
@FunctionalInterface
public interface BatchSender<T, R> {

    List<R> send(List<T> batch) throws Exception;
}
