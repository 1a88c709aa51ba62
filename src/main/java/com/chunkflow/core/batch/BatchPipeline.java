package com.chunkflow.core.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Partition, dispatch and reassemble in one call: the ordered-results half of the engine.
 *
 * @param <T> sub-item type
 * @param <R> result record type
 */
public class BatchPipeline<T, R> {

    private static final Logger log = LoggerFactory.getLogger(BatchPipeline.class);

    private final BatchDispatcher dispatcher;
    private final ResultReassembler<R> reassembler;

    public BatchPipeline(BatchDispatcher dispatcher, SequenceIndexExtractor<R> indexExtractor) {
        this.dispatcher = dispatcher;
        this.reassembler = new ResultReassembler<>(indexExtractor);
    }

    /**
     * Sends {@code items} in batches and returns all results ordered by sequence index.
     * The batch size is validated before anything is sent.
     *
     * @throws IllegalArgumentException if batchSize is not positive
     * @throws BatchDispatchException   if any batch send fails
     * @throws DataContractException    if a result record lacks its sequence index
     */
    public List<R> run(List<T> items, int batchSize, int parallelism, BatchSender<T, R> sender) {
        BatchPartitioner.requireValidBatchSize(batchSize);
        if (items.isEmpty()) {
            return List.of();
        }
        var batches = new ArrayList<List<T>>(BatchPartitioner.batchCount(items.size(), batchSize));
        for (List<T> batch : BatchPartitioner.partition(items, batchSize)) {
            batches.add(batch);
        }
        log.debug("Partitioned {} item(s) into {} batch(es) of up to {}", items.size(), batches.size(), batchSize);

        List<List<R>> perBatch = dispatcher.dispatch(batches, sender, parallelism);
        return reassembler.reassemble(perBatch);
    }
}
