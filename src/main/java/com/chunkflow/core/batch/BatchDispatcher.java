package com.chunkflow.core.batch;

import com.chunkflow.core.events.ChunkflowEvent;
import com.chunkflow.core.events.EventBus;
import com.chunkflow.core.logging.MdcContext;
import com.chunkflow.core.metrics.ChunkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sends batches to a remote processor with bounded parallelism.
 *
 * <p>With a parallelism factor of 1 or less, batches are sent one at a time on the
 * calling thread, in order. Above 1, up to that many sends run at once on a fixed pool
 * and the rest are scheduled as slots free up. The caller blocks until every send has
 * finished. Per-batch results are returned in batch order regardless of which send
 * completed first.
 *
 * <p>The first failing send aborts the whole call: batches not yet started are cancelled
 * and the failure is rethrown. In-flight sends are left to finish on their own.
 */
@Component
public class BatchDispatcher {

    private static final Logger log = LoggerFactory.getLogger(BatchDispatcher.class);

    private final EventBus eventBus;
    private final ChunkflowMetrics metrics;

    public BatchDispatcher() {
        this(null, null);
    }

    @Autowired
    public BatchDispatcher(@Autowired(required = false) EventBus eventBus,
                           @Autowired(required = false) ChunkflowMetrics metrics) {
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Dispatches every batch and returns per-batch results in batch order.
     *
     * @param batches     batches to send
     * @param sender      send function applied to each batch
     * @param parallelism maximum concurrent sends (serial when 1 or less)
     * @return one result list per batch, index-aligned with {@code batches}
     * @throws BatchDispatchException if any send throws
     * @throws DataContractException  if a send violates the result contract
     */
    public <T, R> List<List<R>> dispatch(List<List<T>> batches, BatchSender<T, R> sender, int parallelism) {
        if (batches.isEmpty()) {
            return List.of();
        }
        if (metrics != null) {
            metrics.recordDispatch(batches.size(), parallelism);
        }
        log.info("Dispatching {} batch(es) with parallelism {}", batches.size(), parallelism);

        if (parallelism <= 1 || batches.size() == 1) {
            var results = new ArrayList<List<R>>(batches.size());
            for (int i = 0; i < batches.size(); i++) {
                results.add(sendOne(i, batches.get(i), sender));
            }
            return results;
        }
        return dispatchConcurrently(batches, sender, Math.min(parallelism, batches.size()));
    }

    private <T, R> List<List<R>> dispatchConcurrently(List<List<T>> batches, BatchSender<T, R> sender,
                                                      int threads) {
        var threadCounter = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "batch-dispatch-" + threadCounter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        var completion = new ExecutorCompletionService<IndexedResult<R>>(executor);
        var futures = new ArrayList<Future<IndexedResult<R>>>(batches.size());
        List<List<R>> results = new ArrayList<>(Collections.nCopies(batches.size(), null));

        try {
            for (int i = 0; i < batches.size(); i++) {
                final int batchIndex = i;
                final List<T> batch = batches.get(i);
                futures.add(completion.submit(() -> new IndexedResult<>(batchIndex, sendOne(batchIndex, batch, sender))));
            }
            for (int done = 0; done < batches.size(); done++) {
                Future<IndexedResult<R>> future = completion.take();
                try {
                    var indexed = future.get();
                    results.set(indexed.batchIndex(), indexed.records());
                } catch (ExecutionException e) {
                    cancelPending(futures);
                    throw unwrap(e.getCause());
                }
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelPending(futures);
            throw new BatchDispatchException(-1, e);
        } finally {
            executor.shutdown();
        }
    }

    private <T, R> List<R> sendOne(int batchIndex, List<T> batch, BatchSender<T, R> sender) {
        MdcContext.setBatch(batchIndex);
        long startMs = System.currentTimeMillis();
        try {
            List<R> records = sender.send(batch);
            if (records == null) {
                throw new DataContractException("Batch " + batchIndex + " returned no result list");
            }
            long elapsedMs = System.currentTimeMillis() - startMs;
            log.debug("Batch {} ({} items) returned {} record(s) in {} ms",
                    batchIndex, batch.size(), records.size(), elapsedMs);
            if (metrics != null) {
                metrics.recordBatchDuration(elapsedMs);
            }
            publish("batch.completed", batchIndex,
                    Map.of("items", batch.size(), "records", records.size(), "elapsedMs", elapsedMs));
            return records;
        } catch (DataContractException e) {
            recordFailure(batchIndex, e);
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(batchIndex, e);
            throw new BatchDispatchException(batchIndex, e);
        } catch (Exception e) {
            recordFailure(batchIndex, e);
            throw new BatchDispatchException(batchIndex, e);
        } finally {
            MdcContext.clearBatch();
        }
    }

    private void recordFailure(int batchIndex, Exception e) {
        log.error("Batch {} send failed: {}", batchIndex, e.getMessage());
        if (metrics != null) {
            metrics.recordBatchFailure();
        }
        publish("batch.failed", batchIndex,
                Map.of("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
    }

    private void publish(String type, int batchIndex, Map<String, Object> payload) {
        if (eventBus != null) {
            eventBus.publish(ChunkflowEvent.of(type, "dispatcher", String.valueOf(batchIndex), payload));
        }
    }

    private static void cancelPending(List<? extends Future<?>> futures) {
        for (var future : futures) {
            future.cancel(false);
        }
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof BatchDispatchException || cause instanceof DataContractException) {
            return (RuntimeException) cause;
        }
        return new BatchDispatchException(-1, cause);
    }

    private record IndexedResult<R>(int batchIndex, List<R> records) {}
}
