package com.chunkflow.core.engine;

import com.chunkflow.core.events.ChunkflowEvent;
import com.chunkflow.core.events.EventBus;
import com.chunkflow.core.logging.MdcContext;
import com.chunkflow.core.metrics.ChunkflowMetrics;
import com.chunkflow.core.model.ExecutionOutcome;
import com.chunkflow.core.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-size worker pool that drains a single intake queue, applies a
 * {@link JobHandler} to each item and records the terminal outcome in a {@link JobStore}.
 *
 * <p>Execution is at-least-once with a per-item retry ceiling. Failed attempts are
 * retried inline by the same worker rather than re-queued, so one item's retries
 * never sit behind the backlog while the other workers keep draining it. Items that
 * exhaust their ceiling are quarantined and can be replayed with {@link #retryFailed()}.
 *
 * <p>{@link #shutdown()} is the only cancellation primitive. It is cooperative:
 * workers finish their current attempt loop, and items still queued are abandoned.
 */
public class JobRunner<P, R> {

    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(50);
    static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(1);

    private final String name;
    private final JobHandler<P, R> handler;
    private final int workers;
    private final Duration pollInterval;
    private final Duration retryBackoff;
    private final Duration shutdownTimeout;
    private final EventBus eventBus;
    private final ChunkflowMetrics metrics;

    private final JobStore<P, R> store = new JobStore<>();
    private final BlockingQueue<WorkItem<P>> queue = new LinkedBlockingQueue<>();
    private final WorkItem<P> shutdownSentinel = new WorkItem<>("__shutdown__", null, 0);
    private final Set<String> liveIds = ConcurrentHashMap.newKeySet();

    /** Guards {@link #unfinished}; notified whenever it reaches zero. */
    private final Object drainMonitor = new Object();
    private long unfinished;

    private ExecutorService pool;
    private AtomicBoolean stopSignal;

    public JobRunner(JobHandler<P, R> handler, int workers) {
        this("jobs", handler, workers, DEFAULT_POLL_INTERVAL, Duration.ZERO, DEFAULT_SHUTDOWN_TIMEOUT, null, null);
    }

    public JobRunner(String name, JobHandler<P, R> handler, int workers,
                     Duration pollInterval, Duration retryBackoff, Duration shutdownTimeout,
                     EventBus eventBus, ChunkflowMetrics metrics) {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be > 0, got " + workers);
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        this.name = name;
        this.handler = handler;
        this.workers = workers;
        this.pollInterval = pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()
                ? DEFAULT_POLL_INTERVAL : pollInterval;
        this.retryBackoff = retryBackoff == null || retryBackoff.isNegative() ? Duration.ZERO : retryBackoff;
        this.shutdownTimeout = shutdownTimeout == null ? DEFAULT_SHUTDOWN_TIMEOUT : shutdownTimeout;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Launches the worker loops. Does nothing if the runner is already started.
     */
    public synchronized void start() {
        if (pool != null) {
            return;
        }
        var signal = new AtomicBoolean(false);
        var threadCounter = new AtomicInteger();
        stopSignal = signal;
        pool = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, name + "-worker-" + threadCounter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        for (int i = 0; i < workers; i++) {
            pool.execute(() -> workerLoop(signal));
        }
        log.info("Started runner '{}' with {} workers", name, workers);
    }

    /**
     * Enqueues a work item. Never blocks; the intake queue is unbounded.
     * A failure already recorded for the same id is discarded, so the new item
     * replaces it and can no longer be replayed alongside it.
     *
     * @throws IllegalArgumentException if an item with the same id is queued or running
     */
    public void submit(WorkItem<P> item) {
        if (!liveIds.add(item.id())) {
            throw new IllegalArgumentException("work item already live: " + item.id());
        }
        if (store.discardFailure(item.id())) {
            log.info("Job {} resubmitted; discarding its recorded failure", item.id());
        }
        enqueue(item);
    }

    public WorkItem<P> submit(String id, P payload, int maxRetries) {
        var item = new WorkItem<>(id, payload, maxRetries);
        submit(item);
        return item;
    }

    /**
     * Blocks until the queue and all in-flight items have drained.
     */
    public void join() throws InterruptedException {
        join(null);
    }

    /**
     * Blocks until the queue and all in-flight items have drained, or the timeout elapses.
     *
     * @param timeout maximum wait, or null to wait indefinitely
     * @return true if the drain completed
     */
    public boolean join(Duration timeout) throws InterruptedException {
        long deadline = timeout == null ? 0L : System.nanoTime() + timeout.toNanos();
        synchronized (drainMonitor) {
            while (unfinished > 0) {
                if (timeout == null) {
                    drainMonitor.wait();
                    continue;
                }
                long remainingNanos = deadline - System.nanoTime();
                if (remainingNanos <= 0) {
                    return false;
                }
                drainMonitor.wait(Math.max(1L, TimeUnit.NANOSECONDS.toMillis(remainingNanos)));
            }
            return true;
        }
    }

    /**
     * Stops the worker loops after their current item and waits a bounded time for them to exit.
     *
     * @return items that were queued but never started; they are neither completed nor failed
     */
    public synchronized List<WorkItem<P>> shutdown() {
        if (pool == null) {
            return List.of();
        }
        stopSignal.set(true);
        for (int i = 0; i < workers; i++) {
            queue.offer(shutdownSentinel);
        }
        pool.shutdown();
        try {
            if (!pool.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Runner '{}' workers still busy after {} ms; leaving them to finish",
                        name, shutdownTimeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for runner '{}' to stop", name);
        }
        pool = null;

        var drained = new ArrayList<WorkItem<P>>();
        queue.drainTo(drained);
        var abandoned = new ArrayList<WorkItem<P>>();
        for (var item : drained) {
            if (item != shutdownSentinel) {
                abandoned.add(item);
                liveIds.remove(item.id());
            }
        }
        markDone(abandoned.size());
        if (!abandoned.isEmpty()) {
            log.warn("Runner '{}' abandoned {} queued item(s) at shutdown", name, abandoned.size());
        }
        log.info("Runner '{}' stopped", name);
        return abandoned;
    }

    /**
     * Resubmits every currently failed item with its attempt counter reset.
     *
     * @return number of items resubmitted
     */
    public int retryFailed() {
        return retryFailed(null);
    }

    /**
     * Resubmits the failed item with the given id, or all failed items when id is null.
     * Removal from the failure store and resubmission happen under the store lock.
     *
     * @return number of items resubmitted
     */
    public int retryFailed(String id) {
        int count = store.replay(id, item -> {
            if (!liveIds.add(item.id())) {
                log.warn("Job {} is already live; not replaying it", item.id());
                return false;
            }
            enqueue(item);
            publish("job.replayed", item.id(), Map.of("maxRetries", item.maxRetries()));
            return true;
        });
        if (count > 0) {
            log.info("Runner '{}' replayed {} failed item(s)", name, count);
            if (metrics != null) {
                metrics.recordReplay(name, count);
            }
        }
        return count;
    }

    public Map<String, ExecutionOutcome<R>> completed() {
        return store.completed();
    }

    public Map<String, ExecutionOutcome<R>> failed() {
        return store.failed();
    }

    /** Failed ids mapped to their error text. */
    public Map<String, String> failedErrors() {
        return store.failedErrors();
    }

    public Optional<ExecutionOutcome<R>> outcome(String id) {
        return store.outcome(id);
    }

    /** Items queued or in flight. */
    public long pendingCount() {
        synchronized (drainMonitor) {
            return unfinished;
        }
    }

    public synchronized boolean isRunning() {
        return pool != null;
    }

    public String name() {
        return name;
    }

    private void enqueue(WorkItem<P> item) {
        synchronized (drainMonitor) {
            unfinished++;
        }
        queue.offer(item);
    }

    private void markDone(long count) {
        if (count == 0) {
            return;
        }
        synchronized (drainMonitor) {
            unfinished -= count;
            if (unfinished <= 0) {
                unfinished = 0;
                drainMonitor.notifyAll();
            }
        }
    }

    private void workerLoop(AtomicBoolean stop) {
        while (!stop.get()) {
            WorkItem<P> item;
            try {
                item = queue.poll(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (item == null) {
                continue;
            }
            if (item == shutdownSentinel) {
                return;
            }
            if (stop.get()) {
                // Stop was signalled while polling; leave the item for shutdown to report.
                queue.offer(item);
                return;
            }
            try {
                runItem(item);
            } finally {
                MdcContext.clear();
                markDone(1);
            }
        }
    }

    private void runItem(WorkItem<P> item) {
        while (true) {
            int attempt = item.beginAttempt();
            MdcContext.setJob(item.id(), attempt);
            R value;
            try {
                value = handler.execute(item.payload());
            } catch (Exception e) {
                boolean interrupted = e instanceof InterruptedException;
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
                if (!interrupted && item.canRetry() && awaitBackoff()) {
                    log.warn("Job {} attempt {}/{} failed, retrying: {}",
                            item.id(), attempt, item.maxRetries() + 1, e.getMessage());
                    publish("job.attempt.failed", item.id(),
                            Map.of("attempt", attempt, "error", describe(e)));
                    continue;
                }
                fail(item, e);
                return;
            }
            complete(item, value);
            return;
        }
    }

    private boolean awaitBackoff() {
        if (retryBackoff.isZero()) {
            return true;
        }
        try {
            Thread.sleep(retryBackoff.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void complete(WorkItem<P> item, R value) {
        var outcome = ExecutionOutcome.success(item.id(), item.attempts(), value);
        liveIds.remove(item.id());
        store.recordSuccess(outcome);
        log.info("Job {} completed after {} attempt(s), {} ms after submission", item.id(), item.attempts(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - item.createdAtNanos()));
        publish("job.completed", item.id(), Map.of("attempts", item.attempts()));
        if (metrics != null) {
            metrics.recordJobOutcome(name, true, item.attempts());
        }
    }

    private void fail(WorkItem<P> item, Exception e) {
        var outcome = ExecutionOutcome.<R>failure(item.id(), item.attempts(), describe(e));
        liveIds.remove(item.id());
        store.recordFailure(outcome, item);
        log.error("Job {} failed after {} attempt(s): {}", item.id(), item.attempts(), outcome.error(), e);
        publish("job.failed", item.id(), Map.of("attempts", item.attempts(), "error", outcome.error()));
        if (metrics != null) {
            metrics.recordJobOutcome(name, false, item.attempts());
        }
    }

    private void publish(String type, String id, Map<String, Object> payload) {
        if (eventBus != null) {
            eventBus.publish(ChunkflowEvent.of(type, name, id, payload));
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
