package com.chunkflow.core.model;

/**
 * A unit of opaque work submitted to a {@link com.chunkflow.core.engine.JobRunner}.
 *
 * <p>The payload is never inspected by the engine. The attempt counter is only
 * mutated by the worker that currently owns the item, so it needs no locking.
 * Before a terminal outcome is recorded {@code attempts <= maxRetries + 1}.
 */
public final class WorkItem<P> {

    private final String id;
    private final P payload;
    private final int maxRetries;
    private final long createdAtNanos;
    private int attempts;

    public WorkItem(String id, P payload, int maxRetries) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("work item id must not be blank");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
        this.id = id;
        this.payload = payload;
        this.maxRetries = maxRetries;
        this.createdAtNanos = System.nanoTime();
    }

    public String id() { return id; }
    public P payload() { return payload; }
    public int maxRetries() { return maxRetries; }
    public int attempts() { return attempts; }

    /** Monotonic clock reading taken at construction, for diagnostics only. */
    public long createdAtNanos() { return createdAtNanos; }

    /**
     * Counts a new execution attempt.
     *
     * @return the attempt number just started (1-based)
     */
    public int beginAttempt() {
        return ++attempts;
    }

    /** True while another attempt is allowed after a failure. */
    public boolean canRetry() {
        return attempts <= maxRetries;
    }

    /**
     * Fresh copy for resubmission: same id, payload and retry ceiling, attempts reset to 0.
     */
    public WorkItem<P> resubmittable() {
        return new WorkItem<>(id, payload, maxRetries);
    }

    @Override
    public String toString() {
        return "WorkItem[id=" + id + ", attempts=" + attempts + "/" + (maxRetries + 1) + "]";
    }
}
