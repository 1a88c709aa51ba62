package com.chunkflow.core.model;

/**
 * A quarantined, re-submittable copy of a terminally failed work item.
 * Owned by {@link com.chunkflow.core.engine.JobStore} until replayed.
 *
 * @param outcome the failed outcome
 * @param item    fresh copy with attempts reset to 0
 */
public record FailureRecord<P, R>(
    ExecutionOutcome<R> outcome,
    WorkItem<P> item
) {

    public FailureRecord {
        if (outcome.success()) {
            throw new IllegalArgumentException("failure record requires a failed outcome: " + outcome.id());
        }
        if (!outcome.id().equals(item.id())) {
            throw new IllegalArgumentException("outcome " + outcome.id() + " does not match item " + item.id());
        }
    }

    public String id() {
        return outcome.id();
    }
}
