package com.chunkflow.core.engine;

import com.chunkflow.core.model.ExecutionOutcome;
import com.chunkflow.core.model.FailureRecord;
import com.chunkflow.core.model.WorkItem;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Outcome state of one {@link JobRunner}: completed outcomes, failed outcomes and
 * the failure records that allow replay.
 * <p>
 * All three maps are guarded by a single lock so that replay observes and mutates
 * them atomically relative to workers depositing failures. An id is present in at
 * most one of the completed and failed maps.
 */
public class JobStore<P, R> {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ExecutionOutcome<R>> completed = new LinkedHashMap<>();
    private final Map<String, ExecutionOutcome<R>> failed = new LinkedHashMap<>();
    private final Map<String, FailureRecord<P, R>> failureRecords = new LinkedHashMap<>();

    public void recordSuccess(ExecutionOutcome<R> outcome) {
        lock.lock();
        try {
            failed.remove(outcome.id());
            failureRecords.remove(outcome.id());
            completed.put(outcome.id(), outcome);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Deposits a terminal failure together with a fresh copy of the item for replay.
     */
    public void recordFailure(ExecutionOutcome<R> outcome, WorkItem<P> item) {
        var record = new FailureRecord<>(outcome, item.resubmittable());
        lock.lock();
        try {
            completed.remove(outcome.id());
            failed.put(outcome.id(), outcome);
            failureRecords.put(outcome.id(), record);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops the failed outcome and failure record for {@code id}, if any.
     *
     * @return true if a failure was discarded
     */
    public boolean discardFailure(String id) {
        lock.lock();
        try {
            failureRecords.remove(id);
            return failed.remove(id) != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Hands fresh work items for matching failure records to {@code resubmit} while
     * the lock is still held. A record is removed only when {@code resubmit} accepts it.
     *
     * @param id       failed id to replay, or null for every failed item
     * @param resubmit enqueues a work item, returning false if it declined
     * @return number of items replayed
     */
    public int replay(String id, Predicate<WorkItem<P>> resubmit) {
        lock.lock();
        try {
            List<String> candidates = id != null ? List.of(id) : new ArrayList<>(failed.keySet());
            int replayed = 0;
            for (String failedId : candidates) {
                if (!failed.containsKey(failedId)) {
                    continue;
                }
                FailureRecord<P, R> record = failureRecords.get(failedId);
                if (record == null) {
                    continue;
                }
                if (!resubmit.test(record.item().resubmittable())) {
                    continue;
                }
                failed.remove(failedId);
                failureRecords.remove(failedId);
                replayed++;
            }
            return replayed;
        } finally {
            lock.unlock();
        }
    }

    public Map<String, ExecutionOutcome<R>> completed() {
        lock.lock();
        try {
            return Map.copyOf(completed);
        } finally {
            lock.unlock();
        }
    }

    public Map<String, ExecutionOutcome<R>> failed() {
        lock.lock();
        try {
            return Map.copyOf(failed);
        } finally {
            lock.unlock();
        }
    }

    public List<FailureRecord<P, R>> failureRecords() {
        lock.lock();
        try {
            return List.copyOf(failureRecords.values());
        } finally {
            lock.unlock();
        }
    }

    /** Failed ids mapped to their error text, in failure order. */
    public Map<String, String> failedErrors() {
        lock.lock();
        try {
            var errors = new LinkedHashMap<String, String>();
            failed.forEach((id, outcome) -> errors.put(id, outcome.error()));
            return errors;
        } finally {
            lock.unlock();
        }
    }

    public Optional<ExecutionOutcome<R>> outcome(String id) {
        lock.lock();
        try {
            var outcome = completed.get(id);
            return Optional.ofNullable(outcome != null ? outcome : failed.get(id));
        } finally {
            lock.unlock();
        }
    }
}
