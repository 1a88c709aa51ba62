package com.chunkflow.core.model;

/**
 * Terminal outcome of a {@link WorkItem}, created once by the worker that reached
 * the final attempt.
 *
 * @param id       identity of the originating work item
 * @param success  whether the final attempt succeeded
 * @param attempts attempts consumed, including the final one
 * @param result   handler result (success only, may be null)
 * @param error    error description (failure only)
 */
public record ExecutionOutcome<R>(
    String id,
    boolean success,
    int attempts,
    R result,
    String error
) {

    public ExecutionOutcome {
        if (success && error != null) {
            throw new IllegalArgumentException("successful outcome cannot carry an error");
        }
        if (!success && result != null) {
            throw new IllegalArgumentException("failed outcome cannot carry a result");
        }
    }

    public static <R> ExecutionOutcome<R> success(String id, int attempts, R result) {
        return new ExecutionOutcome<>(id, true, attempts, result, null);
    }

    public static <R> ExecutionOutcome<R> failure(String id, int attempts, String error) {
        return new ExecutionOutcome<>(id, false, attempts, null, error == null ? "unknown error" : error);
    }
}
