package com.chunkflow.core.engine;

/**
 * Processing function applied by a {@link JobRunner} to each work item payload.
 * <p>
 * Called concurrently from several workers with different payloads. Any exception
 * is treated as a retryable failure until the item's retry ceiling is exhausted.
 * The engine enforces no timeout; a handler that may hang must bound itself.
 */
@FunctionalInterface
public interface JobHandler<P, R> {

    R execute(P payload) throws Exception;
}
