package com.chunkflow.core.batch;

/**
 * Thrown when a batch send fails. Fatal to the whole dispatch call; the dispatcher
 * does not retry.
 */
public class BatchDispatchException extends RuntimeException {

    private final int batchIndex;

    public BatchDispatchException(int batchIndex, Throwable cause) {
        super("Batch " + batchIndex + " failed: " + describe(cause), cause);
        this.batchIndex = batchIndex;
    }

    /** Zero-based position of the batch whose send failed. */
    public int getBatchIndex() {
        return batchIndex;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
