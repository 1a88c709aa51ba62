package com.chunkflow.core.batch;

/**
 * Thrown when a remote processor's response breaks the result contract,
 * e.g. a result record without its correlating sequence index.
 */
public class DataContractException extends RuntimeException {
    public DataContractException(String message) {
        super(message);
    }

    public DataContractException(String message, Throwable cause) {
        super(message, cause);
    }
}
