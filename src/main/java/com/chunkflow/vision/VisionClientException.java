package com.chunkflow.vision;

/**
 * Thrown when the remote vision processor cannot be reached or answers with an error status.
 */
public class VisionClientException extends RuntimeException {

    private final int statusCode;

    public VisionClientException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public VisionClientException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status, or -1 when no response was received. */
    public int getStatusCode() {
        return statusCode;
    }
}
