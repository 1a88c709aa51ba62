package com.chunkflow.media;

/**
 * Thrown when an external media tool is missing or exits with a failure.
 */
public class MediaProcessingException extends RuntimeException {
    public MediaProcessingException(String message) {
        super(message);
    }

    public MediaProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
