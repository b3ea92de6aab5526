package com.phillippitts.photobatch.exception;

/**
 * Base exception for all photo-batch application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class PhotoBatchException extends RuntimeException {

    public PhotoBatchException(String message) {
        super(message);
    }

    public PhotoBatchException(String message, Throwable cause) {
        super(message, cause);
    }

    public PhotoBatchException(Throwable cause) {
        super(cause);
    }
}
