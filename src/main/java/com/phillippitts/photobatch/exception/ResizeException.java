package com.phillippitts.photobatch.exception;

/**
 * Thrown when resampling to the target dimensions fails.
 */
public class ResizeException extends PhotoBatchException {

    public ResizeException(String message) {
        super(message);
    }

    public ResizeException(String message, Throwable cause) {
        super(message, cause);
    }
}
