package com.phillippitts.photobatch.exception;

/**
 * Thrown when an embedded ICC profile cannot be applied.
 * Always recovered by the caller: the original pixels are kept.
 */
public class ColorProfileException extends PhotoBatchException {

    public ColorProfileException(String message) {
        super(message);
    }

    public ColorProfileException(String message, Throwable cause) {
        super(message, cause);
    }
}
