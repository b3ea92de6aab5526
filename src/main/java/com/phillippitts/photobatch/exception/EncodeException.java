package com.phillippitts.photobatch.exception;

/**
 * Thrown when pixel data cannot be encoded as JPEG or the metadata block cannot be attached.
 */
public class EncodeException extends PhotoBatchException {

    public EncodeException(String message) {
        super(message);
    }

    public EncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
