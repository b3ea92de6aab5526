package com.phillippitts.photobatch.exception;

/**
 * Thrown when a standard image cannot be read into pixel data.
 * Unsupported containers (no ImageIO reader) end up here as well.
 */
public class DecodeException extends PhotoBatchException {

    private final String fileName;

    public DecodeException(String message, String fileName) {
        super(message + " (file: " + fileName + ")");
        this.fileName = fileName;
    }

    public DecodeException(String message, String fileName, Throwable cause) {
        super(message + " (file: " + fileName + ")", cause);
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }
}
