package com.phillippitts.photobatch.exception;

/**
 * Thrown when a single RAW file cannot be demosaiced.
 * RAW files get one attempt, so this always ends the file's job.
 */
public class RawDecodeException extends PhotoBatchException {

    private final String fileName;

    public RawDecodeException(String message) {
        super(message);
        this.fileName = "unknown";
    }

    public RawDecodeException(String message, String fileName) {
        super(message + " (file: " + fileName + ")");
        this.fileName = fileName;
    }

    public RawDecodeException(String message, String fileName, Throwable cause) {
        super(message + " (file: " + fileName + ")", cause);
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }
}
