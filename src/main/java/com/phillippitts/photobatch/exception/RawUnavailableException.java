package com.phillippitts.photobatch.exception;

/**
 * Thrown when the RAW decoder binary is missing or not executable.
 * Disables the RAW stage for the rest of the run; RAW files left unconverted are recorded as skipped.
 */
public class RawUnavailableException extends PhotoBatchException {

    private final String binaryPath;

    public RawUnavailableException(String binaryPath) {
        super("RAW decoder not available: " + binaryPath);
        this.binaryPath = binaryPath;
    }

    public String getBinaryPath() {
        return binaryPath;
    }
}
