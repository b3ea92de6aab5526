package com.phillippitts.photobatch.exception;

/**
 * Thrown when an output directory or file cannot be written.
 */
public class OutputWriteException extends PhotoBatchException {

    private final String outputPath;

    public OutputWriteException(String outputPath, Throwable cause) {
        super("Cannot write output: " + outputPath, cause);
        this.outputPath = outputPath;
    }

    public String getOutputPath() {
        return outputPath;
    }
}
