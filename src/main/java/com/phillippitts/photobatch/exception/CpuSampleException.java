package com.phillippitts.photobatch.exception;

/**
 * Thrown when host CPU utilization cannot be sampled.
 * The adaptive policy substitutes a neutral load instead of failing the run.
 */
public class CpuSampleException extends PhotoBatchException {

    public CpuSampleException(String message) {
        super(message);
    }

    public CpuSampleException(String message, Throwable cause) {
        super(message, cause);
    }
}
