package com.phillippitts.photobatch.service.batch;

import com.phillippitts.photobatch.domain.ProcessingConfig;
import com.phillippitts.photobatch.domain.RunSummary;

/**
 * Runs one batch over an input tree.
 *
 * <p>Implementations allow a single active run at a time and must be cancellable from another
 * thread while {@link #process(ProcessingConfig)} is blocked.
 */
public interface BatchProcessor {

    /**
     * Scans, processes standard images in parallel, then RAW files sequentially, and writes the
     * error report. Per-file failures never escape; they are counted in the summary.
     *
     * @param config run settings
     * @return final counts, or partial counts when the run was cancelled
     * @throws IllegalStateException if another run is active
     * @throws com.phillippitts.photobatch.exception.PhotoBatchException if the input tree cannot be scanned
     */
    RunSummary process(ProcessingConfig config);

    /**
     * Requests cooperative cancellation of the active run, if any. Returns immediately.
     */
    void cancel();
}
