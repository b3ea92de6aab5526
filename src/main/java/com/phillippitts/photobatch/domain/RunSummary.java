package com.phillippitts.photobatch.domain;

import java.time.Duration;

/**
 * Final (or partial, when cancelled) counts of a run.
 *
 * @param runId            short run identifier, also used as the {@code runId} log context key
 * @param totalFiles       files scheduled after the already-processed pre-filter
 * @param processed        outputs written
 * @param failed           error-log entries
 * @param skipped          duplicate RAW files skipped in favour of a standard image
 * @param skippedSystem    {@code ._} / {@code _} prefixed entries
 * @param alreadyProcessed standard images whose output already existed
 * @param cancelled        whether cancellation was requested before the run ended
 * @param elapsed          wall time since the run started
 */
public record RunSummary(
        String runId,
        int totalFiles,
        int processed,
        int failed,
        int skipped,
        int skippedSystem,
        int alreadyProcessed,
        boolean cancelled,
        Duration elapsed
) {

    /**
     * Every entry the scanner looked at that belongs to a recognised category.
     */
    public int totalConsidered() {
        return totalFiles + alreadyProcessed + skipped + skippedSystem;
    }
}
