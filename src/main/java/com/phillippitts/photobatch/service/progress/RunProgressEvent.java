package com.phillippitts.photobatch.service.progress;

/**
 * Published after every completed file.
 *
 * @param runId     run the file belongs to
 * @param processed outputs written so far; never decreases within a run
 * @param total     files scheduled for the run
 */
public record RunProgressEvent(String runId, int processed, int total) {}
