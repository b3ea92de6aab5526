package com.phillippitts.photobatch.service.progress;

import java.time.Instant;

/**
 * One human-readable run log line.
 *
 * @param runId     run the line belongs to
 * @param message   text shown to the user
 * @param warning   whether the line reports a recoverable problem
 * @param timestamp when the line was produced
 */
public record RunLogEvent(String runId, String message, boolean warning, Instant timestamp) {}
