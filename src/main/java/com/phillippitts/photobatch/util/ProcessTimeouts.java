package com.phillippitts.photobatch.util;

import java.time.Duration;

/**
 * Timeouts for decoder subprocess and helper-thread lifecycle.
 *
 * @see com.phillippitts.photobatch.service.codec.raw.DcrawRawDecoder
 * @see com.phillippitts.photobatch.service.workers.AdaptiveWorkerMonitor
 */
public final class ProcessTimeouts {

    /**
     * Time stream gobblers get to flush buffered output after the process exits.
     * TIFF output of a full-size RAW can be tens of megabytes, so this is generous.
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofSeconds(5);

    /**
     * Best-effort join of gobblers during cleanup; they are daemon threads.
     */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Wait after {@link Process#destroy()} before escalating.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Wait after {@link Process#destroyForcibly()}.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Join timeout for the CPU monitor thread when the standard stage ends.
     * Must exceed one sample window so an in-progress sample can finish.
     */
    public static final Duration MONITOR_STOP_TIMEOUT = Duration.ofMillis(2500);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
