package com.phillippitts.photobatch.service.metrics;

import com.phillippitts.photobatch.domain.FileKind;
import com.phillippitts.photobatch.exception.ColorProfileException;
import com.phillippitts.photobatch.exception.DecodeException;
import com.phillippitts.photobatch.exception.EncodeException;
import com.phillippitts.photobatch.exception.OutputWriteException;
import com.phillippitts.photobatch.exception.RawDecodeException;
import com.phillippitts.photobatch.exception.ResizeException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer instrumentation for batch runs.
 *
 * <p>Provides:
 * <ul>
 *   <li>{@code photobatch.files.processed} / {@code photobatch.files.failed} per file kind</li>
 *   <li>{@code photobatch.file.latency} per file kind</li>
 *   <li>{@code photobatch.workers.pool.size} and {@code photobatch.jobs.in-flight} gauges</li>
 *   <li>{@code photobatch.workers.adjustments} per direction</li>
 * </ul>
 */
@Component
public class ProcessingMetrics {

    private static final String METRIC_PREFIX = "photobatch";

    private final MeterRegistry registry;
    private final AtomicInteger poolSize = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();

    public ProcessingMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder(METRIC_PREFIX + ".workers.pool.size", poolSize, AtomicInteger::get)
                .description("Worker threads of the standard-image pool")
                .register(registry);
        Gauge.builder(METRIC_PREFIX + ".jobs.in-flight", inFlight, AtomicInteger::get)
                .description("Dispatched standard-image jobs not yet collected")
                .register(registry);
    }

    /**
     * @param kind          file kind
     * @param durationNanos wall time of the whole per-file pipeline, retries included
     */
    public void recordLatency(FileKind kind, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".file.latency")
                .description("Time taken to transform one input file")
                .tag("kind", kind.tag())
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementProcessed(FileKind kind) {
        Counter.builder(METRIC_PREFIX + ".files.processed")
                .description("Number of outputs written")
                .tag("kind", kind.tag())
                .register(registry)
                .increment();
    }

    /**
     * @param kind   file kind
     * @param reason short failure category, see {@link #reasonOf(Throwable)}
     */
    public void incrementFailed(FileKind kind, String reason) {
        Counter.builder(METRIC_PREFIX + ".files.failed")
                .description("Number of inputs that produced an error-log entry")
                .tag("kind", kind.tag())
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param direction {@code up} or {@code down}
     */
    public void recordAdjustment(String direction) {
        Counter.builder(METRIC_PREFIX + ".workers.adjustments")
                .description("Worker pool rebuilds requested by the adaptive policy")
                .tag("direction", direction)
                .register(registry)
                .increment();
    }

    public void setPoolSize(int workers) {
        poolSize.set(workers);
    }

    public void setInFlight(int jobs) {
        inFlight.set(jobs);
    }

    public static String reasonOf(Throwable error) {
        if (error instanceof DecodeException) {
            return "decode";
        }
        if (error instanceof ColorProfileException) {
            return "color";
        }
        if (error instanceof ResizeException) {
            return "resize";
        }
        if (error instanceof EncodeException) {
            return "encode";
        }
        if (error instanceof OutputWriteException) {
            return "write";
        }
        if (error instanceof RawDecodeException) {
            return "raw-decode";
        }
        return "error";
    }
}
