package com.phillippitts.photobatch.service.workers;

import com.phillippitts.photobatch.domain.RunState;
import com.phillippitts.photobatch.domain.WorkerPoolState;
import com.phillippitts.photobatch.service.metrics.ProcessingMetrics;
import com.phillippitts.photobatch.service.progress.ProgressSink;
import com.phillippitts.photobatch.service.schedule.PoolSizeAdvisor;
import com.phillippitts.photobatch.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background sampler that turns {@link AdaptiveWorkerPolicy} decisions into pool-size
 * recommendations for the scheduler.
 *
 * <p>The monitor never touches the pool. It keeps its own {@link WorkerPoolState}, assumes each
 * recommendation is applied, and leaves only the latest one in a single-slot mailbox, so a
 * scheduler that polls late skips intermediate sizes.
 */
public class AdaptiveWorkerMonitor implements PoolSizeAdvisor, AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(AdaptiveWorkerMonitor.class);
    private static final int EMPTY = 0;

    private final AdaptiveWorkerPolicy policy;
    private final RunState runState;
    private final ProgressSink sink;
    private final ProcessingMetrics metrics;
    private final Clock clock;
    private final AtomicInteger mailbox = new AtomicInteger(EMPTY);

    private volatile WorkerPoolState poolState;
    private volatile boolean stopped;
    private Thread thread;

    public AdaptiveWorkerMonitor(AdaptiveWorkerPolicy policy,
                                 int initialWorkers,
                                 RunState runState,
                                 ProgressSink sink,
                                 ProcessingMetrics metrics,
                                 Clock clock) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.runState = Objects.requireNonNull(runState, "runState");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.poolState = policy.initialState(initialWorkers, clock.instant());
    }

    /**
     * Starts the daemon sampling thread. Calling it twice has no effect.
     */
    public synchronized void start() {
        if (thread != null) {
            return;
        }
        Map<String, String> context = ThreadContext.getImmutableContext();
        thread = new Thread(() -> {
            ThreadContext.putAll(context);
            try {
                loop();
            } finally {
                ThreadContext.clearAll();
            }
        }, "adaptive-worker-monitor");
        thread.setDaemon(true);
        thread.start();
    }

    @Override
    public OptionalInt takeRecommendation() {
        int workers = mailbox.getAndSet(EMPTY);
        return workers == EMPTY ? OptionalInt.empty() : OptionalInt.of(workers);
    }

    public WorkerPoolState poolState() {
        return poolState;
    }

    /**
     * Runs one sample-and-decide cycle on the calling thread.
     *
     * @return whether a recommendation was posted
     */
    boolean checkOnce() {
        double cpu = policy.sampleOrDefault();
        WorkerPoolState current = poolState;
        Optional<WorkerPoolState> next = policy.recommend(current, cpu, clock.instant());
        if (next.isEmpty()) {
            LOG.debug("CPU {}%, keeping {} workers", String.format(Locale.ROOT, "%.1f", cpu), current.currentWorkers());
            return false;
        }
        WorkerPoolState adjusted = next.get();
        boolean down = adjusted.currentWorkers() < current.currentWorkers();
        poolState = adjusted;
        mailbox.set(adjusted.currentWorkers());
        metrics.recordAdjustment(down ? "down" : "up");
        sink.info(runState, String.format(Locale.ROOT, "CPU %s (%.1f%%), workers %d -> %d",
                down ? "high" : "low", cpu, current.currentWorkers(), adjusted.currentWorkers()));
        return true;
    }

    private void loop() {
        long intervalMs = policy.checkInterval().toMillis();
        while (!stopped && runState.isRunning()) {
            checkOnce();
            try {
                Thread.sleep(intervalMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    /**
     * Stops sampling and waits briefly for the thread to exit.
     */
    @Override
    public synchronized void close() {
        stopped = true;
        if (thread == null) {
            return;
        }
        thread.interrupt();
        try {
            thread.join(ProcessTimeouts.MONITOR_STOP_TIMEOUT.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (thread.isAlive()) {
            LOG.warn("Adaptive worker monitor did not stop within {} ms", ProcessTimeouts.MONITOR_STOP_TIMEOUT.toMillis());
        }
    }
}
