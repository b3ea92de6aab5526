package com.phillippitts.photobatch.service.schedule;

import com.phillippitts.photobatch.config.WorkerPoolFactory;
import com.phillippitts.photobatch.config.properties.ProcessingProperties;
import com.phillippitts.photobatch.domain.FileKind;
import com.phillippitts.photobatch.domain.ProcessingJob;
import com.phillippitts.photobatch.domain.RunState;
import com.phillippitts.photobatch.service.metrics.ProcessingMetrics;
import com.phillippitts.photobatch.service.progress.ProgressSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the standard-image stage across a worker pool with a capped in-flight window.
 *
 * <p>The control thread (the caller) fills the window, polls outstanding jobs without blocking on
 * any one of them, records each completion into the {@link RunState} and sleeps briefly when
 * nothing finished. Once cancellation is requested no new job is dispatched; jobs already
 * dispatched finish and are counted, and the stage returns when they have drained.
 *
 * <p>Between polls the scheduler consults a {@link PoolSizeAdvisor}. Applying a recommendation
 * replaces the pool: dispatched jobs that have not started are withdrawn through their claim
 * token and dispatched again onto the new pool, jobs already running finish on the old pool,
 * which is shut down without waiting. The pool never leaves this class.
 */
@Component
public class BoundedConcurrencyScheduler {

    private static final Logger LOG = LogManager.getLogger(BoundedConcurrencyScheduler.class);

    private final WorkerPoolFactory poolFactory;
    private final ProgressSink sink;
    private final ProcessingMetrics metrics;
    private final long pollIntervalMs;

    @Autowired
    public BoundedConcurrencyScheduler(WorkerPoolFactory poolFactory,
                                       ProgressSink sink,
                                       ProcessingMetrics metrics,
                                       ProcessingProperties properties) {
        this(poolFactory, sink, metrics, properties.getPollIntervalMs());
    }

    BoundedConcurrencyScheduler(WorkerPoolFactory poolFactory,
                                ProgressSink sink,
                                ProcessingMetrics metrics,
                                long pollIntervalMs) {
        this.poolFactory = Objects.requireNonNull(poolFactory, "poolFactory");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.pollIntervalMs = pollIntervalMs;
    }

    /**
     * Processes {@code inputs} and blocks until every dispatched job has completed.
     *
     * @param inputs    standard images in dispatch order
     * @param workers   initial pool size, positive
     * @param processor per-file work
     * @param state     run state: completions are recorded here and its flag gates dispatch
     * @param advisor   worker-count recommendations, {@link PoolSizeAdvisor#none()} for a fixed pool
     * @return completion counts of this stage
     */
    public StageResult run(List<Path> inputs,
                           int workers,
                           JobProcessor processor,
                           RunState state,
                           PoolSizeAdvisor advisor) {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be positive, got: " + workers);
        }
        if (inputs.isEmpty()) {
            return new StageResult(0, 0, 0, !state.isRunning());
        }

        int currentWorkers = workers;
        int inFlightLimit = poolFactory.inFlightLimit(currentWorkers);
        ThreadPoolTaskExecutor pool = poolFactory.create(currentWorkers, inFlightLimit);
        metrics.setPoolSize(currentWorkers);

        Iterator<Path> remaining = inputs.iterator();
        List<Dispatch> inFlight = new ArrayList<>();
        int succeeded = 0;
        int failed = 0;
        int rebuilds = 0;
        boolean interrupted = false;

        try {
            while (true) {
                if (state.isRunning()) {
                    OptionalInt advice = advisor.takeRecommendation();
                    if (advice.isPresent() && advice.getAsInt() > 0 && advice.getAsInt() != currentWorkers) {
                        int next = advice.getAsInt();
                        LOG.info("Rebuilding worker pool: {} -> {} workers", currentWorkers, next);
                        pool = rebuild(pool, next, inFlight, processor);
                        currentWorkers = next;
                        inFlightLimit = poolFactory.inFlightLimit(next);
                        metrics.setPoolSize(next);
                        rebuilds++;
                    }
                    while (inFlight.size() < inFlightLimit && remaining.hasNext()) {
                        inFlight.add(dispatch(pool, remaining.next(), processor));
                    }
                }
                metrics.setInFlight(inFlight.size());
                if (inFlight.isEmpty()) {
                    break;
                }

                int finished = 0;
                Iterator<Dispatch> it = inFlight.iterator();
                while (it.hasNext()) {
                    Dispatch d = it.next();
                    if (!d.future.isDone()) {
                        continue;
                    }
                    it.remove();
                    finished++;
                    if (collect(d, state)) {
                        succeeded++;
                    } else {
                        failed++;
                    }
                }

                if (finished == 0) {
                    try {
                        Thread.sleep(pollIntervalMs);
                    } catch (InterruptedException e) {
                        // Treat as cancellation but keep draining what was dispatched
                        interrupted = true;
                        state.cancel();
                    }
                }
            }
        } finally {
            pool.shutdown();
            metrics.setInFlight(0);
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }

        boolean cancelled = !state.isRunning() && remaining.hasNext();
        LOG.debug("Stage finished: succeeded={}, failed={}, rebuilds={}, cancelled={}",
                succeeded, failed, rebuilds, cancelled);
        return new StageResult(succeeded, failed, rebuilds, cancelled);
    }

    private Dispatch dispatch(ThreadPoolTaskExecutor pool, Path input, JobProcessor processor) {
        ProcessingJob job = new ProcessingJob(input, FileKind.STANDARD);
        AtomicBoolean claimed = new AtomicBoolean(false);
        Future<Boolean> future = pool.submit(() -> {
            if (!claimed.compareAndSet(false, true)) {
                return Boolean.FALSE;
            }
            job.start();
            boolean ok = processor.process(input);
            if (ok) {
                job.succeed();
            } else {
                job.fail();
            }
            return ok;
        });
        return new Dispatch(job, claimed, future);
    }

    /**
     * Withdraws every dispatched job that has not started and dispatches it again onto a new pool
     * right away, so it stays in flight and is counted even if the run is cancelled before the
     * smaller window opens up again.
     */
    private ThreadPoolTaskExecutor rebuild(ThreadPoolTaskExecutor old,
                                           int workers,
                                           List<Dispatch> inFlight,
                                           JobProcessor processor) {
        List<Path> withdrawn = new ArrayList<>();
        Iterator<Dispatch> it = inFlight.iterator();
        while (it.hasNext()) {
            Dispatch d = it.next();
            if (d.claimed.compareAndSet(false, true)) {
                it.remove();
                withdrawn.add(d.job.path());
            }
        }
        old.shutdown();
        // Queue sized for the redispatched jobs too, so none of them runs on the control thread
        int capacity = Math.max(poolFactory.inFlightLimit(workers), withdrawn.size());
        ThreadPoolTaskExecutor fresh = poolFactory.create(workers, capacity);
        for (Path input : withdrawn) {
            inFlight.add(dispatch(fresh, input, processor));
        }
        LOG.debug("Pool rebuilt with {} workers; {} jobs redispatched", workers, withdrawn.size());
        return fresh;
    }

    private boolean collect(Dispatch d, RunState state) {
        try {
            if (Boolean.TRUE.equals(d.future.get())) {
                sink.fileSucceeded(state);
                return true;
            }
            return false;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            LOG.warn("Job for {} failed outside its pipeline", d.job.fileName(), cause);
            String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
            sink.fileFailed(state, d.job.path(), message);
            return false;
        } catch (InterruptedException e) {
            // Unreachable for a completed future; keep the flag for the caller
            Thread.currentThread().interrupt();
            sink.fileFailed(state, d.job.path(), "interrupted");
            return false;
        }
    }

    private static final class Dispatch {
        private final ProcessingJob job;
        private final AtomicBoolean claimed;
        private final Future<Boolean> future;

        private Dispatch(ProcessingJob job, AtomicBoolean claimed, Future<Boolean> future) {
            this.job = job;
            this.claimed = claimed;
            this.future = future;
        }
    }
}
