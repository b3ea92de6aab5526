package com.phillippitts.photobatch.domain;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable counters, error log and cancellation flag of a single run.
 *
 * <p>Created at run start and handed by reference to every component taking part in the run.
 * All counter and error-log mutations go through one run-scoped lock, so completions arriving
 * from worker threads and the control thread are serialized. The {@code running} flag is
 * volatile and read without the lock at every cancellation point.
 */
public final class RunState {

    private final String runId;
    private final Instant startedAt;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile boolean running = true;

    private int totalFiles;
    private int processedFiles;
    private int skipFiles;
    private int skippedSystemFiles;
    private int alreadyProcessed;
    private final List<ErrorRecord> errorLog = new ArrayList<>();

    public RunState() {
        this(Clock.systemDefaultZone());
    }

    public RunState(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.runId = UUID.randomUUID().toString().substring(0, 8);
        this.startedAt = clock.instant();
    }

    public String runId() {
        return runId;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Requests cooperative cancellation. Work already dispatched keeps running and is still counted.
     */
    public void cancel() {
        running = false;
    }

    public void setTotalFiles(int total) {
        lock.lock();
        try {
            this.totalFiles = total;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Counts one successfully written output.
     *
     * @return processed count after the increment
     */
    public int recordSuccess() {
        lock.lock();
        try {
            return ++processedFiles;
        } finally {
            lock.unlock();
        }
    }

    public ErrorRecord recordError(String filename, String message) {
        ErrorRecord entry = new ErrorRecord(LocalTime.now(clock), filename, message);
        lock.lock();
        try {
            errorLog.add(entry);
        } finally {
            lock.unlock();
        }
        return entry;
    }

    public void addDuplicateSkips(int count) {
        lock.lock();
        try {
            skipFiles += count;
        } finally {
            lock.unlock();
        }
    }

    public void addSystemSkips(int count) {
        lock.lock();
        try {
            skippedSystemFiles += count;
        } finally {
            lock.unlock();
        }
    }

    public void setAlreadyProcessed(int count) {
        lock.lock();
        try {
            alreadyProcessed = count;
        } finally {
            lock.unlock();
        }
    }

    public int processedFiles() {
        lock.lock();
        try {
            return processedFiles;
        } finally {
            lock.unlock();
        }
    }

    public int totalFiles() {
        lock.lock();
        try {
            return totalFiles;
        } finally {
            lock.unlock();
        }
    }

    public int errorCount() {
        lock.lock();
        try {
            return errorLog.size();
        } finally {
            lock.unlock();
        }
    }

    public List<ErrorRecord> errorLog() {
        lock.lock();
        try {
            return List.copyOf(errorLog);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Consistent snapshot of every counter.
     */
    public RunSummary summary() {
        lock.lock();
        try {
            return new RunSummary(runId, totalFiles, processedFiles, errorLog.size(), skipFiles,
                    skippedSystemFiles, alreadyProcessed, !running,
                    Duration.between(startedAt, clock.instant()));
        } finally {
            lock.unlock();
        }
    }
}
