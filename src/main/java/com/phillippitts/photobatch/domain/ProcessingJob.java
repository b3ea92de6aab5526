package com.phillippitts.photobatch.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One selected input moving through {@code PENDING -> RUNNING -> SUCCEEDED | FAILED}.
 *
 * <p>Transitions are guarded; an illegal transition indicates a scheduling bug and throws.
 * {@code FAILED} is only entered once the kind's attempt budget is spent.
 */
public final class ProcessingJob {

    public enum JobState { PENDING, RUNNING, SUCCEEDED, FAILED }

    private final Path path;
    private final FileKind kind;
    private volatile JobState state = JobState.PENDING;

    public ProcessingJob(Path path, FileKind kind) {
        this.path = Objects.requireNonNull(path, "path");
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Path path() {
        return path;
    }

    public FileKind kind() {
        return kind;
    }

    public String fileName() {
        Path name = path.getFileName();
        return name == null ? path.toString() : name.toString();
    }

    public JobState state() {
        return state;
    }

    public boolean isFinished() {
        JobState s = state;
        return s == JobState.SUCCEEDED || s == JobState.FAILED;
    }

    public synchronized void start() {
        transition(JobState.PENDING, JobState.RUNNING);
    }

    public synchronized void succeed() {
        transition(JobState.RUNNING, JobState.SUCCEEDED);
    }

    public synchronized void fail() {
        transition(JobState.RUNNING, JobState.FAILED);
    }

    private void transition(JobState from, JobState to) {
        if (state != from) {
            throw new IllegalStateException("Job " + fileName() + " cannot move " + state + " -> " + to);
        }
        state = to;
    }

    @Override
    public String toString() {
        return "ProcessingJob[" + kind.tag() + ", " + fileName() + ", " + state + "]";
    }
}
