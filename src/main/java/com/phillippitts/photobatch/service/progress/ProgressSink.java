package com.phillippitts.photobatch.service.progress;

import com.phillippitts.photobatch.domain.ErrorRecord;
import com.phillippitts.photobatch.domain.RunState;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * Single place where completions reach the {@link RunState} and the progress and log channels.
 *
 * <p>Counter updates go through the run's own lock, so this bean is safe to call from worker
 * threads and the control thread alike. Events are published synchronously on the caller's thread.
 */
@Component
public class ProgressSink {

    private final ApplicationEventPublisher publisher;

    public ProgressSink(ApplicationEventPublisher publisher) {
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    /**
     * Counts one written output and publishes the new progress.
     */
    public void fileSucceeded(RunState state) {
        int processed = state.recordSuccess();
        publisher.publishEvent(new RunProgressEvent(state.runId(), processed, state.totalFiles()));
    }

    /**
     * Adds one error-log entry for {@code file} and echoes it on the log channel.
     */
    public ErrorRecord fileFailed(RunState state, Path file, String message) {
        String name = file.getFileName() == null ? file.toString() : file.getFileName().toString();
        ErrorRecord entry = state.recordError(name, message);
        publisher.publishEvent(new RunLogEvent(state.runId(), entry.format(), true, Instant.now()));
        return entry;
    }

    public void info(RunState state, String message) {
        publisher.publishEvent(new RunLogEvent(state.runId(), message, false, Instant.now()));
    }

    public void warn(RunState state, String message) {
        publisher.publishEvent(new RunLogEvent(state.runId(), message, true, Instant.now()));
    }
}
