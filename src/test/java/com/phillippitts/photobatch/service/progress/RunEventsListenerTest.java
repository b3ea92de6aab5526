package com.phillippitts.photobatch.service.progress;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThatCode;

class RunEventsListenerTest {

    @Test
    void handlersDoNotThrow() {
        RunEventsListener l = new RunEventsListener();

        assertThatCode(() -> {
            l.onLog(new RunLogEvent("run-1", "=== Processing started ===", false, Instant.now()));
            l.onLog(new RunLogEvent("run-1", "Error processing a.jpg", true, Instant.now()));
            l.onProgress(new RunProgressEvent("run-1", 3, 10));
        }).doesNotThrowAnyException();
    }
}
