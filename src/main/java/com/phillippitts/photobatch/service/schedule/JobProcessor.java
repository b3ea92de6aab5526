package com.phillippitts.photobatch.service.schedule;

import java.nio.file.Path;

/**
 * Work performed for one dispatched input.
 *
 * <p>Returning {@code false} means the file failed and its error entry is already recorded.
 * A thrown exception is recorded by the scheduler.
 */
@FunctionalInterface
public interface JobProcessor {

    boolean process(Path input);
}
