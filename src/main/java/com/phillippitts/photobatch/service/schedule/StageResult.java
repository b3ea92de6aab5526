package com.phillippitts.photobatch.service.schedule;

/**
 * Outcome of one scheduled stage.
 *
 * @param succeeded jobs that wrote their output
 * @param failed    jobs that ended with an error entry
 * @param rebuilds  pool rebuilds applied during the stage
 * @param cancelled whether cancellation stopped dispatch before the input was exhausted
 */
public record StageResult(int succeeded, int failed, int rebuilds, boolean cancelled) {

    public int completed() {
        return succeeded + failed;
    }
}
