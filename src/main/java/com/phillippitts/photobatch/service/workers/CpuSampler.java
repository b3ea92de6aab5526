package com.phillippitts.photobatch.service.workers;

import java.time.Duration;

/**
 * Host CPU measurements used for worker sizing.
 */
public interface CpuSampler {

    /**
     * Blocks for {@code window} and returns the system-wide CPU utilization over it.
     *
     * @return utilization in percent, {@code [0, 100]}
     * @throws com.phillippitts.photobatch.exception.CpuSampleException if no valid sample could be taken
     */
    double samplePercent(Duration window);

    /**
     * @return physical core count, at least 1
     */
    int physicalCores();
}
