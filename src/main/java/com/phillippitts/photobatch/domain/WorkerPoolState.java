package com.phillippitts.photobatch.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Worker count and the bounds the adaptive policy may move it within.
 *
 * @param currentWorkers workers of the live pool
 * @param minWorkers     lower bound
 * @param maxWorkers     upper bound
 * @param highThreshold  CPU percent above which the pool shrinks
 * @param lowThreshold   CPU percent below which the pool grows
 * @param step           workers added or removed per adjustment
 * @param minInterval    minimum time between two adjustments
 * @param lastAdjustment time of the previous adjustment, or the pool's creation
 */
public record WorkerPoolState(
        int currentWorkers,
        int minWorkers,
        int maxWorkers,
        double highThreshold,
        double lowThreshold,
        int step,
        Duration minInterval,
        Instant lastAdjustment
) {

    public WorkerPoolState {
        if (minWorkers <= 0 || maxWorkers < minWorkers) {
            throw new IllegalArgumentException(
                    "Worker bounds must satisfy 0 < min <= max, got: [" + minWorkers + ", " + maxWorkers + "]");
        }
        if (lowThreshold > highThreshold) {
            throw new IllegalArgumentException(
                    "lowThreshold must not exceed highThreshold: " + lowThreshold + " > " + highThreshold);
        }
        if (step <= 0) {
            throw new IllegalArgumentException("step must be positive, got: " + step);
        }
        Objects.requireNonNull(minInterval, "minInterval must not be null");
        Objects.requireNonNull(lastAdjustment, "lastAdjustment must not be null");
    }

    public WorkerPoolState withWorkers(int workers, Instant adjustedAt) {
        return new WorkerPoolState(workers, minWorkers, maxWorkers, highThreshold, lowThreshold, step,
                minInterval, adjustedAt);
    }
}
