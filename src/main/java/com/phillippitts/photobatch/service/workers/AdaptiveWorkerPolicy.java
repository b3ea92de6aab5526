package com.phillippitts.photobatch.service.workers;

import com.phillippitts.photobatch.config.properties.WorkerPoolProperties;
import com.phillippitts.photobatch.domain.WorkerPoolState;
import com.phillippitts.photobatch.exception.CpuSampleException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * CPU-driven worker-count policy.
 *
 * <p>Above the high threshold the count drops by {@code step} (not below the minimum); below the
 * low threshold it grows by {@code step} (not above the maximum). No two adjustments are closer
 * than the minimum interval. A failed CPU sample is replaced by the configured fallback load,
 * clamped into {@code [low, high]} so it never causes a change.
 */
@Component
public class AdaptiveWorkerPolicy {

    private static final Logger LOG = LogManager.getLogger(AdaptiveWorkerPolicy.class);

    private final CpuSampler sampler;
    private final WorkerPoolProperties.Adaptive settings;

    @Autowired
    public AdaptiveWorkerPolicy(CpuSampler sampler, WorkerPoolProperties properties) {
        this(sampler, properties.getAdaptive());
    }

    AdaptiveWorkerPolicy(CpuSampler sampler, WorkerPoolProperties.Adaptive settings) {
        this.sampler = Objects.requireNonNull(sampler, "sampler");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public boolean isEnabled() {
        return settings.isEnabled();
    }

    /**
     * Pool state for a stage that starts with {@code workers} threads at {@code now}.
     */
    public WorkerPoolState initialState(int workers, Instant now) {
        return new WorkerPoolState(workers, settings.getMinWorkers(), settings.getMaxWorkers(),
                settings.getHighThreshold(), settings.getLowThreshold(), settings.getStep(),
                Duration.ofSeconds(settings.getMinIntervalSeconds()), now);
    }

    /**
     * Pure decision step.
     *
     * @param state      current pool state
     * @param cpuPercent measured utilization
     * @param now        decision time
     * @return the adjusted state, or empty when the count should stay
     */
    public Optional<WorkerPoolState> recommend(WorkerPoolState state, double cpuPercent, Instant now) {
        if (Duration.between(state.lastAdjustment(), now).compareTo(state.minInterval()) < 0) {
            return Optional.empty();
        }
        int current = state.currentWorkers();
        if (cpuPercent > state.highThreshold() && current > state.minWorkers()) {
            return Optional.of(state.withWorkers(Math.max(current - state.step(), state.minWorkers()), now));
        }
        if (cpuPercent < state.lowThreshold() && current < state.maxWorkers()) {
            return Optional.of(state.withWorkers(Math.min(current + state.step(), state.maxWorkers()), now));
        }
        return Optional.empty();
    }

    /**
     * Takes one blocking sample over the configured window.
     *
     * @return utilization in percent, or the neutral fallback load when sampling fails
     */
    public double sampleOrDefault() {
        try {
            return sampler.samplePercent(Duration.ofMillis(settings.getSampleWindowMs()));
        } catch (CpuSampleException e) {
            double neutral = neutralFallback();
            LOG.warn("CPU sample failed, assuming {}%: {}", neutral, e.getMessage());
            return neutral;
        }
    }

    double neutralFallback() {
        double low = Math.min(settings.getLowThreshold(), settings.getHighThreshold());
        double high = Math.max(settings.getLowThreshold(), settings.getHighThreshold());
        return Math.max(low, Math.min(settings.getFallbackLoad(), high));
    }

    public Duration checkInterval() {
        return Duration.ofMillis(settings.getCheckIntervalMs());
    }
}
