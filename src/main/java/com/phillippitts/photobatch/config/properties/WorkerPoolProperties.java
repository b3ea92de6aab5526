package com.phillippitts.photobatch.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the standard-image worker pool and its adaptive sizing.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "photobatch.workers")
public class WorkerPoolProperties {

    @NotBlank
    private String threadNamePrefix = "photo-worker-";

    /** Dispatched-but-unfinished jobs allowed per worker. */
    @Positive
    private int inFlightFactor = 2;

    @Positive
    private int keepAliveSeconds = 60;

    @Valid
    private Adaptive adaptive = new Adaptive();

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public void setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
    }

    public int getInFlightFactor() {
        return inFlightFactor;
    }

    public void setInFlightFactor(int inFlightFactor) {
        this.inFlightFactor = inFlightFactor;
    }

    public int getKeepAliveSeconds() {
        return keepAliveSeconds;
    }

    public void setKeepAliveSeconds(int keepAliveSeconds) {
        this.keepAliveSeconds = keepAliveSeconds;
    }

    public Adaptive getAdaptive() {
        return adaptive;
    }

    public void setAdaptive(Adaptive adaptive) {
        this.adaptive = adaptive;
    }

    /**
     * CPU-driven resizing of the pool while the standard stage runs. Off unless enabled.
     */
    public static class Adaptive {
        private boolean enabled = false;

        @Min(0)
        @Max(100)
        private double highThreshold = 85;

        @Min(0)
        @Max(100)
        private double lowThreshold = 70;

        @Positive
        private int step = 2;

        @Positive
        private int minWorkers = 4;

        @Positive
        private int maxWorkers = 16;

        @Min(0)
        private long minIntervalSeconds = 5;

        @Positive
        private long sampleWindowMs = 1000;

        @Positive
        private long checkIntervalMs = 2000;

        @Min(0)
        @Max(100)
        private double fallbackLoad = 75;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public double getHighThreshold() {
            return highThreshold;
        }

        public void setHighThreshold(double highThreshold) {
            this.highThreshold = highThreshold;
        }

        public double getLowThreshold() {
            return lowThreshold;
        }

        public void setLowThreshold(double lowThreshold) {
            this.lowThreshold = lowThreshold;
        }

        public int getStep() {
            return step;
        }

        public void setStep(int step) {
            this.step = step;
        }

        public int getMinWorkers() {
            return minWorkers;
        }

        public void setMinWorkers(int minWorkers) {
            this.minWorkers = minWorkers;
        }

        public int getMaxWorkers() {
            return maxWorkers;
        }

        public void setMaxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
        }

        public long getMinIntervalSeconds() {
            return minIntervalSeconds;
        }

        public void setMinIntervalSeconds(long minIntervalSeconds) {
            this.minIntervalSeconds = minIntervalSeconds;
        }

        public long getSampleWindowMs() {
            return sampleWindowMs;
        }

        public void setSampleWindowMs(long sampleWindowMs) {
            this.sampleWindowMs = sampleWindowMs;
        }

        public long getCheckIntervalMs() {
            return checkIntervalMs;
        }

        public void setCheckIntervalMs(long checkIntervalMs) {
            this.checkIntervalMs = checkIntervalMs;
        }

        public double getFallbackLoad() {
            return fallbackLoad;
        }

        public void setFallbackLoad(double fallbackLoad) {
            this.fallbackLoad = fallbackLoad;
        }
    }
}
