package com.phillippitts.photobatch.config.properties;

import com.phillippitts.photobatch.service.codec.QuantizationPreset;
import com.phillippitts.photobatch.service.pipeline.RoundingRule;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Defaults and tuning for the per-file pipelines.
 *
 * <p>Size, quality and RAW switches are the defaults a run starts from; stored user settings and
 * CLI flags override them. Quality outside {@code [85, 100]} is clamped when the run config is
 * built, so it is only checked for positivity here.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "photobatch.processing")
public class ProcessingProperties {

    @Positive
    private int maxSide = 3000;

    @Positive
    private int jpgQuality = 95;

    private boolean processRaw = true;

    private boolean highQualityRaw = false;

    /** Requested worker count; unset means derived from physical cores. */
    @Positive
    private Integer threads;

    /** Attempts per standard image, including the first. */
    @Min(1)
    private int retryAttempts = 3;

    @Min(0)
    private long retryDelayMs = 100;

    @Positive
    private long pollIntervalMs = 50;

    @NotNull
    private RoundingRule rawRounding = RoundingRule.NEAREST;

    @NotNull
    private QuantizationPreset quantization = QuantizationPreset.PHOTOGRAPHIC;

    @NotBlank
    private String errorReportName = "error-log.txt";

    public int getMaxSide() {
        return maxSide;
    }

    public void setMaxSide(int maxSide) {
        this.maxSide = maxSide;
    }

    public int getJpgQuality() {
        return jpgQuality;
    }

    public void setJpgQuality(int jpgQuality) {
        this.jpgQuality = jpgQuality;
    }

    public boolean isProcessRaw() {
        return processRaw;
    }

    public void setProcessRaw(boolean processRaw) {
        this.processRaw = processRaw;
    }

    public boolean isHighQualityRaw() {
        return highQualityRaw;
    }

    public void setHighQualityRaw(boolean highQualityRaw) {
        this.highQualityRaw = highQualityRaw;
    }

    public Integer getThreads() {
        return threads;
    }

    public void setThreads(Integer threads) {
        this.threads = threads;
    }

    public int getRetryAttempts() {
        return retryAttempts;
    }

    public void setRetryAttempts(int retryAttempts) {
        this.retryAttempts = retryAttempts;
    }

    public long getRetryDelayMs() {
        return retryDelayMs;
    }

    public void setRetryDelayMs(long retryDelayMs) {
        this.retryDelayMs = retryDelayMs;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public RoundingRule getRawRounding() {
        return rawRounding;
    }

    public void setRawRounding(RoundingRule rawRounding) {
        this.rawRounding = rawRounding;
    }

    public QuantizationPreset getQuantization() {
        return quantization;
    }

    public void setQuantization(QuantizationPreset quantization) {
        this.quantization = quantization;
    }

    public String getErrorReportName() {
        return errorReportName;
    }

    public void setErrorReportName(String errorReportName) {
        this.errorReportName = errorReportName;
    }
}
