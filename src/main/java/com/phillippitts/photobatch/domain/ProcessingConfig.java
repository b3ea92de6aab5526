package com.phillippitts.photobatch.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable settings for one batch run.
 *
 * <p>Quality is clamped to {@code [85, 100]} on construction; photographic output below 85 is
 * never produced. {@code maxSide} must be positive.
 *
 * @param inputRoot      directory tree to read from
 * @param outputRoot     directory tree to mirror into
 * @param maxSide        longest output side in pixels
 * @param jpgQuality     JPEG quality, clamped to {@code [85, 100]}
 * @param processRaw     whether camera RAW files are selected at all
 * @param highQualityRaw whether RAW output uses a fixed quality of {@value #RAW_HIGH_QUALITY}
 * @param threads        requested worker count, or null to derive it from the CPU core count
 */
public record ProcessingConfig(
        Path inputRoot,
        Path outputRoot,
        int maxSide,
        int jpgQuality,
        boolean processRaw,
        boolean highQualityRaw,
        Integer threads
) {

    public static final int DEFAULT_MAX_SIDE = 3000;
    public static final int DEFAULT_JPG_QUALITY = 95;
    public static final int MIN_JPG_QUALITY = 85;
    public static final int MAX_JPG_QUALITY = 100;
    public static final int RAW_HIGH_QUALITY = 95;
    public static final int MIN_WORKERS = 4;
    public static final int CORES_MULTIPLIER = 4;

    public ProcessingConfig {
        Objects.requireNonNull(inputRoot, "inputRoot must not be null");
        Objects.requireNonNull(outputRoot, "outputRoot must not be null");
        if (maxSide <= 0) {
            throw new IllegalArgumentException("maxSide must be positive, got: " + maxSide);
        }
        if (threads != null && threads <= 0) {
            throw new IllegalArgumentException("threads must be positive when set, got: " + threads);
        }
        inputRoot = inputRoot.toAbsolutePath().normalize();
        outputRoot = outputRoot.toAbsolutePath().normalize();
        jpgQuality = clampQuality(jpgQuality);
    }

    /**
     * Creates a config with default size, quality and RAW handling.
     */
    public static ProcessingConfig of(Path inputRoot, Path outputRoot) {
        return new ProcessingConfig(inputRoot, outputRoot, DEFAULT_MAX_SIDE, DEFAULT_JPG_QUALITY,
                true, false, null);
    }

    public static int clampQuality(int quality) {
        return Math.max(MIN_JPG_QUALITY, Math.min(quality, MAX_JPG_QUALITY));
    }

    /**
     * Quality used for RAW output: fixed when high-quality RAW is on, the configured value otherwise.
     */
    public int rawQuality() {
        return highQualityRaw ? RAW_HIGH_QUALITY : jpgQuality;
    }

    /**
     * Worker count for the standard-image stage before it is capped by the number of files.
     *
     * @param physicalCores physical core count of the host
     * @return {@code max(4, threads)} when threads were requested, else {@code max(4, cores * 4)}
     */
    public int resolveWorkers(int physicalCores) {
        if (threads != null) {
            return Math.max(MIN_WORKERS, threads);
        }
        return Math.max(MIN_WORKERS, Math.max(1, physicalCores) * CORES_MULTIPLIER);
    }

    public ProcessingConfig withRawDisabled() {
        return new ProcessingConfig(inputRoot, outputRoot, maxSide, jpgQuality, false, highQualityRaw, threads);
    }
}
