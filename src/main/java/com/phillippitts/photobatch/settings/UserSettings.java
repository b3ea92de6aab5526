package com.phillippitts.photobatch.settings;

import com.phillippitts.photobatch.domain.ProcessingConfig;

import java.nio.file.Path;

/**
 * Per-user run settings remembered between runs.
 *
 * @param inputDir       last input directory, or null
 * @param outputDir      last output directory, or null
 * @param maxSide        longest output side
 * @param jpgQuality     JPEG quality as entered (clamped only when a run config is built)
 * @param processRaw     whether RAW files are processed
 * @param highQualityRaw whether RAW output uses the fixed high quality
 */
public record UserSettings(
        Path inputDir,
        Path outputDir,
        int maxSide,
        int jpgQuality,
        boolean processRaw,
        boolean highQualityRaw
) {

    public static UserSettings from(ProcessingConfig config) {
        return new UserSettings(config.inputRoot(), config.outputRoot(), config.maxSide(), config.jpgQuality(),
                config.processRaw(), config.highQualityRaw());
    }
}
