package com.phillippitts.photobatch.config.raw;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the external dcraw RAW decoder.
 * Binds to properties prefixed with "photobatch.raw".
 *
 * <p>Example application.properties:
 * <pre>
 * photobatch.raw.binary-path=/usr/local/bin/dcraw
 * photobatch.raw.timeout-seconds=120
 * photobatch.raw.max-metadata-bytes=65536
 * </pre>
 *
 * @param binaryPath       dcraw executable, absolute or resolved against {@code PATH}
 * @param timeoutSeconds   maximum time one decoder invocation may run
 * @param maxMetadataBytes cap on captured text output (identify mode and stderr)
 */
@ConfigurationProperties(prefix = "photobatch.raw")
@Validated
public record RawDecoderConfig(
        @NotBlank(message = "RAW decoder binary path must not be blank")
        @DefaultValue("dcraw")
        String binaryPath,

        @Positive(message = "Timeout must be positive")
        @DefaultValue("120")
        int timeoutSeconds,

        @Positive(message = "Max metadata bytes must be positive")
        @DefaultValue("65536")
        int maxMetadataBytes
) {
    /**
     * Defaults: dcraw from {@code PATH}, two minute timeout, 64KB text cap.
     */
    public static RawDecoderConfig defaults() {
        return new RawDecoderConfig("dcraw", 120, 65536);
    }
}
