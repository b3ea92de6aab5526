package com.phillippitts.photobatch.service.codec;

import com.phillippitts.photobatch.domain.PixelBuffer;
import com.phillippitts.photobatch.service.codec.raw.RawMetadata;

import java.util.Objects;

/**
 * Result of {@link CodecAdapter#demosaic(java.nio.file.Path)}.
 */
public record RawImage(PixelBuffer pixels, RawMetadata metadata) {

    public RawImage {
        Objects.requireNonNull(pixels, "pixels must not be null");
        metadata = metadata == null ? RawMetadata.empty() : metadata;
    }
}
