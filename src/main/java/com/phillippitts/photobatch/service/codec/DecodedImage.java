package com.phillippitts.photobatch.service.codec;

import com.phillippitts.photobatch.domain.PixelBuffer;

import java.util.Objects;

/**
 * Result of {@link CodecAdapter#decode(java.nio.file.Path)}.
 */
public record DecodedImage(PixelBuffer pixels, SourceMetadata metadata) {

    public DecodedImage {
        Objects.requireNonNull(pixels, "pixels must not be null");
        metadata = metadata == null ? SourceMetadata.none() : metadata;
    }
}
