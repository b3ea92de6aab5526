package com.phillippitts.photobatch.service.codec;

import org.apache.commons.imaging.formats.tiff.write.TiffOutputSet;

import java.util.Objects;

/**
 * JPEG encode settings. Huffman optimization, baseline mode and 4:4:4 sampling are always on.
 *
 * @param quality      IJG quality 1-100
 * @param quantization base quantization tables scaled by {@code quality}
 * @param exif         metadata block to embed, or null
 */
public record EncodeParams(int quality, QuantizationPreset quantization, TiffOutputSet exif) {

    public EncodeParams {
        if (quality < 1 || quality > 100) {
            throw new IllegalArgumentException("quality must be within [1, 100], got: " + quality);
        }
        Objects.requireNonNull(quantization, "quantization must not be null");
    }
}
