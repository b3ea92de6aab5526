package com.phillippitts.photobatch.domain;

import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.util.Objects;

/**
 * Decoded pixels tagged with their {@link PixelFormat}.
 *
 * @param image  pixel data
 * @param format layout variant of {@code image}
 */
public record PixelBuffer(BufferedImage image, PixelFormat format) {

    public PixelBuffer {
        Objects.requireNonNull(image, "image must not be null");
        Objects.requireNonNull(format, "format must not be null");
    }

    /**
     * Wraps an image, deriving the format from its colour model.
     */
    public static PixelBuffer of(BufferedImage image) {
        Objects.requireNonNull(image, "image must not be null");
        PixelFormat format;
        if (image.getColorModel() instanceof IndexColorModel) {
            format = PixelFormat.PALETTE;
        } else if (image.getColorModel().hasAlpha()) {
            format = PixelFormat.ALPHA;
        } else {
            format = PixelFormat.PLAIN;
        }
        return new PixelBuffer(image, format);
    }

    public int width() {
        return image.getWidth();
    }

    public int height() {
        return image.getHeight();
    }
}
