package com.phillippitts.photobatch.service.pipeline;

import com.phillippitts.photobatch.domain.PixelBuffer;
import com.phillippitts.photobatch.domain.PixelFormat;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;

/**
 * Rotates and flips pixels into upright form according to the EXIF orientation tag (1-8).
 */
public final class Orientation {

    private Orientation() {
    }

    /**
     * @param pixels      decoded pixels
     * @param orientation EXIF orientation; 1 or an unknown value leaves the pixels untouched
     * @return upright pixels
     */
    public static PixelBuffer apply(PixelBuffer pixels, int orientation) {
        if (orientation < 2 || orientation > 8) {
            return pixels;
        }
        BufferedImage src = pixels.image();
        int w = src.getWidth();
        int h = src.getHeight();
        boolean swap = orientation >= 5;

        // x' = m00*x + m01*y + m02, y' = m10*x + m11*y + m12
        AffineTransform t = switch (orientation) {
            case 2 -> new AffineTransform(-1, 0, 0, 1, w, 0);
            case 3 -> new AffineTransform(-1, 0, 0, -1, w, h);
            case 4 -> new AffineTransform(1, 0, 0, -1, 0, h);
            case 5 -> new AffineTransform(0, 1, 1, 0, 0, 0);
            case 6 -> new AffineTransform(0, 1, -1, 0, h, 0);
            case 7 -> new AffineTransform(0, -1, -1, 0, h, w);
            default -> new AffineTransform(0, -1, 1, 0, 0, w);
        };

        boolean alpha = pixels.format() != PixelFormat.PLAIN || src.getColorModel().hasAlpha();
        BufferedImage target = new BufferedImage(swap ? h : w, swap ? w : h,
                alpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
        Graphics2D g = target.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR);
            g.setTransform(t);
            g.drawImage(src, 0, 0, null);
        } finally {
            g.dispose();
        }
        return PixelBuffer.of(target);
    }
}
