package com.phillippitts.photobatch.service.pipeline;

import com.phillippitts.photobatch.domain.PixelBuffer;
import com.phillippitts.photobatch.domain.PixelFormat;

import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

/**
 * Produces the opaque 3-channel pixels the JPEG encoder accepts.
 *
 * <p>{@code ALPHA} and {@code PALETTE} buffers are composited over white using their alpha or
 * transparency mask; {@code PLAIN} buffers are only repacked when they are not already RGB.
 */
public final class TransparencyFlattener {

    private TransparencyFlattener() {
    }

    public static PixelBuffer flatten(PixelBuffer pixels) {
        return switch (pixels.format()) {
            case ALPHA, PALETTE -> new PixelBuffer(onWhite(pixels.image()), PixelFormat.PLAIN);
            case PLAIN -> new PixelBuffer(toRgb(pixels.image()), PixelFormat.PLAIN);
        };
    }

    private static BufferedImage onWhite(BufferedImage src) {
        BufferedImage rgb = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, src.getWidth(), src.getHeight());
            g.setComposite(AlphaComposite.SrcOver);
            g.drawImage(src, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    private static BufferedImage toRgb(BufferedImage src) {
        int type = src.getType();
        if (type == BufferedImage.TYPE_INT_RGB || type == BufferedImage.TYPE_3BYTE_BGR) {
            return src;
        }
        BufferedImage rgb = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.drawImage(src, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }
}
