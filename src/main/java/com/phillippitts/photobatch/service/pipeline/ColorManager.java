package com.phillippitts.photobatch.service.pipeline;

import com.phillippitts.photobatch.domain.PixelBuffer;
import com.phillippitts.photobatch.domain.PixelFormat;
import com.phillippitts.photobatch.exception.ColorProfileException;

import java.awt.color.ColorSpace;
import java.awt.color.ICC_ColorSpace;
import java.awt.color.ICC_Profile;
import java.awt.image.BufferedImage;
import java.awt.image.ColorConvertOp;
import java.awt.image.WritableRaster;

/**
 * Converts pixels to sRGB with a perceptual rendering intent.
 *
 * <p>Two cases: an image whose decoded colour space already is a non-sRGB RGB space (the reader
 * applied the embedded profile) is converted from that space; otherwise an embedded profile is
 * applied to the raw sample values. Images without a profile pass through.
 */
public final class ColorManager {

    private static final int RENDERING_INTENT_PERCEPTUAL = 0;

    private ColorManager() {
    }

    /**
     * @param pixels  upright pixels
     * @param profile embedded profile, or null
     * @return sRGB pixels
     * @throws ColorProfileException if the profile cannot be applied; the caller keeps the input
     */
    public static PixelBuffer toSrgb(PixelBuffer pixels, ICC_Profile profile) {
        BufferedImage src = pixels.image();
        ColorSpace decoded = src.getColorModel().getColorSpace();

        try {
            if (decoded.getType() == ColorSpace.TYPE_RGB && !decoded.isCS_sRGB()) {
                return convert(pixels, decoded);
            }
            if (profile == null) {
                return pixels;
            }
            if (pixels.format() == PixelFormat.PALETTE) {
                throw new ColorProfileException("Indexed-colour images are not colour managed");
            }
            if (profile.getColorSpaceType() != ColorSpace.TYPE_RGB || src.getRaster().getNumBands() < 3) {
                throw new ColorProfileException("Profile colour space does not match RGB pixel data");
            }
            return convert(pixels, new ICC_ColorSpace(withPerceptualIntent(profile)));
        } catch (ColorProfileException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ColorProfileException("Colour conversion failed: " + e.getMessage(), e);
        }
    }

    private static PixelBuffer convert(PixelBuffer pixels, ColorSpace source) {
        BufferedImage src = pixels.image();
        int w = src.getWidth();
        int h = src.getHeight();
        boolean alpha = src.getColorModel().hasAlpha();

        BufferedImage target = new BufferedImage(w, h, alpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
        WritableRaster srcRaster = src.getRaster();
        WritableRaster dstRaster = target.getRaster();

        ColorConvertOp op = new ColorConvertOp(source, ColorSpace.getInstance(ColorSpace.CS_sRGB), null);
        op.filter(srcRaster.createWritableChild(0, 0, w, h, 0, 0, new int[] {0, 1, 2}),
                dstRaster.createWritableChild(0, 0, w, h, 0, 0, new int[] {0, 1, 2}));
        if (alpha) {
            int alphaBand = srcRaster.getNumBands() - 1;
            dstRaster.setSamples(0, 0, w, h, 3, srcRaster.getSamples(0, 0, w, h, alphaBand, (int[]) null));
        }
        return new PixelBuffer(target, pixels.format() == PixelFormat.PALETTE ? PixelFormat.ALPHA : pixels.format());
    }

    private static ICC_Profile withPerceptualIntent(ICC_Profile profile) {
        byte[] data = profile.getData();
        int offset = ICC_Profile.icHdrRenderingIntent;
        data[offset] = 0;
        data[offset + 1] = 0;
        data[offset + 2] = 0;
        data[offset + 3] = RENDERING_INTENT_PERCEPTUAL;
        return ICC_Profile.getInstance(data);
    }
}
