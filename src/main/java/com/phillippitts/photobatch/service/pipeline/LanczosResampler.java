package com.phillippitts.photobatch.service.pipeline;

import com.phillippitts.photobatch.domain.PixelBuffer;
import com.phillippitts.photobatch.domain.PixelFormat;
import com.phillippitts.photobatch.exception.ResizeException;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

/**
 * Separable Lanczos-3 resampler.
 *
 * <p>The filter support widens with the downscale factor so every source pixel contributes,
 * and each output pixel's weights are normalised to sum to one. Alpha images are filtered in
 * premultiplied form, which keeps transparent pixels from bleeding their colour into opaque
 * neighbours. The intermediate (horizontal pass) is stored as packed 8-bit ARGB.
 */
public final class LanczosResampler {

    private static final double LOBES = 3.0;

    private LanczosResampler() {
    }

    /**
     * @param pixels source pixels
     * @param width  target width, positive
     * @param height target height, positive
     * @return resampled pixels, {@code ALPHA} when the source carries transparency, otherwise {@code PLAIN}
     * @throws ResizeException if the target size is invalid or resampling fails
     */
    public static PixelBuffer resize(PixelBuffer pixels, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new ResizeException("Target size must be positive, got " + width + "x" + height);
        }
        try {
            BufferedImage src = pixels.image();
            boolean alpha = src.getColorModel().hasAlpha();
            int srcW = src.getWidth();
            int srcH = src.getHeight();

            int[] argb = toPackedArgb(src, alpha);
            int[] horizontal = pass(argb, srcW, srcH, width, true, alpha);
            int[] result = pass(horizontal, width, srcH, height, false, alpha);

            BufferedImage out = new BufferedImage(width, height,
                    alpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
            if (alpha) {
                unpremultiply(result);
            }
            out.setRGB(0, 0, width, height, result, 0, width);
            return new PixelBuffer(out, alpha ? PixelFormat.ALPHA : PixelFormat.PLAIN);
        } catch (RuntimeException e) {
            throw new ResizeException("Lanczos resample to " + width + "x" + height + " failed: " + e.getMessage(), e);
        }
    }

    private static int[] toPackedArgb(BufferedImage src, boolean alpha) {
        int type = src.getType();
        BufferedImage packed = src;
        if (type != BufferedImage.TYPE_INT_RGB && type != BufferedImage.TYPE_INT_ARGB) {
            // Draw rather than getRGB so grey sources keep their sample values
            packed = new BufferedImage(src.getWidth(), src.getHeight(),
                    alpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
            Graphics2D g = packed.createGraphics();
            try {
                g.drawImage(src, 0, 0, null);
            } finally {
                g.dispose();
            }
        }
        int w = packed.getWidth();
        int[] data = packed.getRGB(0, 0, w, packed.getHeight(), null, 0, w);
        if (alpha) {
            premultiply(data);
        }
        return data;
    }

    /**
     * One separable pass. Horizontal passes resample rows to {@code outSize} columns, vertical
     * passes resample columns to {@code outSize} rows.
     */
    private static int[] pass(int[] in, int inW, int inH, int outSize, boolean horizontal, boolean alpha) {
        int inSize = horizontal ? inW : inH;
        Coefficients c = Coefficients.compute(inSize, outSize);
        int outW = horizontal ? outSize : inW;
        int outH = horizontal ? inH : outSize;
        int[] out = new int[outW * outH];

        int lines = horizontal ? inH : inW;
        for (int line = 0; line < lines; line++) {
            for (int o = 0; o < outSize; o++) {
                int start = c.start[o];
                double[] weights = c.weights[o];
                double a = 0;
                double r = 0;
                double g = 0;
                double b = 0;
                for (int k = 0; k < weights.length; k++) {
                    int p = horizontal
                            ? in[line * inW + start + k]
                            : in[(start + k) * inW + line];
                    double w = weights[k];
                    a += w * (p >>> 24);
                    r += w * ((p >> 16) & 0xFF);
                    g += w * ((p >> 8) & 0xFF);
                    b += w * (p & 0xFF);
                }
                int alphaValue = alpha ? clamp(a) : 0xFF;
                int packed = (alphaValue << 24) | (clamp(r) << 16) | (clamp(g) << 8) | clamp(b);
                if (horizontal) {
                    out[line * outW + o] = packed;
                } else {
                    out[o * outW + line] = packed;
                }
            }
        }
        return out;
    }

    private static void premultiply(int[] data) {
        for (int i = 0; i < data.length; i++) {
            int p = data[i];
            int a = p >>> 24;
            if (a == 0xFF) {
                continue;
            }
            int r = ((p >> 16) & 0xFF) * a / 255;
            int g = ((p >> 8) & 0xFF) * a / 255;
            int b = (p & 0xFF) * a / 255;
            data[i] = (a << 24) | (r << 16) | (g << 8) | b;
        }
    }

    private static void unpremultiply(int[] data) {
        for (int i = 0; i < data.length; i++) {
            int p = data[i];
            int a = p >>> 24;
            if (a == 0xFF) {
                continue;
            }
            if (a == 0) {
                data[i] = 0;
                continue;
            }
            int r = Math.min(255, ((p >> 16) & 0xFF) * 255 / a);
            int g = Math.min(255, ((p >> 8) & 0xFF) * 255 / a);
            int b = Math.min(255, (p & 0xFF) * 255 / a);
            data[i] = (a << 24) | (r << 16) | (g << 8) | b;
        }
    }

    private static int clamp(double v) {
        long rounded = Math.round(v);
        if (rounded < 0) {
            return 0;
        }
        return rounded > 255 ? 255 : (int) rounded;
    }

    static double lanczos(double x) {
        if (x == 0.0) {
            return 1.0;
        }
        if (x <= -LOBES || x >= LOBES) {
            return 0.0;
        }
        return sinc(x) * sinc(x / LOBES);
    }

    private static double sinc(double x) {
        double px = Math.PI * x;
        return Math.sin(px) / px;
    }

    /**
     * Per-output-pixel source window and normalised weights for one axis.
     */
    static final class Coefficients {
        final int[] start;
        final double[][] weights;

        private Coefficients(int[] start, double[][] weights) {
            this.start = start;
            this.weights = weights;
        }

        static Coefficients compute(int inSize, int outSize) {
            double scale = (double) inSize / outSize;
            double filterScale = Math.max(scale, 1.0);
            double support = LOBES * filterScale;

            int[] start = new int[outSize];
            double[][] weights = new double[outSize][];
            for (int i = 0; i < outSize; i++) {
                double center = (i + 0.5) * scale;
                int min = Math.max(0, (int) (center - support + 0.5));
                int max = Math.min(inSize, (int) (center + support + 0.5));
                if (max <= min) {
                    max = Math.min(inSize, min + 1);
                    min = max - 1;
                }
                double[] w = new double[max - min];
                double total = 0;
                for (int k = 0; k < w.length; k++) {
                    w[k] = lanczos((k + min - center + 0.5) / filterScale);
                    total += w[k];
                }
                if (total != 0) {
                    for (int k = 0; k < w.length; k++) {
                        w[k] /= total;
                    }
                } else {
                    w = new double[max - min];
                    w[0] = 1.0;
                }
                start[i] = min;
                weights[i] = w;
            }
            return new Coefficients(start, weights);
        }
    }
}
