package com.phillippitts.photobatch.service.pipeline;

/**
 * Target size computation shared by both pipelines.
 *
 * <p>Images whose longest side exceeds {@code maxSide} are scaled by
 * {@code maxSide / max(width, height)}; each scaled side is rounded by the given rule and then
 * forced even by adding one to an odd value. Smaller images keep their size.
 */
public final class ResizePolicy {

    private ResizePolicy() {
    }

    /**
     * Computed output size.
     *
     * @param width   output width
     * @param height  output height
     * @param resized whether resampling is needed
     */
    public record TargetSize(int width, int height, boolean resized) {}

    public static TargetSize target(int width, int height, int maxSide, RoundingRule rule) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive: " + width + "x" + height);
        }
        if (maxSide <= 0) {
            throw new IllegalArgumentException("maxSide must be positive, got: " + maxSide);
        }
        int longest = Math.max(width, height);
        if (longest <= maxSide) {
            return new TargetSize(width, height, false);
        }
        double ratio = (double) maxSide / longest;
        return new TargetSize(even(rule.apply(width * ratio)), even(rule.apply(height * ratio)), true);
    }

    private static int even(int value) {
        int v = Math.max(1, value);
        return v % 2 == 0 ? v : v + 1;
    }
}
