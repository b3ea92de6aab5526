package com.phillippitts.photobatch.service.pipeline;

/**
 * How a scaled dimension becomes an integer pixel count.
 */
public enum RoundingRule {
    /** Round half up. */
    NEAREST,
    /** Drop the fraction. */
    TRUNCATE;

    int apply(double value) {
        return this == NEAREST ? (int) Math.round(value) : (int) value;
    }
}
