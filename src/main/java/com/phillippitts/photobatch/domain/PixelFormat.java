package com.phillippitts.photobatch.domain;

/**
 * Pixel layout variants that need different flattening before JPEG encoding.
 */
public enum PixelFormat {
    /** Opaque colour, encodable as is. */
    PLAIN,
    /** Colour with an alpha channel. */
    ALPHA,
    /** Indexed colour, possibly with a transparent palette entry. */
    PALETTE
}
