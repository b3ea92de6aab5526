package com.phillippitts.photobatch.service.codec.raw;

import java.time.LocalDateTime;

/**
 * Capture metadata recovered from a RAW file. Every field is nullable: a field the decoder
 * did not report stays absent instead of being defaulted.
 *
 * @param captured        capture time
 * @param make            camera manufacturer
 * @param model           camera model
 * @param focalLengthMm   focal length in millimetres
 * @param aperture        f-number
 * @param exposureSeconds shutter time in seconds
 * @param iso             ISO speed
 * @param exposureBias    exposure compensation in EV
 * @param width           output pixel width
 * @param height          output pixel height
 */
public record RawMetadata(
        LocalDateTime captured,
        String make,
        String model,
        Double focalLengthMm,
        Double aperture,
        Double exposureSeconds,
        Integer iso,
        Double exposureBias,
        Integer width,
        Integer height
) {

    public static RawMetadata empty() {
        return new RawMetadata(null, null, null, null, null, null, null, null, null, null);
    }

    public boolean isEmpty() {
        return captured == null && make == null && model == null && focalLengthMm == null
                && aperture == null && exposureSeconds == null && iso == null && exposureBias == null
                && width == null && height == null;
    }
}
