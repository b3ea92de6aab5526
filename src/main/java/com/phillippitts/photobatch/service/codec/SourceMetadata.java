package com.phillippitts.photobatch.service.codec;

import org.apache.commons.imaging.formats.tiff.write.TiffOutputSet;

import java.awt.color.ICC_Profile;

/**
 * Metadata read from a standard image alongside its pixels.
 *
 * @param orientation EXIF orientation 1-8 (1 when absent or invalid)
 * @param iccProfile  embedded colour profile, or null
 * @param exif        writable copy of the EXIF block (JPEG sources only), or null
 */
public record SourceMetadata(int orientation, ICC_Profile iccProfile, TiffOutputSet exif) {

    public SourceMetadata {
        if (orientation < 1 || orientation > 8) {
            orientation = 1;
        }
    }

    public static SourceMetadata none() {
        return new SourceMetadata(1, null, null);
    }
}
