package com.phillippitts.photobatch.service.codec;

import com.phillippitts.photobatch.exception.EncodeException;
import com.phillippitts.photobatch.service.codec.raw.RawMetadata;
import org.apache.commons.imaging.ImageWriteException;
import org.apache.commons.imaging.common.RationalNumber;
import org.apache.commons.imaging.formats.tiff.constants.ExifTagConstants;
import org.apache.commons.imaging.formats.tiff.constants.TiffTagConstants;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputDirectory;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputSet;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Builds an EXIF block from RAW capture metadata. Absent fields are left out.
 */
@Component
public class RawExifMapper {

    private static final DateTimeFormatter EXIF_DATE_TIME = DateTimeFormatter.ofPattern("yyyy:MM:dd HH:mm:ss");

    /**
     * @param metadata recovered RAW fields
     * @return EXIF output set, or empty when no field was recovered
     * @throws EncodeException if a value cannot be represented
     */
    public Optional<TiffOutputSet> toExif(RawMetadata metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Optional.empty();
        }
        try {
            TiffOutputSet set = new TiffOutputSet();
            TiffOutputDirectory root = set.getOrCreateRootDirectory();
            if (metadata.make() != null) {
                root.add(TiffTagConstants.TIFF_TAG_MAKE, metadata.make());
            }
            if (metadata.model() != null) {
                root.add(TiffTagConstants.TIFF_TAG_MODEL, metadata.model());
            }

            TiffOutputDirectory exif = set.getOrCreateExifDirectory();
            if (metadata.captured() != null) {
                exif.add(ExifTagConstants.EXIF_TAG_DATE_TIME_ORIGINAL, EXIF_DATE_TIME.format(metadata.captured()));
            }
            if (metadata.focalLengthMm() != null) {
                exif.add(ExifTagConstants.EXIF_TAG_FOCAL_LENGTH, RationalNumber.valueOf(metadata.focalLengthMm()));
            }
            if (metadata.aperture() != null) {
                exif.add(ExifTagConstants.EXIF_TAG_FNUMBER, RationalNumber.valueOf(metadata.aperture()));
            }
            if (metadata.exposureSeconds() != null) {
                exif.add(ExifTagConstants.EXIF_TAG_EXPOSURE_TIME, RationalNumber.valueOf(metadata.exposureSeconds()));
            }
            if (metadata.iso() != null) {
                exif.add(ExifTagConstants.EXIF_TAG_ISO, (short) Math.min(metadata.iso(), Short.MAX_VALUE));
            }
            if (metadata.exposureBias() != null) {
                exif.add(ExifTagConstants.EXIF_TAG_EXPOSURE_COMPENSATION,
                        RationalNumber.valueOf(metadata.exposureBias()));
            }
            if (metadata.width() != null) {
                exif.add(ExifTagConstants.EXIF_TAG_EXIF_IMAGE_WIDTH, (short) Math.min(metadata.width(), Short.MAX_VALUE));
            }
            if (metadata.height() != null) {
                exif.add(ExifTagConstants.EXIF_TAG_EXIF_IMAGE_LENGTH,
                        (short) Math.min(metadata.height(), Short.MAX_VALUE));
            }
            return Optional.of(set);
        } catch (ImageWriteException e) {
            throw new EncodeException("Cannot build EXIF block from RAW metadata: " + e.getMessage(), e);
        }
    }
}
