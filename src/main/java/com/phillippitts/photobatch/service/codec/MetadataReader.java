package com.phillippitts.photobatch.service.codec;

import org.apache.commons.imaging.ImageReadException;
import org.apache.commons.imaging.ImageWriteException;
import org.apache.commons.imaging.Imaging;
import org.apache.commons.imaging.common.ImageMetadata;
import org.apache.commons.imaging.formats.jpeg.JpegImageMetadata;
import org.apache.commons.imaging.formats.tiff.TiffField;
import org.apache.commons.imaging.formats.tiff.TiffImageMetadata;
import org.apache.commons.imaging.formats.tiff.constants.TiffTagConstants;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.awt.color.ICC_Profile;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads orientation, ICC profile and the EXIF block with Apache Commons Imaging.
 *
 * <p>Metadata is optional: formats without it (BMP, most GIFs) or unreadable blocks yield
 * defaults and a DEBUG line, never a failure. Only JPEG sources contribute an EXIF block to carry
 * over; a TIFF's IFD describes its own strip layout and is not reusable.
 */
@Component
public class MetadataReader {

    private static final Logger LOG = LogManager.getLogger(MetadataReader.class);

    public SourceMetadata read(Path path) {
        File file = path.toFile();
        int orientation = 1;
        TiffOutputSet exif = null;

        try {
            ImageMetadata metadata = Imaging.getMetadata(file);
            TiffImageMetadata tiff = null;
            if (metadata instanceof JpegImageMetadata jpeg) {
                tiff = jpeg.getExif();
            } else if (metadata instanceof TiffImageMetadata tiffMetadata) {
                tiff = tiffMetadata;
            }
            if (tiff != null) {
                TiffField field = tiff.findField(TiffTagConstants.TIFF_TAG_ORIENTATION);
                if (field != null) {
                    orientation = field.getIntValue();
                }
                if (metadata instanceof JpegImageMetadata) {
                    exif = tiff.getOutputSet();
                }
            }
        } catch (ImageReadException | ImageWriteException | IOException | RuntimeException e) {
            LOG.debug("No usable EXIF in {}: {}", file.getName(), e.toString());
        }

        return new SourceMetadata(orientation, readIccProfile(file), exif);
    }

    private static ICC_Profile readIccProfile(File file) {
        try {
            return Imaging.getICCProfile(file);
        } catch (ImageReadException | IOException | RuntimeException e) {
            LOG.debug("No usable ICC profile in {}: {}", file.getName(), e.toString());
            return null;
        }
    }
}
