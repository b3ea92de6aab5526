package com.phillippitts.photobatch.service.codec;

import org.apache.commons.imaging.ImageReadException;
import org.apache.commons.imaging.ImageWriteException;
import org.apache.commons.imaging.formats.jpeg.exif.ExifRewriter;
import org.apache.commons.imaging.formats.tiff.constants.TiffTagConstants;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputDirectory;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Splices an EXIF block into encoded JPEG bytes without re-encoding the image data.
 *
 * <p>The orientation tag is dropped first: pixels reaching the encoder are already upright.
 * Metadata is carried on a best-effort basis: a block Commons Imaging cannot write back (broken
 * maker-note offsets, inconsistent directories) is dropped with a warning and the JPEG is
 * returned without it, so the photo itself is never lost over its metadata.
 */
@Component
public class ExifEmbedder {

    private static final Logger LOG = LogManager.getLogger(ExifEmbedder.class);

    public byte[] embed(byte[] jpeg, TiffOutputSet exif) {
        try {
            TiffOutputDirectory root = exif.getRootDirectory();
            if (root != null) {
                root.removeField(TiffTagConstants.TIFF_TAG_ORIENTATION);
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream(jpeg.length + 64 * 1024);
            new ExifRewriter().updateExifMetadataLossless(jpeg, out, exif);
            return out.toByteArray();
        } catch (ImageReadException | ImageWriteException | IOException | RuntimeException e) {
            LOG.warn("EXIF block could not be rewritten, writing JPEG without metadata: {}", e.getMessage());
            return jpeg;
        }
    }
}
