package com.phillippitts.photobatch.service.codec;

import com.phillippitts.photobatch.domain.PixelBuffer;

import java.nio.file.Path;

/**
 * Narrow boundary to the image and RAW libraries.
 *
 * <p>These are the only operations the pipelines need. Failures surface as the unchecked
 * exceptions of {@code com.phillippitts.photobatch.exception}.
 */
public interface CodecAdapter {

    /**
     * Reads a standard raster image and its source metadata.
     *
     * @param path image file
     * @return decoded pixels plus orientation, ICC profile and EXIF block
     * @throws com.phillippitts.photobatch.exception.DecodeException if no reader accepts the file
     */
    DecodedImage decode(Path path);

    /**
     * Encodes pixels as a baseline JPEG.
     *
     * @param pixels 3-channel opaque pixels
     * @param params quality, quantization preset and optional EXIF block
     * @return complete JPEG file contents
     * @throws com.phillippitts.photobatch.exception.EncodeException on writer or metadata failure
     */
    byte[] encode(PixelBuffer pixels, EncodeParams params);

    /**
     * Demosaics a camera RAW file to 8-bit RGB and extracts its capture metadata.
     *
     * @param path RAW file
     * @return pixels plus the recovered metadata fields
     * @throws com.phillippitts.photobatch.exception.RawDecodeException on decoder failure
     * @throws com.phillippitts.photobatch.exception.RawUnavailableException if no decoder is installed
     */
    RawImage demosaic(Path path);

    /**
     * @return whether {@link #demosaic(Path)} can work on this host
     */
    boolean isRawAvailable();
}
