package com.phillippitts.photobatch.service.codec;

import com.phillippitts.photobatch.domain.PixelBuffer;
import com.phillippitts.photobatch.exception.DecodeException;
import com.phillippitts.photobatch.exception.RawUnavailableException;
import com.phillippitts.photobatch.service.codec.raw.DcrawRawDecoder;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Production {@link CodecAdapter}: JDK ImageIO for pixels, Commons Imaging for metadata,
 * dcraw for RAW files.
 */
@Component
public class ImageIoCodecAdapter implements CodecAdapter {

    private final MetadataReader metadataReader;
    private final JpegEncoder jpegEncoder;
    private final ExifEmbedder exifEmbedder;
    private final DcrawRawDecoder rawDecoder;

    public ImageIoCodecAdapter(MetadataReader metadataReader,
                               JpegEncoder jpegEncoder,
                               ExifEmbedder exifEmbedder,
                               DcrawRawDecoder rawDecoder) {
        this.metadataReader = Objects.requireNonNull(metadataReader, "metadataReader");
        this.jpegEncoder = Objects.requireNonNull(jpegEncoder, "jpegEncoder");
        this.exifEmbedder = Objects.requireNonNull(exifEmbedder, "exifEmbedder");
        this.rawDecoder = Objects.requireNonNull(rawDecoder, "rawDecoder");
    }

    @Override
    public DecodedImage decode(Path path) {
        String name = String.valueOf(path.getFileName());
        BufferedImage image;
        try {
            image = ImageIO.read(path.toFile());
        } catch (IOException | RuntimeException e) {
            throw new DecodeException("Cannot read image: " + e.getMessage(), name, e);
        }
        if (image == null) {
            throw new DecodeException("Unsupported image format", name);
        }
        return new DecodedImage(PixelBuffer.of(image), metadataReader.read(path));
    }

    @Override
    public byte[] encode(PixelBuffer pixels, EncodeParams params) {
        byte[] jpeg = jpegEncoder.encode(pixels.image(), params.quality(), params.quantization());
        if (params.exif() == null) {
            return jpeg;
        }
        return exifEmbedder.embed(jpeg, params.exif());
    }

    @Override
    public RawImage demosaic(Path path) {
        if (!rawDecoder.isAvailable()) {
            throw new RawUnavailableException(rawDecoder.binaryPath());
        }
        BufferedImage image = rawDecoder.decode(path);
        return new RawImage(PixelBuffer.of(image), rawDecoder.identify(path));
    }

    @Override
    public boolean isRawAvailable() {
        return rawDecoder.isAvailable();
    }
}
