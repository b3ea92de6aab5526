package com.phillippitts.photobatch.service.pipeline;

import com.phillippitts.photobatch.domain.PixelBuffer;
import com.phillippitts.photobatch.exception.DecodeException;
import com.phillippitts.photobatch.exception.RawDecodeException;
import com.phillippitts.photobatch.service.codec.CodecAdapter;
import com.phillippitts.photobatch.service.codec.DecodedImage;
import com.phillippitts.photobatch.service.codec.EncodeParams;
import com.phillippitts.photobatch.service.codec.JpegEncoder;
import com.phillippitts.photobatch.service.codec.RawImage;
import com.phillippitts.photobatch.service.codec.SourceMetadata;
import com.phillippitts.photobatch.service.codec.raw.RawMetadata;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Codec doubles for pipeline tests. Encoding goes through the real {@link JpegEncoder} so
 * written outputs are valid JPEGs.
 */
final class PipelineTestDoubles {

    private PipelineTestDoubles() {
    }

    /**
     * Returns a fixed image after failing the first {@code failures} decode calls.
     */
    static final class FlakyCodec implements CodecAdapter {
        private final BufferedImage image;
        private final SourceMetadata metadata;
        private final int failures;
        final AtomicInteger decodeCalls = new AtomicInteger();
        final List<EncodeParams> encoded = new CopyOnWriteArrayList<>();
        final List<int[]> encodedSizes = new CopyOnWriteArrayList<>();

        FlakyCodec(BufferedImage image, int failures) {
            this(image, SourceMetadata.none(), failures);
        }

        FlakyCodec(BufferedImage image, SourceMetadata metadata, int failures) {
            this.image = image;
            this.metadata = metadata;
            this.failures = failures;
        }

        @Override
        public DecodedImage decode(Path path) {
            int call = decodeCalls.incrementAndGet();
            if (call <= failures) {
                throw new DecodeException("transient read error " + call, String.valueOf(path.getFileName()));
            }
            return new DecodedImage(PixelBuffer.of(image), metadata);
        }

        @Override
        public byte[] encode(PixelBuffer pixels, EncodeParams params) {
            encoded.add(params);
            encodedSizes.add(new int[] {pixels.width(), pixels.height()});
            return new JpegEncoder().encode(pixels.image(), params.quality(), params.quantization());
        }

        @Override
        public RawImage demosaic(Path path) {
            throw new UnsupportedOperationException("standard images only");
        }

        @Override
        public boolean isRawAvailable() {
            return false;
        }
    }

    /**
     * RAW-only codec returning a fixed demosaiced image, or throwing the configured failure.
     */
    static final class StubRawCodec implements CodecAdapter {
        private final BufferedImage image;
        private final RawMetadata metadata;
        private final RuntimeException failure;
        final AtomicInteger demosaicCalls = new AtomicInteger();
        final List<EncodeParams> encoded = new CopyOnWriteArrayList<>();
        final List<int[]> encodedSizes = new CopyOnWriteArrayList<>();

        StubRawCodec(BufferedImage image, RawMetadata metadata) {
            this(image, metadata, null);
        }

        StubRawCodec(RuntimeException failure) {
            this(null, RawMetadata.empty(), failure);
        }

        private StubRawCodec(BufferedImage image, RawMetadata metadata, RuntimeException failure) {
            this.image = image;
            this.metadata = metadata;
            this.failure = failure;
        }

        @Override
        public DecodedImage decode(Path path) {
            throw new UnsupportedOperationException("RAW only");
        }

        @Override
        public byte[] encode(PixelBuffer pixels, EncodeParams params) {
            encoded.add(params);
            encodedSizes.add(new int[] {pixels.width(), pixels.height()});
            return new JpegEncoder().encode(pixels.image(), params.quality(), params.quantization());
        }

        @Override
        public RawImage demosaic(Path path) {
            demosaicCalls.incrementAndGet();
            if (failure != null) {
                throw failure;
            }
            return new RawImage(PixelBuffer.of(image), metadata);
        }

        @Override
        public boolean isRawAvailable() {
            return true;
        }

        static RawDecodeException decodeFailure(String file) {
            return new RawDecodeException("dcraw exited with 1", file);
        }
    }
}
