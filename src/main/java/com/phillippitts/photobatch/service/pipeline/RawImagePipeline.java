package com.phillippitts.photobatch.service.pipeline;

import com.phillippitts.photobatch.config.properties.ProcessingProperties;
import com.phillippitts.photobatch.domain.FileKind;
import com.phillippitts.photobatch.domain.PixelBuffer;
import com.phillippitts.photobatch.domain.ProcessingConfig;
import com.phillippitts.photobatch.domain.RunState;
import com.phillippitts.photobatch.exception.RawUnavailableException;
import com.phillippitts.photobatch.service.codec.CodecAdapter;
import com.phillippitts.photobatch.service.codec.EncodeParams;
import com.phillippitts.photobatch.service.codec.QuantizationPreset;
import com.phillippitts.photobatch.service.codec.RawExifMapper;
import com.phillippitts.photobatch.service.codec.RawImage;
import com.phillippitts.photobatch.service.metrics.ProcessingMetrics;
import com.phillippitts.photobatch.service.progress.ProgressSink;
import com.phillippitts.photobatch.service.scan.OutputMapper;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Transforms one camera RAW file into its output JPEG in a single attempt.
 *
 * <p>RAW demosaicing is slow, so a failed file is recorded once and not retried. Output quality
 * is {@link ProcessingConfig#rawQuality()}; the recovered capture fields become the EXIF block.
 */
@Component
public class RawImagePipeline {

    private static final Logger LOG = LogManager.getLogger(RawImagePipeline.class);

    private final CodecAdapter codec;
    private final RawExifMapper exifMapper;
    private final ProgressSink sink;
    private final ProcessingMetrics metrics;
    private final RoundingRule rounding;

    @Autowired
    public RawImagePipeline(CodecAdapter codec,
                            RawExifMapper exifMapper,
                            ProgressSink sink,
                            ProcessingMetrics metrics,
                            ProcessingProperties properties) {
        this(codec, exifMapper, sink, metrics, properties.getRawRounding());
    }

    RawImagePipeline(CodecAdapter codec,
                     RawExifMapper exifMapper,
                     ProgressSink sink,
                     ProcessingMetrics metrics,
                     RoundingRule rounding) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.exifMapper = Objects.requireNonNull(exifMapper, "exifMapper");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.rounding = Objects.requireNonNull(rounding, "rounding");
    }

    /**
     * @return whether the output was written; on {@code false} the error entry is already recorded
     * @throws RawUnavailableException if the decoder disappeared; this is a run-wide condition, not a file error
     */
    public boolean process(Path input, ProcessingConfig config, RunState state) {
        String name = String.valueOf(input.getFileName());
        ThreadContext.put("file", name);
        long start = System.nanoTime();
        try {
            Path target = OutputMapper.of(config).map(input);
            RawImage raw = codec.demosaic(input);
            PixelBuffer pixels = raw.pixels();

            ResizePolicy.TargetSize size = ResizePolicy.target(pixels.width(), pixels.height(), config.maxSide(),
                    rounding);
            if (size.resized()) {
                sink.info(state, "[" + name + "] resize: " + pixels.width() + "x" + pixels.height()
                        + " -> " + size.width() + "x" + size.height());
                pixels = LanczosResampler.resize(pixels, size.width(), size.height());
            } else {
                sink.info(state, "[" + name + "] no resize needed (" + pixels.width() + "x" + pixels.height() + ")");
            }
            pixels = TransparencyFlattener.flatten(pixels);

            TiffOutputSet exif = exifMapper.toExif(raw.metadata()).orElse(null);
            byte[] jpeg = codec.encode(pixels, new EncodeParams(config.rawQuality(), QuantizationPreset.STANDARD, exif));
            OutputWriter.write(jpeg, target);
            metrics.incrementProcessed(FileKind.RAW);
            return true;
        } catch (RawUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.debug("RAW processing failed for {}", name, e);
            sink.fileFailed(state, input, StandardImagePipeline.messageOf(e));
            metrics.incrementFailed(FileKind.RAW, ProcessingMetrics.reasonOf(e));
            return false;
        } finally {
            metrics.recordLatency(FileKind.RAW, System.nanoTime() - start);
            ThreadContext.remove("file");
        }
    }
}
