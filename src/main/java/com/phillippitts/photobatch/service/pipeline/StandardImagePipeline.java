package com.phillippitts.photobatch.service.pipeline;

import com.phillippitts.photobatch.config.properties.ProcessingProperties;
import com.phillippitts.photobatch.domain.FileKind;
import com.phillippitts.photobatch.domain.PixelBuffer;
import com.phillippitts.photobatch.domain.ProcessingConfig;
import com.phillippitts.photobatch.domain.RunState;
import com.phillippitts.photobatch.exception.ColorProfileException;
import com.phillippitts.photobatch.service.codec.CodecAdapter;
import com.phillippitts.photobatch.service.codec.DecodedImage;
import com.phillippitts.photobatch.service.codec.EncodeParams;
import com.phillippitts.photobatch.service.codec.QuantizationPreset;
import com.phillippitts.photobatch.service.metrics.ProcessingMetrics;
import com.phillippitts.photobatch.service.progress.ProgressSink;
import com.phillippitts.photobatch.service.scan.OutputMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Transforms one standard raster image into its output JPEG.
 *
 * <p>Steps: decode, colour management to sRGB (perceptual intent), orientation, even-sided
 * Lanczos resize when the longest side exceeds the limit, flattening onto white, baseline 4:4:4
 * encode with the configured quantization preset and the source EXIF, atomic write.
 *
 * <p>Any failure restarts the file from decode, up to {@code retryAttempts} attempts separated
 * by {@code retryDelayMs}. Colour-management failures are not failures: the step is skipped
 * with a warning. When the budget is spent exactly one error-log entry is recorded and the
 * method returns {@code false}; it never throws.
 */
@Component
public class StandardImagePipeline {

    private static final Logger LOG = LogManager.getLogger(StandardImagePipeline.class);

    private final CodecAdapter codec;
    private final ProgressSink sink;
    private final ProcessingMetrics metrics;
    private final int retryAttempts;
    private final long retryDelayMs;
    private final QuantizationPreset quantization;

    @Autowired
    public StandardImagePipeline(CodecAdapter codec,
                                 ProgressSink sink,
                                 ProcessingMetrics metrics,
                                 ProcessingProperties properties) {
        this(codec, sink, metrics, properties.getRetryAttempts(), properties.getRetryDelayMs(),
                properties.getQuantization());
    }

    StandardImagePipeline(CodecAdapter codec,
                          ProgressSink sink,
                          ProcessingMetrics metrics,
                          int retryAttempts,
                          long retryDelayMs,
                          QuantizationPreset quantization) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        if (retryAttempts < 1) {
            throw new IllegalArgumentException("retryAttempts must be >= 1, got: " + retryAttempts);
        }
        this.retryAttempts = retryAttempts;
        this.retryDelayMs = retryDelayMs;
        this.quantization = Objects.requireNonNull(quantization, "quantization");
    }

    /**
     * @param input  image under the config's input root
     * @param config run settings
     * @param state  run state receiving the error entry on failure
     * @return whether the output was written
     */
    public boolean process(Path input, ProcessingConfig config, RunState state) {
        String name = String.valueOf(input.getFileName());
        ThreadContext.put("file", name);
        long start = System.nanoTime();
        try {
            Path target = OutputMapper.of(config).map(input);
            RuntimeException last = null;
            int retries = retryAttempts - 1;
            for (int attempt = 1; attempt <= retryAttempts; attempt++) {
                try {
                    transform(input, target, name, config, state);
                    metrics.incrementProcessed(FileKind.STANDARD);
                    return true;
                } catch (RuntimeException e) {
                    last = e;
                    LOG.debug("Attempt {}/{} failed for {}", attempt, retryAttempts, name, e);
                    if (attempt <= retries) {
                        sink.info(state, "[" + name + "] processing failed, retry (" + attempt + "/" + retries
                                + "): " + messageOf(e));
                        if (!pause()) {
                            break;
                        }
                    }
                }
            }
            sink.fileFailed(state, input, messageOf(last));
            metrics.incrementFailed(FileKind.STANDARD, ProcessingMetrics.reasonOf(last));
            return false;
        } catch (RuntimeException e) {
            // unmappable input path; nothing was attempted
            sink.fileFailed(state, input, messageOf(e));
            metrics.incrementFailed(FileKind.STANDARD, ProcessingMetrics.reasonOf(e));
            return false;
        } finally {
            metrics.recordLatency(FileKind.STANDARD, System.nanoTime() - start);
            ThreadContext.remove("file");
        }
    }

    private void transform(Path input, Path target, String name, ProcessingConfig config, RunState state) {
        DecodedImage decoded = codec.decode(input);
        PixelBuffer pixels = decoded.pixels();

        // Before orientation: redrawing would otherwise bake a decoded colour space into sRGB values
        try {
            pixels = ColorManager.toSrgb(pixels, decoded.metadata().iccProfile());
        } catch (ColorProfileException e) {
            LOG.warn("Colour conversion skipped for {}: {}", name, e.getMessage());
            sink.warn(state, "[" + name + "] colour conversion skipped: " + e.getMessage());
        }

        pixels = Orientation.apply(pixels, decoded.metadata().orientation());

        ResizePolicy.TargetSize size = ResizePolicy.target(pixels.width(), pixels.height(), config.maxSide(),
                RoundingRule.NEAREST);
        if (size.resized()) {
            sink.info(state, "[" + name + "] resize: " + pixels.width() + "x" + pixels.height()
                    + " -> " + size.width() + "x" + size.height());
            pixels = LanczosResampler.resize(pixels, size.width(), size.height());
        } else {
            sink.info(state, "[" + name + "] no resize needed (" + pixels.width() + "x" + pixels.height() + ")");
        }

        pixels = TransparencyFlattener.flatten(pixels);

        byte[] jpeg = codec.encode(pixels,
                new EncodeParams(config.jpgQuality(), quantization, decoded.metadata().exif()));
        OutputWriter.write(jpeg, target);
    }

    private boolean pause() {
        if (retryDelayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(retryDelayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    static String messageOf(Throwable e) {
        if (e == null) {
            return "unknown error";
        }
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
