package com.phillippitts.photobatch.service.batch;

import com.phillippitts.photobatch.config.WorkerPoolFactory;
import com.phillippitts.photobatch.config.properties.ProcessingProperties;
import com.phillippitts.photobatch.config.properties.WorkerPoolProperties;
import com.phillippitts.photobatch.config.raw.RawDecoderConfig;
import com.phillippitts.photobatch.domain.PixelBuffer;
import com.phillippitts.photobatch.domain.ProcessingConfig;
import com.phillippitts.photobatch.domain.RunSummary;
import com.phillippitts.photobatch.exception.RawUnavailableException;
import com.phillippitts.photobatch.service.codec.CodecAdapter;
import com.phillippitts.photobatch.service.codec.DecodedImage;
import com.phillippitts.photobatch.service.codec.EncodeParams;
import com.phillippitts.photobatch.service.codec.ExifEmbedder;
import com.phillippitts.photobatch.service.codec.ImageIoCodecAdapter;
import com.phillippitts.photobatch.service.codec.JpegEncoder;
import com.phillippitts.photobatch.service.codec.MetadataReader;
import com.phillippitts.photobatch.service.codec.RawExifMapper;
import com.phillippitts.photobatch.service.codec.RawImage;
import com.phillippitts.photobatch.service.codec.raw.DcrawRawDecoder;
import com.phillippitts.photobatch.service.codec.raw.RawMetadata;
import com.phillippitts.photobatch.service.metrics.ProcessingMetrics;
import com.phillippitts.photobatch.service.pipeline.RawImagePipeline;
import com.phillippitts.photobatch.service.pipeline.StandardImagePipeline;
import com.phillippitts.photobatch.service.progress.ErrorReportWriter;
import com.phillippitts.photobatch.service.progress.ProgressSink;
import com.phillippitts.photobatch.service.scan.FileScanner;
import com.phillippitts.photobatch.service.schedule.BoundedConcurrencyScheduler;
import com.phillippitts.photobatch.service.workers.AdaptiveWorkerPolicy;
import com.phillippitts.photobatch.service.workers.CpuSampler;
import com.phillippitts.photobatch.testutil.EventCapturingPublisher;
import com.phillippitts.photobatch.testutil.TestImages;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs whole batches over generated image trees with the real scanner, pipelines and scheduler.
 */
class DefaultBatchProcessorTest {

    private static final CpuSampler TWO_CORES = new CpuSampler() {
        @Override
        public double samplePercent(Duration window) {
            return 50.0;
        }

        @Override
        public int physicalCores() {
            return 2;
        }
    };

    @TempDir
    Path tmp;

    private Path input;
    private Path output;
    private EventCapturingPublisher publisher;
    private SimpleMeterRegistry registry;
    private ImageIoCodecAdapter imageIo;

    @BeforeEach
    void setUp() {
        input = tmp.resolve("in");
        output = tmp.resolve("out");
        publisher = new EventCapturingPublisher();
        registry = new SimpleMeterRegistry();
        DcrawRawDecoder missing = new DcrawRawDecoder(
                new RawDecoderConfig(tmp.resolve("no-such/dcraw").toString(), 5, 65536));
        imageIo = new ImageIoCodecAdapter(new MetadataReader(), new JpegEncoder(), new ExifEmbedder(), missing);
    }

    @Test
    void processesMixedTreeAndWritesErrorReport() throws Exception {
        TestImages.writeJpeg(input.resolve("a.jpg"), 200, 100);
        TestImages.writePng(input.resolve("sub/b.png"), TestImages.transparent(30, 20));
        TestImages.writeJpeg(input.resolve("._c.jpg"), 10, 10);
        TestImages.writeBytes(input.resolve("broken.heic"), new byte[] {0, 0, 0, 24, 'f', 't', 'y', 'p'});
        TestImages.writeJpeg(input.resolve("d.jpg"), 40, 40);
        TestImages.writeBytes(input.resolve("d.cr2"), new byte[] {1, 2, 3});

        RunSummary summary = processor(imageIo).process(config(50));

        assertThat(summary.totalFiles()).isEqualTo(4);
        assertThat(summary.processed()).isEqualTo(3);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.skippedSystem()).isEqualTo(1);
        // RAW was switched off for the run, so d.cr2 is not a counted duplicate
        assertThat(summary.skipped()).isZero();
        assertThat(summary.cancelled()).isFalse();

        BufferedImage a = TestImages.read(output.resolve("a.jpg"));
        assertThat(a.getWidth()).isEqualTo(50);
        assertThat(a.getHeight()).isEqualTo(26);
        assertThat(output.resolve("sub/b.jpg")).exists();
        assertThat(output.resolve("d.jpg")).exists();
        assertThat(output.resolve("c.jpg")).doesNotExist();

        Path report = output.resolve("error-log.txt");
        assertThat(Files.readString(report, StandardCharsets.UTF_8))
                .matches("\\[\\d{2}:\\d{2}:\\d{2}] error: broken\\.heic - .*");
        assertThat(publisher.warnings()).contains("RAW processing: disabled (RAW decoder not available)");
        assertThat(publisher.messages()).contains("=== All done ===", "Errors: 1",
                "Error report saved to: " + report.toAbsolutePath().normalize());
    }

    @Test
    void shouldSkipExistingOutputsOnSecondRun() {
        TestImages.writeJpeg(input.resolve("a.jpg"), 20, 20);
        TestImages.writeJpeg(input.resolve("x/b.jpeg"), 20, 20);
        DefaultBatchProcessor processor = processor(imageIo);

        RunSummary first = processor.process(config(3000));
        RunSummary second = processor.process(config(3000));

        assertThat(first.processed()).isEqualTo(2);
        assertThat(second.processed()).isZero();
        assertThat(second.alreadyProcessed()).isEqualTo(2);
        assertThat(second.totalFiles()).isZero();
        assertThat(output.resolve("error-log.txt")).doesNotExist();
        assertThat(publisher.messages()).contains("Already processed: 2");
    }

    @Test
    void rawStageRunsAfterStandardImages() {
        TestImages.writeJpeg(input.resolve("x.jpg"), 20, 20);
        TestImages.writeBytes(input.resolve("x.nef"), new byte[] {1});
        TestImages.writeBytes(input.resolve("y.dng"), new byte[] {1});
        RawCapableCodec codec = new RawCapableCodec(imageIo);

        RunSummary summary = processor(codec).process(config(3000));

        assertThat(summary.totalFiles()).isEqualTo(2);
        assertThat(summary.processed()).isEqualTo(2);
        assertThat(summary.skipped()).isEqualTo(1);
        assertThat(codec.demosaicCalls.get()).isEqualTo(1);
        assertThat(output.resolve("y.jpg")).exists();
        assertThat(publisher.messages())
                .contains("Pending RAW files: 1 (skipped RAW files sharing a name with a standard image: 1)");
    }

    @Test
    void shouldRecordRemainingRawFilesWhenDecoderDisappears() throws Exception {
        TestImages.writeBytes(input.resolve("a.nef"), new byte[] {1});
        TestImages.writeBytes(input.resolve("b.nef"), new byte[] {1});
        TestImages.writeBytes(input.resolve("c.nef"), new byte[] {1});
        RawCapableCodec codec = new RawCapableCodec(imageIo) {
            @Override
            public RawImage demosaic(Path path) {
                if (demosaicCalls.get() == 1) {
                    demosaicCalls.incrementAndGet();
                    throw new RawUnavailableException("/usr/bin/dcraw");
                }
                return super.demosaic(path);
            }
        };

        RunSummary summary = processor(codec).process(config(3000));

        assertThat(summary.totalFiles()).isEqualTo(3);
        assertThat(summary.processed()).isEqualTo(1);
        assertThat(summary.failed()).isEqualTo(2);
        assertThat(codec.demosaicCalls.get()).isEqualTo(2);
        assertThat(output.resolve("a.jpg")).exists();
        assertThat(publisher.warnings()).contains("RAW processing stopped: RAW decoder not available: /usr/bin/dcraw");
        String report = Files.readString(output.resolve("error-log.txt"), StandardCharsets.UTF_8);
        assertThat(report).contains("error: b.nef - skipped, RAW decoder not available")
                .contains("error: c.nef - skipped, RAW decoder not available");
    }

    @Test
    void cancelledRunWritesNoReport() {
        for (int i = 0; i < 6; i++) {
            TestImages.writeJpeg(input.resolve("img" + i + ".jpg"), 16, 16);
        }
        TestImages.writeBytes(input.resolve("broken.heic"), new byte[] {1, 2});
        AtomicReference<DefaultBatchProcessor> ref = new AtomicReference<>();
        CodecAdapter cancelling = new RawCapableCodec(imageIo) {
            @Override
            public DecodedImage decode(Path path) {
                ref.get().cancel();
                return super.decode(path);
            }
        };
        ref.set(processor(cancelling));

        RunSummary summary = ref.get().process(config(3000));

        assertThat(summary.cancelled()).isTrue();
        assertThat(output.resolve("error-log.txt")).doesNotExist();
        assertThat(publisher.messages()).contains("Cancelling...");
        assertThat(publisher.messages()).anyMatch(m -> m.startsWith("=== Processing cancelled ==="));
    }

    @Test
    void shouldFailOnMissingInputDirectoryAndReleaseRun() {
        DefaultBatchProcessor processor = processor(imageIo);

        assertThatThrownBy(() -> processor.process(config(3000)))
                .hasMessageContaining("does not exist");

        TestImages.writeJpeg(input.resolve("a.jpg"), 8, 8);
        assertThat(processor.process(config(3000)).processed()).isEqualTo(1);
    }

    private ProcessingConfig config(int maxSide) {
        return new ProcessingConfig(input, output, maxSide, 95, true, false, null);
    }

    private DefaultBatchProcessor processor(CodecAdapter codec) {
        ProcessingProperties properties = new ProcessingProperties();
        properties.setRetryDelayMs(0);
        properties.setPollIntervalMs(5);
        WorkerPoolProperties poolProperties = new WorkerPoolProperties();
        ProgressSink sink = new ProgressSink(publisher);
        ProcessingMetrics metrics = new ProcessingMetrics(registry);
        return new DefaultBatchProcessor(
                new FileScanner(),
                new StandardImagePipeline(codec, sink, metrics, properties),
                new RawImagePipeline(codec, new RawExifMapper(), sink, metrics, properties),
                new BoundedConcurrencyScheduler(new WorkerPoolFactory(poolProperties), sink, metrics, properties),
                new AdaptiveWorkerPolicy(TWO_CORES, poolProperties),
                TWO_CORES,
                codec,
                sink,
                new ErrorReportWriter(properties),
                metrics);
    }

    /**
     * Real ImageIO decode and encode; RAW files demosaic to a fixed test image.
     */
    private static class RawCapableCodec implements CodecAdapter {
        private final CodecAdapter delegate;
        final AtomicInteger demosaicCalls = new AtomicInteger();

        RawCapableCodec(CodecAdapter delegate) {
            this.delegate = delegate;
        }

        @Override
        public DecodedImage decode(Path path) {
            return delegate.decode(path);
        }

        @Override
        public byte[] encode(PixelBuffer pixels, EncodeParams params) {
            return delegate.encode(pixels, params);
        }

        @Override
        public RawImage demosaic(Path path) {
            demosaicCalls.incrementAndGet();
            return new RawImage(PixelBuffer.of(TestImages.split(24, 16)), RawMetadata.empty());
        }

        @Override
        public boolean isRawAvailable() {
            return true;
        }
    }
}
