package com.phillippitts.photobatch.service.codec.raw;

import com.phillippitts.photobatch.config.raw.RawDecoderConfig;
import com.phillippitts.photobatch.exception.RawDecodeException;
import com.phillippitts.photobatch.exception.RawDecodeExceptionBuilder;
import com.phillippitts.photobatch.util.ProcessTimeouts;
import com.phillippitts.photobatch.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Runs the external dcraw binary to demosaic camera RAW files.
 *
 * <p>Decode CLI contract:
 * <pre>
 * ${binary} -c -w -q 3 -g 2.2 4.5 -T ${raw}
 * </pre>
 * i.e. write to stdout, camera white balance, AHD interpolation, gamma 2.2 with toe slope 4.5,
 * automatic brightening (dcraw's default), 8-bit TIFF output. Metadata comes from a second,
 * cheap invocation in identify mode ({@code -i -v}).
 *
 * <p>Each invocation captures stdout and stderr on gobbler threads, enforces
 * {@link RawDecoderConfig#timeoutSeconds()} and terminates runaway processes. State is local to
 * the call, so one instance may serve concurrent callers.
 */
@Component
public class DcrawRawDecoder {

    private static final Logger LOG = LogManager.getLogger(DcrawRawDecoder.class);

    private static final int STDERR_SNIPPET_MAX_CHARS = 400;

    private final ProcessFactory processFactory;
    private final RawDecoderConfig config;

    /**
     * Captured output of one decoder invocation.
     */
    private record ProcessOutput(byte[] stdout, String stderr, int exitCode) {}

    @Autowired
    public DcrawRawDecoder(RawDecoderConfig config) {
        this(new DefaultProcessFactory(), config);
    }

    DcrawRawDecoder(ProcessFactory processFactory, RawDecoderConfig config) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * @return whether the configured binary resolves to an executable file
     */
    public boolean isAvailable() {
        return resolveBinary().isPresent();
    }

    public String binaryPath() {
        return config.binaryPath();
    }

    /**
     * Demosaics a RAW file to an 8-bit RGB image.
     *
     * @param raw RAW file
     * @return decoded image
     * @throws RawDecodeException on a missing binary, timeout, non-zero exit or unreadable output
     */
    public BufferedImage decode(Path raw) {
        List<String> command = buildCommand(raw, List.of("-c", "-w", "-q", "3", "-g", "2.2", "4.5", "-T"));
        long start = System.nanoTime();
        ProcessOutput output = execute(command, raw, start);

        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(output.stdout()));
            if (image == null) {
                throw failure("Decoder produced no readable image", raw, output.exitCode(), output.stderr(),
                        start, null);
            }
            LOG.debug("Demosaiced {} to {}x{} in {} ms", raw.getFileName(), image.getWidth(), image.getHeight(),
                    TimeUtils.elapsedMillis(start));
            return image;
        } catch (IOException e) {
            throw failure("Unreadable decoder output: " + e.getMessage(), raw, output.exitCode(), output.stderr(),
                    start, e);
        }
    }

    /**
     * Reads capture metadata. A failing identify run only loses metadata; it is logged and
     * reported as {@link RawMetadata#empty()}.
     *
     * @param raw RAW file
     * @return recovered fields
     */
    public RawMetadata identify(Path raw) {
        List<String> command = buildCommand(raw, List.of("-i", "-v"));
        long start = System.nanoTime();
        try {
            ProcessOutput output = execute(command, raw, start);
            return RawMetadataParser.parse(new String(output.stdout(), StandardCharsets.UTF_8));
        } catch (RawDecodeException e) {
            LOG.warn("RAW metadata unavailable for {}: {}", raw.getFileName(), e.getMessage());
            return RawMetadata.empty();
        }
    }

    private List<String> buildCommand(Path raw, List<String> options) {
        Path binary = resolveBinary().orElseThrow(() -> RawDecodeExceptionBuilder
                .create("RAW decoder binary not found")
                .file(fileName(raw))
                .metadata("binaryPath", config.binaryPath())
                .build());
        List<String> cmd = new ArrayList<>();
        cmd.add(binary.toString());
        cmd.addAll(options);
        cmd.add(raw.toAbsolutePath().toString());
        return cmd;
    }

    private ProcessOutput execute(List<String> command, Path raw, long start) {
        Process process = null;
        Thread outGobbler = null;
        Thread errGobbler = null;
        try {
            process = processFactory.start(command, raw.toAbsolutePath().getParent());
            ByteArrayOutputStream stdout = new ByteArrayOutputStream();
            StringBuilder stderr = new StringBuilder();
            outGobbler = startGobbler(new BinaryGobbler(process.getInputStream(), stdout), "dcraw-out");
            errGobbler = startGobbler(new TextGobbler(process.getErrorStream(), stderr, config.maxMetadataBytes()),
                    "dcraw-err");

            boolean finished = process.waitFor(config.timeoutSeconds(), TimeUnit.SECONDS);
            if (!finished) {
                destroyProcess(process);
                throw failure("Timeout after " + config.timeoutSeconds() + "s", raw, -1, snapshot(stderr),
                        start, null);
            }
            joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw failure("Non-zero exit: " + exitCode, raw, exitCode, snapshot(stderr), start, null);
            }
            return new ProcessOutput(stdout.toByteArray(), snapshot(stderr), exitCode);
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw failure("I/O failure: " + e.getMessage(), raw, -1, "", start, e);
        } finally {
            if (process != null && process.isAlive()) {
                destroyProcess(process);
            }
            joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
            joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        }
    }

    /**
     * Resolves the binary: paths with a directory part are used as given, bare names are looked
     * up on {@code PATH}.
     */
    Optional<Path> resolveBinary() {
        String configured = config.binaryPath();
        Path direct = Path.of(configured);
        if (direct.isAbsolute() || direct.getNameCount() > 1) {
            return Files.isRegularFile(direct) && Files.isExecutable(direct) ? Optional.of(direct) : Optional.empty();
        }
        String pathEnv = System.getenv("PATH");
        if (pathEnv == null || pathEnv.isBlank()) {
            return Optional.empty();
        }
        for (String dir : pathEnv.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            for (String candidate : List.of(configured, configured + ".exe")) {
                Path p = Path.of(dir).resolve(candidate);
                if (Files.isRegularFile(p) && Files.isExecutable(p)) {
                    return Optional.of(p);
                }
            }
        }
        return Optional.empty();
    }

    private static String snapshot(StringBuilder sb) {
        synchronized (sb) {
            return sb.toString();
        }
    }

    private static Thread startGobbler(Runnable gobbler, String name) {
        Thread thread = new Thread(gobbler, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Copies a binary stream fully; image output must not be truncated.
     */
    private static final class BinaryGobbler implements Runnable {
        private final InputStream inputStream;
        private final ByteArrayOutputStream sink;

        BinaryGobbler(InputStream inputStream, ByteArrayOutputStream sink) {
            this.inputStream = inputStream;
            this.sink = sink;
        }

        @Override
        public void run() {
            try (InputStream in = inputStream) {
                in.transferTo(sink);
            } catch (IOException e) {
                LOG.debug("Binary gobbler stopped: {}", e.toString());
            }
        }
    }

    /**
     * Accumulates text up to a cap, then keeps draining without accumulating so the child
     * never blocks on a full pipe.
     */
    private static final class TextGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final int maxChars;

        TextGobbler(InputStream inputStream, StringBuilder sink, int maxChars) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.maxChars = maxChars;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (sink.length() >= maxChars) {
                            continue;
                        }
                        if (sink.length() > 0) {
                            sink.append('\n');
                        }
                        sink.append(line, 0, Math.min(line.length(), maxChars - sink.length()));
                    }
                }
            } catch (IOException e) {
                LOG.debug("Text gobbler stopped: {}", e.toString());
            }
        }
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("RAW decoder process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying RAW decoder process");
        }
    }

    private RawDecodeException failure(String msg, Path raw, int exitCode, String stderr, long start,
                                       Throwable cause) {
        String snippet = stderr == null ? "" : stderr.substring(0, Math.min(STDERR_SNIPPET_MAX_CHARS, stderr.length()));
        RawDecodeExceptionBuilder builder = RawDecodeExceptionBuilder.create(msg)
                .file(fileName(raw))
                .exitCode(exitCode)
                .durationMs(TimeUtils.elapsedMillis(start))
                .metadata("binaryPath", config.binaryPath())
                .metadata("stderr", snippet);
        if (cause != null) {
            builder.cause(cause);
        }
        return builder.build();
    }

    private static String fileName(Path raw) {
        Path name = raw.getFileName();
        return name == null ? raw.toString() : name.toString();
    }
}
