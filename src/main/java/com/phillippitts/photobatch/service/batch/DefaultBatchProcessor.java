package com.phillippitts.photobatch.service.batch;

import com.phillippitts.photobatch.domain.ProcessingConfig;
import com.phillippitts.photobatch.domain.RunState;
import com.phillippitts.photobatch.domain.RunSummary;
import com.phillippitts.photobatch.domain.ScanResult;
import com.phillippitts.photobatch.exception.OutputWriteException;
import com.phillippitts.photobatch.exception.RawUnavailableException;
import com.phillippitts.photobatch.service.codec.CodecAdapter;
import com.phillippitts.photobatch.service.metrics.ProcessingMetrics;
import com.phillippitts.photobatch.service.pipeline.RawImagePipeline;
import com.phillippitts.photobatch.service.pipeline.StandardImagePipeline;
import com.phillippitts.photobatch.service.progress.ErrorReportWriter;
import com.phillippitts.photobatch.service.progress.ProgressSink;
import com.phillippitts.photobatch.service.scan.FileScanner;
import com.phillippitts.photobatch.service.scan.OutputMapper;
import com.phillippitts.photobatch.service.schedule.BoundedConcurrencyScheduler;
import com.phillippitts.photobatch.service.schedule.PoolSizeAdvisor;
import com.phillippitts.photobatch.service.schedule.StageResult;
import com.phillippitts.photobatch.service.workers.AdaptiveWorkerMonitor;
import com.phillippitts.photobatch.service.workers.AdaptiveWorkerPolicy;
import com.phillippitts.photobatch.service.workers.CpuSampler;
import com.phillippitts.photobatch.util.TimeUtils;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Default {@link BatchProcessor}.
 *
 * <p>Run order: RAW capability check (RAW disabled for the whole run with a notice when the
 * decoder is missing), scan and group, pre-filter of standard images whose output already
 * exists, parallel standard stage, sequential RAW stage, summary and error report.
 *
 * <p>Cancellation is checked at scan time, at every scheduler poll and before each RAW file.
 * A cancelled run logs its partial counts and writes no error report.
 */
@Service
public class DefaultBatchProcessor implements BatchProcessor {

    private static final Logger LOG = LogManager.getLogger(DefaultBatchProcessor.class);
    private static final int RAW_PROGRESS_EVERY = 5;

    private final FileScanner scanner;
    private final StandardImagePipeline standardPipeline;
    private final RawImagePipeline rawPipeline;
    private final BoundedConcurrencyScheduler scheduler;
    private final AdaptiveWorkerPolicy adaptivePolicy;
    private final CpuSampler cpuSampler;
    private final CodecAdapter codec;
    private final ProgressSink sink;
    private final ErrorReportWriter reportWriter;
    private final ProcessingMetrics metrics;
    private final Clock clock = Clock.systemDefaultZone();

    private final AtomicReference<RunState> active = new AtomicReference<>();

    public DefaultBatchProcessor(FileScanner scanner,
                                 StandardImagePipeline standardPipeline,
                                 RawImagePipeline rawPipeline,
                                 BoundedConcurrencyScheduler scheduler,
                                 AdaptiveWorkerPolicy adaptivePolicy,
                                 CpuSampler cpuSampler,
                                 CodecAdapter codec,
                                 ProgressSink sink,
                                 ErrorReportWriter reportWriter,
                                 ProcessingMetrics metrics) {
        this.scanner = scanner;
        this.standardPipeline = standardPipeline;
        this.rawPipeline = rawPipeline;
        this.scheduler = scheduler;
        this.adaptivePolicy = adaptivePolicy;
        this.cpuSampler = cpuSampler;
        this.codec = codec;
        this.sink = sink;
        this.reportWriter = reportWriter;
        this.metrics = metrics;
    }

    @Override
    public RunSummary process(ProcessingConfig config) {
        RunState state = new RunState(clock);
        if (!active.compareAndSet(null, state)) {
            throw new IllegalStateException("A batch run is already active");
        }
        ThreadContext.put("runId", state.runId());
        try {
            sink.info(state, "=== Processing started ===");
            sink.info(state, "Input directory: " + config.inputRoot());
            sink.info(state, "Output directory: " + config.outputRoot());
            ProcessingConfig effective = checkRawAvailability(config, state);

            ScanResult scan = scanner.scan(effective.inputRoot(), effective.processRaw(), state);
            if (!state.isRunning()) {
                return finish(effective, state);
            }
            if (scan.systemFiles() > 0) {
                sink.info(state, "Skipped system files: " + scan.systemFiles() + " (names starting with '._' or '_')");
            }

            OutputMapper mapper = OutputMapper.of(effective);
            List<Path> pending = scan.images().stream()
                    .filter(p -> !mapper.isProcessed(p))
                    .collect(Collectors.toList());
            state.setAlreadyProcessed(scan.images().size() - pending.size());
            state.setTotalFiles(pending.size() + scan.raws().size());

            sink.info(state, "Pending standard images: " + pending.size());
            String rawStatus = "Pending RAW files: " + scan.raws().size();
            if (effective.processRaw() && scan.duplicateRaws() > 0) {
                rawStatus += " (skipped RAW files sharing a name with a standard image: " + scan.duplicateRaws() + ")";
            }
            sink.info(state, rawStatus);

            runStandardStage(pending, effective, state);
            runRawStage(scan.raws(), effective, state);
            return finish(effective, state);
        } finally {
            active.compareAndSet(state, null);
            ThreadContext.remove("runId");
        }
    }

    @Override
    public void cancel() {
        RunState state = active.get();
        if (state != null && state.isRunning()) {
            state.cancel();
            sink.info(state, "Cancelling...");
        }
    }

    @PreDestroy
    void cancelOnShutdown() {
        cancel();
    }

    private ProcessingConfig checkRawAvailability(ProcessingConfig config, RunState state) {
        if (config.processRaw() && !codec.isRawAvailable()) {
            sink.warn(state, "RAW processing: disabled (RAW decoder not available)");
            return config.withRawDisabled();
        }
        sink.info(state, "RAW processing: " + (config.processRaw() ? "enabled" : "disabled")
                + " | mode: " + (config.highQualityRaw() ? "high quality" : "standard"));
        return config;
    }

    private void runStandardStage(List<Path> pending, ProcessingConfig config, RunState state) {
        if (pending.isEmpty() || !state.isRunning()) {
            return;
        }
        int workers = Math.min(config.resolveWorkers(cpuSampler.physicalCores()), pending.size());
        sink.info(state, "Processing standard images with " + workers + " workers...");

        AdaptiveWorkerMonitor monitor = null;
        if (adaptivePolicy.isEnabled()) {
            monitor = new AdaptiveWorkerMonitor(adaptivePolicy, workers, state, sink, metrics, clock);
            monitor.start();
        }
        StageResult result;
        try {
            result = scheduler.run(pending, workers,
                    input -> standardPipeline.process(input, config, state),
                    state,
                    monitor == null ? PoolSizeAdvisor.none() : monitor);
        } finally {
            if (monitor != null) {
                monitor.close();
            }
        }
        sink.info(state, "Standard images finished: " + result.succeeded() + "/" + pending.size() + " succeeded");
        LOG.debug("Standard stage: {}", result);
    }

    private void runRawStage(List<Path> raws, ProcessingConfig config, RunState state) {
        if (raws.isEmpty() || !state.isRunning() || !config.processRaw()) {
            return;
        }
        sink.info(state, "Processing " + raws.size() + " RAW files ("
                + (config.highQualityRaw() ? "high quality" : "standard") + " mode)...");
        for (int i = 0; i < raws.size(); i++) {
            if (!state.isRunning()) {
                break;
            }
            try {
                if (rawPipeline.process(raws.get(i), config, state)) {
                    sink.fileSucceeded(state);
                }
            } catch (RawUnavailableException e) {
                sink.warn(state, "RAW processing stopped: " + e.getMessage());
                // the current file and every later one are recorded as not converted
                for (Path skipped : raws.subList(i, raws.size())) {
                    sink.fileFailed(state, skipped, "skipped, " + e.getMessage());
                }
                return;
            }
            if ((i + 1) % RAW_PROGRESS_EVERY == 0) {
                sink.info(state, "RAW progress: " + (i + 1) + "/" + raws.size());
            }
        }
    }

    private RunSummary finish(ProcessingConfig config, RunState state) {
        RunSummary summary = state.summary();
        if (summary.cancelled()) {
            sink.info(state, "=== Processing cancelled === (processed " + summary.processed()
                    + ", errors " + summary.failed() + ")");
            return summary;
        }
        sink.info(state, "=== All done ===");
        sink.info(state, "Total: " + summary.totalFiles());
        sink.info(state, "Succeeded: " + summary.processed());
        sink.info(state, "Skipped: " + summary.skipped() + " (same-named files)");
        if (summary.alreadyProcessed() > 0) {
            sink.info(state, "Already processed: " + summary.alreadyProcessed());
        }
        if (summary.skippedSystem() > 0) {
            sink.info(state, "System files skipped: " + summary.skippedSystem() + " (names starting with '._' or '_')");
        }
        sink.info(state, "Errors: " + summary.failed());
        sink.info(state, "Elapsed: " + TimeUtils.formatElapsed(summary.elapsed()));

        try {
            Optional<Path> report = reportWriter.write(state, config.outputRoot());
            report.ifPresent(path -> sink.info(state, "Error report saved to: " + path));
        } catch (OutputWriteException e) {
            LOG.error("Could not write error report", e);
            sink.warn(state, "Could not write error report: " + e.getMessage());
        }
        return summary;
    }
}
