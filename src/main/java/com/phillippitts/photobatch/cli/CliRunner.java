package com.phillippitts.photobatch.cli;

import com.phillippitts.photobatch.config.properties.ProcessingProperties;
import com.phillippitts.photobatch.domain.ProcessingConfig;
import com.phillippitts.photobatch.domain.RunSummary;
import com.phillippitts.photobatch.exception.PhotoBatchException;
import com.phillippitts.photobatch.service.batch.BatchProcessor;
import com.phillippitts.photobatch.settings.UserSettings;
import com.phillippitts.photobatch.settings.UserSettingsStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Runs a batch synchronously when started with {@code --cli --input <path> --output <path>}.
 *
 * <p>Without those flags the usage text and the stored settings are logged and the application
 * exits. While a run is active, a JVM shutdown (Ctrl-C) cancels it and waits a bounded time for
 * dispatched files to finish.
 */
@Component
public class CliRunner implements ApplicationRunner {

    private static final Logger LOG = LogManager.getLogger(CliRunner.class);
    private static final long SHUTDOWN_DRAIN_SECONDS = 30;

    private final BatchProcessor processor;
    private final UserSettingsStore settingsStore;
    private final ProcessingProperties properties;

    public CliRunner(BatchProcessor processor, UserSettingsStore settingsStore, ProcessingProperties properties) {
        this.processor = processor;
        this.settingsStore = settingsStore;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        CliOptions options;
        try {
            options = CliOptions.parse(args.getSourceArgs());
        } catch (IllegalArgumentException e) {
            LOG.error(e.getMessage());
            return;
        }

        UserSettings stored = settingsStore.load();
        if (!options.runnable()) {
            LOG.info(CliOptions.usage());
            LOG.info("Stored settings: input={}, output={}, maxSide={}, quality={}, processRaw={}, highQualityRaw={}",
                    stored.inputDir(), stored.outputDir(), stored.maxSide(), stored.jpgQuality(),
                    stored.processRaw(), stored.highQualityRaw());
            return;
        }

        ProcessingConfig config;
        try {
            config = options.toConfig(stored, properties.getThreads());
        } catch (IllegalArgumentException e) {
            LOG.error("Invalid run settings: {}", e.getMessage());
            return;
        }
        settingsStore.save(UserSettings.from(config));

        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            processor.cancel();
            try {
                finished.await(SHUTDOWN_DRAIN_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "photobatch-cancel");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            RunSummary summary = processor.process(config);
            LOG.info("Run {} {}: processed={}, failed={}, total={}", summary.runId(),
                    summary.cancelled() ? "cancelled" : "completed",
                    summary.processed(), summary.failed(), summary.totalFiles());
        } catch (PhotoBatchException | IllegalStateException e) {
            LOG.error("Run aborted: {}", e.getMessage());
        } finally {
            finished.countDown();
            removeHook(hook);
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            LOG.debug("JVM shutdown in progress; cancel hook stays registered");
        }
    }
}
