package com.phillippitts.photobatch.service.progress;

import com.phillippitts.photobatch.config.properties.ProcessingProperties;
import com.phillippitts.photobatch.domain.ErrorRecord;
import com.phillippitts.photobatch.domain.RunState;
import com.phillippitts.photobatch.exception.OutputWriteException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Writes the run's error log as a plain-text report under the output root.
 *
 * <p>One line per entry, {@code [HH:MM:SS] error: <filename> - <message>}, joined with
 * {@code \n}, UTF-8. Nothing is written for a run without errors.
 */
@Component
public class ErrorReportWriter {

    private static final Logger LOG = LogManager.getLogger(ErrorReportWriter.class);

    private final String reportName;

    @Autowired
    public ErrorReportWriter(ProcessingProperties properties) {
        this(properties.getErrorReportName());
    }

    ErrorReportWriter(String reportName) {
        this.reportName = reportName;
    }

    /**
     * @return the report path, or empty when the run recorded no errors
     * @throws OutputWriteException if the report cannot be written
     */
    public Optional<Path> write(RunState state, Path outputRoot) {
        List<ErrorRecord> errors = state.errorLog();
        if (errors.isEmpty()) {
            return Optional.empty();
        }
        Path report = outputRoot.resolve(reportName);
        String body = errors.stream().map(ErrorRecord::format).collect(Collectors.joining("\n"));
        try {
            Files.createDirectories(outputRoot);
            Files.writeString(report, body, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new OutputWriteException(report.toString(), e);
        }
        LOG.debug("Wrote {} error entries to {}", errors.size(), report);
        return Optional.of(report);
    }
}
