package com.phillippitts.photobatch.service.pipeline;

import com.phillippitts.photobatch.exception.OutputWriteException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes encoded output next to its final name first, then moves it into place, so a reader
 * never sees a half-written JPEG and an interrupted run leaves no file the skip check would trust.
 */
public final class OutputWriter {

    private static final Logger LOG = LogManager.getLogger(OutputWriter.class);

    private static final String PART_SUFFIX = ".part";

    private OutputWriter() {
    }

    /**
     * @param data   encoded file contents
     * @param target final output path; parent directories are created as needed
     * @throws OutputWriteException if the directory, the temporary file or the move fails
     */
    public static void write(byte[] data, Path target) {
        Path part = target.resolveSibling(target.getFileName() + PART_SUFFIX);
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(part, data);
            try {
                Files.move(part, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(part, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(part);
            throw new OutputWriteException(target.toString(), e);
        }
    }

    private static void deleteQuietly(Path part) {
        try {
            Files.deleteIfExists(part);
        } catch (IOException e) {
            LOG.debug("Could not remove {}: {}", part, e.getMessage());
        }
    }
}
