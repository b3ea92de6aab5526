package com.phillippitts.photobatch.service.codec.raw;

import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} so the decoder can be tested without a dcraw binary.
 *
 * <p>Production code uses {@link DefaultProcessFactory}; tests return a fake {@link Process}
 * with canned stdout, stderr and exit behaviour.
 */
interface ProcessFactory {
    /**
     * Starts a new process.
     *
     * @param command full command line, executable first
     * @param workingDir working directory (may be null)
     * @return started process
     * @throws java.io.IOException if the process cannot be started
     */
    Process start(List<String> command, Path workingDir) throws java.io.IOException;
}
