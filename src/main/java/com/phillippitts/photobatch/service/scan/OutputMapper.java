package com.phillippitts.photobatch.service.scan;

import com.phillippitts.photobatch.domain.ProcessingConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Maps an input file to its mirrored {@code .jpg} under the output root.
 *
 * <p>{@code <input>/a/b/IMG_1.png} maps to {@code <output>/a/b/IMG_1.jpg}. An existing mapped
 * output marks the input as already processed.
 */
public final class OutputMapper {

    private static final String OUTPUT_EXTENSION = ".jpg";

    private final Path inputRoot;
    private final Path outputRoot;

    public OutputMapper(Path inputRoot, Path outputRoot) {
        this.inputRoot = Objects.requireNonNull(inputRoot, "inputRoot").toAbsolutePath().normalize();
        this.outputRoot = Objects.requireNonNull(outputRoot, "outputRoot").toAbsolutePath().normalize();
    }

    public static OutputMapper of(ProcessingConfig config) {
        return new OutputMapper(config.inputRoot(), config.outputRoot());
    }

    /**
     * @param input file under the input root
     * @return mirrored output path with the final extension replaced by {@code .jpg}
     * @throws IllegalArgumentException if {@code input} is not under the input root
     */
    public Path map(Path input) {
        Path absolute = input.toAbsolutePath().normalize();
        if (!absolute.startsWith(inputRoot) || absolute.equals(inputRoot)) {
            throw new IllegalArgumentException("Not under input root " + inputRoot + ": " + input);
        }
        Path relative = inputRoot.relativize(absolute);
        Path parent = relative.getParent();
        String name = MediaExtensions.baseName(relative) + OUTPUT_EXTENSION;
        return parent == null ? outputRoot.resolve(name) : outputRoot.resolve(parent).resolve(name);
    }

    public boolean isProcessed(Path input) {
        return Files.exists(map(input));
    }

    public Path outputRoot() {
        return outputRoot;
    }
}
