package com.phillippitts.photobatch.service.scan;

import com.phillippitts.photobatch.domain.FileKind;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Recognised input extensions. Matching is case-insensitive; anything else is ignored by the scanner.
 */
public final class MediaExtensions {

    public static final Set<String> STANDARD = Set.of("jpg", "jpeg", "png", "heic", "bmp", "gif", "tiff");

    public static final Set<String> RAW = Set.of("cr2", "cr3", "nef", "arw", "dng", "raw", "raf", "rw2", "srw", "3fr");

    private MediaExtensions() {
    }

    /**
     * @return the kind for a recognised extension, empty otherwise
     */
    public static Optional<FileKind> classify(Path file) {
        String ext = extension(file);
        if (STANDARD.contains(ext)) {
            return Optional.of(FileKind.STANDARD);
        }
        if (RAW.contains(ext)) {
            return Optional.of(FileKind.RAW);
        }
        return Optional.empty();
    }

    /**
     * Lower-cased text after the last dot of the file name, or an empty string.
     */
    static String extension(Path file) {
        String name = String.valueOf(file.getFileName());
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * File name without its final extension.
     */
    static String baseName(Path file) {
        String name = String.valueOf(file.getFileName());
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? name : name.substring(0, dot);
    }
}
