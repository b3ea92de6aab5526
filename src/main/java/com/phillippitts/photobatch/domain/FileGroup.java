package com.phillippitts.photobatch.domain;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Same-basename candidates competing for one output slot.
 *
 * <p>Selection rule: a standard image always wins and a same-named RAW is then a skipped
 * duplicate (counted only while RAW processing is enabled); a lone RAW is selected only while
 * RAW processing is enabled. A group never selects both files.
 *
 * @param key      parent directory plus lower-cased basename without extension
 * @param standard standard image path, or null
 * @param raw      RAW path, or null
 */
public record FileGroup(String key, Path standard, Path raw) {

    public FileGroup {
        Objects.requireNonNull(key, "key must not be null");
    }

    public static FileGroup empty(String key) {
        return new FileGroup(key, null, null);
    }

    public FileGroup withFile(Path path, FileKind kind) {
        return kind == FileKind.STANDARD
                ? new FileGroup(key, path, raw)
                : new FileGroup(key, standard, path);
    }

    /**
     * @param processRaw whether RAW processing is enabled for the run
     * @return the selected input, if any
     */
    public Optional<Selection> select(boolean processRaw) {
        if (standard != null) {
            return Optional.of(new Selection(standard, FileKind.STANDARD));
        }
        if (raw != null && processRaw) {
            return Optional.of(new Selection(raw, FileKind.RAW));
        }
        return Optional.empty();
    }

    public boolean hasDuplicateRaw(boolean processRaw) {
        return processRaw && standard != null && raw != null;
    }

    /**
     * The input chosen from a group.
     */
    public record Selection(Path path, FileKind kind) {}
}
