package com.phillippitts.photobatch.domain;

import java.nio.file.Path;
import java.util.List;

/**
 * Output of a directory scan: selected inputs in scan order plus the skip counts.
 *
 * @param images        selected standard images
 * @param raws          selected RAW files
 * @param duplicateRaws RAW files skipped because a same-named standard image exists
 * @param systemFiles   entries skipped by the {@code ._} / {@code _} prefix filter
 */
public record ScanResult(List<Path> images, List<Path> raws, int duplicateRaws, int systemFiles) {

    public ScanResult {
        images = List.copyOf(images);
        raws = List.copyOf(raws);
    }

    public static ScanResult empty() {
        return new ScanResult(List.of(), List.of(), 0, 0);
    }

    public int selectedCount() {
        return images.size() + raws.size();
    }

    public ScanResult withImages(List<Path> remaining) {
        return new ScanResult(remaining, raws, duplicateRaws, systemFiles);
    }
}
