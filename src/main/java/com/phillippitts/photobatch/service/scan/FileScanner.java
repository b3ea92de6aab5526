package com.phillippitts.photobatch.service.scan;

import com.phillippitts.photobatch.domain.FileGroup;
import com.phillippitts.photobatch.domain.FileKind;
import com.phillippitts.photobatch.domain.RunState;
import com.phillippitts.photobatch.domain.ScanResult;
import com.phillippitts.photobatch.exception.PhotoBatchException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Walks the input tree and picks one input per same-named group.
 *
 * <p>Files named {@code ._*} or {@code _*} are counted as system files and otherwise ignored.
 * Recognised files are grouped by parent directory and lower-cased basename, then selected per
 * {@link FileGroup#select(boolean)}. System-file and duplicate-RAW counts are added to the
 * run state as they are found. Symlinks to files are followed; symlinked directories are not
 * descended into.
 */
@Component
public class FileScanner {

    private static final Logger LOG = LogManager.getLogger(FileScanner.class);

    /**
     * @param inputRoot  directory to walk
     * @param processRaw whether RAW files may be selected
     * @param state      run state receiving skip counts; checked for cancellation
     * @return selected standard images and RAW files, each sorted by path; empty when cancelled
     * @throws PhotoBatchException if the input root cannot be walked
     */
    public ScanResult scan(Path inputRoot, boolean processRaw, RunState state) {
        if (!state.isRunning()) {
            return ScanResult.empty();
        }
        if (!Files.isDirectory(inputRoot)) {
            throw new PhotoBatchException("Input directory does not exist: " + inputRoot);
        }

        Map<String, FileGroup> groups = new LinkedHashMap<>();
        int[] systemFiles = {0};
        try {
            Files.walkFileTree(inputRoot, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    return state.isRunning() ? FileVisitResult.CONTINUE : FileVisitResult.TERMINATE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    // attrs describe a symlink itself; a link to a regular file still counts
                    if (!attrs.isRegularFile() && !Files.isRegularFile(file)) {
                        return FileVisitResult.CONTINUE;
                    }
                    String name = String.valueOf(file.getFileName());
                    if (isSystemFile(name)) {
                        systemFiles[0]++;
                        return FileVisitResult.CONTINUE;
                    }
                    Optional<FileKind> kind = MediaExtensions.classify(file);
                    if (kind.isPresent()) {
                        String key = groupKey(file);
                        groups.put(key, groups.getOrDefault(key, FileGroup.empty(key)).withFile(file, kind.get()));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    LOG.warn("Skipping unreadable entry {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new PhotoBatchException("Failed to scan " + inputRoot + ": " + e.getMessage(), e);
        }

        if (!state.isRunning()) {
            return ScanResult.empty();
        }

        List<Path> images = new ArrayList<>();
        List<Path> raws = new ArrayList<>();
        int duplicates = 0;
        for (FileGroup group : groups.values()) {
            group.select(processRaw).ifPresent(selection -> {
                if (selection.kind() == FileKind.STANDARD) {
                    images.add(selection.path());
                } else {
                    raws.add(selection.path());
                }
            });
            if (group.hasDuplicateRaw(processRaw)) {
                duplicates++;
            }
        }
        Collections.sort(images);
        Collections.sort(raws);

        state.addSystemSkips(systemFiles[0]);
        state.addDuplicateSkips(duplicates);
        LOG.debug("Scanned {}: {} groups, {} images, {} raws, {} duplicates, {} system files",
                inputRoot, groups.size(), images.size(), raws.size(), duplicates, systemFiles[0]);
        return new ScanResult(images, raws, duplicates, systemFiles[0]);
    }

    static boolean isSystemFile(String name) {
        return name.startsWith("._") || name.startsWith("_");
    }

    private static String groupKey(Path file) {
        Path parent = file.getParent();
        String base = MediaExtensions.baseName(file).toLowerCase(Locale.ROOT);
        return (parent == null ? "" : parent.toString()) + "/" + base;
    }
}
