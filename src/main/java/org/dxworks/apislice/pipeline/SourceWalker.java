package org.dxworks.apislice.pipeline;

import org.dxworks.apislice.DialectSelector;
import org.dxworks.apislice.cache.InventoryCache;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.FileVisitor;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Lists the script sources under a root. A file is skipped when any directory segment of
 * its path relative to the root equals an ignored name, or when it is longer than the line limit.
 * Entries that cannot be read are reported on {@code err} and skipped.
 */
public class SourceWalker {

    private final Set<String> ignoredSegments;
    private final int maxFileLines;
    private final PrintStream err;

    public SourceWalker(List<String> ignoredDirs, int maxFileLines, PrintStream err) {
        this.ignoredSegments = new HashSet<>(ignoredDirs);
        this.ignoredSegments.add(InventoryCache.CACHE_DIR_NAME);
        this.maxFileLines = maxFileLines;
        this.err = err;
    }

    public List<Path> walk(Path input) throws IOException {
        Path root = input.toAbsolutePath().normalize();
        if (Files.isRegularFile(root)) {
            return accepts(root.getParent(), root) ? List.of(root) : List.of();
        }
        List<Path> files = new ArrayList<>();
        Files.walkFileTree(root, collectorFor(root, files));
        Collections.sort(files);
        return files;
    }

    FileVisitor<Path> collectorFor(Path root, List<Path> files) {
        return new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && ignoredSegments.contains(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (Files.isRegularFile(file) && accepts(root, file)) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                err.println("  Skipping unreadable " + file + ": " + e);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException e) {
                if (e != null) {
                    err.println("  Stopped listing " + dir + ": " + e);
                }
                return FileVisitResult.CONTINUE;
            }
        };
    }

    boolean accepts(Path root, Path file) {
        return DialectSelector.isSupported(file)
                && !isIgnored(root, file)
                && withinMaxLines(file);
    }

    boolean isIgnored(Path root, Path file) {
        Path relative = root != null && file.startsWith(root) ? root.relativize(file) : file;
        for (int i = 0; i < relative.getNameCount() - 1; i++) {
            if (ignoredSegments.contains(relative.getName(i).toString())) {
                return true;
            }
        }
        return false;
    }

    private boolean withinMaxLines(Path path) {
        try (Stream<String> lines = Files.lines(path)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (IOException | UncheckedIOException e) {
            return true;
        }
    }
}
