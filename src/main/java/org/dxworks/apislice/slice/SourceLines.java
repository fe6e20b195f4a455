package org.dxworks.apislice.slice;

import org.dxworks.apislice.analyzer.TreeSitterHelper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Line-level access to source files, memoized for the lifetime of one slicing request.
 */
class SourceLines {

    private final Map<Path, Optional<List<String>>> files = new HashMap<>();

    Optional<List<String>> lines(Path file) {
        return files.computeIfAbsent(file.toAbsolutePath().normalize(), SourceLines::read);
    }

    /** Lines {@code startLine..endLine} (1-based, inclusive), clamped to the file. */
    Optional<List<String>> slice(Path file, int startLine, int endLine) {
        return lines(file).map(all -> slice(all, startLine, endLine));
    }

    static List<String> slice(List<String> all, int startLine, int endLine) {
        int from = Math.max(0, startLine - 1);
        int to = Math.min(all.size(), endLine);
        if (from >= to) {
            return new ArrayList<>();
        }
        return new ArrayList<>(all.subList(from, to));
    }

    /**
     * Lines from {@code startIndex} (0-based) until the braces opened on or after it are balanced.
     */
    static List<String> braceBlock(List<String> all, int startIndex) {
        List<String> collected = new ArrayList<>();
        int depth = 0;
        boolean started = false;
        for (int i = startIndex; i < all.size(); i++) {
            String line = all.get(i);
            collected.add(line);
            for (int c = 0; c < line.length(); c++) {
                char ch = line.charAt(c);
                if (ch == '{') {
                    depth++;
                    started = true;
                } else if (ch == '}') {
                    depth--;
                }
            }
            if (started && depth <= 0) {
                break;
            }
        }
        return collected;
    }

    private static Optional<List<String>> read(Path file) {
        try {
            return Optional.of(TreeSitterHelper.readSource(file).lines().collect(Collectors.toList()));
        } catch (IOException e) {
            return Optional.empty();
        }
    }
}
