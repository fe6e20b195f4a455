package org.dxworks.apislice.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.apislice.model.FileInventory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Transient on-disk store of file inventories: one JSON document per source file under
 * {@value #CACHE_DIR_NAME} in the scanned root. Written once before any endpoint is
 * sliced and deleted at the end of the run.
 */
public class InventoryCache {

    public static final String CACHE_DIR_NAME = ".apislice_file_information";
    static final String SEPARATOR_SENTINEL = "_s_";
    static final String UNDERSCORE_ESCAPE = "_u_";
    private static final String CACHE_EXTENSION = ".json";

    static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path root;
    private final Path directory;

    public InventoryCache(Path root) {
        this.root = root.toAbsolutePath().normalize();
        this.directory = this.root.resolve(CACHE_DIR_NAME);
    }

    public Path getDirectory() {
        return directory;
    }

    public Path write(FileInventory inventory) throws IOException {
        Files.createDirectories(directory);
        Path target = pathFor(Path.of(inventory.filePath));
        MAPPER.writeValue(target.toFile(), inventory);
        return target;
    }

    public Path pathFor(Path sourceFile) {
        return directory.resolve(fileNameFor(keyOf(sourceFile)));
    }

    /**
     * Read-only view of everything written so far. Later writes are not visible through it.
     */
    public InventorySnapshot snapshot() throws IOException {
        Set<String> names = new HashSet<>();
        if (Files.isDirectory(directory)) {
            try (Stream<Path> stream = Files.list(directory)) {
                names = stream.map(p -> p.getFileName().toString())
                        .filter(n -> n.endsWith(CACHE_EXTENSION))
                        .collect(Collectors.toSet());
            }
        }
        return new InventorySnapshot(this, names);
    }

    public void delete() throws IOException {
        if (!Files.exists(directory)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> stream = Files.walk(directory)) {
            paths = stream.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        }
        for (Path path : paths) {
            Files.deleteIfExists(path);
        }
    }

    /**
     * Files inside the scanned root are keyed by their relative path, anything else by its absolute path.
     */
    String keyOf(Path sourceFile) {
        Path absolute = sourceFile.toAbsolutePath().normalize();
        return absolute.startsWith(root) ? root.relativize(absolute).toString() : absolute.toString();
    }

    /**
     * {@code src/routes/users.ts} becomes {@code src_s_routes_s_users.json}. Underscores in
     * the path are written as {@value #UNDERSCORE_ESCAPE}, so every underscore in the result
     * starts a three-character token and the name decodes unambiguously.
     */
    public static String fileNameFor(String filePath) {
        int lastSeparator = Math.max(filePath.lastIndexOf('/'), filePath.lastIndexOf('\\'));
        int dot = filePath.lastIndexOf('.');
        String withoutExtension = dot > lastSeparator + 1 ? filePath.substring(0, dot) : filePath;

        StringBuilder name = new StringBuilder();
        for (char c : withoutExtension.toCharArray()) {
            if (c == '/' || c == '\\') {
                name.append(SEPARATOR_SENTINEL);
            } else if (c == '_') {
                name.append(UNDERSCORE_ESCAPE);
            } else {
                name.append(c);
            }
        }
        return name.append(CACHE_EXTENSION).toString();
    }

    /**
     * Inverse of {@link #fileNameFor(String)} up to the dropped source extension; separators
     * come back as {@code /}.
     */
    public static String decodeFileName(String cacheFileName) {
        String name = cacheFileName.endsWith(CACHE_EXTENSION)
                ? cacheFileName.substring(0, cacheFileName.length() - CACHE_EXTENSION.length())
                : cacheFileName;
        StringBuilder decoded = new StringBuilder();
        int i = 0;
        while (i < name.length()) {
            if (name.startsWith(SEPARATOR_SENTINEL, i)) {
                decoded.append('/');
                i += SEPARATOR_SENTINEL.length();
            } else if (name.startsWith(UNDERSCORE_ESCAPE, i)) {
                decoded.append('_');
                i += UNDERSCORE_ESCAPE.length();
            } else {
                decoded.append(name.charAt(i++));
            }
        }
        return decoded.toString();
    }
}
