package org.dxworks.apislice.resolve;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;

/**
 * Resolves import specifiers to files the way Node.js does for relative paths and
 * {@code node_modules} packages. Never throws: unresolved specifiers become sentinels.
 */
public class ModuleOriginResolver {

    private static final String PACKAGE_DIRECTORY = "node_modules";

    // Probe order matters: the first existing candidate wins.
    private static final List<String> FILE_SUFFIXES = List.of(
            ".ts", ".tsx", ".cts", ".mts", ".js", ".mjs", ".cjs", ".d.ts");
    private static final List<String> INDEX_SUFFIXES = List.of(
            "/index.ts", "/index.tsx", "/index.cts", "/index.mts", "/index.js", "/index.mjs", "/index.cjs");

    private final Path projectRoot;

    /**
     * @param projectRoot upper bound when looking for {@code node_modules} in ancestor directories
     */
    public ModuleOriginResolver(Path projectRoot) {
        this.projectRoot = projectRoot.toAbsolutePath().normalize();
    }

    public Origin resolve(String specifier, Path importingDirectory) {
        if (specifier == null || specifier.isEmpty()) {
            return Origin.notFound();
        }
        Path directory = importingDirectory.toAbsolutePath().normalize();
        try {
            if (specifier.startsWith(".")) {
                return resolveRelative(specifier, directory);
            }
            return resolvePackage(specifier, directory);
        } catch (InvalidPathException e) {
            return specifier.startsWith(".") ? Origin.notFound() : Origin.external();
        }
    }

    private Origin resolveRelative(String specifier, Path directory) {
        Path joined = directory.resolve(specifier).normalize();
        if (Files.isRegularFile(joined)) {
            return Origin.localFile(joined);
        }
        String base = joined.toString();
        for (String suffix : FILE_SUFFIXES) {
            Path candidate = Path.of(base + suffix);
            if (Files.exists(candidate)) {
                return Origin.localFile(candidate);
            }
        }
        for (String suffix : INDEX_SUFFIXES) {
            Path candidate = Path.of(base + suffix).normalize();
            if (Files.exists(candidate)) {
                return Origin.localFile(candidate);
            }
        }
        return Origin.notFound();
    }

    private Origin resolvePackage(String specifier, Path directory) {
        Path current = directory;
        while (current != null) {
            Path candidate = current.resolve(PACKAGE_DIRECTORY).resolve(specifier).normalize();
            if (Files.exists(candidate)) {
                return Origin.packageDirectory(candidate);
            }
            if (!current.startsWith(projectRoot) || current.equals(projectRoot)) {
                break;
            }
            current = current.getParent();
        }
        return Origin.external();
    }
}
