package org.dxworks.apislice.pipeline;

import org.dxworks.apislice.cache.InventoryCache;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.FileVisitor;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.dxworks.apislice.TestUtils.writeLines;
import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeFalse;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class SourceWalkerTest {

    @TempDir
    Path root;

    private final ByteArrayOutputStream errors = new ByteArrayOutputStream();
    private final PrintStream errStream = new PrintStream(errors, true, StandardCharsets.UTF_8);

    @Test
    void keepsScriptSourcesOutsideIgnoredDirectories() throws Exception {
        writeLines(root.resolve("src/app.ts"), "export {};");
        writeLines(root.resolve("src/view.tsx"), "export {};");
        writeLines(root.resolve("src/legacy.cjs"), "module.exports = {};");
        writeLines(root.resolve("src/readme.md"), "# docs");
        writeLines(root.resolve("node_modules/express/index.js"), "module.exports = {};");
        writeLines(root.resolve("src/dist/bundle.js"), "x();");
        writeLines(root.resolve("src/distribution/keep.js"), "x();");
        writeLines(root.resolve(InventoryCache.CACHE_DIR_NAME).resolve("stale.js"), "x();");

        List<Path> files = new SourceWalker(List.of("node_modules", "dist"), 100, errStream).walk(root);

        assertEquals(List.of("src/app.ts", "src/distribution/keep.js", "src/legacy.cjs", "src/view.tsx"),
                relative(files));
    }

    @Test
    void skipsFilesLongerThanTheLimit() throws Exception {
        writeLines(root.resolve("short.js"), "a();", "b();");
        writeLines(root.resolve("long.js"), "a();", "b();", "c();");

        List<Path> files = new SourceWalker(List.of(), 2, errStream).walk(root);

        assertEquals(List.of("short.js"), relative(files));
    }

    @Test
    void unreadableEntryIsReportedAndTheWalkContinues() throws Exception {
        Path locked = root.resolve("locked");
        FileVisitor<Path> collector = new SourceWalker(List.of(), 100, errStream)
                .collectorFor(root, new ArrayList<>());

        FileVisitResult result = collector.visitFileFailed(locked, new AccessDeniedException(locked.toString()));

        assertEquals(FileVisitResult.CONTINUE, result);
        assertTrue(errors.toString(StandardCharsets.UTF_8).contains("AccessDeniedException"));
    }

    @Test
    void unreadableDirectoryDoesNotAbortTheWalk() throws Exception {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        writeLines(root.resolve("open/app.js"), "app.get('/a', h);");
        Path locked = root.resolve("locked");
        writeLines(locked.resolve("secret.js"), "app.get('/b', h);");
        Set<PosixFilePermission> original = Files.getPosixFilePermissions(locked);
        Files.setPosixFilePermissions(locked, Set.of());
        try {
            // root can read anything, so the failure only happens for other users
            assumeFalse(Files.isReadable(locked));

            List<Path> files = new SourceWalker(List.of(), 100, errStream).walk(root);

            assertEquals(List.of("open/app.js"), relative(files));
            assertTrue(errors.toString(StandardCharsets.UTF_8).contains("locked"));
        } finally {
            Files.setPosixFilePermissions(locked, original);
        }
    }

    private List<String> relative(List<Path> files) {
        Path base = root.toAbsolutePath().normalize();
        return files.stream()
                .map(f -> base.relativize(f).toString().replace('\\', '/'))
                .sorted()
                .collect(Collectors.toList());
    }
}
