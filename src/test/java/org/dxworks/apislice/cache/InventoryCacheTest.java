package org.dxworks.apislice.cache;

import org.dxworks.apislice.model.FileInventory;
import org.dxworks.apislice.model.SymbolSpan;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InventoryCacheTest {

    @TempDir
    Path root;

    @Test
    void fileNameReplacesSeparatorsAndExtension() {
        assertEquals("src_s_routes_s_users.json", InventoryCache.fileNameFor("src/routes/users.ts"));
        assertEquals("src_s_routes_s_users.json", InventoryCache.fileNameFor("src\\routes\\users.ts"));
        assertEquals("app.json", InventoryCache.fileNameFor("app.js"));
        assertEquals("src/routes/users", InventoryCache.decodeFileName("src_s_routes_s_users.json"));
    }

    @Test
    void namesContainingTheSentinelStayDistinct() {
        String withSentinel = InventoryCache.fileNameFor("a/my_s_x.js");
        String nested = InventoryCache.fileNameFor("a/my/x.js");

        assertNotEquals(nested, withSentinel);
        assertEquals("a_s_my_u_s_u_x.json", withSentinel);
        assertEquals("a/my_s_x", InventoryCache.decodeFileName(withSentinel));
        assertEquals("a/my/x", InventoryCache.decodeFileName(nested));
        assertEquals("lib/snake_case/user_routes", InventoryCache.decodeFileName(
                InventoryCache.fileNameFor("lib/snake_case/user_routes.ts")));
        assertEquals(".env", InventoryCache.decodeFileName(InventoryCache.fileNameFor(".env")));
    }

    @Test
    void sentinelLookalikeFilesAreCachedSeparately() throws Exception {
        InventoryCache cache = new InventoryCache(root);
        cache.write(inventory(root.resolve("a").resolve("my_s_x.js")));
        cache.write(inventory(root.resolve("a").resolve("my").resolve("x.js")));

        InventorySnapshot snapshot = cache.snapshot();

        assertEquals(2, snapshot.size());
        assertTrue(snapshot.find(root.resolve("a").resolve("my_s_x.js")).isPresent());
        assertTrue(snapshot.find(root.resolve("a").resolve("my").resolve("x.js")).isPresent());
    }

    @Test
    void writtenInventoryIsFoundThroughSnapshot() throws Exception {
        InventoryCache cache = new InventoryCache(root);
        Path source = root.resolve("src").resolve("app.js");
        cache.write(inventory(source));

        assertTrue(Files.exists(root.resolve(InventoryCache.CACHE_DIR_NAME).resolve("src_s_app.json")));
        InventorySnapshot snapshot = cache.snapshot();
        Optional<FileInventory> found = snapshot.find(source);

        assertTrue(found.isPresent());
        assertEquals("main", found.get().functions.get(0).name);
        assertEquals(1, snapshot.size());
    }

    @Test
    void snapshotDoesNotSeeLaterWrites() throws Exception {
        InventoryCache cache = new InventoryCache(root);
        InventorySnapshot before = cache.snapshot();
        Path source = root.resolve("late.js");

        cache.write(inventory(source));

        assertFalse(before.find(source).isPresent());
        assertTrue(cache.snapshot().find(source).isPresent());
    }

    @Test
    void sameNameWithDifferentExtensionIsNotConfused() throws Exception {
        InventoryCache cache = new InventoryCache(root);
        cache.write(inventory(root.resolve("index.ts")));

        InventorySnapshot snapshot = cache.snapshot();

        assertTrue(snapshot.find(root.resolve("index.ts")).isPresent());
        assertFalse(snapshot.find(root.resolve("index.js")).isPresent());
    }

    @Test
    void deleteRemovesTheCacheDirectory() throws Exception {
        InventoryCache cache = new InventoryCache(root);
        cache.write(inventory(root.resolve("a.js")));

        cache.delete();

        assertFalse(Files.exists(cache.getDirectory()));
        cache.delete();
    }

    private static FileInventory inventory(Path source) {
        FileInventory inventory = new FileInventory();
        inventory.filePath = source.toAbsolutePath().normalize().toString();
        inventory.dialect = "javascript";
        inventory.functions.add(new SymbolSpan("main", 1, 3));
        return inventory;
    }
}
