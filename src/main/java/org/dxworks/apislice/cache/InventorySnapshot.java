package org.dxworks.apislice.cache;

import org.dxworks.apislice.model.FileInventory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable view of the inventory cache handed to endpoint workers. Lookups only read
 * files that were completely written before the snapshot was taken, so workers share it
 * without synchronization.
 */
public final class InventorySnapshot {

    private final InventoryCache cache;
    private final Set<String> cachedFileNames;

    InventorySnapshot(InventoryCache cache, Set<String> cachedFileNames) {
        this.cache = cache;
        this.cachedFileNames = Set.copyOf(cachedFileNames);
    }

    public int size() {
        return cachedFileNames.size();
    }

    public boolean contains(Path sourceFile) {
        return cachedFileNames.contains(cache.pathFor(sourceFile).getFileName().toString());
    }

    /**
     * The cached inventory of {@code sourceFile}; empty when it was never cached, cannot be
     * read, or the cache entry belongs to another file with the same extension-less name.
     */
    public Optional<FileInventory> find(Path sourceFile) {
        if (!contains(sourceFile)) {
            return Optional.empty();
        }
        try {
            FileInventory inventory = InventoryCache.MAPPER.readValue(cache.pathFor(sourceFile).toFile(), FileInventory.class);
            String expected = sourceFile.toAbsolutePath().normalize().toString();
            if (inventory == null || !expected.equals(inventory.filePath)) {
                return Optional.empty();
            }
            return Optional.of(inventory);
        } catch (IOException e) {
            return Optional.empty();
        }
    }
}
