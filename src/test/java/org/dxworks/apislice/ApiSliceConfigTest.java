package org.dxworks.apislice;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ApiSliceConfigTest {

    @TempDir
    Path dir;

    @Test
    void missingFileGivesDefaults() {
        ApiSliceConfig config = ApiSliceConfig.load(dir.resolve("absent.yml"));

        assertEquals(5, config.getMaxWorkers());
        assertEquals(20000, config.getMaxFileLines());
        assertTrue(config.getIgnoredDirs().contains("node_modules"));
        assertEquals("https://api.example.com", config.getHost());
        assertNull(config.getTitle());
        assertEquals("1.0.0", config.getVersion());
    }

    @Test
    void yamlValuesOverrideDefaultsAndWorkersAreCapped() throws Exception {
        Path file = Files.writeString(dir.resolve("apislice-config.yml"), String.join("\n",
                "ignoredDirs:",
                "  - generated",
                "maxWorkers: 12",
                "maxFileLines: 500",
                "host: https://internal.test",
                "title: Orders API",
                ""));

        ApiSliceConfig config = ApiSliceConfig.load(file);

        assertEquals(List.of("generated"), config.getIgnoredDirs());
        assertEquals(5, config.getMaxWorkers());
        assertEquals(500, config.getMaxFileLines());
        assertEquals("https://internal.test", config.getHost());
        assertEquals("Orders API", config.getTitle());
        assertEquals("1.0.0", config.getVersion());
    }

    @Test
    void unreadableYamlFallsBackToDefaults() throws Exception {
        Path file = Files.writeString(dir.resolve("broken.yml"), "maxWorkers: [oops\n");

        ApiSliceConfig config = ApiSliceConfig.load(file);

        assertEquals(5, config.getMaxWorkers());
    }

    @Test
    void workersNeverDropBelowOne() {
        assertEquals(1, ApiSliceConfig.with(null, 0, 0, null, null, null).getMaxWorkers());
    }
}
