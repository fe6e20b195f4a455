package org.dxworks.apislice.swagger;

import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.lib.StoredConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.dxworks.apislice.TestUtils.writeLines;
import static org.junit.jupiter.api.Assertions.*;

class RepositoryMetadataTest {

    @TempDir
    Path dir;

    @Test
    void readsHeadAndOriginFromEnclosingRepository() throws Exception {
        Path work = Files.createDirectories(dir.resolve("shop"));
        try (Git git = Git.init().setDirectory(work.toFile()).call()) {
            StoredConfig config = git.getRepository().getConfig();
            config.setString("remote", "origin", "url", "https://example.com/shop.git");
            config.save();
            writeLines(work.resolve("app.js"), "app.listen(3000);");
            git.add().addFilepattern("app.js").call();
            git.commit().setMessage("initial").setAuthor("dev", "dev@example.com")
                    .setCommitter("dev", "dev@example.com").setSign(false).call();
        }
        Path nested = Files.createDirectories(work.resolve("src"));

        RepositoryMetadata metadata = RepositoryMetadata.read(nested);

        assertEquals("shop", metadata.getName());
        assertEquals("https://example.com/shop.git", metadata.getRemoteUrl());
        assertNotNull(metadata.getCommitHash());
        assertEquals(40, metadata.getCommitHash().length());
    }

    @Test
    void unversionedDirectoryHasNoMetadata() {
        RepositoryMetadata none = RepositoryMetadata.none();

        assertNull(none.getName());
        assertNull(none.getCommitHash());
        assertNull(none.getRemoteUrl());
    }
}
