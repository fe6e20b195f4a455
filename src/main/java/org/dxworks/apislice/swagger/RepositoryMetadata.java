package org.dxworks.apislice.swagger;

import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Source-control facts stamped into the generated document. Every value is {@code null}
 * when the scanned directory is not inside a git work tree.
 */
public final class RepositoryMetadata {

    private final String name;
    private final String commitHash;
    private final String remoteUrl;

    public RepositoryMetadata(String name, String commitHash, String remoteUrl) {
        this.name = name;
        this.commitHash = commitHash;
        this.remoteUrl = remoteUrl;
    }

    public static RepositoryMetadata none() {
        return new RepositoryMetadata(null, null, null);
    }

    /**
     * Reads HEAD and the {@code origin} remote of the repository enclosing {@code root}.
     */
    public static RepositoryMetadata read(Path root) throws IOException {
        FileRepositoryBuilder builder = new FileRepositoryBuilder()
                .findGitDir(root.toAbsolutePath().toFile());
        if (builder.getGitDir() == null) {
            return none();
        }
        try (Repository repository = builder.build()) {
            ObjectId head = repository.resolve("HEAD");
            String remote = repository.getConfig().getString("remote", "origin", "url");
            String name = repository.isBare()
                    ? repository.getDirectory().getName()
                    : repository.getWorkTree().getName();
            return new RepositoryMetadata(name, head != null ? head.getName() : null, remote);
        }
    }

    public String getName() {
        return name;
    }

    public String getCommitHash() {
        return commitHash;
    }

    public String getRemoteUrl() {
        return remoteUrl;
    }
}
