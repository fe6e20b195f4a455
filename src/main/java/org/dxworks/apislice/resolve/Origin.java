package org.dxworks.apislice.resolve;

import org.dxworks.apislice.model.ImportInfo;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Where an import specifier points to.
 */
public final class Origin {

    public enum Kind {
        /** A source file inside the scanned tree. */
        LOCAL_FILE,
        /** A directory under a {@code node_modules} folder. */
        PACKAGE,
        /** A built-in or externally installed module that is not introspected. */
        EXTERNAL,
        /** A relative specifier whose target does not exist. */
        NOT_FOUND
    }

    private static final Origin EXTERNAL = new Origin(Kind.EXTERNAL, null);
    private static final Origin NOT_FOUND = new Origin(Kind.NOT_FOUND, null);

    private final Kind kind;
    private final Path path;

    private Origin(Kind kind, Path path) {
        this.kind = kind;
        this.path = path;
    }

    public static Origin localFile(Path path) {
        return new Origin(Kind.LOCAL_FILE, path.toAbsolutePath().normalize());
    }

    public static Origin packageDirectory(Path path) {
        return new Origin(Kind.PACKAGE, path.toAbsolutePath().normalize());
    }

    public static Origin external() {
        return EXTERNAL;
    }

    public static Origin notFound() {
        return NOT_FOUND;
    }

    public Kind getKind() {
        return kind;
    }

    public Path getPath() {
        return path;
    }

    public boolean hasPath() {
        return path != null;
    }

    /**
     * Inventory representation: the absolute path, the external sentinel, or {@code null}.
     */
    public String render() {
        return switch (kind) {
            case LOCAL_FILE, PACKAGE -> path.toString();
            case EXTERNAL -> ImportInfo.EXTERNAL_ORIGIN;
            case NOT_FOUND -> null;
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Origin)) return false;
        Origin other = (Origin) o;
        return kind == other.kind && Objects.equals(path, other.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, path);
    }

    @Override
    public String toString() {
        return path != null ? kind + "(" + path + ")" : kind.toString();
    }
}
