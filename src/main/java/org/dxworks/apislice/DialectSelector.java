package org.dxworks.apislice;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Maps a source file to the grammar dialect used to parse it.
 * Selection is by extension only; {@code .tsx} wins over the plain typed extensions
 * and every other supported file is parsed as plain script.
 */
public class DialectSelector {

    public static Dialect select(Path filePath) {
        String fileName = lowerCaseName(filePath);
        if (Dialect.TYPED_MARKUP.matchesFileName(fileName)) {
            return Dialect.TYPED_MARKUP;
        }
        if (Dialect.TYPED_SCRIPT.matchesFileName(fileName)) {
            return Dialect.TYPED_SCRIPT;
        }
        return Dialect.PLAIN_SCRIPT;
    }

    public static boolean isSupported(Path filePath) {
        String fileName = lowerCaseName(filePath);
        for (Dialect dialect : Dialect.values()) {
            if (dialect.matchesFileName(fileName)) {
                return true;
            }
        }
        return false;
    }

    private static String lowerCaseName(Path filePath) {
        Path fileName = filePath.getFileName();
        return fileName == null ? "" : fileName.toString().toLowerCase(Locale.ROOT);
    }
}
