package org.dxworks.apislice.analyzer;

import org.dxworks.apislice.Dialect;
import org.treesitter.TSQuery;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Map;

/**
 * Structural query source per dialect, loaded from {@code queries/*.scm} on the class path.
 */
public class SymbolQueries {

    private final Map<Dialect, String> queryText;

    private SymbolQueries(Map<Dialect, String> queryText) {
        this.queryText = queryText;
    }

    public static SymbolQueries fromClasspath() {
        Map<Dialect, String> texts = new EnumMap<>(Dialect.class);
        for (Dialect dialect : Dialect.values()) {
            texts.put(dialect, loadResource("queries/" + dialect.getName() + ".scm"));
        }
        return new SymbolQueries(texts);
    }

    /**
     * Replaces the query of one dialect, keeping the class-path queries for the others.
     */
    public SymbolQueries withQuery(Dialect dialect, String text) {
        Map<Dialect, String> texts = new EnumMap<>(queryText);
        texts.put(dialect, text);
        return new SymbolQueries(texts);
    }

    public TSQuery compile(Dialect dialect) throws ParseException {
        String text = queryText.get(dialect);
        if (text == null) {
            throw new ParseException("No structural query for " + dialect.getName());
        }
        try {
            return new TSQuery(TreeSitterGrammars.language(dialect), text);
        } catch (RuntimeException e) {
            throw new ParseException("Structural query does not match the " + dialect.getName()
                    + " grammar: " + e.getMessage(), e);
        }
    }

    private static String loadResource(String path) {
        try (InputStream in = SymbolQueries.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) throw new IOException("Resource not found: " + path);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
