package org.dxworks.apislice.analyzer;

import org.dxworks.apislice.Dialect;
import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TSTree;

import java.util.EnumMap;
import java.util.Map;

public final class TreeSitterGrammars {

    private static final Map<Dialect, TSLanguage> TREE_SITTER_LANGUAGES = new EnumMap<>(Dialect.class);

    static {
        try {
            TREE_SITTER_LANGUAGES.put(Dialect.PLAIN_SCRIPT, instantiate("org.treesitter.TreeSitterJavascript"));
            TSLanguage typescript = instantiate("org.treesitter.TreeSitterTypescript");
            TREE_SITTER_LANGUAGES.put(Dialect.TYPED_SCRIPT, typescript);
            TREE_SITTER_LANGUAGES.put(Dialect.TYPED_MARKUP, instantiateOrDefault("org.treesitter.TreeSitterTsx", typescript));
        } catch (Exception e) {
            throw new RuntimeException("Failed to initialize Tree-sitter languages", e);
        }
    }

    private TreeSitterGrammars() {
    }

    public static TSLanguage language(Dialect dialect) {
        return TREE_SITTER_LANGUAGES.get(dialect);
    }

    public static TSTree parse(Dialect dialect, String sourceCode) {
        TSParser parser = new TSParser();
        parser.setLanguage(language(dialect));
        return parser.parseString(null, sourceCode);
    }

    private static TSLanguage instantiate(String className) throws ReflectiveOperationException {
        return (TSLanguage) Class.forName(className).getDeclaredConstructor().newInstance();
    }

    // Older tree-sitter-typescript bindings ship without the TSX grammar.
    private static TSLanguage instantiateOrDefault(String className, TSLanguage fallback)
            throws ReflectiveOperationException {
        try {
            return instantiate(className);
        } catch (ClassNotFoundException e) {
            return fallback;
        }
    }
}
