package org.dxworks.apislice.endpoint;

import org.dxworks.apislice.Dialect;
import org.dxworks.apislice.DialectSelector;
import org.dxworks.apislice.analyzer.TreeSitterGrammars;
import org.treesitter.TSNode;
import org.treesitter.TSTree;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One file as seen by the detection tiers: the raw text plus, when tree-sitter produced
 * one, the syntax tree. {@link #isParseFailed()} is true when the tree still contains
 * errors after the optional-catch-binding repair.
 */
public final class DetectionContext {

    private static final Pattern OPTIONAL_CATCH_PATTERN = Pattern.compile("catch\\s*(\\{)");
    static final String CATCH_PLACEHOLDER = "__apislice_err";

    private final Path filePath;
    private final Dialect dialect;
    private final String rawSource;
    private final byte[] parsedBytes;
    private final TSNode rootNode;
    private final boolean parseFailed;

    private DetectionContext(Path filePath, Dialect dialect, String rawSource, String parsedSource,
                             TSNode rootNode, boolean parseFailed) {
        this.filePath = filePath;
        this.dialect = dialect;
        this.rawSource = rawSource;
        this.parsedBytes = parsedSource.getBytes(StandardCharsets.UTF_8);
        this.rootNode = rootNode;
        this.parseFailed = parseFailed;
    }

    public static DetectionContext parse(Path filePath, String source) {
        Dialect dialect = DialectSelector.select(filePath);
        TSNode root = parseRoot(dialect, source);
        if (root != null && !root.hasError()) {
            return new DetectionContext(filePath, dialect, source, source, root, false);
        }

        String patched = repairOptionalCatch(source);
        if (patched != null) {
            TSNode patchedRoot = parseRoot(dialect, patched);
            if (patchedRoot != null && !patchedRoot.hasError()) {
                return new DetectionContext(filePath, dialect, source, patched, patchedRoot, false);
            }
        }
        return new DetectionContext(filePath, dialect, source, source, root, true);
    }

    /**
     * Rewrites every <code>catch {</code> to <code>catch (placeholder) {</code> without
     * changing line numbers, or returns {@code null} when the source has no parameterless catch.
     */
    static String repairOptionalCatch(String source) {
        Matcher matcher = OPTIONAL_CATCH_PATTERN.matcher(source);
        if (!matcher.find()) {
            return null;
        }
        return matcher.replaceAll(Matcher.quoteReplacement("catch (" + CATCH_PLACEHOLDER + ") {"));
    }

    private static TSNode parseRoot(Dialect dialect, String source) {
        TSTree tree = TreeSitterGrammars.parse(dialect, source);
        if (tree == null) {
            return null;
        }
        TSNode root = tree.getRootNode();
        return root == null || root.isNull() ? null : root;
    }

    public Path getFilePath() {
        return filePath;
    }

    public Dialect getDialect() {
        return dialect;
    }

    /** The file text exactly as read. */
    public String getRawSource() {
        return rawSource;
    }

    /** UTF-8 bytes of the text the syntax tree was built from (possibly catch-repaired). */
    public byte[] getParsedBytes() {
        return parsedBytes;
    }

    public boolean hasTree() {
        return rootNode != null;
    }

    public TSNode getRootNode() {
        return rootNode;
    }

    public boolean isParseFailed() {
        return parseFailed;
    }
}
