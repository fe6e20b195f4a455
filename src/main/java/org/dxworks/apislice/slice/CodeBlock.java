package org.dxworks.apislice.slice;

import java.util.List;

/**
 * Literal source lines copied from one file.
 */
public class CodeBlock {

    public enum Kind {
        IN_FILE_DEPENDENCY,
        IMPORTED_SYMBOL,
        CATCH_ALL_HANDLER
    }

    private final Kind kind;
    private final String name;
    private final String filePath;
    private final int startLine;
    private final int endLine;
    private final List<String> lines;

    public CodeBlock(Kind kind, String name, String filePath, int startLine, int endLine, List<String> lines) {
        this.kind = kind;
        this.name = name;
        this.filePath = filePath;
        this.startLine = startLine;
        this.endLine = endLine;
        this.lines = List.copyOf(lines);
    }

    public Kind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public String getFilePath() {
        return filePath;
    }

    public int getStartLine() {
        return startLine;
    }

    public int getEndLine() {
        return endLine;
    }

    public List<String> getLines() {
        return lines;
    }

    public String text() {
        return String.join("\n", lines);
    }

    @Override
    public String toString() {
        return kind + " " + name + " " + filePath + ":" + startLine + "-" + endLine;
    }
}
