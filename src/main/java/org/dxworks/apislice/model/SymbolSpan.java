package org.dxworks.apislice.model;

/**
 * A named declaration with its 1-based, inclusive line span.
 */
public class SymbolSpan {
    public String name;
    public int startLine;
    public int endLine;

    public SymbolSpan() {
    }

    public SymbolSpan(String name, int startLine, int endLine) {
        this.name = name;
        this.startLine = startLine;
        this.endLine = endLine;
    }

    public boolean contains(int line) {
        return startLine <= line && line <= endLine;
    }

    public boolean liesWithin(int fromLine, int toLine) {
        return startLine >= fromLine && endLine <= toLine;
    }
}
