package org.dxworks.apislice.slice;

/**
 * A call from inside an endpoint (or one of its dependencies) to a function declared in
 * the same file, with the declaration chosen for it.
 */
public class InFileDependency {
    public final String name;
    public final String filePath;
    public final int callStartLine;
    public final int callEndLine;
    public final int functionStartLine;
    public final int functionEndLine;

    public InFileDependency(String name, String filePath, int callStartLine, int callEndLine,
                            int functionStartLine, int functionEndLine) {
        this.name = name;
        this.filePath = filePath;
        this.callStartLine = callStartLine;
        this.callEndLine = callEndLine;
        this.functionStartLine = functionStartLine;
        this.functionEndLine = functionEndLine;
    }

    boolean callSpanContains(int line) {
        return callStartLine <= line && line <= callEndLine;
    }

    boolean definitionContains(int line) {
        return functionStartLine <= line && line <= functionEndLine;
    }
}
