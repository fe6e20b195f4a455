package org.dxworks.apislice.model;

public class CallSite extends SymbolSpan {
    public CallKind kind;

    public CallSite() {
    }

    public CallSite(String name, CallKind kind, int startLine, int endLine) {
        super(name, startLine, endLine);
        this.kind = kind;
    }
}
