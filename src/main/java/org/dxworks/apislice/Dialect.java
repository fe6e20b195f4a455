package org.dxworks.apislice;

import java.util.List;

public enum Dialect {
    PLAIN_SCRIPT("javascript", false, List.of(".js", ".cjs", ".mjs")),
    TYPED_SCRIPT("typescript", true, List.of(".ts", ".cts", ".mts")),
    TYPED_MARKUP("tsx", true, List.of(".tsx"));

    private final String name;
    private final boolean typed;
    private final List<String> extensions;

    Dialect(String name, boolean typed, List<String> extensions) {
        this.name = name;
        this.typed = typed;
        this.extensions = extensions;
    }

    public String getName() {
        return name;
    }

    public boolean isTyped() {
        return typed;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    public boolean matchesFileName(String lowerCaseFileName) {
        for (String ext : extensions) {
            if (lowerCaseFileName.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }
}
