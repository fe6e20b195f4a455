package org.dxworks.apislice.endpoint;

public final class RoutePaths {

    private RoutePaths() {
    }

    /**
     * Joins a controller prefix and a handler path: {@code ("users", ":id")} gives {@code /users/:id}.
     * Missing parts count as {@code /}; runs of slashes collapse and a trailing slash is dropped.
     */
    public static String combine(String prefix, String path) {
        String prefixPart = prefix == null || prefix.isEmpty() ? "/" : prefix;
        String pathPart = path == null ? "/" : path;
        if (!prefixPart.startsWith("/")) prefixPart = "/" + prefixPart;
        if (!pathPart.startsWith("/")) pathPart = "/" + pathPart;

        String combined = (prefixPart + pathPart).replaceAll("/{2,}", "/");
        if (combined.length() > 1 && combined.endsWith("/")) {
            combined = combined.substring(0, combined.length() - 1);
        }
        return combined.startsWith("/") ? combined : "/" + combined;
    }
}
