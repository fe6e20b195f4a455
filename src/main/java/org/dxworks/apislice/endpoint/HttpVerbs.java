package org.dxworks.apislice.endpoint;

import java.util.Locale;
import java.util.Set;

public final class HttpVerbs {

    /** Lower-case router/decorator method names that register a route. */
    public static final Set<String> ROUTE_METHODS = Set.of(
            "get", "post", "put", "delete", "patch", "options", "head", "all");

    private HttpVerbs() {
    }

    public static boolean isRouteMethod(String name) {
        return name != null && ROUTE_METHODS.contains(name.trim().toLowerCase(Locale.ROOT));
    }
}
