package org.dxworks.apislice.endpoint;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decides whether the receiver of a {@code .get(...)}-style call is a router. Every
 * detection tier and the candidate-file filter go through this one predicate.
 */
public final class RouteObjects {

    private static final Set<String> KEYWORDS = Set.of(
            "app", "router", "route", "api", "controller", "server");
    private static final List<String> SUFFIXES = List.of(
            "router", "routes", "route", "app", "server", "controller", "api");
    private static final List<String> PREFIXES = List.of("app", "api");

    private RouteObjects() {
    }

    public static boolean looksLikeRouteObject(String objectName) {
        if (objectName == null) {
            return false;
        }
        String low = objectName.trim().toLowerCase(Locale.ROOT);
        if (low.isEmpty()) {
            return false;
        }
        if (KEYWORDS.contains(low)) {
            return true;
        }
        for (String suffix : SUFFIXES) {
            if (low.endsWith(suffix)) return true;
        }
        for (String prefix : PREFIXES) {
            if (low.startsWith(prefix)) return true;
        }
        return false;
    }
}
