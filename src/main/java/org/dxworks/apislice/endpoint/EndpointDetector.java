package org.dxworks.apislice.endpoint;

import org.dxworks.apislice.analyzer.TreeSitterHelper;
import org.dxworks.apislice.model.EndpointRecord;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds HTTP route declarations in one file. The tiers run in order and their results are
 * unioned by {@link EndpointRecord#identityKey()}; the first tier to report a key keeps it.
 * Detection never fails: unreadable or unparseable files yield what the weaker tiers find.
 */
public class EndpointDetector {

    private static final Pattern ROUTE_CALL_HINT = Pattern.compile(
            "([A-Za-z_$][\\w$]*)\\s*\\.\\s*(?:get|post|put|delete|patch|options|head|all)\\s*\\(",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern API_DECORATOR_HINT = Pattern.compile(
            "@\\s*(?:route|get|post|put|delete|patch|options|head|all|api|endpoint|router|controller|rest)\\b",
            Pattern.CASE_INSENSITIVE);

    private final List<DetectionStrategy> strategies;

    public EndpointDetector() {
        this(List.of(new DecoratorRouteStrategy(), new CallPatternStrategy(), new TextPatternStrategy()));
    }

    public EndpointDetector(List<DetectionStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    public List<EndpointRecord> detect(Path file) {
        String source;
        try {
            source = TreeSitterHelper.readSource(file);
        } catch (IOException e) {
            return new ArrayList<>();
        }
        return detect(file, source);
    }

    public List<EndpointRecord> detect(Path file, String source) {
        DetectionContext context = DetectionContext.parse(file.toAbsolutePath().normalize(), source);
        Map<List<Object>, EndpointRecord> unique = new LinkedHashMap<>();
        for (DetectionStrategy strategy : strategies) {
            strategy.detect(context).ifPresent(found -> {
                for (EndpointRecord endpoint : found) {
                    unique.putIfAbsent(endpoint.identityKey(), endpoint);
                }
            });
        }
        return new ArrayList<>(unique.values());
    }

    /**
     * Cheap text check used to pick the files worth parsing for routes.
     */
    public static boolean looksLikeApiFile(String source) {
        Matcher matcher = ROUTE_CALL_HINT.matcher(source);
        while (matcher.find()) {
            if (RouteObjects.looksLikeRouteObject(matcher.group(1))) {
                return true;
            }
        }
        return API_DECORATOR_HINT.matcher(source).find();
    }
}
