package org.dxworks.apislice.endpoint;

import org.dxworks.apislice.model.DetectionTier;
import org.dxworks.apislice.model.EndpointRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.dxworks.apislice.analyzer.TreeSitterHelper.stripQuotes;

/**
 * Regular-expression detection over the raw text. Route calls are scanned when the file
 * does not parse cleanly. Controller composition is scanned for typed files that do not
 * parse cleanly or in which the syntax tree shows no controller class. Controller routes
 * start on the decorated member's first line, as the structural tier reports them, so
 * both tiers produce the same identity key for one route.
 */
public class TextPatternStrategy implements DetectionStrategy {

    private static final String VERBS = "GET|POST|PUT|DELETE|PATCH|OPTIONS|HEAD|ALL";
    private static final String QUOTED = "\"[^\"\\n]*\"|'[^'\\n]*'|`[^`\\n]*`";

    private static final Pattern ROUTE_CALL_PATTERN = Pattern.compile(
            "(?<object>[A-Za-z_$][\\w$]*)\\s*\\.\\s*(?<method>" + VERBS + ")\\s*\\(\\s*(?<route>" + QUOTED + ")?",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern CONTROLLER_PATTERN = Pattern.compile(
            "@Controller\\s*\\(\\s*(?<arg>`[^`]*`|\"[^\"]*\"|'[^']*'|[^)]*)?\\s*\\)");
    private static final Pattern CLASS_PATTERN = Pattern.compile(
            "class\\s+[A-Za-z_$][\\w$]*\\s*[^{]*\\{");
    private static final Pattern METHOD_DECORATOR_PATTERN = Pattern.compile(
            "@(?<verb>Get|Post|Put|Delete|Patch|Options|Head|All)\\s*\\(\\s*(?<arg>`[^`]*`|\"[^\"]*\"|'[^']*'|[^)]*)?\\s*\\)",
            Pattern.CASE_INSENSITIVE);

    @Override
    public DetectionTier tier() {
        return DetectionTier.TEXT_PATTERN;
    }

    @Override
    public Optional<List<EndpointRecord>> detect(DetectionContext context) {
        boolean scanCalls = context.isParseFailed();
        boolean scanControllers = context.getDialect().isTyped()
                && (scanCalls || !DecoratorRouteStrategy.hasControllerClass(context));
        if (!scanCalls && !scanControllers) {
            return Optional.empty();
        }
        List<EndpointRecord> endpoints = new ArrayList<>();
        if (scanCalls) {
            endpoints.addAll(routeCalls(context));
        }
        if (scanControllers) {
            endpoints.addAll(controllerRoutes(context));
        }
        return Optional.of(endpoints);
    }

    private List<EndpointRecord> routeCalls(DetectionContext context) {
        String source = context.getRawSource();
        List<EndpointRecord> endpoints = new ArrayList<>();
        Matcher matcher = ROUTE_CALL_PATTERN.matcher(source);
        while (matcher.find()) {
            if (!RouteObjects.looksLikeRouteObject(matcher.group("object"))) {
                continue;
            }
            String literal = matcher.group("route");
            String route = literal == null || (literal.startsWith("`") && literal.contains("${"))
                    ? null
                    : stripQuotes(literal);
            endpoints.add(new EndpointRecord(matcher.group("method").toUpperCase(Locale.ROOT), route,
                    context.getFilePath().toString(),
                    lineAt(source, matcher.start()), lineAt(source, matcher.end()), tier()));
        }
        return endpoints;
    }

    List<EndpointRecord> controllerRoutes(DetectionContext context) {
        String source = context.getRawSource();
        List<EndpointRecord> endpoints = new ArrayList<>();
        Matcher controller = CONTROLLER_PATTERN.matcher(source);
        while (controller.find()) {
            String prefix = cleanArgument(controller.group("arg"));
            Matcher classMatch = CLASS_PATTERN.matcher(source);
            if (!classMatch.find(controller.end())) {
                continue;
            }
            int braceStart = source.indexOf('{', classMatch.start());
            int braceEnd = matchingBrace(source, braceStart);
            if (braceStart < 0 || braceEnd < 0) {
                continue;
            }
            String body = source.substring(braceStart, braceEnd);
            int baseLine = lineAt(source, braceStart);

            Matcher method = METHOD_DECORATOR_PATTERN.matcher(body);
            while (method.find()) {
                String route = RoutePaths.combine(prefix, cleanArgument(method.group("arg")));
                int member = memberStart(body, method.end());
                int startLine = baseLine + countNewlines(body, member);
                int memberBrace = body.indexOf('{', member);
                int memberEnd = memberBrace < 0 ? -1 : matchingBrace(body, memberBrace);
                int endLine = memberEnd < 0 ? startLine : baseLine + countNewlines(body, memberEnd);
                endpoints.add(new EndpointRecord(method.group("verb").toUpperCase(Locale.ROOT), route,
                        context.getFilePath().toString(), startLine, endLine, tier()));
            }
        }
        return endpoints;
    }

    /** Offset of the first token after {@code from} that is not part of another decorator. */
    static int memberStart(String body, int from) {
        int i = from;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '@') {
                i = skipDecorator(body, i);
            } else {
                return i;
            }
        }
        return from;
    }

    private static int skipDecorator(String body, int at) {
        int i = at + 1;
        while (i < body.length() && (Character.isJavaIdentifierPart(body.charAt(i)) || body.charAt(i) == '.')) {
            i++;
        }
        if (i < body.length() && body.charAt(i) == '(') {
            int depth = 0;
            for (; i < body.length(); i++) {
                char c = body.charAt(i);
                if (c == '(') {
                    depth++;
                } else if (c == ')' && --depth == 0) {
                    return i + 1;
                }
            }
        }
        return i;
    }

    private static String cleanArgument(String raw) {
        if (raw == null) {
            return "/";
        }
        String cleaned = stripQuotes(raw);
        return cleaned.isEmpty() ? "/" : cleaned;
    }

    static int matchingBrace(String source, int openIndex) {
        if (openIndex < 0) {
            return -1;
        }
        int depth = 0;
        for (int i = openIndex; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    static int lineAt(String source, int offset) {
        return countNewlines(source, offset) + 1;
    }

    private static int countNewlines(String text, int end) {
        int count = 0;
        int limit = Math.min(end, text.length());
        for (int i = 0; i < limit; i++) {
            if (text.charAt(i) == '\n') count++;
        }
        return count;
    }
}
