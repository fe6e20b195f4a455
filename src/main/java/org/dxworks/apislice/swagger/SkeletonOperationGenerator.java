package org.dxworks.apislice.swagger;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dxworks.apislice.slice.CodeBlock;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic stand-in for an external documentation generator. It reads the HTTP method
 * off the registration line, declares one string parameter per {@code {param}} segment and
 * a plain 200 response. The summary is the first line of the handler. Endpoints without a
 * literal route yield an empty fragment.
 */
public class SkeletonOperationGenerator implements OperationGenerator {

    private static final Pattern ROUTE_CALL = Pattern.compile(
            "\\.(get|post|put|delete|patch|options|head|all)\\s*\\(", Pattern.CASE_INSENSITIVE);
    private static final Pattern ROUTE_DECORATOR = Pattern.compile(
            "@(Get|Post|Put|Delete|Patch|Options|Head|All)\\s*\\(");
    private static final Pattern PATH_PARAMETER = Pattern.compile("\\{([^}/]+)}");

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    @Override
    public ObjectNode generate(List<String> handlerLines, List<CodeBlock> contextBlocks, String route) {
        ObjectNode fragment = NODES.objectNode();
        ObjectNode paths = fragment.putObject("paths");
        // Without a literal route there is no path key to describe.
        if (route == null) {
            return fragment;
        }
        String method = methodOf(handlerLines);

        ObjectNode operation = NODES.objectNode();
        operation.put("summary", summaryOf(handlerLines, method, route));
        if (!contextBlocks.isEmpty()) {
            ArrayNode related = operation.putArray("x-related-symbols");
            contextBlocks.forEach(block -> related.add(block.getName()));
        }

        ArrayNode parameters = NODES.arrayNode();
        Matcher matcher = PATH_PARAMETER.matcher(route);
        while (matcher.find()) {
            ObjectNode parameter = parameters.addObject();
            parameter.put("name", matcher.group(1));
            parameter.put("in", "path");
            parameter.put("required", true);
            parameter.putObject("schema").put("type", "string");
        }
        if (!parameters.isEmpty()) {
            operation.set("parameters", parameters);
        }
        operation.putObject("responses").putObject("200").put("description", "Successful response.");

        paths.putObject(route).set(method, operation);
        return fragment;
    }

    static String methodOf(List<String> handlerLines) {
        for (String line : handlerLines) {
            Matcher call = ROUTE_CALL.matcher(line);
            if (call.find()) {
                return openApiMethod(call.group(1));
            }
            Matcher decorator = ROUTE_DECORATOR.matcher(line);
            if (decorator.find()) {
                return openApiMethod(decorator.group(1));
            }
        }
        return "get";
    }

    // OpenAPI has no catch-all verb.
    private static String openApiMethod(String verb) {
        String lower = verb.toLowerCase(Locale.ROOT);
        return "all".equals(lower) ? "get" : lower;
    }

    private static String summaryOf(List<String> handlerLines, String method, String route) {
        for (String line : handlerLines) {
            if (!line.isBlank()) {
                return line.strip();
            }
        }
        return method.toUpperCase(Locale.ROOT) + " " + route;
    }
}
