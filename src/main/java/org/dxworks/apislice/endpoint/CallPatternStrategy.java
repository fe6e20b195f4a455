package org.dxworks.apislice.endpoint;

import org.dxworks.apislice.model.DetectionTier;
import org.dxworks.apislice.model.EndpointRecord;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static org.dxworks.apislice.analyzer.TreeSitterHelper.*;

/**
 * Express-style registrations: {@code router.get('/users/:id', handler)}.
 */
public class CallPatternStrategy implements DetectionStrategy {

    @Override
    public DetectionTier tier() {
        return DetectionTier.CALL_PATTERN;
    }

    @Override
    public Optional<List<EndpointRecord>> detect(DetectionContext context) {
        if (!context.hasTree()) {
            return Optional.empty();
        }
        byte[] source = context.getParsedBytes();
        List<EndpointRecord> endpoints = new ArrayList<>();
        for (TSNode call : findAllDescendants(context.getRootNode(), "call_expression")) {
            EndpointRecord endpoint = endpointFor(context, source, call);
            if (endpoint != null) {
                endpoints.add(endpoint);
            }
        }
        return Optional.of(endpoints);
    }

    private EndpointRecord endpointFor(DetectionContext context, byte[] source, TSNode call) {
        TSNode function = getChildByFieldName(call, "function");
        if (!isNodeTypeOneOf(function, "member_expression")) {
            return null;
        }
        TSNode property = getChildByFieldName(function, "property");
        TSNode object = getChildByFieldName(function, "object");
        if (!isNodeTypeOneOf(property, "property_identifier", "identifier")) {
            return null;
        }
        String methodName = getNodeText(source, property).trim();
        if (!HttpVerbs.isRouteMethod(methodName)) {
            return null;
        }
        if (object == null || !RouteObjects.looksLikeRouteObject(getNodeText(source, object))) {
            return null;
        }

        String route = null;
        List<String> handlerNames = new ArrayList<>();
        boolean routeSeen = false;
        for (TSNode argument : namedChildren(getChildByFieldName(call, "arguments"))) {
            if (!routeSeen && isNodeTypeOneOf(argument, "string", "template_string")) {
                route = literalValue(source, argument);
                routeSeen = true;
            } else if ("identifier".equals(argument.getType())) {
                handlerNames.add(getNodeText(source, argument));
            }
        }

        EndpointRecord endpoint = new EndpointRecord(methodName.toUpperCase(Locale.ROOT), route,
                context.getFilePath().toString(), startLine(call), endLine(call), tier());
        endpoint.handlerNames.addAll(handlerNames);
        return endpoint;
    }
}
