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
 * NestJS-style routes: {@code @Controller('users')} on a class and {@code @Get(':id')} on
 * its methods compose to {@code /users/:id}. Only applies to typed dialects.
 */
public class DecoratorRouteStrategy implements DetectionStrategy {

    private static final String CONTROLLER_DECORATOR = "controller";
    private static final String[] CLASS_TYPES = {"class_declaration", "abstract_class_declaration"};
    private static final String[] MEMBER_TYPES = {"method_definition", "public_field_definition"};

    @Override
    public DetectionTier tier() {
        return DetectionTier.DECORATOR;
    }

    @Override
    public Optional<List<EndpointRecord>> detect(DetectionContext context) {
        if (!context.getDialect().isTyped() || !context.hasTree()) {
            return Optional.empty();
        }
        byte[] source = context.getParsedBytes();
        List<EndpointRecord> endpoints = new ArrayList<>();
        for (TSNode classNode : findAllDescendantsOfTypes(context.getRootNode(), CLASS_TYPES)) {
            String prefix = controllerPrefix(source, classNode);
            if (prefix == null) {
                continue;
            }
            collectMethods(context, source, classNode, prefix, endpoints);
        }
        return Optional.of(endpoints);
    }

    /**
     * Whether the structural pass sees at least one controller class in the file.
     */
    public static boolean hasControllerClass(DetectionContext context) {
        if (!context.hasTree()) {
            return false;
        }
        for (TSNode classNode : findAllDescendantsOfTypes(context.getRootNode(), CLASS_TYPES)) {
            if (controllerPrefix(context.getParsedBytes(), classNode) != null) {
                return true;
            }
        }
        return false;
    }

    /** The controller path prefix, {@code "/"} when the decorator has none, {@code null} for other classes. */
    private static String controllerPrefix(byte[] source, TSNode classNode) {
        List<TSNode> decorators = findAllChildren(classNode, "decorator");
        TSNode parent = classNode.getParent();
        if (isNodeTypeOneOf(parent, "export_statement")) {
            decorators.addAll(findAllChildren(parent, "decorator"));
        }
        for (TSNode decorator : decorators) {
            DecoratorCall call = DecoratorCall.of(source, decorator);
            if (call != null && CONTROLLER_DECORATOR.equals(call.simpleName())) {
                return call.argument != null ? call.argument : "/";
            }
        }
        return null;
    }

    private void collectMethods(DetectionContext context, byte[] source, TSNode classNode, String prefix,
                                List<EndpointRecord> endpoints) {
        TSNode body = getChildByFieldName(classNode, "body");
        if (body == null) body = findFirstChild(classNode, "class_body");
        if (body == null) return;

        // The TypeScript grammar places member decorators before the member inside the
        // class body; the JavaScript grammar nests them in the member.
        List<TSNode> pending = new ArrayList<>();
        for (TSNode member : namedChildren(body)) {
            if ("decorator".equals(member.getType())) {
                pending.add(member);
                continue;
            }
            if (isNodeTypeOneOf(member, MEMBER_TYPES)) {
                List<TSNode> decorators = new ArrayList<>(pending);
                decorators.addAll(findAllChildren(member, "decorator"));
                EndpointRecord endpoint = routeFor(context, source, member, decorators, prefix);
                if (endpoint != null) {
                    endpoints.add(endpoint);
                }
            }
            pending.clear();
        }
    }

    private EndpointRecord routeFor(DetectionContext context, byte[] source, TSNode member,
                                    List<TSNode> decorators, String prefix) {
        for (TSNode decorator : decorators) {
            DecoratorCall call = DecoratorCall.of(source, decorator);
            if (call == null || !HttpVerbs.isRouteMethod(call.simpleName())) {
                continue;
            }
            String route = RoutePaths.combine(prefix, call.argument != null ? call.argument : "/");
            return new EndpointRecord(call.simpleName().toUpperCase(Locale.ROOT), route,
                    context.getFilePath().toString(), startLine(member), endLine(member), tier());
        }
        return null;
    }

    /**
     * Name and first path-like argument of a decorator: {@code @Get(':id')}, {@code @Get()},
     * {@code @Controller({ path: 'users' })} or a bare {@code @Get}.
     */
    static final class DecoratorCall {
        final String name;
        final String argument;

        private DecoratorCall(String name, String argument) {
            this.name = name;
            this.argument = argument;
        }

        String simpleName() {
            int dot = name.lastIndexOf('.');
            return (dot >= 0 ? name.substring(dot + 1) : name).toLowerCase(Locale.ROOT);
        }

        static DecoratorCall of(byte[] source, TSNode decorator) {
            List<TSNode> children = namedChildren(decorator);
            if (children.isEmpty()) {
                return null;
            }
            TSNode expression = children.get(0);
            if ("call_expression".equals(expression.getType())) {
                TSNode function = getChildByFieldName(expression, "function");
                if (function == null) return null;
                return new DecoratorCall(getNodeText(source, function),
                        firstPathArgument(source, getChildByFieldName(expression, "arguments")));
            }
            if (isNodeTypeOneOf(expression, "identifier", "property_identifier", "member_expression")) {
                return new DecoratorCall(getNodeText(source, expression), null);
            }
            return null;
        }

        private static String firstPathArgument(byte[] source, TSNode arguments) {
            for (TSNode argument : namedChildren(arguments)) {
                if (isNodeTypeOneOf(argument, "string", "template_string")) {
                    return literalValue(source, argument);
                }
                if ("object".equals(argument.getType())) {
                    return pathProperty(source, argument);
                }
            }
            return null;
        }

        private static String pathProperty(byte[] source, TSNode object) {
            for (TSNode pair : findAllChildren(object, "pair")) {
                TSNode key = getChildByFieldName(pair, "key");
                TSNode value = getChildByFieldName(pair, "value");
                if (key != null && "path".equals(stripQuotes(getNodeText(source, key)))) {
                    return literalValue(source, value);
                }
            }
            return null;
        }
    }
}
