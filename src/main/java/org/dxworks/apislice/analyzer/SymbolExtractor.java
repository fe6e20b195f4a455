package org.dxworks.apislice.analyzer;

import org.dxworks.apislice.Dialect;
import org.dxworks.apislice.DialectSelector;
import org.dxworks.apislice.model.CallKind;
import org.dxworks.apislice.model.CallSite;
import org.dxworks.apislice.model.FileInventory;
import org.dxworks.apislice.model.ImportInfo;
import org.dxworks.apislice.model.SymbolSpan;
import org.dxworks.apislice.resolve.ModuleOriginResolver;
import org.dxworks.apislice.resolve.Origin;
import org.treesitter.TSNode;
import org.treesitter.TSQuery;
import org.treesitter.TSQueryCapture;
import org.treesitter.TSQueryCursor;
import org.treesitter.TSQueryMatch;
import org.treesitter.TSTree;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static org.dxworks.apislice.analyzer.TreeSitterHelper.*;

/**
 * Builds the {@link FileInventory} of a JavaScript or TypeScript file from a tree-sitter
 * structural query. Typed files whose query does not fit the typed grammar are
 * re-extracted with the plain JavaScript grammar.
 */
public class SymbolExtractor {

    private static final String[] FUNCTION_VALUE_TYPES = {
            "arrow_function", "function", "function_expression", "generator_function"
    };
    private static final String[] DECLARATION_STATEMENT_TYPES = {
            "lexical_declaration", "variable_declaration"
    };
    private static final String[] USAGE_NODE_TYPES = {
            "identifier", "shorthand_property_identifier", "type_identifier"
    };

    private final SymbolQueries queries;

    public SymbolExtractor() {
        this(SymbolQueries.fromClasspath());
    }

    public SymbolExtractor(SymbolQueries queries) {
        this.queries = queries;
    }

    public FileInventory extract(Path file, Path baseDirectory) throws IOException, ParseException {
        return extract(file, readSource(file), baseDirectory);
    }

    public FileInventory extract(Path file, String sourceCode, Path baseDirectory) throws ParseException {
        Path absoluteFile = file.toAbsolutePath().normalize();
        ModuleOriginResolver resolver = new ModuleOriginResolver(baseDirectory);
        Dialect dialect = DialectSelector.select(absoluteFile);
        try {
            return extractWith(absoluteFile, sourceCode, dialect, resolver);
        } catch (ParseException e) {
            if (!dialect.isTyped()) {
                throw e;
            }
            return extractWith(absoluteFile, sourceCode, Dialect.PLAIN_SCRIPT, resolver);
        }
    }

    private FileInventory extractWith(Path file, String sourceCode, Dialect dialect, ModuleOriginResolver resolver)
            throws ParseException {
        TSQuery query = queries.compile(dialect);
        TSTree tree = TreeSitterGrammars.parse(dialect, sourceCode);
        TSNode rootNode = tree.getRootNode();
        if (rootNode == null || rootNode.isNull()) {
            throw new ParseException("Parsing produced no syntax tree for " + file);
        }
        byte[] sourceBytes = sourceCode.getBytes(StandardCharsets.UTF_8);

        FileInventory inventory = new FileInventory();
        inventory.filePath = file.toString();
        inventory.dialect = dialect.getName();

        List<TSNode> importStatements = new ArrayList<>();
        List<TSNode> requireDeclarators = new ArrayList<>();

        TSQueryCursor cursor = new TSQueryCursor();
        cursor.exec(query, rootNode);
        TSQueryMatch match = new TSQueryMatch();
        while (cursor.nextMatch(match)) {
            Map<String, TSNode> captured = new HashMap<>();
            for (TSQueryCapture capture : match.getCaptures()) {
                TSNode node = capture.getNode();
                if (node != null && !node.isNull()) {
                    captured.put(query.getCaptureNameForId(capture.getIndex()), node);
                }
            }
            collectCaptures(sourceBytes, captured, inventory, importStatements, requireDeclarators);
        }

        Path importingDirectory = file.getParent();
        List<ImportBinding> bindings = new ArrayList<>();
        for (TSNode importStatement : importStatements) {
            bindings.addAll(importBindings(sourceBytes, importStatement));
        }
        for (TSNode declarator : requireDeclarators) {
            bindings.addAll(requireBindings(sourceBytes, declarator));
        }
        addImports(rootNode, sourceBytes, bindings, importingDirectory, resolver, inventory);

        return inventory;
    }

    private void collectCaptures(byte[] source, Map<String, TSNode> captured, FileInventory inventory,
                                 List<TSNode> importStatements, List<TSNode> requireDeclarators) {
        if (captured.containsKey("class.name")) {
            inventory.classes.add(span(source, captured.get("class.name"), captured.get("class")));
        } else if (captured.containsKey("function.name")) {
            inventory.functions.add(span(source, captured.get("function.name"), captured.get("function")));
        } else if (captured.containsKey("variable.name")) {
            TSNode declarator = captured.get("variable");
            SymbolSpan variable = span(source, captured.get("variable.name"), enclosingDeclaration(declarator));
            inventory.variables.add(variable);
            if (isNodeTypeOneOf(getChildByFieldName(declarator, "value"), FUNCTION_VALUE_TYPES)) {
                inventory.functions.add(new SymbolSpan(variable.name, variable.startLine, variable.endLine));
            }
        } else if (captured.containsKey("call.name")) {
            TSNode call = captured.get("call");
            inventory.functionCalls.add(new CallSite(getNodeText(source, captured.get("call.name")),
                    CallKind.FUNCTION_CALL, startLine(call), endLine(call)));
        } else if (captured.containsKey("method.name")) {
            TSNode call = captured.get("method.call");
            inventory.functionCalls.add(new CallSite(getNodeText(source, captured.get("method.name")),
                    CallKind.METHOD_CALL, startLine(call), endLine(call)));
        } else if (captured.containsKey("import")) {
            importStatements.add(captured.get("import"));
        } else if (captured.containsKey("require")
                && "require".equals(getNodeText(source, captured.get("require.function")))) {
            requireDeclarators.add(captured.get("require"));
        }
    }

    private SymbolSpan span(byte[] source, TSNode nameNode, TSNode declarationNode) {
        TSNode spanNode = declarationNode != null ? declarationNode : nameNode;
        return new SymbolSpan(getNodeText(source, nameNode), startLine(spanNode), endLine(spanNode));
    }

    private TSNode enclosingDeclaration(TSNode declarator) {
        TSNode parent = declarator.getParent();
        if (isNodeTypeOneOf(parent, DECLARATION_STATEMENT_TYPES)) {
            return parent;
        }
        return declarator;
    }

    private List<ImportBinding> importBindings(byte[] source, TSNode importStatement) {
        List<ImportBinding> bindings = new ArrayList<>();
        TSNode sourceNode = getChildByFieldName(importStatement, "source");

        // TypeScript: import x = require('y')
        TSNode requireClause = findFirstChild(importStatement, "import_require_clause");
        if (requireClause != null) {
            TSNode alias = findFirstChild(requireClause, "identifier");
            TSNode requireSource = getChildByFieldName(requireClause, "source");
            if (requireSource == null) requireSource = findFirstChild(requireClause, "string");
            if (alias != null && requireSource != null) {
                String name = getNodeText(source, alias);
                bindings.add(new ImportBinding(name, name, stripQuotes(getNodeText(source, requireSource)), importStatement));
            }
            return bindings;
        }
        if (sourceNode == null) {
            return bindings;
        }
        String specifier = stripQuotes(getNodeText(source, sourceNode));

        TSNode clause = findFirstChild(importStatement, "import_clause");
        if (clause == null) {
            bindings.add(new ImportBinding(ImportInfo.NAMESPACE, null, specifier, importStatement));
            return bindings;
        }
        for (TSNode part : namedChildren(clause)) {
            switch (part.getType()) {
                case "identifier" -> {
                    String name = getNodeText(source, part);
                    bindings.add(new ImportBinding(name, name, specifier, importStatement));
                }
                case "namespace_import" -> {
                    TSNode alias = findFirstChild(part, "identifier");
                    bindings.add(new ImportBinding(ImportInfo.NAMESPACE,
                            alias != null ? getNodeText(source, alias) : null, specifier, importStatement));
                }
                case "named_imports" -> {
                    for (TSNode specifierNode : findAllChildren(part, "import_specifier")) {
                        TSNode nameNode = getChildByFieldName(specifierNode, "name");
                        TSNode aliasNode = getChildByFieldName(specifierNode, "alias");
                        if (nameNode == null) continue;
                        String name = stripQuotes(getNodeText(source, nameNode));
                        String local = aliasNode != null ? getNodeText(source, aliasNode) : name;
                        bindings.add(new ImportBinding(name, local, specifier, importStatement));
                    }
                }
                default -> {
                }
            }
        }
        return bindings;
    }

    private List<ImportBinding> requireBindings(byte[] source, TSNode declarator) {
        List<ImportBinding> bindings = new ArrayList<>();
        TSNode nameNode = getChildByFieldName(declarator, "name");
        TSNode call = getChildByFieldName(declarator, "value");
        TSNode arguments = getChildByFieldName(call, "arguments");
        TSNode sourceNode = findFirstChild(arguments, "string");
        if (nameNode == null || sourceNode == null) {
            return bindings;
        }
        String specifier = stripQuotes(getNodeText(source, sourceNode));
        TSNode statement = enclosingDeclaration(declarator);

        if ("identifier".equals(nameNode.getType())) {
            String name = getNodeText(source, nameNode);
            bindings.add(new ImportBinding(name, name, specifier, statement));
        } else if ("object_pattern".equals(nameNode.getType())) {
            // const { a, b: c } = require('x')
            for (TSNode property : namedChildren(nameNode)) {
                if ("shorthand_property_identifier_pattern".equals(property.getType())) {
                    String name = getNodeText(source, property);
                    bindings.add(new ImportBinding(name, name, specifier, statement));
                } else if ("pair_pattern".equals(property.getType())) {
                    TSNode key = getChildByFieldName(property, "key");
                    TSNode value = getChildByFieldName(property, "value");
                    if (key != null && isNodeTypeOneOf(value, "identifier")) {
                        bindings.add(new ImportBinding(getNodeText(source, key), getNodeText(source, value),
                                specifier, statement));
                    }
                }
            }
        } else {
            bindings.add(new ImportBinding(ImportInfo.NAMESPACE, null, specifier, statement));
        }
        return bindings;
    }

    private void addImports(TSNode rootNode, byte[] source, List<ImportBinding> bindings, Path importingDirectory,
                            ModuleOriginResolver resolver, FileInventory inventory) {
        Set<String> localNames = new HashSet<>();
        for (ImportBinding binding : bindings) {
            if (binding.localName != null) localNames.add(binding.localName);
        }
        Map<String, TreeSet<Integer>> usages = findUsages(rootNode, source, localNames);

        for (ImportBinding binding : bindings) {
            Origin origin = resolver.resolve(binding.specifier, importingDirectory);
            int declarationStart = startLine(binding.declaration);
            int declarationEnd = endLine(binding.declaration);

            ImportInfo info = new ImportInfo();
            info.importedName = binding.importedName;
            info.localName = binding.localName;
            info.source = binding.specifier;
            info.origin = origin.render();
            info.line = declarationStart;
            info.originExists = origin.hasPath() && Files.exists(origin.getPath());
            if (binding.localName != null) {
                for (int line : usages.getOrDefault(binding.localName, new TreeSet<>())) {
                    if (line < declarationStart || line > declarationEnd) {
                        info.usageLines.add(line);
                    }
                }
            }
            inventory.imports.add(info);
        }
    }

    private Map<String, TreeSet<Integer>> findUsages(TSNode rootNode, byte[] source, Set<String> names) {
        Map<String, TreeSet<Integer>> usages = new HashMap<>();
        if (names.isEmpty()) {
            return usages;
        }
        for (TSNode identifier : findAllDescendantsOfTypes(rootNode, USAGE_NODE_TYPES)) {
            String name = getNodeText(source, identifier);
            if (names.contains(name)) {
                usages.computeIfAbsent(name, k -> new TreeSet<>()).add(startLine(identifier));
            }
        }
        return usages;
    }

    private static class ImportBinding {
        final String importedName;
        final String localName;
        final String specifier;
        final TSNode declaration;

        ImportBinding(String importedName, String localName, String specifier, TSNode declaration) {
            this.importedName = importedName;
            this.localName = localName;
            this.specifier = specifier;
            this.declaration = declaration;
        }
    }
}
