package org.dxworks.apislice.slice;

import org.dxworks.apislice.cache.InventorySnapshot;
import org.dxworks.apislice.endpoint.HttpVerbs;
import org.dxworks.apislice.model.CallKind;
import org.dxworks.apislice.model.CallSite;
import org.dxworks.apislice.model.EndpointRecord;
import org.dxworks.apislice.model.FileInventory;
import org.dxworks.apislice.model.ImportInfo;
import org.dxworks.apislice.model.SymbolSpan;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Assembles the {@link ContextBundle} of an endpoint from the cached inventories: the
 * in-file functions it calls (transitively), the declarations behind the imports it uses
 * and the file's catch-all responder, if any. Missing files and declarations are skipped.
 */
public class DependencySlicer {

    // app.use('/:name', ...) installs a fallback handler shaping every route's response
    private static final Pattern CATCH_ALL_USE = Pattern.compile("\\.use\\s*\\(\\s*['\"]/:");

    public ContextBundle slice(EndpointRecord endpoint, InventorySnapshot snapshot) {
        SourceLines sources = new SourceLines();
        Path endpointFile = Path.of(endpoint.filePath);
        List<String> handlerLines = sources.slice(endpointFile, endpoint.startLine, endpoint.endLine)
                .orElseGet(ArrayList::new);

        Optional<FileInventory> inventory = snapshot.find(endpointFile);
        if (inventory.isEmpty()) {
            return new ContextBundle(endpoint, handlerLines, List.of(), List.of(), List.of());
        }

        List<InFileDependency> dependencies = findInFileDependencies(inventory.get(), endpoint);
        List<ImportInfo> imports = findRelevantImports(inventory.get(), endpoint, dependencies);

        List<CodeBlock> dependencyBlocks = new ArrayList<>();
        for (InFileDependency dependency : dependencies) {
            sources.slice(Path.of(dependency.filePath), dependency.functionStartLine, dependency.functionEndLine)
                    .filter(lines -> !lines.isEmpty())
                    .ifPresent(lines -> dependencyBlocks.add(new CodeBlock(CodeBlock.Kind.IN_FILE_DEPENDENCY,
                            dependency.name, dependency.filePath,
                            dependency.functionStartLine, dependency.functionEndLine, lines)));
        }

        List<CodeBlock> importBlocks = new ArrayList<>();
        for (ImportInfo imported : imports) {
            importedDeclaration(imported, snapshot, sources).ifPresent(importBlocks::add);
        }

        List<CodeBlock> catchAllBlocks = new ArrayList<>();
        sources.lines(endpointFile).flatMap(lines -> catchAllBlock(endpoint.filePath, lines))
                .ifPresent(catchAllBlocks::add);

        return new ContextBundle(endpoint, handlerLines, dependencyBlocks, importBlocks, catchAllBlocks);
    }

    /**
     * Calls to same-file functions inside the endpoint span, then inside the bodies of the
     * functions found so far, until no new declaration turns up. Named handlers passed to
     * the registration call count as calls on the registration lines.
     */
    public List<InFileDependency> findInFileDependencies(FileInventory inventory, EndpointRecord endpoint) {
        Set<String> functionNames = inventory.functionNames();
        functionNames.removeAll(HttpVerbs.ROUTE_METHODS);

        List<InFileDependency> dependencies = new ArrayList<>();
        Set<List<Object>> seenDefinitions = new HashSet<>();
        Deque<int[]> scopes = new ArrayDeque<>();
        scopes.add(new int[]{endpoint.startLine, endpoint.endLine});

        for (String handlerName : endpoint.handlerNames) {
            if (functionNames.contains(handlerName)) {
                CallSite reference = new CallSite(handlerName, CallKind.FUNCTION_CALL, endpoint.startLine, endpoint.endLine);
                addDependency(inventory, reference, dependencies, seenDefinitions, scopes);
            }
        }

        while (!scopes.isEmpty()) {
            int[] scope = scopes.poll();
            for (CallSite call : inventory.functionCalls) {
                // Only bare calls: obj.name() never resolves to a same-file function.
                if (call.kind != CallKind.FUNCTION_CALL || !functionNames.contains(call.name)) {
                    continue;
                }
                if (!call.liesWithin(scope[0], scope[1])) {
                    continue;
                }
                addDependency(inventory, call, dependencies, seenDefinitions, scopes);
            }
        }
        return dependencies;
    }

    private void addDependency(FileInventory inventory, CallSite call, List<InFileDependency> dependencies,
                               Set<List<Object>> seenDefinitions, Deque<int[]> scopes) {
        SymbolSpan definition = chooseDefinition(inventory.functionsNamed(call.name), call.startLine);
        int definitionStart = definition != null ? definition.startLine : call.startLine;
        int definitionEnd = definition != null ? definition.endLine : call.endLine;
        if (!seenDefinitions.add(List.of(call.name, definitionStart, definitionEnd))) {
            return;
        }
        dependencies.add(new InFileDependency(call.name, inventory.filePath, call.startLine, call.endLine,
                definitionStart, definitionEnd));
        if (definition != null) {
            scopes.add(new int[]{definitionStart, definitionEnd});
        }
    }

    /**
     * Picks the declaration a call refers to when a name is declared more than once:
     * the first declaration (by start line) whose span contains the call line, otherwise the
     * last declaration starting at or before the call line, otherwise the first declaration.
     * A declaration after the call is only chosen when nothing starts at or before it.
     */
    public static SymbolSpan chooseDefinition(List<SymbolSpan> candidates, int callLine) {
        if (candidates == null || candidates.isEmpty()) {
            return null;
        }
        List<SymbolSpan> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparingInt(span -> span.startLine));

        SymbolSpan preceding = null;
        for (SymbolSpan candidate : sorted) {
            if (candidate.contains(callLine)) {
                return candidate;
            }
            if (candidate.startLine <= callLine) {
                preceding = candidate;
            }
        }
        return preceding != null ? preceding : sorted.get(0);
    }

    /**
     * Imports whose origin exists on disk and whose binding is referenced inside the endpoint,
     * inside a dependency call, or inside a dependency's declaration.
     */
    public List<ImportInfo> findRelevantImports(FileInventory inventory, EndpointRecord endpoint,
                                                List<InFileDependency> dependencies) {
        List<ImportInfo> relevant = new ArrayList<>();
        for (ImportInfo imported : inventory.imports) {
            if (!imported.originExists) {
                continue;
            }
            if (isReferenced(imported, endpoint, dependencies)) {
                relevant.add(imported);
            }
        }
        return relevant;
    }

    private boolean isReferenced(ImportInfo imported, EndpointRecord endpoint, List<InFileDependency> dependencies) {
        if (imported.isUsedWithin(endpoint.startLine, endpoint.endLine)) {
            return true;
        }
        for (int usage : imported.usageLines) {
            for (InFileDependency dependency : dependencies) {
                if (dependency.callSpanContains(usage) || dependency.definitionContains(usage)) {
                    return true;
                }
            }
        }
        return false;
    }

    private Optional<CodeBlock> importedDeclaration(ImportInfo imported, InventorySnapshot snapshot,
                                                    SourceLines sources) {
        if (imported.origin == null || ImportInfo.NAMESPACE.equals(imported.importedName)) {
            return Optional.empty();
        }
        Path originFile = Path.of(imported.origin);
        Optional<FileInventory> originInventory = snapshot.find(originFile);
        if (originInventory.isEmpty()) {
            return Optional.empty();
        }
        SymbolSpan declaration = findDeclaration(originInventory.get(), imported.importedName);
        if (declaration == null) {
            return Optional.empty();
        }
        return sources.slice(originFile, declaration.startLine, declaration.endLine)
                .filter(lines -> !lines.isEmpty())
                .map(lines -> new CodeBlock(CodeBlock.Kind.IMPORTED_SYMBOL, imported.importedName,
                        originFile.toString(), declaration.startLine, declaration.endLine, lines));
    }

    /** Classes first, then functions, then variables. */
    static SymbolSpan findDeclaration(FileInventory inventory, String name) {
        for (List<SymbolSpan> category : List.of(inventory.classes, inventory.functions, inventory.variables)) {
            for (SymbolSpan span : category) {
                if (span.name.equals(name)) {
                    return span;
                }
            }
        }
        return null;
    }

    private Optional<CodeBlock> catchAllBlock(String filePath, List<String> lines) {
        for (int i = 0; i < lines.size(); i++) {
            if (CATCH_ALL_USE.matcher(lines.get(i)).find()) {
                List<String> block = SourceLines.braceBlock(lines, i);
                return Optional.of(new CodeBlock(CodeBlock.Kind.CATCH_ALL_HANDLER, "use", filePath,
                        i + 1, i + block.size(), block));
            }
        }
        return Optional.empty();
    }
}
