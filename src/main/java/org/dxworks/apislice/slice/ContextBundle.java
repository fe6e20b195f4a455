package org.dxworks.apislice.slice;

import org.dxworks.apislice.model.EndpointRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Source context for one endpoint: the handler itself plus the code it depends on.
 */
public class ContextBundle {

    private final EndpointRecord endpoint;
    private final List<String> handlerLines;
    private final List<CodeBlock> dependencyBlocks;
    private final List<CodeBlock> importBlocks;
    private final List<CodeBlock> catchAllBlocks;

    public ContextBundle(EndpointRecord endpoint, List<String> handlerLines, List<CodeBlock> dependencyBlocks,
                         List<CodeBlock> importBlocks, List<CodeBlock> catchAllBlocks) {
        this.endpoint = endpoint;
        this.handlerLines = List.copyOf(handlerLines);
        this.dependencyBlocks = List.copyOf(dependencyBlocks);
        this.importBlocks = List.copyOf(importBlocks);
        this.catchAllBlocks = List.copyOf(catchAllBlocks);
    }

    public EndpointRecord getEndpoint() {
        return endpoint;
    }

    public List<String> getHandlerLines() {
        return handlerLines;
    }

    public List<CodeBlock> getDependencyBlocks() {
        return dependencyBlocks;
    }

    public List<CodeBlock> getImportBlocks() {
        return importBlocks;
    }

    public List<CodeBlock> getCatchAllBlocks() {
        return catchAllBlocks;
    }

    /** In-file dependencies, then imported symbols, then catch-all handlers. */
    public List<CodeBlock> contextBlocks() {
        List<CodeBlock> blocks = new ArrayList<>(dependencyBlocks);
        blocks.addAll(importBlocks);
        blocks.addAll(catchAllBlocks);
        return blocks;
    }
}
