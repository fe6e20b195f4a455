package org.dxworks.apislice.swagger;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dxworks.apislice.slice.CodeBlock;

import java.util.List;

/**
 * Turns one endpoint's source slice into an OpenAPI fragment of the form
 * {@code {"paths": {route: {method: operation}}}}. Implementations are called from worker
 * threads and must not share mutable state. {@code route} is {@code null} when the
 * registration did not use a literal path.
 */
public interface OperationGenerator {

    ObjectNode generate(List<String> handlerLines, List<CodeBlock> contextBlocks, String route) throws Exception;
}
