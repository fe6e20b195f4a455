package org.dxworks.apislice.swagger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dxworks.apislice.slice.CodeBlock;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SkeletonOperationGeneratorTest {

    private final SkeletonOperationGenerator generator = new SkeletonOperationGenerator();

    @Test
    void describesPathParametersAndMethodFromRegistration() {
        List<String> handler = List.of("router.delete('/orders/:id/items/:item', (req, res) => {", "});");
        CodeBlock helper = new CodeBlock(CodeBlock.Kind.IN_FILE_DEPENDENCY, "removeItem", "orders.js", 1, 3,
                List.of("function removeItem() {", "}", ""));

        ObjectNode fragment = generator.generate(handler, List.of(helper), "/orders/{id}/items/{item}");

        JsonNode operation = fragment.at("/paths/~1orders~1{id}~1items~1{item}/delete");
        assertTrue(operation.isObject());
        assertEquals("id", operation.at("/parameters/0/name").asText());
        assertEquals("item", operation.at("/parameters/1/name").asText());
        assertEquals("path", operation.at("/parameters/1/in").asText());
        assertEquals("removeItem", operation.at("/x-related-symbols/0").asText());
        assertEquals(handler.get(0), operation.get("summary").asText());
        assertTrue(operation.at("/responses/200").isObject());
    }

    @Test
    void decoratedHandlerUsesDecoratorVerb() {
        assertEquals("patch", SkeletonOperationGenerator.methodOf(List.of("  @Patch(':id')", "  update() {}")));
        assertEquals("get", SkeletonOperationGenerator.methodOf(List.of("app.all('/x', h);")));
        assertEquals("get", SkeletonOperationGenerator.methodOf(List.of("handler();")));
    }

    @Test
    void missingRouteYieldsEmptyFragment() {
        ObjectNode fragment = generator.generate(List.of("app.get(path, h);"), List.of(), null);

        assertTrue(fragment.get("paths").isEmpty());
    }
}
