package org.dxworks.apislice.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dxworks.apislice.ApiSliceConfig;
import org.dxworks.apislice.cache.InventoryCache;
import org.dxworks.apislice.slice.CodeBlock;
import org.dxworks.apislice.swagger.OperationGenerator;
import org.dxworks.apislice.swagger.SkeletonOperationGenerator;
import org.dxworks.apislice.swagger.SwaggerDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import static org.dxworks.apislice.TestUtils.writeLines;
import static org.junit.jupiter.api.Assertions.*;

class ApiSlicePipelineTest {

    @TempDir
    Path root;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private ApiSliceConfig config;

    @BeforeEach
    void setUp() {
        config = ApiSliceConfig.with(List.of("node_modules"), 5, 20000, "https://widgets.test", "widgets", "2.0.0");
    }

    @Test
    void handlerSliceFollowsCallsIntoSiblingModule() throws Exception {
        writeWidgetApp();
        RecordingGenerator generator = new RecordingGenerator();

        SwaggerDocument document = pipeline(generator).run(root);

        List<CodeBlock> blocks = generator.blocksByRoute.get("/widgets/{id}");
        assertNotNull(blocks, "endpoint was not sliced");
        assertEquals(List.of("handler", "loadWidget", "find"),
                blocks.stream().map(CodeBlock::getName).collect(Collectors.toList()));
        CodeBlock find = blocks.get(2);
        assertEquals(CodeBlock.Kind.IMPORTED_SYMBOL, find.getKind());
        assertEquals(root.resolve("db.js").toAbsolutePath().normalize().toString(), find.getFilePath());
        assertTrue(find.text().contains("return widgets.get(id);"));

        assertTrue(document.paths().has("/widgets/{id}"));
        assertFalse(Files.exists(root.resolve(InventoryCache.CACHE_DIR_NAME)));
    }

    @Test
    void skeletonDocumentForWholeTree() throws Exception {
        writeWidgetApp();

        SwaggerDocument document = pipeline(new SkeletonOperationGenerator()).run(root);

        assertEquals("widgets", document.info().get("title").asText());
        assertEquals("2.0.0", document.info().get("version").asText());
        assertEquals("https://widgets.test", document.root().at("/servers/0/url").asText());
        JsonNode get = document.paths().at("/~1widgets~1{id}/get");
        assertEquals("id", get.at("/parameters/0/name").asText());
        assertEquals(1, document.paths().size());
    }

    @Test
    void failingGeneratorSkipsOnlyThatEndpoint() throws Exception {
        writeLines(root.resolve("server.js"),
                "app.get('/ok', (req, res) => res.send('ok'));",
                "app.get('/boom', (req, res) => res.send('boom'));");
        OperationGenerator generator = (handler, blocks, route) -> {
            if (route.equals("/boom")) {
                throw new IllegalStateException("generator failed");
            }
            return new SkeletonOperationGenerator().generate(handler, blocks, route);
        };

        SwaggerDocument document = pipeline(generator).run(root);

        assertTrue(document.paths().has("/ok"));
        assertFalse(document.paths().has("/boom"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("generator failed"));
    }

    @Test
    void treeWithoutEndpointsYieldsEmptyPaths() throws Exception {
        writeLines(root.resolve("util.js"), "export const add = (a, b) => a + b;");

        SwaggerDocument document = pipeline(new SkeletonOperationGenerator()).run(root);

        assertTrue(document.paths().isEmpty());
        assertFalse(Files.exists(root.resolve(InventoryCache.CACHE_DIR_NAME)));
    }

    @Test
    void unparseableFileIsLoggedAndSkipped() throws Exception {
        writeLines(root.resolve("api.js"), "app.get('/fine', (req, res) => res.end());");
        Files.write(root.resolve("binary.js"), new byte[]{(byte) 0xC3, (byte) 0x28, 0x0A});

        SwaggerDocument document = pipeline(new SkeletonOperationGenerator()).run(root);

        assertTrue(document.paths().has("/fine"));
    }

    private ApiSlicePipeline pipeline(OperationGenerator generator) {
        return new ApiSlicePipeline(config, generator,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private void writeWidgetApp() throws Exception {
        writeLines(root.resolve("app.js"),
                "const express = require('express');",
                "const { find } = require('./db');",
                "",
                "const app = express();",
                "",
                "function loadWidget(id) {",
                "  return find(id);",
                "}",
                "",
                "function handler(req, res) {",
                "  res.json(loadWidget(req.params.id));",
                "}",
                "",
                "app.get('/widgets/:id', handler);",
                "",
                "module.exports = app;");
        writeLines(root.resolve("db.js"),
                "const widgets = new Map();",
                "",
                "function find(id) {",
                "  return widgets.get(id);",
                "}",
                "",
                "module.exports = { find };");
        writeLines(root.resolve("node_modules/express/index.js"),
                "module.exports = function express() {};");
    }

    private static class RecordingGenerator implements OperationGenerator {
        final Map<String, List<CodeBlock>> blocksByRoute = new ConcurrentHashMap<>();

        @Override
        public ObjectNode generate(List<String> handlerLines, List<CodeBlock> contextBlocks, String route) {
            blocksByRoute.put(route, contextBlocks);
            ObjectNode fragment = JsonNodeFactory.instance.objectNode();
            fragment.putObject("paths").putObject(route).putObject("get").put("summary", handlerLines.get(0));
            return fragment;
        }
    }
}
