package org.dxworks.apislice.swagger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * The OpenAPI 3.0 document the pipeline accumulates fragments into.
 */
public class SwaggerDocument {

    public static final String OPENAPI_VERSION = "3.0.0";
    static final String DESCRIPTION = "This Swagger file was generated from the endpoints found in the source tree.";

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final ObjectNode root;

    private SwaggerDocument(ObjectNode root) {
        this.root = root;
    }

    public static SwaggerDocument create(String title, String version, String host,
                                         RepositoryMetadata repository, Instant generatedAt) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("openapi", OPENAPI_VERSION);

        ObjectNode info = root.putObject("info");
        info.put("title", title);
        info.put("version", version);
        info.put("description", DESCRIPTION);
        info.put("generated_at", generatedAt.truncatedTo(ChronoUnit.SECONDS).toString());
        info.put("commit_reference", repository.getCommitHash());
        info.put("repository_url", repository.getRemoteUrl());

        root.putArray("servers").addObject().put("url", host);
        root.putObject("paths");
        return new SwaggerDocument(root);
    }

    public ObjectNode root() {
        return root;
    }

    public ObjectNode paths() {
        return (ObjectNode) root.get("paths");
    }

    public ObjectNode info() {
        return (ObjectNode) root.get("info");
    }

    public void write(Path output) throws IOException {
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }
        MAPPER.writeValue(output.toFile(), root);
    }
}
