package org.dxworks.apislice.swagger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Folds per-endpoint fragments into a {@link SwaggerDocument}. Paths are always keyed in the
 * {@code {param}} convention; a second fragment for the same path and method replaces the first.
 */
public class SwaggerMerger {

    private static final Pattern COLON_PARAMETER = Pattern.compile(":([A-Za-z_][\\w-]*)");
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    static final String COLLECTION_PATH = "/{name}";
    static final String RESOURCE_PATH = "/{name}/{id}";

    /** {@code /users/:id} becomes {@code /users/{id}}; other text is left alone. */
    public static String normalize(String path) {
        if (path == null || path.isEmpty()) {
            return path;
        }
        return COLON_PARAMETER.matcher(path).replaceAll("{$1}");
    }

    public SwaggerDocument merge(SwaggerDocument document, JsonNode fragment) {
        if (fragment == null || !(fragment.get("paths") instanceof ObjectNode)) {
            return document;
        }
        ObjectNode paths = document.paths();
        Iterator<Map.Entry<String, JsonNode>> entries = fragment.get("paths").fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (!entry.getValue().isObject()) {
                continue;
            }
            ObjectNode methods = pathItem(paths, normalize(entry.getKey()));
            methods.setAll((ObjectNode) entry.getValue());
        }
        return document;
    }

    /**
     * Final cleanup once every fragment is merged: wildcard paths go, leftover colon keys
     * are re-keyed, then the collection/resource repairs are applied.
     */
    public SwaggerDocument postProcess(SwaggerDocument document) {
        ObjectNode paths = document.paths();
        paths.remove("/*");
        paths.remove("*");

        List<String> keys = new ArrayList<>();
        paths.fieldNames().forEachRemaining(keys::add);
        for (String original : keys) {
            String normalized = normalize(original);
            if (normalized.equals(original)) {
                continue;
            }
            JsonNode existing = paths.remove(original);
            if (existing instanceof ObjectNode) {
                pathItem(paths, normalized).setAll((ObjectNode) existing);
            }
        }

        repairCollectionCreate(operation(paths, COLLECTION_PATH, "post"));
        repairCollectionRead(operation(paths, COLLECTION_PATH, "get"));
        repairResourceDelete(operation(paths, RESOURCE_PATH, "delete"));
        return document;
    }

    private static ObjectNode pathItem(ObjectNode paths, String key) {
        JsonNode item = paths.get(key);
        if (item instanceof ObjectNode) {
            return (ObjectNode) item;
        }
        return paths.putObject(key);
    }

    private static ObjectNode operation(ObjectNode paths, String path, String method) {
        JsonNode item = paths.get(path);
        if (item == null) return null;
        JsonNode operation = item.get(method);
        return operation instanceof ObjectNode ? (ObjectNode) operation : null;
    }

    // Creation answers 201 with the best schema already described and an optional body.
    private void repairCollectionCreate(ObjectNode post) {
        if (post == null) return;
        if (post.get("requestBody") instanceof ObjectNode) {
            ((ObjectNode) post.get("requestBody")).put("required", false);
        }

        JsonNode schema = null;
        JsonNode responses = post.get("responses");
        if (responses != null) {
            for (String code : new String[]{"201", "200"}) {
                JsonNode candidate = responses.path(code).path("content").path("application/json").get("schema");
                if (candidate != null && !candidate.isNull() && !candidate.isEmpty()) {
                    schema = candidate;
                    break;
                }
            }
        }
        if (schema == null) {
            ObjectNode fallback = NODES.objectNode();
            fallback.put("type", "object");
            fallback.putObject("properties").putObject("id").put("type", "string");
            fallback.put("additionalProperties", true);
            schema = fallback;
        }

        ObjectNode repaired = post.putObject("responses");
        ObjectNode created = repaired.putObject("201");
        created.put("description", "Resource created successfully.");
        created.putObject("content").putObject("application/json").set("schema", schema);
        repaired.putObject("404").put("description", "Collection not found.");
    }

    private void repairCollectionRead(ObjectNode get) {
        if (get == null) return;
        if (get.get("responses") instanceof ObjectNode) {
            ((ObjectNode) get.get("responses")).remove("400");
        }
    }

    private void repairResourceDelete(ObjectNode delete) {
        if (delete == null || !delete.path("parameters").isArray()) return;
        for (JsonNode parameter : delete.get("parameters")) {
            if (parameter instanceof ObjectNode && "_dependent".equals(parameter.path("name").asText(null))) {
                ObjectNode schema = ((ObjectNode) parameter).putObject("schema");
                ArrayNode oneOf = schema.putArray("oneOf");
                oneOf.addObject().put("type", "string");
                ObjectNode array = oneOf.addObject();
                array.put("type", "array");
                array.putObject("items").put("type", "string");
                break;
            }
        }
    }
}
