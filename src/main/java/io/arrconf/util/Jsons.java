package io.arrconf.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.util.Iterator;
import java.util.Map;

public final class Jsons {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    private static final ObjectMapper COMPACT_MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .findAndRegisterModules();

    private Jsons() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static ObjectMapper yamlMapper() {
        return YAML_MAPPER;
    }

    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize JSON", e);
        }
    }

    public static String toCompactJson(Object value) {
        try {
            return COMPACT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize JSON", e);
        }
    }

    public static String toYaml(JsonNode value) {
        try {
            return YAML_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize YAML", e);
        }
    }

    // MissingNode when a segment is absent, NullNode for an explicit null.
    public static JsonNode at(JsonNode root, String dottedPath) {
        if (root == null) {
            return MissingNode.getInstance();
        }
        if (dottedPath == null || dottedPath.isBlank()) {
            return root;
        }
        JsonNode current = root;
        for (String segment : dottedPath.split("\\.")) {
            if (current == null || !current.isObject()) {
                return MissingNode.getInstance();
            }
            current = current.get(segment);
            if (current == null) {
                return MissingNode.getInstance();
            }
        }
        return current;
    }

    // Nested objects merge, anything else is replaced by the overlay value.
    public static ObjectNode deepMerge(ObjectNode base, JsonNode overlay) {
        ObjectNode merged = base == null ? MAPPER.createObjectNode() : base.deepCopy();
        if (overlay == null || !overlay.isObject()) {
            return merged;
        }
        Iterator<Map.Entry<String, JsonNode>> it = overlay.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            JsonNode existing = merged.get(entry.getKey());
            JsonNode value = entry.getValue();
            if (existing != null && existing.isObject() && value.isObject()) {
                merged.set(entry.getKey(), deepMerge((ObjectNode) existing, value));
            } else {
                merged.set(entry.getKey(), value.deepCopy());
            }
        }
        return merged;
    }
}
