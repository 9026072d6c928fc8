package io.arrconf.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.file.Path;
import java.util.List;

public record LoadedConfig(Path path, List<Path> files, ObjectNode tree, EngineSettings settings) {
    public LoadedConfig {
        files = List.copyOf(files);
    }

    public JsonNode section(String name) {
        JsonNode node = tree.get(name);
        return node == null ? tree.missingNode() : node;
    }
}
