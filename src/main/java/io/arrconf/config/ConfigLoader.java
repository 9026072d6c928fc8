package io.arrconf.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.arrconf.security.SensitiveDataMasker;
import io.arrconf.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class ConfigLoader {
    public static final String INCLUDES = "includes";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public LoadedConfig load(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        log.info("Loading configuration file '{}'", absolute);
        List<Path> files = new ArrayList<>();
        List<ObjectNode> documents = new ArrayList<>();
        collect(absolute, files, documents, new LinkedHashSet<>());

        log.debug("Merging configuration objects in order of file precedence:");
        ObjectNode merged = Jsons.mapper().createObjectNode();
        for (int i = 0; i < files.size(); i++) {
            log.debug("  - {}", files.get(i));
            merged = Jsons.deepMerge(merged, documents.get(i));
        }
        if (log.isDebugEnabled()) {
            log.debug("Loaded configuration:\n{}", SensitiveDataMasker.maskedYaml(merged));
        }
        EngineSettings settings = EngineSettings.fromNode(merged.get(EngineSettings.SECTION));
        log.info("Finished loading configuration file");
        return new LoadedConfig(absolute, files, merged, settings);
    }

    private void collect(Path path, List<Path> files, List<ObjectNode> documents, Set<Path> chain) {
        if (!chain.add(path)) {
            throw new ConfigurationException("Configuration file include cycle detected at '" + path + "'");
        }
        ObjectNode document = read(path);
        JsonNode includes = document.remove(INCLUDES);
        files.add(path);
        documents.add(document);

        if (includes != null && !includes.isNull()) {
            if (!includes.isArray()) {
                throw new ConfigurationException(
                        "Error while loading configuration file '" + path + "': "
                                + "Invalid value type for '" + INCLUDES + "' (expected a list)"
                );
            }
            for (JsonNode include : includes) {
                Path target = Path.of(include.asText());
                Path resolved = target.isAbsolute()
                        ? target.normalize()
                        : path.getParent().resolve(target).toAbsolutePath().normalize();
                log.debug("Including configuration file '{}' from '{}'", resolved, path);
                collect(resolved, files, documents, chain);
            }
        }
        chain.remove(path);
    }

    private ObjectNode read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Configuration file not found: " + path);
        }
        String raw;
        try {
            raw = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration file: " + path, e);
        }
        if (raw.isBlank()) {
            return Jsons.mapper().createObjectNode();
        }
        JsonNode node;
        try {
            node = Jsons.yamlMapper().readTree(raw);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException(
                    "Error while loading configuration file '" + path + "': " + e.getOriginalMessage(), e);
        }
        if (node == null || node.isMissingNode() || node.isNull()) {
            return Jsons.mapper().createObjectNode();
        }
        if (!node.isObject()) {
            throw new ConfigurationException(
                    "Error while loading configuration file '" + path + "': "
                            + "Invalid configuration object type (got '" + node.getNodeType() + "', expected a mapping)"
            );
        }
        return (ObjectNode) node;
    }
}
