package io.arrconf.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.arrconf.config.ConfigLoader;
import io.arrconf.config.ConfigurationException;
import io.arrconf.config.EngineSettings;
import io.arrconf.config.LoadedConfig;
import io.arrconf.model.InstanceLink;
import io.arrconf.model.InstanceRef;
import io.arrconf.plugin.InstanceConnection;
import io.arrconf.plugin.Plugin;
import io.arrconf.plugin.PluginRegistry;
import io.arrconf.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

public final class InstanceRegistry {
    public static final String INSTANCES = "instances";
    private static final Set<String> RESERVED_SECTIONS = Set.of(EngineSettings.SECTION, ConfigLoader.INCLUDES);
    private static final Logger log = LoggerFactory.getLogger(InstanceRegistry.class);

    private final Map<InstanceRef, Instance> instances;
    private final List<InstanceLink> links;
    private final List<String> activePlugins;

    private InstanceRegistry(Map<InstanceRef, Instance> instances, List<InstanceLink> links, List<String> activePlugins) {
        this.instances = instances;
        this.links = links;
        this.activePlugins = activePlugins;
    }

    public static InstanceRegistry build(LoadedConfig config, PluginRegistry plugins, Set<String> usePlugins) {
        List<Plugin> selected = plugins.select(usePlugins);
        Iterator<String> sections = config.tree().fieldNames();
        while (sections.hasNext()) {
            String section = sections.next();
            if (RESERVED_SECTIONS.contains(section)) {
                continue;
            }
            if (!plugins.isInstalled(section)) {
                throw new ConfigurationException("Configuration defined for plugin '" + section + "', which is not installed");
            }
        }

        Map<InstanceRef, Instance> instances = new TreeMap<>();
        List<String> active = new ArrayList<>();
        for (Plugin plugin : selected) {
            JsonNode section = config.section(plugin.name());
            if (section.isMissingNode() || section.isNull()) {
                log.debug("No configuration defined for plugin '{}', skipping", plugin.name());
                continue;
            }
            if (!section.isObject()) {
                throw new ConfigurationException("Configuration for plugin '" + plugin.name() + "' must be a mapping");
            }
            active.add(plugin.name());
            for (Instance instance : resolvePlugin(plugin, (ObjectNode) section)) {
                instances.put(instance.ref(), instance);
            }
        }
        if (active.isEmpty()) {
            throw new ConfigurationException("No configuration defined for any selected plugin");
        }

        List<InstanceLink> links = new ArrayList<>();
        for (Instance instance : instances.values()) {
            for (InstanceRef target : instance.plugin().instanceLinks(instance.ref(), instance.config())) {
                links.add(new InstanceLink(instance.ref(), target));
            }
        }
        return new InstanceRegistry(instances, List.copyOf(links), List.copyOf(active));
    }

    static List<Instance> resolvePlugin(Plugin plugin, ObjectNode section) {
        ObjectNode global = section.deepCopy();
        JsonNode declared = global.remove(INSTANCES);
        List<Instance> out = new ArrayList<>();
        if (declared == null || declared.isNull() || declared.isEmpty()) {
            out.add(resolveInstance(plugin, InstanceRef.DEFAULT_INSTANCE, global));
            return out;
        }
        if (!declared.isObject()) {
            throw new ConfigurationException("'" + plugin.name() + "." + INSTANCES + "' must be a mapping");
        }
        Map<String, JsonNode> named = new LinkedHashMap<>();
        declared.fields().forEachRemaining(e -> named.put(e.getKey(), e.getValue()));
        for (Map.Entry<String, JsonNode> entry : named.entrySet()) {
            String name = entry.getKey();
            if (InstanceRef.DEFAULT_INSTANCE.equals(name)) {
                throw new ConfigurationException(
                        "Instance name '" + InstanceRef.DEFAULT_INSTANCE + "' is reserved: "
                                + plugin.name() + "." + INSTANCES + "['" + name + "']",
                        List.of(InstanceRef.of(plugin.name(), name))
                );
            }
            if (name.isBlank()) {
                throw new ConfigurationException("Instance names under '" + plugin.name() + "' cannot be empty");
            }
            JsonNode overrides = entry.getValue();
            if (overrides != null && !overrides.isNull() && !overrides.isObject()) {
                throw new ConfigurationException(
                        "Configuration for " + InstanceRef.of(plugin.name(), name) + " must be a mapping");
            }
            ObjectNode merged = Jsons.deepMerge(global, overrides);
            // An instance without its own hostname is addressed by its name.
            if (overrides == null || !overrides.has("hostname")) {
                merged.put("hostname", name);
            }
            out.add(resolveInstance(plugin, name, merged));
        }
        return out;
    }

    private static Instance resolveInstance(Plugin plugin, String name, ObjectNode config) {
        InstanceRef ref = InstanceRef.of(plugin.name(), name);
        InstanceConnection connection = connection(plugin, ref, config);
        plugin.validate(ref, config);
        return new Instance(ref, plugin, connection, config);
    }

    private static InstanceConnection connection(Plugin plugin, InstanceRef ref, JsonNode config) {
        String hostname = config.path("hostname").asText(plugin.defaultHostname());
        if (hostname == null || hostname.isBlank()) {
            throw new ConfigurationException(ref + ": 'hostname' cannot be empty", List.of(ref));
        }
        JsonNode portNode = config.path("port");
        int port = plugin.defaultPort();
        if (!portNode.isMissingNode()) {
            if (!portNode.canConvertToInt() || !portNode.isIntegralNumber()) {
                throw new ConfigurationException(ref + ": 'port' must be an integer", List.of(ref));
            }
            port = portNode.intValue();
        }
        if (port < 1 || port > 65535) {
            throw new ConfigurationException(ref + ": 'port' must be between 1 and 65535, got " + port, List.of(ref));
        }
        String protocol = config.path("protocol").asText(plugin.defaultProtocol()).toLowerCase(Locale.ROOT);
        if (!protocol.equals("http") && !protocol.equals("https")) {
            throw new ConfigurationException(ref + ": 'protocol' must be 'http' or 'https', got '" + protocol + "'", List.of(ref));
        }
        JsonNode apiKey = config.path("api_key");
        String key = apiKey.isMissingNode() || apiKey.isNull() ? null : apiKey.asText();
        return new InstanceConnection(hostname, port, protocol, key);
    }

    public Collection<Instance> instances() {
        return instances.values();
    }

    public Instance get(InstanceRef ref) {
        Instance instance = instances.get(ref);
        if (instance == null) {
            throw new IllegalArgumentException("Unknown instance: " + ref);
        }
        return instance;
    }

    public boolean contains(InstanceRef ref) {
        return instances.containsKey(ref);
    }

    public List<InstanceLink> links() {
        return links;
    }

    public List<String> activePlugins() {
        return activePlugins;
    }

    public boolean isPluginActive(String pluginName) {
        return activePlugins.contains(pluginName);
    }
}
