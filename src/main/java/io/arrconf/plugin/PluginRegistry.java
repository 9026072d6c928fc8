package io.arrconf.plugin;

import io.arrconf.config.ConfigurationException;
import io.arrconf.plugin.dummy.DummyPlugin;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

public final class PluginRegistry {
    private final Map<String, Plugin> plugins = new TreeMap<>();

    public static PluginRegistry builtin() {
        PluginRegistry registry = new PluginRegistry();
        registry.register(new DummyPlugin());
        return registry;
    }

    public PluginRegistry register(Plugin plugin) {
        if (plugins.putIfAbsent(plugin.name(), plugin) != null) {
            throw new IllegalArgumentException("Plugin already registered: " + plugin.name());
        }
        return this;
    }

    public Optional<Plugin> findByName(String name) {
        return Optional.ofNullable(plugins.get(name));
    }

    public boolean isInstalled(String name) {
        return plugins.containsKey(name);
    }

    public Collection<String> names() {
        return plugins.keySet();
    }

    public Collection<Plugin> all() {
        return plugins.values();
    }

    public List<Plugin> select(Set<String> requested) {
        if (requested == null || requested.isEmpty()) {
            return new ArrayList<>(plugins.values());
        }
        List<Plugin> selected = new ArrayList<>();
        for (String name : new TreeSet<>(requested)) {
            Plugin plugin = plugins.get(name);
            if (plugin == null) {
                throw new ConfigurationException("Plugin '" + name + "' not installed");
            }
            selected.add(plugin);
        }
        return selected;
    }
}
