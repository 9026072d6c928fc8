package io.arrconf.plugin;

import io.arrconf.config.ConfigurationException;
import io.arrconf.plugin.dummy.DummyPlugin;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginRegistryTest {
    @Test
    void builtinRegistryHasTheDummyPlugin() {
        PluginRegistry registry = PluginRegistry.builtin();

        assertTrue(registry.isInstalled(DummyPlugin.NAME));
        assertEquals(List.of(DummyPlugin.NAME), List.copyOf(registry.names()));
        assertEquals(DummyPlugin.VERSION, registry.findByName(DummyPlugin.NAME).orElseThrow().version());
    }

    @Test
    void duplicateRegistrationIsRejected() {
        PluginRegistry registry = PluginRegistry.builtin();

        assertThrows(IllegalArgumentException.class, () -> registry.register(new DummyPlugin()));
    }

    @Test
    void selectFiltersAndRejectsUnknownNames() {
        PluginRegistry registry = PluginRegistry.builtin();

        assertEquals(1, registry.select(null).size());
        assertEquals(1, registry.select(Set.of()).size());
        assertEquals(DummyPlugin.NAME, registry.select(Set.of(DummyPlugin.NAME)).get(0).name());

        ConfigurationException error = assertThrows(ConfigurationException.class,
                () -> registry.select(Set.of("sonarr")));
        assertEquals("Plugin 'sonarr' not installed", error.getMessage());
    }
}
