package io.arrconf.model;

import java.util.Comparator;

public record InstanceRef(String pluginName, String instanceName) implements Comparable<InstanceRef> {
    public static final String DEFAULT_INSTANCE = "default";

    private static final Comparator<InstanceRef> ORDER = Comparator
            .comparing(InstanceRef::pluginName)
            .thenComparing(InstanceRef::instanceName);

    public InstanceRef {
        if (pluginName == null || pluginName.isBlank()) {
            throw new IllegalArgumentException("plugin name cannot be empty");
        }
        if (instanceName == null || instanceName.isBlank()) {
            instanceName = DEFAULT_INSTANCE;
        }
    }

    public static InstanceRef of(String pluginName, String instanceName) {
        return new InstanceRef(pluginName, instanceName);
    }

    @Override
    public int compareTo(InstanceRef other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return pluginName + ".instances['" + instanceName + "']";
    }
}
