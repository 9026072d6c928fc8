package io.arrconf.config;

import io.arrconf.model.InstanceRef;

import java.util.List;

public class ConfigurationException extends RuntimeException {
    private final List<InstanceRef> instances;

    public ConfigurationException(String message) {
        this(message, List.of(), null);
    }

    public ConfigurationException(String message, Throwable cause) {
        this(message, List.of(), cause);
    }

    public ConfigurationException(String message, List<InstanceRef> instances) {
        this(message, instances, null);
    }

    public ConfigurationException(String message, List<InstanceRef> instances, Throwable cause) {
        super(message, cause);
        this.instances = instances == null ? List.of() : List.copyOf(instances);
    }

    public List<InstanceRef> instances() {
        return instances;
    }
}
