package io.arrconf.plugin;

import com.fasterxml.jackson.databind.JsonNode;
import io.arrconf.model.InstanceRef;

import java.util.List;

public interface Plugin {
    String name();

    String version();

    default String defaultHostname() {
        return "localhost";
    }

    int defaultPort();

    default String defaultProtocol() {
        return "http";
    }

    default void validate(InstanceRef instance, JsonNode config) {
    }

    default List<InstanceRef> instanceLinks(InstanceRef instance, JsonNode config) {
        return List.of();
    }

    default void renderPreInit(List<InstanceContext> instances) {
    }

    default void initialize(InstanceContext instance) {
    }

    default void renderPostInit(InstanceContext instance) {
    }

    default void validateOffline(InstanceContext instance) {
    }

    InstanceSecrets fetchSecrets(InstanceContext instance);

    List<ResourceType> resourceTypes();
}
