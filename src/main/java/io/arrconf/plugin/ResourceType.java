package io.arrconf.plugin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.arrconf.reconcile.AttributeMapping;
import io.arrconf.util.Jsons;

import java.util.List;

public interface ResourceType {
    String DELETE_UNMANAGED = "delete_unmanaged";

    String name();

    default JsonNode localSection(InstanceContext instance) {
        return instance.section(name());
    }

    JsonNode fetchRemote(InstanceContext instance);

    List<AttributeMapping> mappings(InstanceContext instance);

    default ObjectNode basePayload(JsonNode remote) {
        return remote != null && remote.isObject()
                ? ((ObjectNode) remote).deepCopy()
                : Jsons.mapper().createObjectNode();
    }

    void apply(InstanceContext instance, ObjectNode payload, JsonNode remote);

    default boolean deleteUnmanagedEnabled(InstanceContext instance) {
        return Jsons.at(localSection(instance), DELETE_UNMANAGED).asBoolean(false);
    }

    default List<RemoteItem> unmanaged(InstanceContext instance, JsonNode remote) {
        return List.of();
    }

    default void delete(InstanceContext instance, RemoteItem item) {
        throw new UnsupportedOperationException(name() + " does not support deleting remote items");
    }
}
