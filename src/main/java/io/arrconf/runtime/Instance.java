package io.arrconf.runtime;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.arrconf.model.InstanceRef;
import io.arrconf.plugin.InstanceConnection;
import io.arrconf.plugin.Plugin;

public record Instance(InstanceRef ref, Plugin plugin, InstanceConnection connection, ObjectNode config) {
}
