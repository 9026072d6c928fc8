package io.arrconf.plugin.dummy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.arrconf.plugin.InstanceContext;
import io.arrconf.plugin.ResourceType;
import io.arrconf.reconcile.AttributeMapping;
import io.arrconf.reconcile.Canonicalizers;

import java.util.List;

final class DummySettingsResource implements ResourceType {
    static final String PATH = "/api/v1/settings";

    @Override
    public String name() {
        return DummyPlugin.SETTINGS;
    }

    @Override
    public JsonNode fetchRemote(InstanceContext instance) {
        return DummyPlugin.client(instance).get(PATH);
    }

    @Override
    public List<AttributeMapping> mappings(InstanceContext instance) {
        return List.of(
                AttributeMapping.builder("instance_name")
                        .remote("instanceName")
                        .canonical(Canonicalizers.trimmedText())
                        .build(),
                AttributeMapping.builder("log_level")
                        .remote("logLevel")
                        .canonical(Canonicalizers.enumeration(DummyLogLevel.class))
                        .encoder(Canonicalizers.enumerationWire(DummyLogLevel.class))
                        .build(),
                AttributeMapping.builder("enable_ssl")
                        .remote("enableSsl")
                        .build(),
                // Resolved from the upstream instance's remote id after initialisation.
                AttributeMapping.builder(DummyPlugin.UPSTREAM)
                        .local(section -> {
                            JsonNode declared = section.path(DummyPlugin.UPSTREAM);
                            if (declared.isMissingNode() || declared.isNull()) {
                                return declared;
                            }
                            return instance.rendered(DummyPlugin.UPSTREAM_ID, String.class)
                                    .<JsonNode>map(TextNode::valueOf)
                                    .orElse(MissingNode.getInstance());
                        })
                        .remote("upstreamId")
                        .build()
        );
    }

    @Override
    public void apply(InstanceContext instance, ObjectNode payload, JsonNode remote) {
        DummyPlugin.client(instance).put(PATH, payload);
    }
}
