package io.arrconf.plugin.dummy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.arrconf.plugin.InstanceContext;
import io.arrconf.plugin.RemoteItem;
import io.arrconf.plugin.ResourceType;
import io.arrconf.reconcile.AttributeMapping;
import io.arrconf.reconcile.Canonicalizers;
import io.arrconf.reconcile.Equalities;
import io.arrconf.util.Jsons;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

final class DummyTagsResource implements ResourceType {
    static final String PATH = "/api/v1/tag";
    static final String DEFINITIONS = "definitions";

    @Override
    public String name() {
        return DummyPlugin.TAGS;
    }

    @Override
    public JsonNode fetchRemote(InstanceContext instance) {
        JsonNode tags = DummyPlugin.client(instance).get(PATH);
        return tags.isArray() ? tags : Jsons.mapper().createArrayNode();
    }

    @Override
    public List<AttributeMapping> mappings(InstanceContext instance) {
        return List.of(
                AttributeMapping.builder(DEFINITIONS)
                        .remote(DummyTagsResource::labels)
                        .canonical(Canonicalizers.textSet())
                        .equality(Equalities.remoteContainsAll())
                        .render((payload, value) -> payload.set("labels", value))
                        .build()
        );
    }

    @Override
    public ObjectNode basePayload(JsonNode remote) {
        return Jsons.mapper().createObjectNode();
    }

    @Override
    public void apply(InstanceContext instance, ObjectNode payload, JsonNode remote) {
        Set<String> existing = new HashSet<>();
        labels(remote).forEach(label -> existing.add(label.asText()));
        ArrayNode missing = Jsons.mapper().createArrayNode();
        for (JsonNode label : payload.path("labels")) {
            if (!existing.contains(label.asText())) {
                missing.add(label.asText());
            }
        }
        if (missing.isEmpty()) {
            return;
        }
        ObjectNode body = Jsons.mapper().createObjectNode();
        body.set("labels", missing);
        DummyPlugin.client(instance).post(PATH, body);
    }

    @Override
    public List<RemoteItem> unmanaged(InstanceContext instance, JsonNode remote) {
        Set<String> declared = new HashSet<>();
        for (JsonNode label : localSection(instance).path(DEFINITIONS)) {
            declared.add(label.asText());
        }
        List<RemoteItem> out = new ArrayList<>();
        for (JsonNode tag : remote) {
            String label = tag.path("label").asText();
            if (!declared.contains(label)) {
                out.add(new RemoteItem(tag.path("id").asText(), label));
            }
        }
        return out;
    }

    @Override
    public void delete(InstanceContext instance, RemoteItem item) {
        DummyPlugin.client(instance).delete(PATH + "/" + item.id());
    }

    private static JsonNode labels(JsonNode remote) {
        ArrayNode out = Jsons.mapper().createArrayNode();
        if (remote != null && remote.isArray()) {
            for (JsonNode tag : remote) {
                out.add(tag.path("label").asText());
            }
        }
        return out;
    }
}
