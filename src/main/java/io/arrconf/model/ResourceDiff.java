package io.arrconf.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

public record ResourceDiff(String resource, List<AttributeChange> changes, ObjectNode payload) {
    public ResourceDiff {
        changes = changes == null ? List.of() : List.copyOf(changes);
    }

    public boolean changed() {
        return !changes.isEmpty();
    }
}
