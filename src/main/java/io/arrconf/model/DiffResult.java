package io.arrconf.model;

import java.util.List;

public record DiffResult(InstanceRef instance, List<ResourceDiff> resources) {
    public DiffResult {
        resources = resources == null ? List.of() : List.copyOf(resources);
    }

    public boolean requiresUpdate() {
        return resources.stream().anyMatch(ResourceDiff::changed);
    }

    public List<AttributeChange> changes() {
        return resources.stream().flatMap(r -> r.changes().stream()).toList();
    }
}
