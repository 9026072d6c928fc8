package io.arrconf.model;

public record InstanceLink(InstanceRef source, InstanceRef target) {
}
