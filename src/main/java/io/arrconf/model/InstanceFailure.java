package io.arrconf.model;

public record InstanceFailure(
        InstanceRef instance,
        RunStage stage,
        FailureKind kind,
        String resource,
        String message
) {
}
