package io.arrconf.model;

public enum FailureKind {
    CONNECTIVITY,
    REMOTE_API,
    INTERNAL
}
