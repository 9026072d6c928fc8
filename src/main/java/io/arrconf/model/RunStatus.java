package io.arrconf.model;

public enum RunStatus {
    SUCCESS(0),
    PARTIAL_FAILURE(1),
    FATAL(2),
    CANCELLED(3);

    private final int exitCode;

    RunStatus(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
