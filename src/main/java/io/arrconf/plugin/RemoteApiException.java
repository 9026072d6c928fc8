package io.arrconf.plugin;

public class RemoteApiException extends RuntimeException {
    private final int status;

    public RemoteApiException(String message) {
        this(message, -1, null);
    }

    public RemoteApiException(String message, int status) {
        this(message, status, null);
    }

    public RemoteApiException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public int status() {
        return status;
    }
}
