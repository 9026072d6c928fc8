package io.arrconf.reconcile;

public class AttributeMappingException extends RuntimeException {
    private final String path;

    public AttributeMappingException(String path, String message, Throwable cause) {
        super(path + ": " + message, cause);
        this.path = path;
    }

    public String path() {
        return path;
    }
}
