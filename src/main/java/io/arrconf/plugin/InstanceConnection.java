package io.arrconf.plugin;

public record InstanceConnection(String hostname, int port, String protocol, String apiKey) {
    public String baseUrl() {
        return protocol + "://" + hostname + ":" + port;
    }

    @Override
    public String toString() {
        return "InstanceConnection[url=" + baseUrl() + ", apiKey=" + (apiKey == null ? "null" : "***") + "]";
    }
}
