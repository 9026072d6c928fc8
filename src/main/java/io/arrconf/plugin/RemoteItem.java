package io.arrconf.plugin;

public record RemoteItem(String id, String label) {
}
