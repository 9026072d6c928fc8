package io.arrconf.plugin;

public interface InstanceSecrets {
    boolean test();
}
