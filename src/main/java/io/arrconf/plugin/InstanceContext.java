package io.arrconf.plugin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.arrconf.model.InstanceRef;
import io.arrconf.util.Jsons;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

public final class InstanceContext {
    private final InstanceRef ref;
    private final InstanceConnection connection;
    private final ObjectNode config;
    private final Duration requestTimeout;
    private final Function<InstanceRef, Optional<InstanceContext>> peers;
    private final Map<String, Object> rendered;
    private volatile InstanceSecrets secrets;

    public InstanceContext(
            InstanceRef ref,
            InstanceConnection connection,
            ObjectNode config,
            Duration requestTimeout,
            Function<InstanceRef, Optional<InstanceContext>> peers
    ) {
        this.ref = ref;
        this.connection = connection;
        this.config = config;
        this.requestTimeout = requestTimeout;
        this.peers = peers == null ? r -> Optional.empty() : peers;
        this.rendered = new ConcurrentHashMap<>();
    }

    public InstanceRef ref() {
        return ref;
    }

    public InstanceConnection connection() {
        return connection;
    }

    public ObjectNode config() {
        return config;
    }

    public JsonNode section(String name) {
        return Jsons.at(config, name);
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }

    public Optional<InstanceContext> peer(InstanceRef other) {
        return peers.apply(other);
    }

    public InstanceSecrets secrets() {
        if (secrets == null) {
            throw new IllegalStateException("Secrets not yet fetched for " + ref);
        }
        return secrets;
    }

    public void secrets(InstanceSecrets secrets) {
        this.secrets = secrets;
    }

    public void putRendered(String key, Object value) {
        rendered.put(key, value);
    }

    public <T> Optional<T> rendered(String key, Class<T> type) {
        Object value = rendered.get(key);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }
}
