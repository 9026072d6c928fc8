package io.arrconf.plugin.dummy;

import com.fasterxml.jackson.databind.JsonNode;
import io.arrconf.config.ConfigurationException;
import io.arrconf.model.InstanceRef;
import io.arrconf.plugin.InstanceConnection;
import io.arrconf.plugin.InstanceContext;
import io.arrconf.plugin.InstanceSecrets;
import io.arrconf.plugin.Plugin;
import io.arrconf.plugin.ResourceType;
import io.arrconf.plugin.SecretsException;
import io.arrconf.reconcile.Canonicalizers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Set;

public final class DummyPlugin implements Plugin {
    public static final String NAME = "dummy";
    public static final String VERSION = "0.1.0";
    public static final int DEFAULT_PORT = 5000;

    static final String SETTINGS = "settings";
    static final String TAGS = "tags";
    static final String UPSTREAM = "upstream";
    static final String UPSTREAM_ID = "upstream_id";
    static final String INITIALIZE_PATH = "/api/v1/initialize";
    static final String STATUS_PATH = "/api/v1/status";

    private static final Set<String> TOP_LEVEL_FIELDS =
            Set.of("hostname", "port", "protocol", "api_key", SETTINGS, TAGS);
    private static final Set<String> SETTINGS_FIELDS = Set.of("instance_name", "log_level", "enable_ssl", UPSTREAM);
    private static final Set<String> TAGS_FIELDS = Set.of(DummyTagsResource.DEFINITIONS, "delete_unmanaged");
    private static final Logger log = LoggerFactory.getLogger(DummyPlugin.class);

    private final List<ResourceType> resources = List.of(new DummySettingsResource(), new DummyTagsResource());

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String version() {
        return VERSION;
    }

    @Override
    public int defaultPort() {
        return DEFAULT_PORT;
    }

    @Override
    public void validate(InstanceRef instance, JsonNode config) {
        requireKnownFields(instance, config, "", TOP_LEVEL_FIELDS);

        JsonNode settings = config.path(SETTINGS);
        if (!settings.isMissingNode()) {
            requireObject(instance, settings, SETTINGS);
            requireKnownFields(instance, settings, SETTINGS + ".", SETTINGS_FIELDS);
            JsonNode name = settings.path("instance_name");
            if (!name.isMissingNode() && !name.isTextual()) {
                throw invalid(instance, "settings.instance_name must be a string");
            }
            JsonNode level = settings.path("log_level");
            if (!level.isMissingNode()) {
                try {
                    Canonicalizers.enumeration(DummyLogLevel.class).apply(level);
                } catch (IllegalArgumentException e) {
                    throw new ConfigurationException(
                            instance + ": invalid settings.log_level '" + level.asText()
                                    + "' (expected one of trace, debug, info, warn, error)",
                            List.of(instance), e);
                }
            }
            JsonNode ssl = settings.path("enable_ssl");
            if (!ssl.isMissingNode() && !ssl.isBoolean()) {
                throw invalid(instance, "settings.enable_ssl must be a boolean");
            }
            JsonNode upstream = settings.path(UPSTREAM);
            if (!upstream.isMissingNode() && !upstream.isNull() && !upstream.isTextual()) {
                throw invalid(instance, "settings.upstream must be the name of a dummy instance");
            }
        }

        JsonNode tags = config.path(TAGS);
        if (!tags.isMissingNode()) {
            requireObject(instance, tags, TAGS);
            requireKnownFields(instance, tags, TAGS + ".", TAGS_FIELDS);
            JsonNode definitions = tags.path(DummyTagsResource.DEFINITIONS);
            if (!definitions.isMissingNode()) {
                if (!definitions.isArray()) {
                    throw invalid(instance, "tags.definitions must be a list");
                }
                for (JsonNode label : definitions) {
                    if (!label.isTextual() || label.asText().isBlank()) {
                        throw invalid(instance, "tags.definitions entries must be non-empty strings");
                    }
                }
            }
            JsonNode deleteUnmanaged = tags.path("delete_unmanaged");
            if (!deleteUnmanaged.isMissingNode() && !deleteUnmanaged.isBoolean()) {
                throw invalid(instance, "tags.delete_unmanaged must be a boolean");
            }
        }
    }

    @Override
    public List<InstanceRef> instanceLinks(InstanceRef instance, JsonNode config) {
        JsonNode upstream = config.path(SETTINGS).path(UPSTREAM);
        if (!upstream.isTextual()) {
            return List.of();
        }
        return List.of(InstanceRef.of(NAME, upstream.asText()));
    }

    @Override
    public void initialize(InstanceContext instance) {
        DummyApiClient client = new DummyApiClient(
                instance.connection().baseUrl(), instance.connection().apiKey(), instance.requestTimeout());
        JsonNode state = client.get(INITIALIZE_PATH);
        if (state.path("initialized").asBoolean(false)) {
            log.debug("Instance already initialised");
            return;
        }
        log.info("Initialising instance");
        client.post(INITIALIZE_PATH, null);
        log.info("Finished initialising instance");
    }

    @Override
    public void renderPostInit(InstanceContext instance) {
        JsonNode upstream = instance.section(SETTINGS).path(UPSTREAM);
        if (!upstream.isTextual()) {
            return;
        }
        InstanceRef target = InstanceRef.of(NAME, upstream.asText());
        InstanceContext peer = instance.peer(target)
                .orElseThrow(() -> new IllegalStateException("Upstream instance " + target + " is not available"));
        String key = resolveApiKey(peer.connection(), peer.requestTimeout());
        JsonNode status = new DummyApiClient(peer.connection().baseUrl(), key, peer.requestTimeout()).get(STATUS_PATH);
        String upstreamId = status.path("instanceId").asText(null);
        if (upstreamId == null) {
            throw new IllegalStateException("Upstream instance " + target + " did not report an instanceId");
        }
        instance.putRendered(UPSTREAM_ID, upstreamId);
        log.debug("Resolved upstream {} to instance id '{}'", target, upstreamId);
    }

    @Override
    public InstanceSecrets fetchSecrets(InstanceContext instance) {
        InstanceConnection connection = instance.connection();
        String key = resolveApiKey(connection, instance.requestTimeout());
        if (key == null) {
            throw new SecretsException("API key is required but was not configured or discoverable for " + instance.ref());
        }
        DummySecrets secrets = new DummySecrets(connection.baseUrl(), key, instance.requestTimeout());
        if (!secrets.test()) {
            throw new SecretsException("Connection test failed for " + instance.ref() + " at " + connection.baseUrl());
        }
        return secrets;
    }

    @Override
    public void validateOffline(InstanceContext instance) {
        JsonNode upstream = instance.section(SETTINGS).path(UPSTREAM);
        if (!upstream.isTextual()) {
            return;
        }
        InstanceRef target = InstanceRef.of(NAME, upstream.asText());
        if (target.equals(instance.ref())) {
            throw new ConfigurationException(instance.ref() + ": settings.upstream cannot refer to itself",
                    List.of(instance.ref()));
        }
        if (instance.peer(target).isEmpty()) {
            throw new ConfigurationException(instance.ref() + ": upstream instance " + target + " is not defined",
                    List.of(instance.ref()));
        }
    }

    @Override
    public List<ResourceType> resourceTypes() {
        return resources;
    }

    static DummyApiClient client(InstanceContext instance) {
        DummySecrets secrets = (DummySecrets) instance.secrets();
        return secrets.client();
    }

    private static String resolveApiKey(InstanceConnection connection, Duration timeout) {
        if (connection.apiKey() != null && !connection.apiKey().isBlank()) {
            return connection.apiKey();
        }
        JsonNode state = new DummyApiClient(connection.baseUrl(), null, timeout).get(INITIALIZE_PATH);
        return state.path("apiKey").asText(null);
    }

    private static void requireObject(InstanceRef instance, JsonNode node, String path) {
        if (!node.isObject()) {
            throw invalid(instance, path + " must be a mapping");
        }
    }

    private static void requireKnownFields(InstanceRef instance, JsonNode node, String prefix, Set<String> known) {
        for (var it = node.fieldNames(); it.hasNext(); ) {
            String field = it.next();
            if (!known.contains(field)) {
                throw invalid(instance, "unknown field '" + prefix + field + "'");
            }
        }
    }

    private static ConfigurationException invalid(InstanceRef instance, String message) {
        return new ConfigurationException(instance + ": " + message, List.of(instance));
    }
}
