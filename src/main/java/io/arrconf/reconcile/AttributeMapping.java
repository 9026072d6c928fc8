package io.arrconf.reconcile;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.arrconf.util.Jsons;

import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.function.UnaryOperator;

// Renderers only write into the payload. The owning resource type sends it.
public final class AttributeMapping {
    private final String key;
    private final Function<JsonNode, JsonNode> localReader;
    private final Function<JsonNode, JsonNode> remoteReader;
    private final UnaryOperator<JsonNode> canonicalizer;
    private final BiPredicate<JsonNode, JsonNode> equality;
    private final BiConsumer<ObjectNode, JsonNode> renderer;

    private AttributeMapping(Builder builder) {
        this.key = builder.key;
        this.localReader = builder.localReader;
        this.remoteReader = builder.remoteReader;
        this.canonicalizer = builder.canonicalizer;
        this.equality = builder.equality;
        this.renderer = builder.renderer;
    }

    public static Builder builder(String key) {
        return new Builder(key);
    }

    public String key() {
        return key;
    }

    public JsonNode readLocal(JsonNode localSection) {
        JsonNode value = localReader.apply(localSection == null ? MissingNode.getInstance() : localSection);
        return value == null ? MissingNode.getInstance() : value;
    }

    public JsonNode readRemote(JsonNode remote) {
        JsonNode value = remoteReader.apply(remote == null ? MissingNode.getInstance() : remote);
        return value == null || value.isMissingNode() ? NullNode.getInstance() : value;
    }

    public JsonNode canonical(JsonNode raw) {
        return canonicalizer.apply(raw);
    }

    public boolean matches(JsonNode local, JsonNode remote) {
        return equality.test(local, remote);
    }

    public void render(ObjectNode payload, JsonNode newValue) {
        renderer.accept(payload, newValue);
    }

    public static final class Builder {
        private final String key;
        private Function<JsonNode, JsonNode> localReader;
        private Function<JsonNode, JsonNode> remoteReader;
        private UnaryOperator<JsonNode> canonicalizer = Canonicalizers.standard();
        private BiPredicate<JsonNode, JsonNode> equality = Equalities.exact();
        private String remoteField;
        private UnaryOperator<JsonNode> encoder = UnaryOperator.identity();
        private BiConsumer<ObjectNode, JsonNode> renderer;

        private Builder(String key) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("attribute key cannot be empty");
            }
            this.key = key;
            this.remoteField = key;
        }

        public Builder local(String dottedPath) {
            this.localReader = section -> Jsons.at(section, dottedPath);
            return this;
        }

        public Builder local(Function<JsonNode, JsonNode> reader) {
            this.localReader = Objects.requireNonNull(reader);
            return this;
        }

        public Builder remote(String field) {
            this.remoteField = Objects.requireNonNull(field);
            return this;
        }

        public Builder remote(Function<JsonNode, JsonNode> reader) {
            this.remoteReader = Objects.requireNonNull(reader);
            return this;
        }

        public Builder canonical(UnaryOperator<JsonNode> canonicalizer) {
            this.canonicalizer = Objects.requireNonNull(canonicalizer);
            return this;
        }

        public Builder equality(BiPredicate<JsonNode, JsonNode> equality) {
            this.equality = Objects.requireNonNull(equality);
            return this;
        }

        public Builder encoder(UnaryOperator<JsonNode> encoder) {
            this.encoder = Objects.requireNonNull(encoder);
            return this;
        }

        public Builder render(BiConsumer<ObjectNode, JsonNode> renderer) {
            this.renderer = Objects.requireNonNull(renderer);
            return this;
        }

        public AttributeMapping build() {
            String field = remoteField;
            if (localReader == null) {
                local(key);
            }
            if (remoteReader == null) {
                remoteReader = remote -> Jsons.at(remote, field);
            }
            if (renderer == null) {
                UnaryOperator<JsonNode> enc = encoder;
                renderer = (payload, value) -> setPath(payload, field, enc.apply(value));
            }
            return new AttributeMapping(this);
        }

        private static void setPath(ObjectNode payload, String dottedPath, JsonNode value) {
            String[] segments = dottedPath.split("\\.");
            ObjectNode current = payload;
            for (int i = 0; i < segments.length - 1; i++) {
                JsonNode next = current.get(segments[i]);
                if (next == null || !next.isObject()) {
                    next = current.putObject(segments[i]);
                }
                current = (ObjectNode) next;
            }
            current.set(segments[segments.length - 1], value);
        }
    }
}
