package io.arrconf.reconcile;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiPredicate;

public final class Equalities {
    private Equalities() {
    }

    public static BiPredicate<JsonNode, JsonNode> exact() {
        return Objects::equals;
    }

    public static BiPredicate<JsonNode, JsonNode> unordered() {
        return (local, remote) -> asSet(local).equals(asSet(remote));
    }

    // Remote extras are left alone.
    public static BiPredicate<JsonNode, JsonNode> remoteContainsAll() {
        return (local, remote) -> asSet(remote).containsAll(asSet(local));
    }

    private static Set<JsonNode> asSet(JsonNode node) {
        Set<JsonNode> out = new HashSet<>();
        if (node == null || node.isMissingNode() || node.isNull()) {
            return out;
        }
        if (node.isArray()) {
            node.forEach(out::add);
        } else {
            out.add(node);
        }
        return out;
    }
}
