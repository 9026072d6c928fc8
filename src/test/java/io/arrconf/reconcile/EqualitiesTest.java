package io.arrconf.reconcile;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.arrconf.util.Jsons;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EqualitiesTest {
    private static JsonNode json(String raw) throws Exception {
        return Jsons.mapper().readTree(raw);
    }

    @Test
    void exactComparesStructurally() throws Exception {
        assertTrue(Equalities.exact().test(json("{\"a\":[1,2]}"), json("{\"a\":[1,2]}")));
        assertFalse(Equalities.exact().test(json("[1,2]"), json("[2,1]")));
    }

    @Test
    void unorderedIgnoresOrderAndRepeats() throws Exception {
        assertTrue(Equalities.unordered().test(json("[1,2,2]"), json("[2,1]")));
        assertFalse(Equalities.unordered().test(json("[1,2]"), json("[1,2,3]")));
        assertTrue(Equalities.unordered().test(NullNode.getInstance(), json("[]")));
    }

    @Test
    void remoteContainsAllToleratesRemoteExtras() throws Exception {
        assertTrue(Equalities.remoteContainsAll().test(json("[\"a\"]"), json("[\"a\",\"b\"]")));
        assertFalse(Equalities.remoteContainsAll().test(json("[\"a\",\"c\"]"), json("[\"a\",\"b\"]")));
        assertTrue(Equalities.remoteContainsAll().test(json("[]"), NullNode.getInstance()));
    }
}
