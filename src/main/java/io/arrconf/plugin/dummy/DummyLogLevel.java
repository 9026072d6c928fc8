package io.arrconf.plugin.dummy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import io.arrconf.reconcile.WireEnum;

import java.util.List;

public enum DummyLogLevel implements WireEnum {
    TRACE(0),
    DEBUG(1),
    INFO(2),
    WARN(3, "warning"),
    ERROR(4);

    private final int wire;
    private final List<String> aliases;

    DummyLogLevel(int wire, String... aliases) {
        this.wire = wire;
        this.aliases = List.of(aliases);
    }

    @Override
    public JsonNode wireValue() {
        return IntNode.valueOf(wire);
    }

    @Override
    public List<String> aliases() {
        return aliases;
    }
}
