package io.arrconf.reconcile;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Locale;

public interface WireEnum {
    JsonNode wireValue();

    default String canonicalName() {
        return ((Enum<?>) this).name().toLowerCase(Locale.ROOT);
    }

    default List<String> aliases() {
        return List.of();
    }
}
