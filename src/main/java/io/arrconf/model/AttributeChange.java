package io.arrconf.model;

import com.fasterxml.jackson.databind.JsonNode;

public record AttributeChange(String path, JsonNode oldValue, JsonNode newValue) {
    @Override
    public String toString() {
        return path + ": " + oldValue + " -> " + newValue;
    }
}
