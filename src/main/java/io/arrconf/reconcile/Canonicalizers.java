package io.arrconf.reconcile;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.arrconf.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.UnaryOperator;

public final class Canonicalizers {
    private Canonicalizers() {
    }

    // YAML and JSON may pick different integer widths.
    public static UnaryOperator<JsonNode> standard() {
        return Canonicalizers::normalizeNumbers;
    }

    public static UnaryOperator<JsonNode> trimmedText() {
        return value -> value != null && value.isTextual() ? TextNode.valueOf(value.asText().trim()) : value;
    }

    public static UnaryOperator<JsonNode> textSet() {
        return value -> {
            if (value == null || !value.isArray()) {
                return value;
            }
            TreeSet<String> sorted = new TreeSet<>();
            for (JsonNode item : value) {
                sorted.add(item.asText());
            }
            ArrayNode out = Jsons.mapper().createArrayNode();
            sorted.forEach(out::add);
            return out;
        };
    }

    public static <E extends Enum<E> & WireEnum> UnaryOperator<JsonNode> enumeration(Class<E> type) {
        Map<String, E> byText = new TreeMap<>();
        for (E constant : type.getEnumConstants()) {
            byText.put(constant.name().toLowerCase(Locale.ROOT), constant);
            byText.put(constant.canonicalName().toLowerCase(Locale.ROOT), constant);
            for (String alias : constant.aliases()) {
                byText.put(alias.toLowerCase(Locale.ROOT), constant);
            }
        }
        return value -> {
            if (value == null || value.isMissingNode() || value.isNull()) {
                return value;
            }
            E resolved = null;
            if (value.isTextual()) {
                resolved = byText.get(value.asText().trim().toLowerCase(Locale.ROOT));
            }
            if (resolved == null) {
                JsonNode normalized = normalizeNumbers(value);
                for (E constant : type.getEnumConstants()) {
                    if (normalizeNumbers(constant.wireValue()).equals(normalized)) {
                        resolved = constant;
                        break;
                    }
                }
            }
            if (resolved == null) {
                throw new IllegalArgumentException(
                        "Unknown " + type.getSimpleName() + " value: " + value);
            }
            return TextNode.valueOf(resolved.canonicalName());
        };
    }

    public static <E extends Enum<E> & WireEnum> UnaryOperator<JsonNode> enumerationWire(Class<E> type) {
        UnaryOperator<JsonNode> canonical = enumeration(type);
        return value -> {
            JsonNode name = canonical.apply(value);
            if (name == null || !name.isTextual()) {
                return name;
            }
            for (E constant : type.getEnumConstants()) {
                if (constant.canonicalName().equals(name.asText())) {
                    return constant.wireValue();
                }
            }
            return name;
        };
    }

    static JsonNode normalizeNumbers(JsonNode value) {
        if (value == null) {
            return null;
        }
        if (value.isIntegralNumber() && value.canConvertToLong()) {
            return LongNode.valueOf(value.longValue());
        }
        if (value.isFloatingPointNumber()) {
            double d = value.doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < Long.MAX_VALUE) {
                return LongNode.valueOf((long) d);
            }
            return DoubleNode.valueOf(d);
        }
        if (value.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode item : value) {
                out.add(normalizeNumbers(item));
            }
            return out;
        }
        if (value.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = value.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                out.set(entry.getKey(), normalizeNumbers(entry.getValue()));
            }
            return out;
        }
        return value;
    }
}
