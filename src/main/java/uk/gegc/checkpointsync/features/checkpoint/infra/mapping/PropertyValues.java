package uk.gegc.checkpointsync.features.checkpoint.infra.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.jsonld.JsonLdPropertyValue;

import java.util.List;
import java.util.Optional;

/**
 * Lookups over schema.org {@code PropertyValue} lists.
 */
public final class PropertyValues {

    private PropertyValues() {
    }

    public static Optional<JsonNode> find(List<JsonLdPropertyValue> properties, String name) {
        if (properties == null) {
            return Optional.empty();
        }
        return properties.stream()
                .filter(property -> property != null && name.equals(property.name()))
                .map(JsonLdPropertyValue::value)
                .filter(value -> value != null && !value.isNull())
                .findFirst();
    }

    public static Optional<String> text(List<JsonLdPropertyValue> properties, String name) {
        return find(properties, name).map(PropertyValues::asText);
    }

    public static boolean bool(List<JsonLdPropertyValue> properties, String name, boolean fallback) {
        return find(properties, name).map(value -> value.asBoolean(fallback)).orElse(fallback);
    }

    public static Optional<Integer> integer(List<JsonLdPropertyValue> properties, String name) {
        return find(properties, name)
                .filter(JsonNode::isIntegralNumber)
                .map(JsonNode::asInt);
    }

    /**
     * Text form of a value: strings as they are, anything else as compact JSON.
     */
    public static String asText(JsonNode value) {
        return value.isTextual() ? value.asText() : value.toString();
    }
}
