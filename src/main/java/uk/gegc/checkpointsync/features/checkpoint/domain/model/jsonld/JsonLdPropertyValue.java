package uk.gegc.checkpointsync.features.checkpoint.domain.model.jsonld;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.TextNode;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"@type", "name", "value"})
public record JsonLdPropertyValue(
        @JsonProperty("@type") String type,
        @JsonProperty("name") String name,
        @JsonProperty("value") JsonNode value
) {
    public static final String TYPE = "PropertyValue";

    public static JsonLdPropertyValue of(String name, JsonNode value) {
        return new JsonLdPropertyValue(TYPE, name, value);
    }

    public static JsonLdPropertyValue of(String name, String value) {
        return of(name, value == null ? null : TextNode.valueOf(value));
    }

    public static JsonLdPropertyValue of(String name, boolean value) {
        return of(name, BooleanNode.valueOf(value));
    }
}
