package uk.gegc.checkpointsync.features.checkpoint.domain.model.jsonld;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * schema.org {@code Question}. Keys this model does not know are kept in {@link #getExtensions()}
 * and written back unchanged.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"@type", "@id", "text", "acceptedAnswer", "hasPart", "rating", "additionalProperty"})
public class JsonLdQuestion {

    public static final String TYPE = "Question";

    @JsonProperty("@type")
    private String type;

    @JsonProperty("@id")
    private String id;

    @JsonProperty("text")
    private String text;

    @JsonProperty("acceptedAnswer")
    private JsonLdAnswer acceptedAnswer;

    @JsonProperty("hasPart")
    private JsonLdSourceCode hasPart;

    @JsonProperty("rating")
    private List<JsonLdRating> rating;

    @JsonProperty("additionalProperty")
    private List<JsonLdPropertyValue> additionalProperty = new ArrayList<>();

    private final Map<String, JsonNode> extensions = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, JsonNode> getExtensions() {
        return extensions;
    }

    @JsonAnySetter
    public void putExtension(String key, JsonNode value) {
        extensions.put(key, value);
    }
}
