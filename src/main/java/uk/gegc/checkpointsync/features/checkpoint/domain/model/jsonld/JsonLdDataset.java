package uk.gegc.checkpointsync.features.checkpoint.domain.model.jsonld;

import com.fasterxml.jackson.annotation.JsonAlias;
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
 * Root of the portable JSON-LD representation of a checkpoint: a schema.org {@code Dataset}
 * whose {@code hasPart} lists one {@link JsonLdDataFeedItem} per question.
 * <p>
 * {@code creator} is kept as a raw node: exports write a display string, but imports also
 * accept a Person or Organization object. Documents using the older {@code DataFeed} /
 * {@code dataFeedElement} spelling bind to the same fields.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"@context", "@type", "@id", "name", "description", "version", "creator", "license",
        "keywords", "dateCreated", "dateModified", "rating", "hasPart", "additionalProperty"})
public class JsonLdDataset {

    public static final String TYPE = "Dataset";
    public static final String LEGACY_TYPE = "DataFeed";

    @JsonProperty("@context")
    private JsonNode context;

    @JsonProperty("@type")
    private String type;

    @JsonProperty("@id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description;

    @JsonProperty("version")
    private String version;

    @JsonProperty("creator")
    private JsonNode creator;

    @JsonProperty("license")
    private String license;

    @JsonProperty("keywords")
    private List<String> keywords;

    @JsonProperty("dateCreated")
    private String dateCreated;

    @JsonProperty("dateModified")
    private String dateModified;

    @JsonProperty("rating")
    private List<JsonLdRating> rating;

    @JsonProperty("hasPart")
    @JsonAlias("dataFeedElement")
    private List<JsonLdDataFeedItem> hasPart = new ArrayList<>();

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
