package uk.gegc.checkpointsync.features.checkpoint.domain.model.jsonld;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"@type", "@id", "text"})
public record JsonLdAnswer(
        @JsonProperty("@type") String type,
        @JsonProperty("@id") String id,
        @JsonProperty("text") String text
) {
    public static final String TYPE = "Answer";
}
