package uk.gegc.checkpointsync.features.checkpoint.domain.model.jsonld;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * One entry of the dataset's {@code hasPart}: a question plus its own timestamps.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"@type", "@id", "dateCreated", "dateModified", "item", "keywords"})
public record JsonLdDataFeedItem(
        @JsonProperty("@type") String type,
        @JsonProperty("@id") String id,
        @JsonProperty("dateCreated") String dateCreated,
        @JsonProperty("dateModified") String dateModified,
        @JsonProperty("item") JsonLdQuestion item,
        @JsonProperty("keywords") List<String> keywords
) {
    public static final String TYPE = "DataFeedItem";
}
