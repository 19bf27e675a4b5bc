package uk.gegc.checkpointsync.features.checkpoint.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Source a question was drawn from. {@code type} is one of {@code CreativeWork},
 * {@code ScholarlyArticle} or {@code WebPage}; {@code identifier} holds a DOI, ISBN or similar.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "CreativeWork", description = "schema.org CreativeWork cited as a question source")
public record CreativeWork(
        @JsonProperty("@type") String type,
        String name,
        Person author,
        String url,
        String datePublished,
        String publisher,
        String identifier,
        String description
) {
}
