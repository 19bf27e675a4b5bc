package uk.gegc.checkpointsync.features.checkpoint.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * Descriptive metadata about a checkpoint, aligned with schema.org {@code Dataset}.
 * <p>
 * Every field is optional. {@code dateCreated} is fixed once a checkpoint lineage has one;
 * {@code dateModified} only moves when a conversion represents a new edit.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "DatasetMetadata", description = "schema.org Dataset metadata for a checkpoint")
public record DatasetMetadata(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("version") String version,
        @JsonProperty("license") String license,
        @JsonProperty("keywords") List<String> keywords,
        @JsonProperty("creator") Creator creator,
        @JsonProperty("publisher") Organization publisher,
        @JsonProperty("datePublished") String datePublished,
        @JsonProperty("dateCreated") String dateCreated,
        @JsonProperty("dateModified") String dateModified,
        @JsonProperty("custom_properties") Map<String, String> customProperties
) {
}
