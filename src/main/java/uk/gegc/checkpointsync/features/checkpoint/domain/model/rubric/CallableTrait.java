package uk.gegc.checkpointsync.features.checkpoint.domain.model.rubric;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;

/**
 * Trait evaluated by user-supplied code. {@code callableCode} is base64 and treated as opaque.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "CallableTrait")
public record CallableTrait(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("callable_code") String callableCode,
        @JsonProperty("kind") TraitKind kind,
        @JsonProperty("min_score") Integer minScore,
        @JsonProperty("max_score") Integer maxScore,
        @JsonProperty("invert_result") Boolean invertResult,
        @JsonProperty("higher_is_better") Boolean higherIsBetter
) {
}
