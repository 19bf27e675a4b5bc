package uk.gegc.checkpointsync.features.checkpoint.domain.model.rubric;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;

@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "RegexTrait")
public record RegexTrait(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("pattern") String pattern,
        @JsonProperty("case_sensitive") Boolean caseSensitive,
        @JsonProperty("invert_result") Boolean invertResult,
        @JsonProperty("higher_is_better") Boolean higherIsBetter
) {
}
