package uk.gegc.checkpointsync.features.checkpoint.domain.model.rubric;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;

import java.util.List;

@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "MetricRubricTrait")
public record MetricRubricTrait(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("evaluation_mode") MetricEvaluationMode evaluationMode,
        @JsonProperty("metrics") List<String> metrics,
        @JsonProperty("tp_instructions") List<String> tpInstructions,
        @JsonProperty("tn_instructions") List<String> tnInstructions,
        @JsonProperty("repeated_extraction") Boolean repeatedExtraction
) {
}
