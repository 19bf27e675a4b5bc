package uk.gegc.checkpointsync.features.checkpoint.domain.model.rubric;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;

import java.util.List;

@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@Schema(name = "Rubric", description = "Evaluation traits applied to a question or to the whole checkpoint")
public record Rubric(
        @JsonProperty("llm_traits") @JsonInclude(JsonInclude.Include.ALWAYS) List<LlmRubricTrait> llmTraits,
        @JsonProperty("regex_traits") List<RegexTrait> regexTraits,
        @JsonProperty("callable_traits") List<CallableTrait> callableTraits,
        @JsonProperty("metric_traits") List<MetricRubricTrait> metricTraits
) {
    public Rubric {
        llmTraits = llmTraits == null ? List.of() : List.copyOf(llmTraits);
        regexTraits = regexTraits == null ? List.of() : List.copyOf(regexTraits);
        callableTraits = callableTraits == null ? List.of() : List.copyOf(callableTraits);
        metricTraits = metricTraits == null ? List.of() : List.copyOf(metricTraits);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return llmTraits.isEmpty() && regexTraits.isEmpty() && callableTraits.isEmpty() && metricTraits.isEmpty();
    }

    @JsonIgnore
    public int traitCount() {
        return llmTraits.size() + regexTraits.size() + callableTraits.size() + metricTraits.size();
    }
}
