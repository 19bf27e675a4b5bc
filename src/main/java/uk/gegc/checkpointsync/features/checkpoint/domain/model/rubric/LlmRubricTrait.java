package uk.gegc.checkpointsync.features.checkpoint.domain.model.rubric;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;

/**
 * Trait judged by a language model, either pass/fail or on a score range.
 * The {@code deepJudgment*} settings only carry meaning when {@code deepJudgmentEnabled} is true.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "LlmRubricTrait")
public record LlmRubricTrait(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("kind") TraitKind kind,
        @JsonProperty("min_score") Integer minScore,
        @JsonProperty("max_score") Integer maxScore,
        @JsonProperty("higher_is_better") Boolean higherIsBetter,
        @JsonProperty("deep_judgment_enabled") Boolean deepJudgmentEnabled,
        @JsonProperty("deep_judgment_excerpt_enabled") Boolean deepJudgmentExcerptEnabled,
        @JsonProperty("deep_judgment_max_excerpts") Integer deepJudgmentMaxExcerpts,
        @JsonProperty("deep_judgment_fuzzy_match_threshold") Double deepJudgmentFuzzyMatchThreshold,
        @JsonProperty("deep_judgment_excerpt_retry_attempts") Integer deepJudgmentExcerptRetryAttempts,
        @JsonProperty("deep_judgment_search_enabled") Boolean deepJudgmentSearchEnabled
) {
}
