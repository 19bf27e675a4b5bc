package uk.gegc.checkpointsync.features.checkpoint.domain.model.jsonld;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;

import java.util.List;

/**
 * schema.org {@code Rating} carrying one rubric trait definition.
 * <p>
 * {@code additionalType} tells the trait family and scope apart, for example
 * {@code GlobalRegexTrait} or {@code QuestionSpecificRubricTrait}.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"@type", "@id", "name", "description", "bestRating", "worstRating", "additionalType"})
public record JsonLdRating(
        @JsonProperty("@type") String type,
        @JsonProperty("@id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("bestRating") Integer bestRating,
        @JsonProperty("worstRating") Integer worstRating,
        @JsonProperty("additionalType") String additionalType,
        @JsonProperty("ratingExplanation") String ratingExplanation,
        @JsonProperty("deep_judgment_enabled") Boolean deepJudgmentEnabled,
        @JsonProperty("deep_judgment_excerpt_enabled") Boolean deepJudgmentExcerptEnabled,
        @JsonProperty("deep_judgment_max_excerpts") Integer deepJudgmentMaxExcerpts,
        @JsonProperty("deep_judgment_fuzzy_match_threshold") Double deepJudgmentFuzzyMatchThreshold,
        @JsonProperty("deep_judgment_excerpt_retry_attempts") Integer deepJudgmentExcerptRetryAttempts,
        @JsonProperty("deep_judgment_search_enabled") Boolean deepJudgmentSearchEnabled,
        @JsonProperty("additionalProperty") List<JsonLdPropertyValue> additionalProperty
) {
    public static final String TYPE = "Rating";
}
