package uk.gegc.checkpointsync.features.checkpoint.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.rubric.Rubric;

import java.util.List;
import java.util.Map;

/**
 * Full state of one benchmark question inside a checkpoint.
 * <p>
 * {@code lastModified} is mandatory. {@code dateCreated} may be absent; readers fall back to
 * {@link #effectiveDateCreated()} for display, but the absence is kept as is.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "QuestionItem", description = "One benchmark question with its answer template and workflow state")
public record QuestionItem(
        @Schema(description = "Question prompt") @JsonProperty("question") String question,
        @Schema(description = "Expected answer text") @JsonProperty("raw_answer") String rawAnswer,
        @Schema(description = "Answer template as first generated") @JsonProperty("original_answer_template") String originalAnswerTemplate,
        @Schema(description = "Current answer template source") @JsonProperty("answer_template") String answerTemplate,
        @Schema(description = "ISO-8601 creation time", example = "2025-01-15T14:30:00Z") @JsonProperty("date_created") String dateCreated,
        @Schema(description = "ISO-8601 last modification time", example = "2025-01-15T14:30:00Z") @JsonProperty("last_modified") String lastModified,
        @Schema(description = "Workflow flag: template reviewed") @JsonProperty("finished") boolean finished,
        @JsonProperty("question_rubric") Rubric questionRubric,
        @JsonProperty("few_shot_examples") List<FewShotExample> fewShotExamples,
        @JsonProperty("custom_metadata") Map<String, String> customMetadata,
        @JsonProperty("author") Person author,
        @JsonProperty("sources") List<CreativeWork> sources,
        @JsonProperty("keywords") List<String> keywords,
        @JsonProperty("tags") List<String> tags,
        @Schema(description = "Unrecognized keys of the JSON-LD Question node, written back unchanged on export")
        @JsonProperty("jsonld_extensions") Map<String, JsonNode> jsonLdExtensions
) {

    /**
     * Creation time for display: {@code dateCreated} when set, otherwise {@code lastModified}.
     */
    public String effectiveDateCreated() {
        return dateCreated != null && !dateCreated.isBlank() ? dateCreated : lastModified;
    }
}
