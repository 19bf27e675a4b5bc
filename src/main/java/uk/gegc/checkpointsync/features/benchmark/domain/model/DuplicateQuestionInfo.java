package uk.gegc.checkpointsync.features.benchmark.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.QuestionItem;

/**
 * A question present both in a candidate checkpoint and in the persisted benchmark.
 * Both versions are complete snapshots; they may be identical.
 */
@Schema(name = "DuplicateQuestionInfo", description = "Question present in both the candidate and the stored benchmark")
public record DuplicateQuestionInfo(
        @Schema(description = "Question ID shared by both versions")
        @JsonProperty("question_id") String questionId,
        @Schema(description = "Question text of the candidate version")
        @JsonProperty("question_text") String questionText,
        @Schema(description = "Persisted version")
        @JsonProperty("old_version") QuestionItem oldVersion,
        @Schema(description = "Candidate version")
        @JsonProperty("new_version") QuestionItem newVersion
) {
}
