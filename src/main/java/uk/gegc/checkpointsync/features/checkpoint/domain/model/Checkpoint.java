package uk.gegc.checkpointsync.features.checkpoint.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.rubric.Rubric;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * In-memory collection of benchmark questions keyed by question ID.
 * <p>
 * The question map keeps insertion order so exports are deterministic for a given checkpoint,
 * but no ordering is part of the contract.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "Checkpoint", description = "Unified v2.0 checkpoint")
public record Checkpoint(
        @Schema(description = "Format tag used to route parsing", example = "2.0")
        @JsonProperty("version") String version,
        @JsonProperty("global_rubric") Rubric globalRubric,
        @JsonProperty("dataset_metadata") DatasetMetadata datasetMetadata,
        @Schema(description = "Questions keyed by question ID")
        @JsonProperty("checkpoint") Map<String, QuestionItem> questions
) {
    public static final String FORMAT_VERSION = "2.0";

    public Checkpoint {
        if (version == null || version.isBlank()) {
            version = FORMAT_VERSION;
        }
        questions = questions == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(questions));
    }

    public static Checkpoint of(Map<String, QuestionItem> questions) {
        return new Checkpoint(FORMAT_VERSION, null, null, questions);
    }

    /**
     * Rubric that applies to a question: its own when present, otherwise the global one.
     */
    public Rubric rubricFor(String questionId) {
        QuestionItem item = questions.get(questionId);
        if (item != null && item.questionRubric() != null && !item.questionRubric().isEmpty()) {
            return item.questionRubric();
        }
        return globalRubric;
    }

    public int questionCount() {
        return questions.size();
    }
}
