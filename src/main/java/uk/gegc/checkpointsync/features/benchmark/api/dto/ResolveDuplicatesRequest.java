package uk.gegc.checkpointsync.features.benchmark.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import uk.gegc.checkpointsync.features.benchmark.domain.model.DuplicateResolution;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.Checkpoint;

import java.util.Map;

@Schema(name = "ResolveDuplicatesRequest", description = "Candidate checkpoint and the per-question duplicate choices")
public record ResolveDuplicatesRequest(
        @Schema(description = "Checkpoint being merged into the stored benchmark")
        @NotNull(message = "Candidate checkpoint is required")
        @JsonProperty("checkpoint") Checkpoint checkpoint,

        @Schema(description = "Choice per duplicate question ID; questions without a choice keep the new version",
                example = "{\"q1\": \"keep_old\"}")
        @JsonProperty("resolutions") Map<String, DuplicateResolution> resolutions
) {
    public ResolveDuplicatesRequest {
        resolutions = resolutions == null ? Map.of() : Map.copyOf(resolutions);
    }
}
