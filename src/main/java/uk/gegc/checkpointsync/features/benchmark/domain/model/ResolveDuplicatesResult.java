package uk.gegc.checkpointsync.features.benchmark.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "ResolveDuplicatesResult", description = "Outcome of merging a candidate checkpoint into a stored benchmark")
public record ResolveDuplicatesResult(
        @Schema(description = "Human-readable summary") @JsonProperty("message") String message,
        @JsonProperty("kept_old") int keptOld,
        @JsonProperty("kept_new") int keptNew,
        @JsonProperty("benchmark") BenchmarkInfo benchmark
) {
}
