package uk.gegc.checkpointsync.features.benchmark.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(name = "BenchmarkInfo", description = "Summary of a stored benchmark")
public record BenchmarkInfo(
        @Schema(description = "Benchmark name", example = "capital-cities")
        @JsonProperty("name") String name,
        @Schema(description = "Number of questions", example = "42")
        @JsonProperty("question_count") int questionCount,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt
) {
}
