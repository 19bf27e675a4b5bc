package uk.gegc.checkpointsync.features.benchmark.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Outcome of a save. When {@code duplicates} is non-empty nothing was written and the caller is
 * expected to resolve them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "SaveBenchmarkResult", description = "Result of saving a checkpoint as a benchmark")
public record SaveBenchmarkResult(
        @Schema(description = "Whether the benchmark was written") @JsonProperty("saved") boolean saved,
        @Schema(description = "Whether the benchmark did not exist before") @JsonProperty("created") boolean created,
        @JsonProperty("benchmark") BenchmarkInfo benchmark,
        @Schema(description = "Questions that need a resolution before the save can go through")
        @JsonProperty("duplicates") List<DuplicateQuestionInfo> duplicates
) {

    public SaveBenchmarkResult {
        duplicates = duplicates == null ? List.of() : List.copyOf(duplicates);
    }

    public static SaveBenchmarkResult saved(BenchmarkInfo benchmark, boolean created) {
        return new SaveBenchmarkResult(true, created, benchmark, List.of());
    }

    public static SaveBenchmarkResult pendingDuplicates(List<DuplicateQuestionInfo> duplicates) {
        return new SaveBenchmarkResult(false, false, null, duplicates);
    }

    public boolean hasDuplicates() {
        return !duplicates.isEmpty();
    }
}
