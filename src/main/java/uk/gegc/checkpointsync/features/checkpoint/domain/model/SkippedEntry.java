package uk.gegc.checkpointsync.features.checkpoint.domain.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "SkippedEntry", description = "A hasPart entry left out of an import")
public record SkippedEntry(
        @Schema(description = "Zero-based position in hasPart") int index,
        @Schema(description = "Question ID the entry would have had") String questionId,
        @Schema(description = "Why the entry was skipped") String reason
) {
}
