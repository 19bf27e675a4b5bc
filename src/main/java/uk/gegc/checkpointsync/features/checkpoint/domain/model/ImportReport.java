package uk.gegc.checkpointsync.features.checkpoint.domain.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "ImportReport", description = "Checkpoint read from a JSON-LD document plus the entries that were skipped")
public record ImportReport(
        Checkpoint checkpoint,
        List<SkippedEntry> skipped
) {
    public ImportReport {
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
    }

    public boolean hasSkippedEntries() {
        return !skipped.isEmpty();
    }
}
