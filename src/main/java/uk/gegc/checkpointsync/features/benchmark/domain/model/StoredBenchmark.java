package uk.gegc.checkpointsync.features.benchmark.domain.model;

import uk.gegc.checkpointsync.features.checkpoint.domain.model.Checkpoint;

import java.time.Instant;

/**
 * A named checkpoint as held by a {@code BenchmarkRepository}.
 */
public record StoredBenchmark(
        String name,
        Checkpoint checkpoint,
        Instant createdAt,
        Instant updatedAt
) {

    public BenchmarkInfo toInfo() {
        return new BenchmarkInfo(name, checkpoint.questionCount(), createdAt, updatedAt);
    }
}
