package uk.gegc.checkpointsync.features.benchmark.application;

import uk.gegc.checkpointsync.features.benchmark.domain.model.DuplicateResolution;

/**
 * Records benchmark store events as metrics.
 */
public interface BenchmarkMetricsService {

    void recordSaved(boolean created);

    void recordSaveHeldForDuplicates(int duplicateCount);

    void recordResolution(DuplicateResolution resolution, int count);

    void recordDeleted();
}
