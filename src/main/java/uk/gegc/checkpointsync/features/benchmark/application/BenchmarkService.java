package uk.gegc.checkpointsync.features.benchmark.application;

import uk.gegc.checkpointsync.features.benchmark.domain.model.BenchmarkInfo;
import uk.gegc.checkpointsync.features.benchmark.domain.model.DuplicateResolution;
import uk.gegc.checkpointsync.features.benchmark.domain.model.ResolveDuplicatesResult;
import uk.gegc.checkpointsync.features.benchmark.domain.model.SaveBenchmarkResult;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.Checkpoint;

import java.util.List;
import java.util.Map;

public interface BenchmarkService {

    List<BenchmarkInfo> listBenchmarks();

    Checkpoint loadBenchmark(String name);

    /**
     * Saves a checkpoint under {@code name}. With {@code detectDuplicates} and at least one
     * shared question ID, nothing is written and the duplicates are returned instead.
     */
    SaveBenchmarkResult saveBenchmark(String name, Checkpoint data, boolean detectDuplicates);

    ResolveDuplicatesResult resolveDuplicates(String name, Checkpoint candidate,
                                              Map<String, DuplicateResolution> resolutions);

    void deleteBenchmark(String name);
}
