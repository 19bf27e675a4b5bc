package uk.gegc.checkpointsync.features.benchmark.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.checkpointsync.features.benchmark.application.BenchmarkMetricsService;
import uk.gegc.checkpointsync.features.benchmark.domain.model.DuplicateResolution;

import java.util.EnumMap;
import java.util.Map;

/**
 * Micrometer-backed benchmark metrics.
 */
@Slf4j
@Service
public class BenchmarkMetricsServiceImpl implements BenchmarkMetricsService {

    private final Counter createdCounter;
    private final Counter updatedCounter;
    private final Counter heldCounter;
    private final Counter heldDuplicatesCounter;
    private final Counter deletedCounter;
    private final Map<DuplicateResolution, Counter> resolutionCounters = new EnumMap<>(DuplicateResolution.class);

    public BenchmarkMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.createdCounter = Counter.builder("benchmarks.saves")
                .description("Number of benchmark saves")
                .tag("outcome", "created")
                .register(meterRegistry);
        this.updatedCounter = Counter.builder("benchmarks.saves")
                .description("Number of benchmark saves")
                .tag("outcome", "updated")
                .register(meterRegistry);
        this.heldCounter = Counter.builder("benchmarks.saves.held")
                .description("Number of saves held back because duplicates need a resolution")
                .register(meterRegistry);
        this.heldDuplicatesCounter = Counter.builder("benchmarks.duplicates.detected")
                .description("Number of duplicate questions returned for resolution")
                .register(meterRegistry);
        this.deletedCounter = Counter.builder("benchmarks.deletes")
                .description("Number of benchmarks deleted")
                .register(meterRegistry);
        for (DuplicateResolution resolution : DuplicateResolution.values()) {
            resolutionCounters.put(resolution, Counter.builder("benchmarks.duplicates.resolved")
                    .description("Number of duplicate questions resolved")
                    .tag("resolution", resolution.value())
                    .register(meterRegistry));
        }
    }

    @Override
    public void recordSaved(boolean created) {
        (created ? createdCounter : updatedCounter).increment();
    }

    @Override
    public void recordSaveHeldForDuplicates(int duplicateCount) {
        heldCounter.increment();
        heldDuplicatesCounter.increment(duplicateCount);
        log.debug("Metrics: save held for {} duplicates", duplicateCount);
    }

    @Override
    public void recordResolution(DuplicateResolution resolution, int count) {
        if (count > 0) {
            resolutionCounters.get(resolution).increment(count);
        }
    }

    @Override
    public void recordDeleted() {
        deletedCounter.increment();
    }
}
