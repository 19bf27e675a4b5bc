package uk.gegc.checkpointsync.features.benchmark.application.impl;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.checkpointsync.features.benchmark.domain.model.DuplicateResolution;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BenchmarkMetricsServiceImpl")
class BenchmarkMetricsServiceImplTest {

    private SimpleMeterRegistry meterRegistry;
    private BenchmarkMetricsServiceImpl metricsService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metricsService = new BenchmarkMetricsServiceImpl(meterRegistry);
    }

    @Test
    @DisplayName("recordSaved: created and updated saves are tagged separately")
    void recordSaved_tagsOutcome() {
        metricsService.recordSaved(true);
        metricsService.recordSaved(false);
        metricsService.recordSaved(false);

        assertThat(meterRegistry.counter("benchmarks.saves", "outcome", "created").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("benchmarks.saves", "outcome", "updated").count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("recordResolution: zero counts leave the counter untouched")
    void recordResolution_zeroCount_noIncrement() {
        metricsService.recordResolution(DuplicateResolution.KEEP_OLD, 0);
        metricsService.recordResolution(DuplicateResolution.KEEP_NEW, 3);

        assertThat(meterRegistry.counter("benchmarks.duplicates.resolved", "resolution", "keep_old").count()).isZero();
        assertThat(meterRegistry.counter("benchmarks.duplicates.resolved", "resolution", "keep_new").count()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("recordDeleted: counts deletes")
    void recordDeleted_increments() {
        metricsService.recordDeleted();

        assertThat(meterRegistry.counter("benchmarks.deletes").count()).isEqualTo(1.0);
    }
}
