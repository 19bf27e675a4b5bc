package uk.gegc.checkpointsync.features.benchmark.domain.repository;

import uk.gegc.checkpointsync.features.benchmark.domain.model.StoredBenchmark;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Storage for named benchmarks.
 * <p>
 * {@link #compute} runs its update function while holding exclusive access to the benchmark,
 * so at most one write per name is in flight.
 */
public interface BenchmarkRepository {

    List<StoredBenchmark> findAll();

    Optional<StoredBenchmark> findByName(String name);

    /**
     * Atomically replaces the benchmark stored under {@code name}.
     *
     * @param update receives the current benchmark, or {@code null} when absent, and returns the
     *               value to store; returning the argument unchanged leaves storage as it was
     * @return the value stored after the update
     */
    StoredBenchmark compute(String name, UnaryOperator<StoredBenchmark> update);

    boolean deleteByName(String name);
}
