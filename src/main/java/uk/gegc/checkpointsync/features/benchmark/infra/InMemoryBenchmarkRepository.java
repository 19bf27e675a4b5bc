package uk.gegc.checkpointsync.features.benchmark.infra;

import org.springframework.stereotype.Repository;
import uk.gegc.checkpointsync.features.benchmark.domain.model.StoredBenchmark;
import uk.gegc.checkpointsync.features.benchmark.domain.repository.BenchmarkRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

/**
 * Process-local benchmark store. Writes to one name are serialized by
 * {@link ConcurrentHashMap#compute}.
 */
@Repository
public class InMemoryBenchmarkRepository implements BenchmarkRepository {

    private final ConcurrentMap<String, StoredBenchmark> benchmarks = new ConcurrentHashMap<>();

    @Override
    public List<StoredBenchmark> findAll() {
        return benchmarks.values().stream()
                .sorted(Comparator.comparing(StoredBenchmark::name))
                .toList();
    }

    @Override
    public Optional<StoredBenchmark> findByName(String name) {
        return Optional.ofNullable(benchmarks.get(name));
    }

    @Override
    public StoredBenchmark compute(String name, UnaryOperator<StoredBenchmark> update) {
        return benchmarks.compute(name, (key, current) -> update.apply(current));
    }

    @Override
    public boolean deleteByName(String name) {
        return benchmarks.remove(name) != null;
    }
}
