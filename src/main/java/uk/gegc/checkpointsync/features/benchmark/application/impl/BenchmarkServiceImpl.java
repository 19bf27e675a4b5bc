package uk.gegc.checkpointsync.features.benchmark.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.checkpointsync.features.benchmark.application.BenchmarkMetricsService;
import uk.gegc.checkpointsync.features.benchmark.application.BenchmarkService;
import uk.gegc.checkpointsync.features.benchmark.application.DuplicateDetector;
import uk.gegc.checkpointsync.features.benchmark.application.ResolutionApplier;
import uk.gegc.checkpointsync.features.benchmark.domain.model.BenchmarkInfo;
import uk.gegc.checkpointsync.features.benchmark.domain.model.DuplicateQuestionInfo;
import uk.gegc.checkpointsync.features.benchmark.domain.model.DuplicateResolution;
import uk.gegc.checkpointsync.features.benchmark.domain.model.ResolveDuplicatesResult;
import uk.gegc.checkpointsync.features.benchmark.domain.model.SaveBenchmarkResult;
import uk.gegc.checkpointsync.features.benchmark.domain.model.StoredBenchmark;
import uk.gegc.checkpointsync.features.benchmark.domain.repository.BenchmarkRepository;
import uk.gegc.checkpointsync.features.checkpoint.application.DatasetMetadataResolver;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.Checkpoint;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.DatasetMetadata;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.QuestionItem;
import uk.gegc.checkpointsync.shared.exception.ResourceNotFoundException;
import uk.gegc.checkpointsync.shared.exception.ValidationException;
import uk.gegc.checkpointsync.shared.util.DateUtils;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

@Service
@RequiredArgsConstructor
@Slf4j
public class BenchmarkServiceImpl implements BenchmarkService {

    private final BenchmarkRepository benchmarkRepository;
    private final DuplicateDetector duplicateDetector;
    private final ResolutionApplier resolutionApplier;
    private final DatasetMetadataResolver metadataResolver;
    private final DateUtils dateUtils;
    private final BenchmarkMetricsService metricsService;

    @Override
    public List<BenchmarkInfo> listBenchmarks() {
        return benchmarkRepository.findAll().stream()
                .map(StoredBenchmark::toInfo)
                .toList();
    }

    @Override
    public Checkpoint loadBenchmark(String name) {
        String key = requireName(name);
        return benchmarkRepository.findByName(key)
                .map(StoredBenchmark::checkpoint)
                .orElseThrow(() -> new ResourceNotFoundException("Benchmark " + key + " not found"));
    }

    @Override
    public SaveBenchmarkResult saveBenchmark(String name, Checkpoint data, boolean detectDuplicates) {
        String key = requireName(name);
        if (data == null) {
            throw new ValidationException("Benchmark data is required");
        }

        AtomicBoolean created = new AtomicBoolean(false);
        AtomicReference<List<DuplicateQuestionInfo>> pending = new AtomicReference<>(List.of());

        StoredBenchmark stored = benchmarkRepository.compute(key, existing -> {
            Instant now = dateUtils.now();
            if (existing == null) {
                created.set(true);
                return new StoredBenchmark(key, prepareNew(data), now, now);
            }
            if (detectDuplicates) {
                List<DuplicateQuestionInfo> duplicates =
                        duplicateDetector.detect(data.questions(), existing.checkpoint().questions());
                if (!duplicates.isEmpty()) {
                    pending.set(duplicates);
                    return existing;
                }
            }
            Map<String, QuestionItem> questions = resolutionApplier.apply(
                    existing.checkpoint().questions(), data.questions(), List.of(), Map.of());
            return new StoredBenchmark(key, mergeInto(existing.checkpoint(), data, questions), existing.createdAt(), now);
        });

        if (!pending.get().isEmpty()) {
            log.info("Save of benchmark {} held back: {} duplicate questions need a resolution", key, pending.get().size());
            metricsService.recordSaveHeldForDuplicates(pending.get().size());
            return SaveBenchmarkResult.pendingDuplicates(pending.get());
        }
        log.info("{} benchmark {} with {} questions",
                created.get() ? "Created" : "Updated", key, stored.checkpoint().questionCount());
        metricsService.recordSaved(created.get());
        return SaveBenchmarkResult.saved(stored.toInfo(), created.get());
    }

    @Override
    public ResolveDuplicatesResult resolveDuplicates(String name, Checkpoint candidate,
                                                     Map<String, DuplicateResolution> resolutions) {
        String key = requireName(name);
        if (candidate == null) {
            throw new ValidationException("Candidate checkpoint is required");
        }

        AtomicInteger keptOld = new AtomicInteger();
        AtomicInteger keptNew = new AtomicInteger();
        StoredBenchmark stored = benchmarkRepository.compute(key, existing -> {
            if (existing == null) {
                throw new ResourceNotFoundException("Benchmark " + key + " not found");
            }
            List<DuplicateQuestionInfo> duplicates =
                    duplicateDetector.detect(candidate.questions(), existing.checkpoint().questions());
            for (DuplicateQuestionInfo duplicate : duplicates) {
                if (resolutionApplier.resolutionFor(duplicate.questionId(), resolutions) == DuplicateResolution.KEEP_OLD) {
                    keptOld.incrementAndGet();
                } else {
                    keptNew.incrementAndGet();
                }
            }
            Map<String, QuestionItem> questions = resolutionApplier.apply(
                    existing.checkpoint().questions(), candidate.questions(), duplicates, resolutions);
            return new StoredBenchmark(key, mergeInto(existing.checkpoint(), candidate, questions),
                    existing.createdAt(), dateUtils.now());
        });

        String message = String.format("Resolved %d duplicate questions (%d kept old, %d kept new); benchmark %s now has %d questions",
                keptOld.get() + keptNew.get(), keptOld.get(), keptNew.get(), key, stored.checkpoint().questionCount());
        log.info(message);
        metricsService.recordResolution(DuplicateResolution.KEEP_OLD, keptOld.get());
        metricsService.recordResolution(DuplicateResolution.KEEP_NEW, keptNew.get());
        return new ResolveDuplicatesResult(message, keptOld.get(), keptNew.get(), stored.toInfo());
    }

    @Override
    public void deleteBenchmark(String name) {
        String key = requireName(name);
        if (!benchmarkRepository.deleteByName(key)) {
            throw new ResourceNotFoundException("Benchmark " + key + " not found");
        }
        metricsService.recordDeleted();
        log.info("Deleted benchmark {}", key);
    }

    private Checkpoint prepareNew(Checkpoint data) {
        DatasetMetadata metadata = metadataResolver.resolve(data.datasetMetadata(), data.questionCount(), true);
        return data.toBuilder()
                .datasetMetadata(metadata)
                .build();
    }

    // Keeps the stored lineage (dateCreated, fields the candidate leaves empty) and marks the edit.
    private Checkpoint mergeInto(Checkpoint existing, Checkpoint candidate, Map<String, QuestionItem> questions) {
        DatasetMetadata inherited = metadataResolver.inheritLineage(candidate.datasetMetadata(), existing.datasetMetadata());
        DatasetMetadata metadata = metadataResolver.resolve(inherited, questions.size(), true);
        return Checkpoint.builder()
                .version(Checkpoint.FORMAT_VERSION)
                .globalRubric(candidate.globalRubric() != null ? candidate.globalRubric() : existing.globalRubric())
                .datasetMetadata(metadata)
                .questions(questions)
                .build();
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Benchmark name is required");
        }
        return name.trim();
    }
}
