package uk.gegc.checkpointsync.features.benchmark.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.checkpointsync.features.benchmark.domain.DuplicateMergeException;
import uk.gegc.checkpointsync.features.benchmark.domain.model.DuplicateQuestionInfo;
import uk.gegc.checkpointsync.features.benchmark.domain.model.DuplicateResolution;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.QuestionItem;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges question sets according to per-question duplicate resolutions.
 * <p>
 * A duplicate without a resolution is resolved as {@link DuplicateResolution#KEEP_NEW}. A
 * resolution naming a question that is not in the duplicate list has no effect. Questions are
 * never removed by a merge.
 */
@Slf4j
@Component
public class ResolutionApplier {

    /**
     * Merges a candidate set into the persisted set.
     *
     * @return one entry per question ID in {@code persisted} or {@code candidate}; duplicates carry
     * the chosen snapshot, other candidate questions replace or extend the persisted ones
     */
    public Map<String, QuestionItem> apply(Map<String, QuestionItem> persisted,
                                           Map<String, QuestionItem> candidate,
                                           List<DuplicateQuestionInfo> duplicates,
                                           Map<String, DuplicateResolution> resolutions) {
        Map<String, QuestionItem> merged = new LinkedHashMap<>();
        if (persisted != null) {
            merged.putAll(persisted);
        }
        if (candidate != null) {
            merged.putAll(candidate);
        }
        for (DuplicateQuestionInfo duplicate : indexDuplicates(duplicates).values()) {
            if (!merged.containsKey(duplicate.questionId())) {
                throw new DuplicateMergeException(
                        "Duplicate " + duplicate.questionId() + " is in neither the persisted nor the candidate set");
            }
            merged.put(duplicate.questionId(), chosenVersion(duplicate, resolutions));
        }
        logIgnoredResolutions(duplicates, resolutions);
        return Collections.unmodifiableMap(merged);
    }

    /**
     * Applies resolutions on top of {@code base}, usually the candidate set the duplicates were
     * detected for. Questions resolved as {@code keep_old} get their persisted snapshot back.
     */
    public Map<String, QuestionItem> apply(Map<String, QuestionItem> base,
                                           List<DuplicateQuestionInfo> duplicates,
                                           Map<String, DuplicateResolution> resolutions) {
        Map<String, QuestionItem> merged = new LinkedHashMap<>();
        if (base != null) {
            merged.putAll(base);
        }
        for (DuplicateQuestionInfo duplicate : indexDuplicates(duplicates).values()) {
            merged.put(duplicate.questionId(), chosenVersion(duplicate, resolutions));
        }
        logIgnoredResolutions(duplicates, resolutions);
        return Collections.unmodifiableMap(merged);
    }

    public DuplicateResolution resolutionFor(String questionId, Map<String, DuplicateResolution> resolutions) {
        if (resolutions == null) {
            return DuplicateResolution.KEEP_NEW;
        }
        DuplicateResolution resolution = resolutions.get(questionId);
        return resolution != null ? resolution : DuplicateResolution.KEEP_NEW;
    }

    private QuestionItem chosenVersion(DuplicateQuestionInfo duplicate, Map<String, DuplicateResolution> resolutions) {
        DuplicateResolution resolution = resolutionFor(duplicate.questionId(), resolutions);
        QuestionItem chosen = switch (resolution) {
            case KEEP_OLD -> duplicate.oldVersion();
            case KEEP_NEW -> duplicate.newVersion();
        };
        if (chosen == null) {
            throw new DuplicateMergeException(
                    "Duplicate " + duplicate.questionId() + " has no snapshot for " + resolution.value());
        }
        return chosen;
    }

    private static Map<String, DuplicateQuestionInfo> indexDuplicates(List<DuplicateQuestionInfo> duplicates) {
        Map<String, DuplicateQuestionInfo> index = new LinkedHashMap<>();
        if (duplicates == null) {
            return index;
        }
        for (DuplicateQuestionInfo duplicate : duplicates) {
            if (duplicate == null || duplicate.questionId() == null || duplicate.questionId().isBlank()) {
                throw new DuplicateMergeException("Duplicate list contains an entry without a question ID");
            }
            if (index.putIfAbsent(duplicate.questionId(), duplicate) != null) {
                throw new DuplicateMergeException(
                        "Duplicate list names question " + duplicate.questionId() + " more than once");
            }
        }
        return index;
    }

    private static void logIgnoredResolutions(List<DuplicateQuestionInfo> duplicates,
                                              Map<String, DuplicateResolution> resolutions) {
        if (resolutions == null || resolutions.isEmpty() || !log.isDebugEnabled()) {
            return;
        }
        Set<String> unmatched = new HashSet<>(resolutions.keySet());
        if (duplicates != null) {
            duplicates.forEach(duplicate -> unmatched.remove(duplicate.questionId()));
        }
        if (!unmatched.isEmpty()) {
            log.debug("Ignoring resolutions for questions that are not duplicates: {}", unmatched);
        }
    }
}
