package uk.gegc.checkpointsync.features.benchmark.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.checkpointsync.features.benchmark.domain.model.DuplicateQuestionInfo;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.Checkpoint;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.QuestionItem;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Finds questions whose ID exists both in a candidate set and in the persisted set.
 * <p>
 * Content is not compared: a shared ID is a duplicate even when both versions are identical.
 * Neither input is modified.
 */
@Slf4j
@Component
public class DuplicateDetector {

    public List<DuplicateQuestionInfo> detect(Map<String, QuestionItem> candidate, Map<String, QuestionItem> persisted) {
        if (candidate == null || candidate.isEmpty() || persisted == null || persisted.isEmpty()) {
            return List.of();
        }
        List<DuplicateQuestionInfo> duplicates = new ArrayList<>();
        candidate.forEach((questionId, newVersion) -> {
            QuestionItem oldVersion = persisted.get(questionId);
            if (oldVersion != null) {
                String text = newVersion != null ? newVersion.question() : oldVersion.question();
                duplicates.add(new DuplicateQuestionInfo(questionId, text, oldVersion, newVersion));
            }
        });
        log.debug("Found {} duplicate questions among {} candidates", duplicates.size(), candidate.size());
        return List.copyOf(duplicates);
    }

    public List<DuplicateQuestionInfo> detect(Checkpoint candidate, Checkpoint persisted) {
        return detect(
                candidate != null ? candidate.questions() : null,
                persisted != null ? persisted.questions() : null);
    }
}
