package uk.gegc.checkpointsync.features.benchmark.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.checkpointsync.features.benchmark.domain.DuplicateMergeException;
import uk.gegc.checkpointsync.features.benchmark.domain.model.DuplicateQuestionInfo;
import uk.gegc.checkpointsync.features.benchmark.domain.model.DuplicateResolution;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.QuestionItem;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static uk.gegc.checkpointsync.features.checkpoint.CheckpointTestFixtures.question;

class ResolutionApplierTest {

    private final ResolutionApplier applier = new ResolutionApplier();
    private final DuplicateDetector detector = new DuplicateDetector();

    private final QuestionItem oldQ1 = question("Old Q1", "A", "2025-01-01T00:00:00Z");
    private final QuestionItem newQ1 = question("New Q1", "A", "2025-02-01T00:00:00Z");
    private final QuestionItem oldQ2 = question("Old Q2", "B", "2025-01-01T00:00:00Z");
    private final QuestionItem newQ2 = question("New Q2", "B", "2025-02-01T00:00:00Z");
    private final QuestionItem onlyOld = question("Stored only", "C", "2025-01-01T00:00:00Z");
    private final QuestionItem onlyNew = question("Candidate only", "D", "2025-02-01T00:00:00Z");

    @Test
    @DisplayName("apply: keep_old for q1 and no choice for q2 keeps old q1 and new q2")
    void apply_mixedResolutions_choosesPerQuestion() {
        Map<String, QuestionItem> persisted = Map.of("q1", oldQ1, "q2", oldQ2, "q9", onlyOld);
        Map<String, QuestionItem> candidate = Map.of("q1", newQ1, "q2", newQ2, "q5", onlyNew);
        List<DuplicateQuestionInfo> duplicates = detector.detect(candidate, persisted);

        Map<String, QuestionItem> merged = applier.apply(persisted, candidate, duplicates,
                Map.of("q1", DuplicateResolution.KEEP_OLD));

        assertThat(merged).containsOnlyKeys("q1", "q2", "q5", "q9");
        assertThat(merged.get("q1")).isSameAs(oldQ1);
        assertThat(merged.get("q2")).isSameAs(newQ2);
        assertThat(merged.get("q5")).isSameAs(onlyNew);
        assertThat(merged.get("q9")).isSameAs(onlyOld);
    }

    @Test
    @DisplayName("apply: resolutions for non-duplicates have no effect")
    void apply_resolutionForNonDuplicate_isIgnored() {
        Map<String, QuestionItem> persisted = Map.of("q9", onlyOld);
        Map<String, QuestionItem> candidate = Map.of("q5", onlyNew);

        Map<String, QuestionItem> merged = applier.apply(persisted, candidate, List.of(),
                Map.of("q5", DuplicateResolution.KEEP_OLD));

        assertThat(merged).containsEntry("q5", onlyNew).containsEntry("q9", onlyOld);
    }

    @Test
    @DisplayName("apply: three-argument form restores old snapshots on top of the base set")
    void apply_baseForm_restoresKeptOld() {
        List<DuplicateQuestionInfo> duplicates = List.of(
                new DuplicateQuestionInfo("q1", "New Q1", oldQ1, newQ1),
                new DuplicateQuestionInfo("q2", "New Q2", oldQ2, newQ2));

        Map<String, QuestionItem> merged = applier.apply(Map.of("q1", newQ1, "q2", newQ2), duplicates,
                Map.of("q1", DuplicateResolution.KEEP_OLD, "q2", DuplicateResolution.KEEP_NEW));

        assertThat(merged.get("q1")).isSameAs(oldQ1);
        assertThat(merged.get("q2")).isSameAs(newQ2);
    }

    @Test
    @DisplayName("apply: result is read-only")
    void apply_result_isUnmodifiable() {
        Map<String, QuestionItem> merged = applier.apply(Map.of("q9", onlyOld), Map.of(), List.of(), null);

        assertThatThrownBy(() -> merged.put("q1", newQ1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("apply: duplicate missing from both sets is a conflict")
    void apply_unknownDuplicate_throws() {
        List<DuplicateQuestionInfo> duplicates = List.of(new DuplicateQuestionInfo("q7", "Q7", oldQ1, newQ1));

        assertThatThrownBy(() -> applier.apply(Map.of(), Map.of(), duplicates, Map.of()))
                .isInstanceOf(DuplicateMergeException.class)
                .hasMessageContaining("q7");
    }

    @Test
    @DisplayName("apply: chosen snapshot missing is a conflict")
    void apply_missingChosenSnapshot_throws() {
        List<DuplicateQuestionInfo> duplicates = List.of(new DuplicateQuestionInfo("q1", "Q1", null, newQ1));

        assertThatThrownBy(() -> applier.apply(Map.of("q1", newQ1), duplicates,
                Map.of("q1", DuplicateResolution.KEEP_OLD)))
                .isInstanceOf(DuplicateMergeException.class)
                .hasMessageContaining("keep_old");
    }

    @Test
    @DisplayName("apply: the same duplicate listed twice is a conflict")
    void apply_repeatedDuplicate_throws() {
        DuplicateQuestionInfo duplicate = new DuplicateQuestionInfo("q1", "Q1", oldQ1, newQ1);

        assertThatThrownBy(() -> applier.apply(Map.of("q1", newQ1), List.of(duplicate, duplicate), Map.of()))
                .isInstanceOf(DuplicateMergeException.class)
                .hasMessageContaining("more than once");
    }

    @Test
    @DisplayName("resolutionFor: defaults to keep_new")
    void resolutionFor_missingChoice_defaultsToKeepNew() {
        assertThat(applier.resolutionFor("q1", null)).isEqualTo(DuplicateResolution.KEEP_NEW);
        assertThat(applier.resolutionFor("q1", Map.of("q2", DuplicateResolution.KEEP_OLD)))
                .isEqualTo(DuplicateResolution.KEEP_NEW);
        assertThat(applier.resolutionFor("q2", Map.of("q2", DuplicateResolution.KEEP_OLD)))
                .isEqualTo(DuplicateResolution.KEEP_OLD);
    }
}
