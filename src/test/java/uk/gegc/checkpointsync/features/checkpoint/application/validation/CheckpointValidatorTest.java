package uk.gegc.checkpointsync.features.checkpoint.application.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.checkpointsync.features.checkpoint.domain.CheckpointConversionException;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.Checkpoint;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.QuestionItem;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static uk.gegc.checkpointsync.features.checkpoint.CheckpointTestFixtures.question;

class CheckpointValidatorTest {

    private final CheckpointValidator validator = new CheckpointValidator();

    @Test
    @DisplayName("validateForExport: well-formed checkpoint passes")
    void validateForExport_validCheckpoint_passes() {
        Checkpoint checkpoint = Checkpoint.of(Map.of("q1", question("Q?", "A", "2025-01-15T14:30:00Z")));

        assertThatCode(() -> validator.validateForExport(checkpoint)).doesNotThrowAnyException();
        assertThatCode(() -> validator.validateForExport(Checkpoint.of(Map.of()))).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("validateForExport: missing last_modified is rejected")
    void validateForExport_missingLastModified_throws() {
        Checkpoint checkpoint = Checkpoint.of(Map.of("q1", question("Q?", "A", null)));

        assertThatThrownBy(() -> validator.validateForExport(checkpoint))
                .isInstanceOf(CheckpointConversionException.class)
                .hasMessageContaining("q1")
                .hasMessageContaining("last_modified");
    }

    @Test
    @DisplayName("validateForExport: malformed date_created is rejected")
    void validateForExport_malformedDateCreated_throws() {
        QuestionItem item = question("Q?", "A", "2025-01-15T14:30:00Z").toBuilder()
                .dateCreated("last tuesday")
                .build();

        assertThatThrownBy(() -> validator.validateForExport(Checkpoint.of(Map.of("q1", item))))
                .isInstanceOf(CheckpointConversionException.class)
                .hasMessageContaining("date_created");
    }

    @Test
    @DisplayName("validateForExport: blank question text is rejected")
    void validateForExport_blankText_throws() {
        Checkpoint checkpoint = Checkpoint.of(Map.of("q1", question(" ", "A", "2025-01-15T14:30:00Z")));

        assertThatThrownBy(() -> validator.validateForExport(checkpoint))
                .isInstanceOf(CheckpointConversionException.class)
                .hasMessageContaining("question text");
    }

    @Test
    @DisplayName("validateForExport: null checkpoint is rejected")
    void validateForExport_null_throws() {
        assertThatThrownBy(() -> validator.validateForExport(null))
                .isInstanceOf(CheckpointConversionException.class);
    }
}
