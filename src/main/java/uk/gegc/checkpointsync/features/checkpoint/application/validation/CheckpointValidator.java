package uk.gegc.checkpointsync.features.checkpoint.application.validation;

import org.springframework.stereotype.Component;
import uk.gegc.checkpointsync.features.checkpoint.domain.CheckpointConversionException;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.Checkpoint;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.QuestionItem;
import uk.gegc.checkpointsync.shared.util.DateUtils;

import java.util.Map;

/**
 * Checks that a checkpoint can be exported: every question has text and a well-formed
 * {@code last_modified}, and any {@code date_created} that is set is well-formed too.
 */
@Component
public class CheckpointValidator {

    public void validateForExport(Checkpoint checkpoint) {
        if (checkpoint == null) {
            throw new CheckpointConversionException("Checkpoint is required");
        }
        for (Map.Entry<String, QuestionItem> entry : checkpoint.questions().entrySet()) {
            validateItem(entry.getKey(), entry.getValue());
        }
    }

    private void validateItem(String questionId, QuestionItem item) {
        if (questionId == null || questionId.isBlank()) {
            throw new CheckpointConversionException("Checkpoint contains a question with an empty ID");
        }
        if (item == null) {
            throw new CheckpointConversionException("Question " + questionId + " has no content");
        }
        if (item.question() == null || item.question().isBlank()) {
            throw new CheckpointConversionException("Question " + questionId + " has no question text");
        }
        if (!DateUtils.isIsoTimestamp(item.lastModified())) {
            throw new CheckpointConversionException(
                    "Question " + questionId + " has missing or malformed last_modified: " + item.lastModified());
        }
        if (item.dateCreated() != null && !item.dateCreated().isBlank() && !DateUtils.isIsoTimestamp(item.dateCreated())) {
            throw new CheckpointConversionException(
                    "Question " + questionId + " has malformed date_created: " + item.dateCreated());
        }
    }
}
