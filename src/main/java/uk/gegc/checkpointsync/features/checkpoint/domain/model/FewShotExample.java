package uk.gegc.checkpointsync.features.checkpoint.domain.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "FewShotExample", description = "Question/answer pair used to prime answering models")
public record FewShotExample(String question, String answer) {
}
