package uk.gegc.checkpointsync.features.checkpoint.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.checkpointsync.features.checkpoint.CheckpointTestFixtures;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.ImportReport;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.QuestionItem;
import uk.gegc.checkpointsync.shared.exception.ValidationException;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CheckpointDocumentParserTest {

    private CheckpointDocumentParser parser;

    @BeforeEach
    void setUp() {
        parser = new CheckpointDocumentParser(
                CheckpointTestFixtures.objectMapper(),
                CheckpointTestFixtures.converter(CheckpointTestFixtures.fixedClock()));
    }

    private static InputStream stream(String json) {
        return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("parse: JSON-LD Dataset is routed through the converter")
    void parse_jsonLdDataset_returnsConvertedCheckpoint() {
        String json = """
                {
                  "@context": {"@vocab": "http://schema.org/"},
                  "@type": "Dataset",
                  "name": "Bench",
                  "hasPart": [
                    {
                      "@type": "DataFeedItem",
                      "@id": "urn:uuid:q1",
                      "dateModified": "2025-01-15T14:30:00Z",
                      "item": {"@type": "Question", "text": "Q?", "acceptedAnswer": {"@type": "Answer", "text": "A"}}
                    }
                  ]
                }
                """;

        ImportReport report = parser.parse(stream(json));

        assertThat(report.checkpoint().version()).isEqualTo("2.0");
        assertThat(report.checkpoint().questions()).containsOnlyKeys("q1");
        assertThat(report.skipped()).isEmpty();
    }

    @Test
    @DisplayName("parse: v2.0 checkpoint is bound directly")
    void parse_v2Checkpoint_isBoundDirectly() {
        String json = """
                {
                  "version": "2.0",
                  "global_rubric": null,
                  "dataset_metadata": {"name": "Bench", "dateCreated": "2024-01-01T00:00:00Z"},
                  "checkpoint": {
                    "q1": {
                      "question": "Q?",
                      "raw_answer": "A",
                      "original_answer_template": "class A: pass",
                      "answer_template": "class A: pass",
                      "last_modified": "2025-01-15T14:30:00Z",
                      "finished": true
                    }
                  }
                }
                """;

        ImportReport report = parser.parse(stream(json));

        QuestionItem item = report.checkpoint().questions().get("q1");
        assertThat(item.rawAnswer()).isEqualTo("A");
        assertThat(item.finished()).isTrue();
        assertThat(report.checkpoint().datasetMetadata().dateCreated()).isEqualTo("2024-01-01T00:00:00Z");
        assertThat(report.hasSkippedEntries()).isFalse();
    }

    @Test
    @DisplayName("parse: duplicate object keys are rejected")
    void parse_duplicateKeys_throwsValidationException() {
        String json = """
                {"version": "2.0", "checkpoint": {"q1": {"question": "A"}, "q1": {"question": "B"}}}
                """;

        assertThatThrownBy(() -> parser.parse(stream(json)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Malformed JSON")
                .hasMessageContaining("q1");
    }

    @Test
    @DisplayName("parse: unrecognised shapes are rejected")
    void parse_unknownFormat_throwsValidationException() {
        assertThatThrownBy(() -> parser.parse(stream("{\"version\": \"1.0\", \"questions\": []}")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Unrecognized checkpoint format");
        assertThatThrownBy(() -> parser.parse(stream("[1, 2, 3]")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("JSON object");
        assertThatThrownBy(() -> parser.parse(stream("{\"@type\": ")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Malformed JSON");
    }
}
