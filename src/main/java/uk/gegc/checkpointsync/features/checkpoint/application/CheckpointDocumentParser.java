package uk.gegc.checkpointsync.features.checkpoint.application;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.Checkpoint;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.ImportReport;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.jsonld.JsonLdDataset;
import uk.gegc.checkpointsync.shared.exception.ValidationException;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads a checkpoint document of either supported format.
 * <ul>
 *     <li>JSON-LD: root {@code @type} is {@code Dataset} (or the older {@code DataFeed});
 *     imported through the {@link CheckpointConverter}.</li>
 *     <li>v2.0: root {@code version} is {@code "2.0"} and {@code checkpoint} is an object;
 *     bound directly.</li>
 * </ul>
 * Duplicate object keys anywhere in the document are rejected.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CheckpointDocumentParser {

    private final ObjectMapper objectMapper;
    private final CheckpointConverter checkpointConverter;

    public ImportReport parse(InputStream input) {
        if (input == null) {
            throw new ValidationException("Checkpoint input stream is required");
        }

        JsonNode root;
        try (JsonParser parser = objectMapper.getFactory().createParser(input)) {
            parser.enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
            root = objectMapper.readTree(parser);
        } catch (IOException ex) {
            throw new ValidationException("Malformed JSON checkpoint payload: " + ex.getMessage());
        }
        if (root == null || !root.isObject()) {
            throw new ValidationException("Checkpoint payload must be a JSON object");
        }

        if (isJsonLdDataset(root)) {
            log.debug("Detected JSON-LD checkpoint document");
            return checkpointConverter.importWithReport(bind(root, JsonLdDataset.class));
        }
        if (isV2Checkpoint(root)) {
            log.debug("Detected v2.0 checkpoint document");
            return new ImportReport(bind(root, Checkpoint.class), null);
        }
        throw new ValidationException("Unrecognized checkpoint format: expected a JSON-LD Dataset or a v2.0 checkpoint");
    }

    static boolean isJsonLdDataset(JsonNode root) {
        String type = root.path("@type").asText("");
        return JsonLdDataset.TYPE.equals(type) || JsonLdDataset.LEGACY_TYPE.equals(type);
    }

    static boolean isV2Checkpoint(JsonNode root) {
        return Checkpoint.FORMAT_VERSION.equals(root.path("version").asText(null))
                && root.path("checkpoint").isObject();
    }

    private <T> T bind(JsonNode root, Class<T> type) {
        try {
            return objectMapper.treeToValue(root, type);
        } catch (IOException | IllegalArgumentException ex) {
            throw new ValidationException("Checkpoint document does not match the expected structure: " + ex.getMessage());
        }
    }
}
