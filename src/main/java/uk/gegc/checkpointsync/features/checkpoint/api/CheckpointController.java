package uk.gegc.checkpointsync.features.checkpoint.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import uk.gegc.checkpointsync.features.checkpoint.application.CheckpointConverter;
import uk.gegc.checkpointsync.features.checkpoint.application.CheckpointDocumentParser;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.Checkpoint;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.ImportReport;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.jsonld.JsonLdDataset;
import uk.gegc.checkpointsync.shared.exception.ValidationException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;

@Tag(name = "Checkpoints", description = "Conversion between checkpoints and JSON-LD Datasets")
@RestController
@RequestMapping("/api/v1/checkpoints")
@RequiredArgsConstructor
@Slf4j
public class CheckpointController {

    public static final String JSON_LD_VALUE = "application/ld+json";

    private final CheckpointConverter checkpointConverter;
    private final CheckpointDocumentParser documentParser;

    @Operation(
            summary = "Export a checkpoint as JSON-LD",
            description = "Converts a v2.0 checkpoint into a schema.org Dataset. With isCreation=true the dataset "
                    + "dateModified is regenerated; otherwise a provided dateModified is kept."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "JSON-LD document",
                    content = @Content(mediaType = JSON_LD_VALUE, schema = @Schema(implementation = JsonLdDataset.class))),
            @ApiResponse(responseCode = "422", description = "Checkpoint cannot be converted")
    })
    @PostMapping(value = "/export", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<JsonLdDataset> exportCheckpoint(
            @RequestBody Checkpoint checkpoint,
            @Parameter(description = "Whether this export records a new edit")
            @RequestParam(defaultValue = "false") boolean isCreation) {
        if (checkpoint == null) {
            throw new ValidationException("Checkpoint payload is required");
        }
        JsonLdDataset dataset = checkpointConverter.exportToJsonLd(checkpoint, isCreation);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(JSON_LD_VALUE))
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filenameFor(dataset.getName()) + "\"")
                .body(dataset);
    }

    @Operation(
            summary = "Import a JSON-LD document",
            description = "Converts a schema.org Dataset into a checkpoint. Malformed entries are left out and listed in the report."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Imported checkpoint and skipped entries"),
            @ApiResponse(responseCode = "400", description = "Malformed JSON"),
            @ApiResponse(responseCode = "422", description = "Document cannot be converted")
    })
    @PostMapping(value = "/import", consumes = {JSON_LD_VALUE, MediaType.APPLICATION_JSON_VALUE})
    public ResponseEntity<ImportReport> importCheckpoint(@RequestBody JsonLdDataset dataset) {
        ImportReport report = checkpointConverter.importWithReport(dataset);
        if (report.hasSkippedEntries()) {
            log.info("JSON-LD import left out {} entries", report.skipped().size());
        }
        return ResponseEntity.ok(report);
    }

    @Operation(
            summary = "Import a checkpoint file",
            description = "Accepts either a JSON-LD document or a v2.0 checkpoint. The format is detected from the content."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Imported checkpoint"),
            @ApiResponse(responseCode = "400", description = "Unreadable or unrecognized file"),
            @ApiResponse(responseCode = "422", description = "Document cannot be converted")
    })
    @PostMapping(value = "/import/file", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ImportReport> importCheckpointFile(
            @Parameter(description = "Checkpoint file (.jsonld or .json)", required = true)
            @RequestParam("file") MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new ValidationException("Checkpoint file is required");
        }
        try (InputStream input = file.getInputStream()) {
            return ResponseEntity.ok(documentParser.parse(input));
        } catch (IOException ex) {
            log.error("Failed to read uploaded checkpoint {}", file.getOriginalFilename(), ex);
            throw new ValidationException("Failed to read uploaded checkpoint file");
        }
    }

    static String filenameFor(String datasetName) {
        String base = datasetName == null ? "" : datasetName.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-+|-+$)", "");
        return (base.isEmpty() ? "checkpoint" : base) + ".jsonld";
    }
}
