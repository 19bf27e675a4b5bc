package uk.gegc.checkpointsync.features.checkpoint.application;

import uk.gegc.checkpointsync.features.checkpoint.domain.model.Checkpoint;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.ConversionOptions;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.ImportReport;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.jsonld.JsonLdDataset;

/**
 * Converts between the in-memory checkpoint and its JSON-LD Dataset form.
 * <p>
 * Exporting a checkpoint and importing the result gives back the same questions, the same
 * dataset metadata and the same per-question timestamps. Only an export with
 * {@code isCreation=true} produces a new {@code dateModified}.
 */
public interface CheckpointConverter {

    JsonLdDataset exportToJsonLd(Checkpoint checkpoint, ConversionOptions options);

    default JsonLdDataset exportToJsonLd(Checkpoint checkpoint, boolean isCreation) {
        return exportToJsonLd(checkpoint, ConversionOptions.defaults().withCreation(isCreation));
    }

    /**
     * Imports a document, leaving out malformed entries.
     */
    default Checkpoint importFromJsonLd(JsonLdDataset dataset) {
        return importWithReport(dataset).checkpoint();
    }

    /**
     * Imports a document and reports every {@code hasPart} entry that was left out.
     */
    ImportReport importWithReport(JsonLdDataset dataset);
}
