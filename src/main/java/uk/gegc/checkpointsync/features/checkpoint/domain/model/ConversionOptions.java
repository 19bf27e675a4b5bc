package uk.gegc.checkpointsync.features.checkpoint.domain.model;

/**
 * Value object describing how a checkpoint is converted to JSON-LD.
 *
 * @param preserveIds     write {@code @id} URNs so question IDs survive a round trip
 * @param includeMetadata add a {@code conversion_metadata} property describing the conversion
 * @param validateOutput  run the structural validator over the produced document
 * @param isCreation      the conversion records a new edit, so {@code dateModified} is refreshed
 */
public record ConversionOptions(
        boolean preserveIds,
        boolean includeMetadata,
        boolean validateOutput,
        boolean isCreation
) {

    public static ConversionOptions defaults() {
        return new ConversionOptions(true, true, true, false);
    }

    public static ConversionOptions creation() {
        return new ConversionOptions(true, true, true, true);
    }

    public ConversionOptions withCreation(boolean creation) {
        return new ConversionOptions(preserveIds, includeMetadata, validateOutput, creation);
    }
}
