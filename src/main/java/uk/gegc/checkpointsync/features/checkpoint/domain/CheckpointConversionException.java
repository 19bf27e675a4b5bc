package uk.gegc.checkpointsync.features.checkpoint.domain;

/**
 * Thrown when a checkpoint or JSON-LD document cannot be converted as a whole.
 * Problems confined to a single imported question are reported, not thrown.
 */
public class CheckpointConversionException extends RuntimeException {

    public CheckpointConversionException(String message) {
        super(message);
    }

    public CheckpointConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
