package uk.gegc.checkpointsync.features.benchmark.domain;

/**
 * Raised when a merge is asked to work on inconsistent input, such as a duplicate list that
 * names the same question twice.
 */
public class DuplicateMergeException extends IllegalStateException {

    public DuplicateMergeException(String message) {
        super(message);
    }
}
