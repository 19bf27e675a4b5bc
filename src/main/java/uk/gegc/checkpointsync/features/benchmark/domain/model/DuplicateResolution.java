package uk.gegc.checkpointsync.features.benchmark.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Per-question choice when a candidate question collides with a persisted one.
 */
public enum DuplicateResolution {
    /** Keep the persisted version. */
    KEEP_OLD("keep_old"),
    /** Keep the candidate version. Applied when no choice was made. */
    KEEP_NEW("keep_new");

    private final String value;

    DuplicateResolution(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static DuplicateResolution fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "keep_old" -> KEEP_OLD;
            case "keep_new" -> KEEP_NEW;
            default -> throw new IllegalArgumentException("Unknown duplicate resolution: " + raw);
        };
    }
}
