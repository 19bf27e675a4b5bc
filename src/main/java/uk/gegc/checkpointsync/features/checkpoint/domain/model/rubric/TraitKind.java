package uk.gegc.checkpointsync.features.checkpoint.domain.model.rubric;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Result shape of a rubric trait: pass/fail or a bounded score.
 */
public enum TraitKind {
    BOOLEAN("boolean"),
    SCORE("score");

    private final String value;

    TraitKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Reads a kind, accepting the legacy {@code binary} spelling as {@link #BOOLEAN}.
     */
    @JsonCreator
    public static TraitKind fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "boolean", "binary" -> BOOLEAN;
            case "score" -> SCORE;
            default -> throw new IllegalArgumentException("Unknown trait kind: " + raw);
        };
    }
}
