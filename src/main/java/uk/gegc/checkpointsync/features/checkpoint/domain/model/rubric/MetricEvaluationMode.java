package uk.gegc.checkpointsync.features.checkpoint.domain.model.rubric;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MetricEvaluationMode {
    /** Only true-positive instructions are defined. */
    TP_ONLY("tp_only"),
    /** True-positive and true-negative instructions are both defined. */
    FULL_MATRIX("full_matrix");

    private final String value;

    MetricEvaluationMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static MetricEvaluationMode fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "tp_only" -> TP_ONLY;
            case "full_matrix", "tp_and_tn" -> FULL_MATRIX;
            default -> throw new IllegalArgumentException("Unknown evaluation mode: " + raw);
        };
    }
}
