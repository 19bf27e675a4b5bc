package uk.gegc.checkpointsync.features.checkpoint.infra.mapping;

/**
 * Where a rubric applies. Used as the {@code additionalType} prefix of a Rating.
 */
public enum RubricScope {
    GLOBAL("Global"),
    QUESTION_SPECIFIC("QuestionSpecific");

    private final String prefix;

    RubricScope(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }
}
