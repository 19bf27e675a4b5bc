package uk.gegc.checkpointsync.features.checkpoint.application;

import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Derives a stable {@code urn:uuid:question-...} identifier from question text.
 * The same text always yields the same URN.
 */
@Component
public class QuestionIdGenerator {

    private static final int SLUG_LENGTH = 50;

    public String generate(String questionText) {
        String text = questionText == null ? "" : questionText;
        String slug = text.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9\\s]", "")
                .replaceAll("\\s+", "-");
        if (slug.length() > SLUG_LENGTH) {
            slug = slug.substring(0, SLUG_LENGTH);
        }
        String hash = Long.toHexString(Math.abs((long) text.hashCode()));
        return "urn:uuid:question-" + slug + "-" + hash;
    }
}
