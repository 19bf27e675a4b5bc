package uk.gegc.checkpointsync.features.checkpoint.application.validation;

import org.springframework.stereotype.Component;
import uk.gegc.checkpointsync.features.checkpoint.domain.CheckpointConversionException;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.jsonld.JsonLdDataFeedItem;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.jsonld.JsonLdDataset;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.jsonld.JsonLdQuestion;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.jsonld.JsonLdRating;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.jsonld.JsonLdSourceCode;
import uk.gegc.checkpointsync.features.checkpoint.infra.mapping.RubricRatingMapper;
import uk.gegc.checkpointsync.features.checkpoint.infra.mapping.RubricScope;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Structural check of a produced JSON-LD document. All problems are collected before failing.
 */
@Component
public class JsonLdDatasetValidator {

    private static final Set<String> RATING_TYPES = Stream.of(RubricScope.values())
            .flatMap(scope -> Stream.of(
                    RubricRatingMapper.LLM_FAMILY,
                    RubricRatingMapper.REGEX_FAMILY,
                    RubricRatingMapper.CALLABLE_FAMILY,
                    RubricRatingMapper.METRIC_FAMILY
            ).map(family -> scope.prefix() + family))
            .collect(Collectors.toUnmodifiableSet());

    public void validate(JsonLdDataset dataset) {
        List<String> errors = collectErrors(dataset);
        if (!errors.isEmpty()) {
            throw new CheckpointConversionException("JSON-LD validation failed:\n" + String.join("\n", errors));
        }
    }

    public List<String> collectErrors(JsonLdDataset dataset) {
        List<String> errors = new ArrayList<>();
        if (dataset == null) {
            errors.add("Document is empty");
            return errors;
        }
        if (!JsonLdDataset.TYPE.equals(dataset.getType())) {
            errors.add("Root @type must be " + JsonLdDataset.TYPE);
        }
        if (dataset.getName() == null || dataset.getName().isBlank()) {
            errors.add("Dataset must have a name");
        }
        validateRatings(dataset.getRating(), "Dataset", errors);

        List<JsonLdDataFeedItem> parts = dataset.getHasPart();
        if (parts == null) {
            errors.add("Dataset must have a hasPart array");
            return errors;
        }
        for (int i = 0; i < parts.size(); i++) {
            validatePart(parts.get(i), "hasPart[" + i + "]", errors);
        }
        return errors;
    }

    private void validatePart(JsonLdDataFeedItem part, String path, List<String> errors) {
        if (part == null) {
            errors.add(path + " is null");
            return;
        }
        if (!JsonLdDataFeedItem.TYPE.equals(part.type())) {
            errors.add(path + " @type must be " + JsonLdDataFeedItem.TYPE);
        }
        if (part.dateModified() == null || part.dateModified().isBlank()) {
            errors.add(path + " is missing dateModified");
        }
        JsonLdQuestion question = part.item();
        if (question == null) {
            errors.add(path + " is missing item");
            return;
        }
        if (!JsonLdQuestion.TYPE.equals(question.getType())) {
            errors.add(path + ".item @type must be " + JsonLdQuestion.TYPE);
        }
        if (question.getText() == null || question.getText().isBlank()) {
            errors.add(path + ".item is missing text");
        }
        if (question.getAcceptedAnswer() == null) {
            errors.add(path + ".item is missing acceptedAnswer");
        }
        JsonLdSourceCode template = question.getHasPart();
        if (template == null) {
            errors.add(path + ".item is missing hasPart");
        } else if (!JsonLdSourceCode.TYPE.equals(template.type())) {
            errors.add(path + ".item.hasPart @type must be " + JsonLdSourceCode.TYPE);
        }
        validateRatings(question.getRating(), path + ".item", errors);
    }

    private void validateRatings(List<JsonLdRating> ratings, String path, List<String> errors) {
        if (ratings == null) {
            return;
        }
        for (int i = 0; i < ratings.size(); i++) {
            JsonLdRating rating = ratings.get(i);
            String ratingPath = path + ".rating[" + i + "]";
            if (rating == null) {
                errors.add(ratingPath + " is null");
                continue;
            }
            if (!JsonLdRating.TYPE.equals(rating.type())) {
                errors.add(ratingPath + " @type must be " + JsonLdRating.TYPE);
            }
            if (rating.bestRating() == null || rating.worstRating() == null) {
                errors.add(ratingPath + " must have bestRating and worstRating");
            }
            if (rating.additionalType() == null || !RATING_TYPES.contains(rating.additionalType())) {
                errors.add(ratingPath + " has invalid additionalType: " + rating.additionalType());
            }
        }
    }
}
