package uk.gegc.checkpointsync.features.checkpoint.infra.mapping;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.checkpointsync.features.checkpoint.domain.CheckpointConversionException;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.jsonld.JsonLdPropertyValue;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.jsonld.JsonLdRating;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.rubric.CallableTrait;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.rubric.LlmRubricTrait;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.rubric.MetricEvaluationMode;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.rubric.MetricRubricTrait;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.rubric.RegexTrait;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.rubric.Rubric;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.rubric.TraitKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Maps rubric traits to schema.org {@code Rating} objects and back.
 * <p>
 * Each trait family keeps its own settings in {@code additionalProperty}; the family and the
 * scope are encoded together in {@code additionalType}. A trait that cannot be represented,
 * or a Rating that cannot be read back into a trait, raises {@link CheckpointConversionException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RubricRatingMapper {

    public static final String LLM_FAMILY = "RubricTrait";
    public static final String REGEX_FAMILY = "RegexTrait";
    public static final String CALLABLE_FAMILY = "CallableTrait";
    public static final String METRIC_FAMILY = "MetricRubricTrait";

    static final String PROP_KIND = "kind";
    static final String PROP_HIGHER_IS_BETTER = "higher_is_better";
    static final String PROP_PATTERN = "pattern";
    static final String PROP_CASE_SENSITIVE = "case_sensitive";
    static final String PROP_INVERT_RESULT = "invert_result";
    static final String PROP_CALLABLE_CODE = "callable_code";
    static final String PROP_MIN_SCORE = "min_score";
    static final String PROP_MAX_SCORE = "max_score";
    static final String PROP_EVALUATION_MODE = "evaluation_mode";
    static final String PROP_METRICS = "metrics";
    static final String PROP_TP_INSTRUCTIONS = "tp_instructions";
    static final String PROP_TN_INSTRUCTIONS = "tn_instructions";
    static final String PROP_REPEATED_EXTRACTION = "repeated_extraction";

    private static final int DEFAULT_MIN_SCORE = 1;
    private static final int DEFAULT_MAX_SCORE = 5;
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public List<JsonLdRating> toRatings(Rubric rubric, RubricScope scope) {
        if (rubric == null || rubric.isEmpty()) {
            return List.of();
        }
        List<JsonLdRating> ratings = new ArrayList<>(rubric.traitCount());
        rubric.llmTraits().forEach(trait -> ratings.add(fromLlmTrait(trait, scope)));
        rubric.regexTraits().forEach(trait -> ratings.add(fromRegexTrait(trait, scope)));
        rubric.callableTraits().forEach(trait -> ratings.add(fromCallableTrait(trait, scope)));
        rubric.metricTraits().forEach(trait -> ratings.add(fromMetricTrait(trait, scope)));
        return ratings;
    }

    /**
     * Reads the Ratings of one scope back into a rubric. Ratings of the other scope, or with an
     * unknown {@code additionalType}, are ignored.
     *
     * @return the rubric, or {@code null} when no trait of this scope is present
     */
    public Rubric toRubric(List<JsonLdRating> ratings, RubricScope scope) {
        if (ratings == null || ratings.isEmpty()) {
            return null;
        }
        List<LlmRubricTrait> llmTraits = new ArrayList<>();
        List<RegexTrait> regexTraits = new ArrayList<>();
        List<CallableTrait> callableTraits = new ArrayList<>();
        List<MetricRubricTrait> metricTraits = new ArrayList<>();

        for (JsonLdRating rating : ratings) {
            if (rating == null) {
                continue;
            }
            String additionalType = rating.additionalType();
            if (additionalType == null || !additionalType.startsWith(scope.prefix())) {
                log.debug("Skipping rating '{}' with additionalType {} outside scope {}",
                        rating.name(), additionalType, scope);
                continue;
            }
            switch (additionalType.substring(scope.prefix().length())) {
                case LLM_FAMILY -> llmTraits.add(toLlmTrait(rating));
                case REGEX_FAMILY -> regexTraits.add(toRegexTrait(rating));
                case CALLABLE_FAMILY -> callableTraits.add(toCallableTrait(rating));
                case METRIC_FAMILY -> metricTraits.add(toMetricTrait(rating));
                default -> log.debug("Skipping rating '{}' with unrecognized additionalType {}",
                        rating.name(), additionalType);
            }
        }

        Rubric rubric = new Rubric(llmTraits, regexTraits, callableTraits, metricTraits);
        return rubric.isEmpty() ? null : rubric;
    }

    // --- export -----------------------------------------------------------------------------

    private JsonLdRating fromLlmTrait(LlmRubricTrait trait, RubricScope scope) {
        String name = requireName(trait.name(), "LLM");
        TraitKind kind = requireKind(trait.kind(), name);

        int best = 1;
        int worst = 0;
        if (kind == TraitKind.SCORE) {
            best = trait.maxScore() != null ? trait.maxScore() : DEFAULT_MAX_SCORE;
            worst = trait.minScore() != null ? trait.minScore() : DEFAULT_MIN_SCORE;
            if (worst >= best) {
                throw new CheckpointConversionException(
                        "Score trait '" + name + "' has min_score " + worst + " not below max_score " + best);
            }
        }

        List<JsonLdPropertyValue> properties = new ArrayList<>();
        properties.add(JsonLdPropertyValue.of(PROP_KIND, kind.value()));
        properties.add(JsonLdPropertyValue.of(PROP_HIGHER_IS_BETTER, orDefault(trait.higherIsBetter(), true)));

        JsonLdRating.JsonLdRatingBuilder builder = ratingBuilder(name, trait.description(), scope, LLM_FAMILY)
                .bestRating(best)
                .worstRating(worst)
                .additionalProperty(properties);
        if (Boolean.TRUE.equals(trait.deepJudgmentEnabled())) {
            builder.deepJudgmentEnabled(true)
                    .deepJudgmentExcerptEnabled(trait.deepJudgmentExcerptEnabled())
                    .deepJudgmentMaxExcerpts(trait.deepJudgmentMaxExcerpts())
                    .deepJudgmentFuzzyMatchThreshold(trait.deepJudgmentFuzzyMatchThreshold())
                    .deepJudgmentExcerptRetryAttempts(trait.deepJudgmentExcerptRetryAttempts())
                    .deepJudgmentSearchEnabled(trait.deepJudgmentSearchEnabled());
        }
        return builder.build();
    }

    private JsonLdRating fromRegexTrait(RegexTrait trait, RubricScope scope) {
        String name = requireName(trait.name(), "regex");
        if (trait.pattern() == null || trait.pattern().isEmpty()) {
            throw new CheckpointConversionException("Regex trait '" + name + "' is missing a pattern");
        }
        List<JsonLdPropertyValue> properties = List.of(
                JsonLdPropertyValue.of(PROP_PATTERN, trait.pattern()),
                JsonLdPropertyValue.of(PROP_CASE_SENSITIVE, orDefault(trait.caseSensitive(), true)),
                JsonLdPropertyValue.of(PROP_INVERT_RESULT, orDefault(trait.invertResult(), false)),
                JsonLdPropertyValue.of(PROP_HIGHER_IS_BETTER, orDefault(trait.higherIsBetter(), true))
        );
        return ratingBuilder(name, trait.description(), scope, REGEX_FAMILY)
                .bestRating(1)
                .worstRating(0)
                .additionalProperty(properties)
                .build();
    }

    private JsonLdRating fromCallableTrait(CallableTrait trait, RubricScope scope) {
        String name = requireName(trait.name(), "callable");
        if (trait.callableCode() == null || trait.callableCode().isEmpty()) {
            throw new CheckpointConversionException("Callable trait '" + name + "' is missing callable_code");
        }
        TraitKind kind = requireKind(trait.kind(), name);

        List<JsonLdPropertyValue> properties = new ArrayList<>();
        properties.add(JsonLdPropertyValue.of(PROP_CALLABLE_CODE, trait.callableCode()));
        properties.add(JsonLdPropertyValue.of(PROP_KIND, kind.value()));
        properties.add(JsonLdPropertyValue.of(PROP_INVERT_RESULT, orDefault(trait.invertResult(), false)));
        properties.add(JsonLdPropertyValue.of(PROP_HIGHER_IS_BETTER, orDefault(trait.higherIsBetter(), true)));
        if (trait.minScore() != null) {
            properties.add(JsonLdPropertyValue.of(PROP_MIN_SCORE, tree(trait.minScore())));
        }
        if (trait.maxScore() != null) {
            properties.add(JsonLdPropertyValue.of(PROP_MAX_SCORE, tree(trait.maxScore())));
        }

        boolean isBoolean = kind == TraitKind.BOOLEAN;
        return ratingBuilder(name, trait.description(), scope, CALLABLE_FAMILY)
                .bestRating(isBoolean ? 1 : orDefault(trait.maxScore(), DEFAULT_MAX_SCORE))
                .worstRating(isBoolean ? 0 : orDefault(trait.minScore(), DEFAULT_MIN_SCORE))
                .additionalProperty(properties)
                .build();
    }

    private JsonLdRating fromMetricTrait(MetricRubricTrait trait, RubricScope scope) {
        String name = requireName(trait.name(), "metric");
        if (trait.evaluationMode() == null) {
            throw new CheckpointConversionException("Metric trait '" + name + "' is missing evaluation_mode");
        }
        if (trait.metrics() == null || trait.metrics().isEmpty()) {
            throw new CheckpointConversionException("Metric trait '" + name + "' has no metrics");
        }
        List<JsonLdPropertyValue> properties = List.of(
                JsonLdPropertyValue.of(PROP_EVALUATION_MODE, trait.evaluationMode().value()),
                JsonLdPropertyValue.of(PROP_METRICS, tree(trait.metrics())),
                JsonLdPropertyValue.of(PROP_TP_INSTRUCTIONS, tree(orEmpty(trait.tpInstructions()))),
                JsonLdPropertyValue.of(PROP_TN_INSTRUCTIONS, tree(orEmpty(trait.tnInstructions()))),
                JsonLdPropertyValue.of(PROP_REPEATED_EXTRACTION, orDefault(trait.repeatedExtraction(), false))
        );
        return ratingBuilder(name, trait.description(), scope, METRIC_FAMILY)
                .bestRating(1)
                .worstRating(0)
                .additionalProperty(properties)
                .build();
    }

    private JsonLdRating.JsonLdRatingBuilder ratingBuilder(String name, String description,
                                                           RubricScope scope, String family) {
        return JsonLdRating.builder()
                .type(JsonLdRating.TYPE)
                .id(ratingId(name))
                .name(name)
                .description(description)
                .additionalType(scope.prefix() + family);
    }

    static String ratingId(String traitName) {
        return "urn:uuid:rating-" + traitName.toLowerCase(Locale.ROOT).replaceAll("\\s+", "-");
    }

    // --- import -----------------------------------------------------------------------------

    private LlmRubricTrait toLlmTrait(JsonLdRating rating) {
        String name = requireName(rating.name(), "LLM");
        if (rating.bestRating() == null || rating.worstRating() == null) {
            throw new CheckpointConversionException("Rating '" + name + "' is missing bestRating or worstRating");
        }
        int best = rating.bestRating();
        int worst = rating.worstRating();
        List<JsonLdPropertyValue> properties = rating.additionalProperty();

        // Without an explicit kind, a 0..1 range is read as pass/fail.
        TraitKind kind = PropertyValues.text(properties, PROP_KIND)
                .map(raw -> parseKind(raw, name))
                .orElse(best == 1 && worst == 0 ? TraitKind.BOOLEAN : TraitKind.SCORE);
        if (kind == TraitKind.SCORE && worst >= best) {
            throw new CheckpointConversionException(
                    "Score rating '" + name + "' has worstRating " + worst + " not below bestRating " + best);
        }

        LlmRubricTrait.LlmRubricTraitBuilder builder = LlmRubricTrait.builder()
                .name(name)
                .description(rating.description())
                .kind(kind)
                .higherIsBetter(PropertyValues.bool(properties, PROP_HIGHER_IS_BETTER, true));
        if (kind == TraitKind.SCORE) {
            builder.minScore(worst).maxScore(best);
        }
        if (rating.deepJudgmentEnabled() != null) {
            builder.deepJudgmentEnabled(rating.deepJudgmentEnabled())
                    .deepJudgmentExcerptEnabled(rating.deepJudgmentExcerptEnabled())
                    .deepJudgmentMaxExcerpts(rating.deepJudgmentMaxExcerpts())
                    .deepJudgmentFuzzyMatchThreshold(rating.deepJudgmentFuzzyMatchThreshold())
                    .deepJudgmentExcerptRetryAttempts(rating.deepJudgmentExcerptRetryAttempts())
                    .deepJudgmentSearchEnabled(rating.deepJudgmentSearchEnabled());
        }
        return builder.build();
    }

    private RegexTrait toRegexTrait(JsonLdRating rating) {
        String name = requireName(rating.name(), "regex");
        List<JsonLdPropertyValue> properties = rating.additionalProperty();
        String pattern = PropertyValues.text(properties, PROP_PATTERN)
                .filter(value -> !value.isEmpty())
                .orElseThrow(() -> new CheckpointConversionException(
                        "Regex trait '" + name + "' is missing a pattern"));
        return RegexTrait.builder()
                .name(name)
                .description(rating.description())
                .pattern(pattern)
                .caseSensitive(PropertyValues.bool(properties, PROP_CASE_SENSITIVE, true))
                .invertResult(PropertyValues.bool(properties, PROP_INVERT_RESULT, false))
                .higherIsBetter(PropertyValues.bool(properties, PROP_HIGHER_IS_BETTER, true))
                .build();
    }

    private CallableTrait toCallableTrait(JsonLdRating rating) {
        String name = requireName(rating.name(), "callable");
        List<JsonLdPropertyValue> properties = rating.additionalProperty();
        String code = PropertyValues.text(properties, PROP_CALLABLE_CODE)
                .filter(value -> !value.isEmpty())
                .orElseThrow(() -> new CheckpointConversionException(
                        "Callable trait '" + name + "' is missing callable_code"));
        TraitKind kind = PropertyValues.text(properties, PROP_KIND)
                .map(raw -> parseKind(raw, name))
                .orElseThrow(() -> new CheckpointConversionException(
                        "Callable trait '" + name + "' is missing kind"));
        return CallableTrait.builder()
                .name(name)
                .description(rating.description())
                .callableCode(code)
                .kind(kind)
                .minScore(PropertyValues.integer(properties, PROP_MIN_SCORE).orElse(null))
                .maxScore(PropertyValues.integer(properties, PROP_MAX_SCORE).orElse(null))
                .invertResult(PropertyValues.bool(properties, PROP_INVERT_RESULT, false))
                .higherIsBetter(PropertyValues.bool(properties, PROP_HIGHER_IS_BETTER, true))
                .build();
    }

    private MetricRubricTrait toMetricTrait(JsonLdRating rating) {
        String name = requireName(rating.name(), "metric");
        List<JsonLdPropertyValue> properties = rating.additionalProperty();
        MetricEvaluationMode mode = PropertyValues.text(properties, PROP_EVALUATION_MODE)
                .map(raw -> parseEvaluationMode(raw, name))
                .orElseThrow(() -> new CheckpointConversionException(
                        "Metric trait '" + name + "' is missing evaluation_mode"));
        List<String> metrics = readStringList(properties, PROP_METRICS, name);
        if (metrics == null || metrics.isEmpty()) {
            throw new CheckpointConversionException("Metric trait '" + name + "' has no metrics");
        }
        List<String> tpInstructions = readStringList(properties, PROP_TP_INSTRUCTIONS, name);
        if (tpInstructions == null) {
            throw new CheckpointConversionException("Metric trait '" + name + "' is missing tp_instructions");
        }
        List<String> tnInstructions = readStringList(properties, PROP_TN_INSTRUCTIONS, name);
        return MetricRubricTrait.builder()
                .name(name)
                .description(rating.description())
                .evaluationMode(mode)
                .metrics(metrics)
                .tpInstructions(tpInstructions)
                .tnInstructions(tnInstructions != null ? tnInstructions : List.of())
                .repeatedExtraction(PropertyValues.bool(properties, PROP_REPEATED_EXTRACTION, false))
                .build();
    }

    private List<String> readStringList(List<JsonLdPropertyValue> properties, String propertyName, String traitName) {
        JsonNode value = PropertyValues.find(properties, propertyName).orElse(null);
        if (value == null) {
            return null;
        }
        if (!value.isArray()) {
            throw new CheckpointConversionException(
                    "Metric trait '" + traitName + "' has a non-array " + propertyName);
        }
        return objectMapper.convertValue(value, STRING_LIST);
    }

    // --- helpers ----------------------------------------------------------------------------

    private JsonNode tree(Object value) {
        return objectMapper.valueToTree(value);
    }

    private static String requireName(String name, String family) {
        if (name == null || name.isBlank()) {
            throw new CheckpointConversionException("A " + family + " trait is missing its name");
        }
        return name;
    }

    private static TraitKind requireKind(TraitKind kind, String traitName) {
        if (kind == null) {
            throw new CheckpointConversionException("Trait '" + traitName + "' is missing kind");
        }
        return kind;
    }

    private static TraitKind parseKind(String raw, String traitName) {
        try {
            return TraitKind.fromValue(raw);
        } catch (IllegalArgumentException ex) {
            throw new CheckpointConversionException("Trait '" + traitName + "' has invalid kind '" + raw + "'", ex);
        }
    }

    private static MetricEvaluationMode parseEvaluationMode(String raw, String traitName) {
        try {
            return MetricEvaluationMode.fromValue(raw);
        } catch (IllegalArgumentException ex) {
            throw new CheckpointConversionException(
                    "Metric trait '" + traitName + "' has invalid evaluation_mode '" + raw + "'", ex);
        }
    }

    private static <T> T orDefault(T value, T fallback) {
        return value != null ? value : fallback;
    }

    private static List<String> orEmpty(List<String> values) {
        return values != null ? values : List.of();
    }
}
