package uk.gegc.checkpointsync.features.checkpoint.infra.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.jsonld.JsonLdPropertyValue;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.rubric.CallableTrait;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.rubric.MetricRubricTrait;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.rubric.RegexTrait;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.rubric.Rubric;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads global traits from older documents that stored them as JSON-string dataset properties
 * instead of Ratings. Unreadable values are logged and ignored.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LegacyRubricPropertyReader {

    static final String GLOBAL_REGEX_TRAITS = "global_regex_rubric_traits";
    static final String GLOBAL_CALLABLE_TRAITS = "global_callable_rubric_traits";
    static final String GLOBAL_METRIC_TRAITS = "global_metric_rubric_traits";

    private static final String LEGACY_INVERT = "invert";
    private static final String INVERT_RESULT = "invert_result";

    private static final TypeReference<List<RegexTrait>> REGEX_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<CallableTrait>> CALLABLE_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<MetricRubricTrait>> METRIC_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    /**
     * Adds the legacy traits found in {@code properties} to {@code base}.
     *
     * @return the merged rubric, or {@code base} unchanged when no legacy property is present
     */
    public Rubric mergeInto(Rubric base, List<JsonLdPropertyValue> properties) {
        List<RegexTrait> regexTraits = read(properties, GLOBAL_REGEX_TRAITS, REGEX_LIST);
        List<CallableTrait> callableTraits = read(properties, GLOBAL_CALLABLE_TRAITS, CALLABLE_LIST);
        List<MetricRubricTrait> metricTraits = read(properties, GLOBAL_METRIC_TRAITS, METRIC_LIST);
        if (regexTraits.isEmpty() && callableTraits.isEmpty() && metricTraits.isEmpty()) {
            return base;
        }
        log.debug("Merging legacy global traits: {} regex, {} callable, {} metric",
                regexTraits.size(), callableTraits.size(), metricTraits.size());

        Rubric current = base != null ? base : new Rubric(null, null, null, null);
        return new Rubric(
                current.llmTraits(),
                concat(current.regexTraits(), regexTraits),
                concat(current.callableTraits(), callableTraits),
                concat(current.metricTraits(), metricTraits)
        );
    }

    private <T> List<T> read(List<JsonLdPropertyValue> properties, String name, TypeReference<List<T>> type) {
        JsonNode value = PropertyValues.find(properties, name).orElse(null);
        if (value == null) {
            return List.of();
        }
        try {
            JsonNode node = value.isTextual() ? objectMapper.readTree(value.asText()) : value.deepCopy();
            if (node == null || !node.isArray()) {
                log.warn("Ignoring legacy property '{}': expected an array", name);
                return List.of();
            }
            renameLegacyInvert(node);
            List<T> traits = objectMapper.convertValue(node, type);
            return traits != null ? traits : List.of();
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            log.warn("Ignoring unreadable legacy property '{}': {}", name, ex.getMessage());
            return List.of();
        }
    }

    private void renameLegacyInvert(JsonNode traits) {
        for (JsonNode trait : traits) {
            if (trait instanceof ObjectNode object && object.has(LEGACY_INVERT)) {
                JsonNode invert = object.remove(LEGACY_INVERT);
                if (!object.has(INVERT_RESULT)) {
                    object.set(INVERT_RESULT, invert);
                }
            }
        }
    }

    private static <T> List<T> concat(List<T> first, List<T> second) {
        if (second.isEmpty()) {
            return first;
        }
        List<T> merged = new ArrayList<>(first);
        merged.addAll(second);
        return merged;
    }
}
