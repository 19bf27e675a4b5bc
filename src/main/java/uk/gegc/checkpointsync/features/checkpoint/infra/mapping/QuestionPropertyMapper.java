package uk.gegc.checkpointsync.features.checkpoint.infra.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.checkpointsync.features.checkpoint.domain.CheckpointConversionException;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.CreativeWork;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.FewShotExample;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.Person;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.QuestionItem;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.jsonld.JsonLdPropertyValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stores the question fields schema.org has no slot for as {@code additionalProperty} entries.
 * <p>
 * Structured values (author, sources, few-shot examples) travel as JSON strings. Custom metadata
 * keys get a {@code custom_} prefix. On the way back any property with an unknown name ends up
 * in {@code custom_metadata} under its full name.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QuestionPropertyMapper {

    static final String FINISHED = "finished";
    static final String ORIGINAL_ANSWER_TEMPLATE = "original_answer_template";
    static final String AUTHOR = "author";
    static final String SOURCES = "sources";
    static final String FEW_SHOT_EXAMPLES = "few_shot_examples";
    static final String TAGS = "tags";
    static final String CUSTOM_PREFIX = "custom_";

    private static final Set<String> SIBLING_KEYS =
            Set.of(FINISHED, ORIGINAL_ANSWER_TEMPLATE, AUTHOR, SOURCES, FEW_SHOT_EXAMPLES, TAGS);

    private static final TypeReference<List<CreativeWork>> SOURCE_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<FewShotExample>> EXAMPLE_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public List<JsonLdPropertyValue> toProperties(QuestionItem item) {
        List<JsonLdPropertyValue> properties = new ArrayList<>();
        properties.add(JsonLdPropertyValue.of(FINISHED, item.finished()));
        if (item.originalAnswerTemplate() != null) {
            properties.add(JsonLdPropertyValue.of(ORIGINAL_ANSWER_TEMPLATE, item.originalAnswerTemplate()));
        }
        if (item.author() != null) {
            properties.add(JsonLdPropertyValue.of(AUTHOR, writeJson(item.author(), AUTHOR)));
        }
        if (item.sources() != null && !item.sources().isEmpty()) {
            properties.add(JsonLdPropertyValue.of(SOURCES, writeJson(item.sources(), SOURCES)));
        }
        if (item.fewShotExamples() != null && !item.fewShotExamples().isEmpty()) {
            properties.add(JsonLdPropertyValue.of(FEW_SHOT_EXAMPLES, writeJson(item.fewShotExamples(), FEW_SHOT_EXAMPLES)));
        }
        if (item.tags() != null && !item.tags().isEmpty()) {
            JsonNode tags = objectMapper.valueToTree(item.tags());
            properties.add(JsonLdPropertyValue.of(TAGS, tags));
        }
        if (item.customMetadata() != null) {
            item.customMetadata().forEach((key, value) ->
                    properties.add(JsonLdPropertyValue.of(CUSTOM_PREFIX + key, value)));
        }
        return properties;
    }

    /**
     * Copies the recognised properties onto {@code builder}. Values that fail to parse are
     * logged and left out.
     */
    public void applyProperties(List<JsonLdPropertyValue> properties, QuestionItem.QuestionItemBuilder builder) {
        builder.originalAnswerTemplate("");
        if (properties == null || properties.isEmpty()) {
            return;
        }
        Map<String, String> customMetadata = new LinkedHashMap<>();
        for (JsonLdPropertyValue property : properties) {
            if (property == null || property.name() == null || property.value() == null || property.value().isNull()) {
                continue;
            }
            String name = property.name();
            if (!applyKnown(name, property.value(), builder)) {
                String key = name.startsWith(CUSTOM_PREFIX) ? name.substring(CUSTOM_PREFIX.length()) : name;
                customMetadata.put(key, PropertyValues.asText(property.value()));
            }
        }
        if (!customMetadata.isEmpty()) {
            builder.customMetadata(customMetadata);
        }
    }

    /**
     * Reads question fields written as sibling keys of the Question node instead of
     * {@code additionalProperty}. Keys with other names are kept verbatim in
     * {@code jsonld_extensions}.
     */
    public void applySiblingKeys(Map<String, JsonNode> extensions, QuestionItem.QuestionItemBuilder builder) {
        if (extensions == null || extensions.isEmpty()) {
            return;
        }
        Map<String, JsonNode> unknown = new LinkedHashMap<>();
        extensions.forEach((key, value) -> {
            if (SIBLING_KEYS.contains(key)) {
                if (value != null && !value.isNull()) {
                    applyKnown(key, value, builder);
                }
            } else {
                unknown.put(key, value);
            }
        });
        if (!unknown.isEmpty()) {
            builder.jsonLdExtensions(unknown);
        }
    }

    private boolean applyKnown(String name, JsonNode value, QuestionItem.QuestionItemBuilder builder) {
        switch (name) {
            case FINISHED -> builder.finished(value.asBoolean(false));
            case ORIGINAL_ANSWER_TEMPLATE -> builder.originalAnswerTemplate(value.asText());
            case AUTHOR -> builder.author(readJson(value, Person.class, AUTHOR));
            case SOURCES -> builder.sources(readJson(value, SOURCE_LIST, SOURCES));
            case FEW_SHOT_EXAMPLES -> builder.fewShotExamples(readJson(value, EXAMPLE_LIST, FEW_SHOT_EXAMPLES));
            case TAGS -> builder.tags(readJson(value, STRING_LIST, TAGS));
            default -> {
                return false;
            }
        }
        return true;
    }

    private String writeJson(Object value, String propertyName) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new CheckpointConversionException("Failed to encode question property '" + propertyName + "'", ex);
        }
    }

    // Values written by this mapper are JSON strings; arrays and objects are accepted as well.
    private <T> T readJson(JsonNode value, Class<T> type, String propertyName) {
        try {
            JsonNode node = value.isTextual() ? objectMapper.readTree(value.asText()) : value;
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            log.warn("Ignoring unreadable question property '{}': {}", propertyName, ex.getMessage());
            return null;
        }
    }

    private <T> T readJson(JsonNode value, TypeReference<T> type, String propertyName) {
        try {
            JsonNode node = value.isTextual() ? objectMapper.readTree(value.asText()) : value;
            return objectMapper.convertValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            log.warn("Ignoring unreadable question property '{}': {}", propertyName, ex.getMessage());
            return null;
        }
    }
}
