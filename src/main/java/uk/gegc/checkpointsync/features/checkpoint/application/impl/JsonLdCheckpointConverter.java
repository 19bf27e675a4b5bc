package uk.gegc.checkpointsync.features.checkpoint.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.checkpointsync.features.checkpoint.application.CheckpointConverter;
import uk.gegc.checkpointsync.features.checkpoint.application.DatasetMetadataResolver;
import uk.gegc.checkpointsync.features.checkpoint.application.QuestionIdGenerator;
import uk.gegc.checkpointsync.features.checkpoint.application.validation.CheckpointValidator;
import uk.gegc.checkpointsync.features.checkpoint.application.validation.JsonLdDatasetValidator;
import uk.gegc.checkpointsync.features.checkpoint.config.CheckpointImportProperties;
import uk.gegc.checkpointsync.features.checkpoint.domain.CheckpointConversionException;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.Checkpoint;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.ConversionOptions;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.Creator;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.DatasetMetadata;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.ImportReport;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.Organization;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.Person;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.QuestionItem;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.SkippedEntry;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.jsonld.JsonLdAnswer;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.jsonld.JsonLdContext;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.jsonld.JsonLdDataFeedItem;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.jsonld.JsonLdDataset;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.jsonld.JsonLdPropertyValue;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.jsonld.JsonLdQuestion;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.jsonld.JsonLdRating;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.jsonld.JsonLdSourceCode;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.rubric.Rubric;
import uk.gegc.checkpointsync.features.checkpoint.infra.mapping.LegacyRubricPropertyReader;
import uk.gegc.checkpointsync.features.checkpoint.infra.mapping.PropertyValues;
import uk.gegc.checkpointsync.features.checkpoint.infra.mapping.QuestionPropertyMapper;
import uk.gegc.checkpointsync.features.checkpoint.infra.mapping.RubricRatingMapper;
import uk.gegc.checkpointsync.features.checkpoint.infra.mapping.RubricScope;
import uk.gegc.checkpointsync.shared.util.DateUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Service
@RequiredArgsConstructor
@Slf4j
public class JsonLdCheckpointConverter implements CheckpointConverter {

    public static final String FORMAT_VERSION = "3.0.0-jsonld";

    static final String PROP_FORMAT_VERSION = "checkpoint_format_version";
    static final String PROP_CONVERSION_METADATA = "conversion_metadata";
    static final String PROP_PUBLISHER = "publisher";
    static final String PROP_DATE_PUBLISHED = "datePublished";
    static final String CUSTOM_PREFIX = "custom_";

    private static final String URN_PREFIX = "urn:uuid:";
    private static final String QUESTION_ID_PREFIX = "question_";
    private static final String CODE_REPOSITORY = "karenina-benchmarks";
    private static final int TEMPLATE_NAME_LENGTH = 30;
    private static final Set<String> QUESTION_KEYS =
            Set.of("@type", "@id", "text", "acceptedAnswer", "hasPart", "rating", "additionalProperty");

    private final DatasetMetadataResolver metadataResolver;
    private final QuestionIdGenerator questionIdGenerator;
    private final RubricRatingMapper ratingMapper;
    private final QuestionPropertyMapper propertyMapper;
    private final LegacyRubricPropertyReader legacyRubricReader;
    private final CheckpointValidator checkpointValidator;
    private final JsonLdDatasetValidator datasetValidator;
    private final CheckpointImportProperties importProperties;
    private final DateUtils dateUtils;
    private final ObjectMapper objectMapper;

    @Override
    public JsonLdDataset exportToJsonLd(Checkpoint checkpoint, ConversionOptions options) {
        checkpointValidator.validateForExport(checkpoint);
        ConversionOptions effective = options != null ? options : ConversionOptions.defaults();

        DatasetMetadata metadata = metadataResolver.resolve(
                checkpoint.datasetMetadata(), checkpoint.questionCount(), effective.isCreation());
        List<JsonLdRating> globalRatings = ratingMapper.toRatings(checkpoint.globalRubric(), RubricScope.GLOBAL);

        List<JsonLdDataFeedItem> parts = new ArrayList<>(checkpoint.questionCount());
        int ratingCount = globalRatings.size();
        for (Map.Entry<String, QuestionItem> entry : checkpoint.questions().entrySet()) {
            JsonLdDataFeedItem part = toDataFeedItem(entry.getKey(), entry.getValue(), effective);
            if (part.item().getRating() != null) {
                ratingCount += part.item().getRating().size();
            }
            parts.add(part);
        }

        JsonLdDataset dataset = new JsonLdDataset();
        dataset.setContext(JsonLdContext.schemaOrg());
        dataset.setType(JsonLdDataset.TYPE);
        if (effective.preserveIds()) {
            dataset.setId(URN_PREFIX + "karenina-checkpoint-" + dateUtils.currentTimeMillis());
        }
        dataset.setName(metadata.name());
        dataset.setDescription(metadata.description());
        dataset.setVersion(metadata.version());
        dataset.setCreator(TextNode.valueOf(metadataResolver.creatorDisplayName(metadata.creator())));
        dataset.setLicense(metadata.license());
        dataset.setKeywords(metadata.keywords());
        dataset.setDateCreated(metadata.dateCreated());
        dataset.setDateModified(metadata.dateModified());
        dataset.setRating(globalRatings.isEmpty() ? null : globalRatings);
        dataset.setHasPart(parts);
        dataset.setAdditionalProperty(datasetProperties(checkpoint, metadata, ratingCount, effective));

        if (effective.validateOutput()) {
            datasetValidator.validate(dataset);
        }
        log.debug("Exported checkpoint '{}' with {} questions and {} ratings (isCreation={})",
                metadata.name(), parts.size(), ratingCount, effective.isCreation());
        return dataset;
    }

    @Override
    public ImportReport importWithReport(JsonLdDataset dataset) {
        validateRoot(dataset);
        List<JsonLdPropertyValue> datasetProperties = dataset.getAdditionalProperty();
        checkFormatVersion(datasetProperties);

        List<JsonLdDataFeedItem> parts = dataset.getHasPart() != null ? dataset.getHasPart() : List.of();
        if (parts.size() > importProperties.getMaxItems()) {
            throw new CheckpointConversionException("Document has " + parts.size()
                    + " entries, above the import limit of " + importProperties.getMaxItems());
        }

        Rubric globalRubric = legacyRubricReader.mergeInto(
                ratingMapper.toRubric(dataset.getRating(), RubricScope.GLOBAL), datasetProperties);

        Map<String, QuestionItem> questions = new LinkedHashMap<>();
        List<SkippedEntry> skipped = new ArrayList<>();
        for (int i = 0; i < parts.size(); i++) {
            JsonLdDataFeedItem part = parts.get(i);
            String questionId = questionIdOf(part, i);

            String problem = structuralProblem(part);
            if (problem != null) {
                skip(skipped, i, questionId, problem);
                continue;
            }
            String lastModified = lastModifiedOf(part, i);
            if (lastModified == null) {
                skip(skipped, i, questionId, "entry has no usable dateModified or dateCreated");
                continue;
            }
            QuestionItem item;
            try {
                item = toQuestionItem(part, lastModified, dateCreatedOf(part, i));
            } catch (CheckpointConversionException ex) {
                skip(skipped, i, questionId, ex.getMessage());
                continue;
            }
            if (questions.putIfAbsent(questionId, item) != null) {
                throw new CheckpointConversionException(
                        "Document contains question ID '" + questionId + "' more than once");
            }
        }

        Checkpoint checkpoint = Checkpoint.builder()
                .version(Checkpoint.FORMAT_VERSION)
                .globalRubric(globalRubric)
                .datasetMetadata(readMetadata(dataset))
                .questions(questions)
                .build();
        log.debug("Imported {} questions from JSON-LD dataset '{}' ({} skipped)",
                questions.size(), dataset.getName(), skipped.size());
        return new ImportReport(checkpoint, skipped);
    }

    // --- export -----------------------------------------------------------------------------

    private JsonLdDataFeedItem toDataFeedItem(String questionId, QuestionItem item, ConversionOptions options) {
        boolean preserveIds = options.preserveIds();

        JsonLdQuestion question = new JsonLdQuestion();
        question.setType(JsonLdQuestion.TYPE);
        if (preserveIds) {
            question.setId(questionIdGenerator.generate(item.question()));
        }
        question.setText(item.question());
        question.setAcceptedAnswer(new JsonLdAnswer(
                JsonLdAnswer.TYPE,
                preserveIds ? URN_PREFIX + "answer-" + questionId : null,
                nullToEmpty(item.rawAnswer())));
        question.setHasPart(new JsonLdSourceCode(
                JsonLdSourceCode.TYPE,
                preserveIds ? URN_PREFIX + "template-" + questionId : null,
                templateName(item.question()),
                nullToEmpty(item.answerTemplate()),
                JsonLdSourceCode.LANGUAGE_PYTHON,
                CODE_REPOSITORY));

        List<JsonLdRating> ratings;
        try {
            ratings = ratingMapper.toRatings(item.questionRubric(), RubricScope.QUESTION_SPECIFIC);
        } catch (CheckpointConversionException ex) {
            throw new CheckpointConversionException("Question " + questionId + ": " + ex.getMessage(), ex);
        }
        question.setRating(ratings.isEmpty() ? null : ratings);
        question.setAdditionalProperty(propertyMapper.toProperties(item));
        if (item.jsonLdExtensions() != null) {
            item.jsonLdExtensions().forEach((key, value) -> {
                if (!QUESTION_KEYS.contains(key)) {
                    question.putExtension(key, value);
                }
            });
        }

        return new JsonLdDataFeedItem(
                JsonLdDataFeedItem.TYPE,
                preserveIds ? URN_PREFIX + questionId : null,
                item.effectiveDateCreated(),
                item.lastModified(),
                question,
                item.keywords() == null || item.keywords().isEmpty() ? null : item.keywords());
    }

    private List<JsonLdPropertyValue> datasetProperties(Checkpoint checkpoint, DatasetMetadata metadata,
                                                        int ratingCount, ConversionOptions options) {
        List<JsonLdPropertyValue> properties = new ArrayList<>();
        properties.add(JsonLdPropertyValue.of(PROP_FORMAT_VERSION, FORMAT_VERSION));
        if (metadata.publisher() != null) {
            properties.add(JsonLdPropertyValue.of(PROP_PUBLISHER, writeJson(metadata.publisher())));
        }
        if (metadata.datePublished() != null) {
            properties.add(JsonLdPropertyValue.of(PROP_DATE_PUBLISHED, metadata.datePublished()));
        }
        if (metadata.customProperties() != null) {
            metadata.customProperties().forEach((key, value) ->
                    properties.add(JsonLdPropertyValue.of(CUSTOM_PREFIX + key, value)));
        }
        if (options.includeMetadata()) {
            ObjectNode conversion = objectMapper.createObjectNode();
            conversion.put("originalVersion", checkpoint.version());
            conversion.put("convertedAt", dateUtils.now().toString());
            conversion.put("totalQuestions", checkpoint.questionCount());
            conversion.put("totalRatings", ratingCount);
            properties.add(JsonLdPropertyValue.of(PROP_CONVERSION_METADATA, writeJson(conversion)));
        }
        return properties;
    }

    private static String templateName(String questionText) {
        String prefix = questionText.length() > TEMPLATE_NAME_LENGTH
                ? questionText.substring(0, TEMPLATE_NAME_LENGTH)
                : questionText;
        return prefix + "... Answer Template";
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new CheckpointConversionException("Failed to encode dataset property", ex);
        }
    }

    // --- import -----------------------------------------------------------------------------

    private void validateRoot(JsonLdDataset dataset) {
        if (dataset == null) {
            throw new CheckpointConversionException("JSON-LD document is required");
        }
        String type = dataset.getType();
        if (!JsonLdDataset.TYPE.equals(type) && !JsonLdDataset.LEGACY_TYPE.equals(type)) {
            throw new CheckpointConversionException(
                    "Root @type must be " + JsonLdDataset.TYPE + " but was " + type);
        }
    }

    private void checkFormatVersion(List<JsonLdPropertyValue> properties) {
        PropertyValues.text(properties, PROP_FORMAT_VERSION).ifPresent(version -> {
            String major = version.contains(".") ? version.substring(0, version.indexOf('.')) : version;
            if (!FORMAT_VERSION.startsWith(major + ".")) {
                log.warn("Importing JSON-LD document with unrecognized checkpoint_format_version {}", version);
            }
        });
    }

    private static String questionIdOf(JsonLdDataFeedItem part, int index) {
        if (part == null || part.id() == null || part.id().isBlank()) {
            return QUESTION_ID_PREFIX + index;
        }
        return part.id().startsWith(URN_PREFIX) ? part.id().substring(URN_PREFIX.length()) : part.id();
    }

    private static String structuralProblem(JsonLdDataFeedItem part) {
        if (part == null) {
            return "entry is null";
        }
        JsonLdQuestion question = part.item();
        if (question == null) {
            return "entry has no item";
        }
        if (question.getText() == null || question.getText().isBlank()) {
            return "question has no text";
        }
        if (question.getAcceptedAnswer() == null || question.getAcceptedAnswer().text() == null) {
            return "question has no acceptedAnswer text";
        }
        return null;
    }

    // dateModified when readable, otherwise dateCreated; null when neither is.
    private static String lastModifiedOf(JsonLdDataFeedItem part, int index) {
        Optional<String> modified = DateUtils.toIsoTimestamp(part.dateModified());
        if (modified.isPresent()) {
            return modified.get();
        }
        Optional<String> created = DateUtils.toIsoTimestamp(part.dateCreated());
        created.ifPresent(value -> log.warn("hasPart[{}] has unusable dateModified '{}', using dateCreated {}",
                index, part.dateModified(), value));
        return created.orElse(null);
    }

    private static String dateCreatedOf(JsonLdDataFeedItem part, int index) {
        if (part.dateCreated() == null || part.dateCreated().isBlank()) {
            return null;
        }
        Optional<String> created = DateUtils.toIsoTimestamp(part.dateCreated());
        if (created.isEmpty()) {
            log.warn("hasPart[{}] has unreadable dateCreated '{}', leaving it unset", index, part.dateCreated());
        }
        return created.orElse(null);
    }

    private static void skip(List<SkippedEntry> skipped, int index, String questionId, String reason) {
        log.warn("Skipping hasPart[{}] ({}): {}", index, questionId, reason);
        skipped.add(new SkippedEntry(index, questionId, reason));
    }

    private QuestionItem toQuestionItem(JsonLdDataFeedItem part, String lastModified, String dateCreated) {
        JsonLdQuestion question = part.item();
        JsonLdSourceCode template = question.getHasPart();

        QuestionItem.QuestionItemBuilder builder = QuestionItem.builder()
                .question(question.getText())
                .rawAnswer(question.getAcceptedAnswer().text())
                .answerTemplate(template != null && template.text() != null ? template.text() : "")
                .dateCreated(dateCreated)
                .lastModified(lastModified)
                .questionRubric(ratingMapper.toRubric(question.getRating(), RubricScope.QUESTION_SPECIFIC))
                .keywords(part.keywords() == null || part.keywords().isEmpty() ? null : part.keywords());
        propertyMapper.applyProperties(question.getAdditionalProperty(), builder);
        propertyMapper.applySiblingKeys(question.getExtensions(), builder);
        return builder.build();
    }

    private DatasetMetadata readMetadata(JsonLdDataset dataset) {
        List<JsonLdPropertyValue> properties = dataset.getAdditionalProperty();
        Creator creator = readCreator(dataset.getCreator());
        Organization publisher = PropertyValues.find(properties, PROP_PUBLISHER)
                .map(this::readPublisher)
                .orElse(null);
        String datePublished = PropertyValues.text(properties, PROP_DATE_PUBLISHED).orElse(null);
        Map<String, String> customProperties = readCustomProperties(properties);

        // Only the descriptive core decides presence; license, keywords and extras ride along.
        boolean present = dataset.getName() != null || dataset.getDescription() != null
                || dataset.getVersion() != null || creator != null
                || dataset.getDateCreated() != null || dataset.getDateModified() != null;
        if (!present) {
            return null;
        }
        return DatasetMetadata.builder()
                .name(dataset.getName())
                .description(dataset.getDescription())
                .version(dataset.getVersion())
                .license(dataset.getLicense())
                .keywords(dataset.getKeywords())
                .creator(creator)
                .publisher(publisher)
                .datePublished(datePublished)
                .dateCreated(dataset.getDateCreated())
                .dateModified(dataset.getDateModified())
                .customProperties(customProperties)
                .build();
    }

    private Creator readCreator(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText().isBlank() ? null : Person.named(node.asText());
        }
        if (node.isObject()) {
            try {
                return objectMapper.treeToValue(node, Creator.class);
            } catch (JsonProcessingException | IllegalArgumentException ex) {
                log.warn("Unreadable dataset creator, keeping its name only: {}", ex.getMessage());
                String name = node.path("name").asText(null);
                return name != null ? Person.named(name) : null;
            }
        }
        log.warn("Ignoring dataset creator of unsupported shape {}", node.getNodeType());
        return null;
    }

    private Organization readPublisher(JsonNode value) {
        try {
            JsonNode node = value.isTextual() ? objectMapper.readTree(value.asText()) : value;
            return objectMapper.treeToValue(node, Organization.class);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            log.warn("Ignoring unreadable dataset publisher: {}", ex.getMessage());
            return null;
        }
    }

    private static Map<String, String> readCustomProperties(List<JsonLdPropertyValue> properties) {
        if (properties == null) {
            return null;
        }
        Map<String, String> custom = new LinkedHashMap<>();
        for (JsonLdPropertyValue property : properties) {
            if (property != null && property.name() != null && property.name().startsWith(CUSTOM_PREFIX)
                    && property.value() != null && !property.value().isNull()) {
                custom.put(property.name().substring(CUSTOM_PREFIX.length()), PropertyValues.asText(property.value()));
            }
        }
        return custom.isEmpty() ? null : custom;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
