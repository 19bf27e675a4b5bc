package uk.gegc.checkpointsync.features.checkpoint.infra.mapping;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import uk.gegc.checkpointsync.features.checkpoint.CheckpointTestFixtures;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.CreativeWork;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.FewShotExample;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.Person;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.QuestionItem;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.jsonld.JsonLdPropertyValue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class QuestionPropertyMapperTest {

    private QuestionPropertyMapper mapper;
    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        mapper = new QuestionPropertyMapper(CheckpointTestFixtures.objectMapper());
        logger = (Logger) LoggerFactory.getLogger(QuestionPropertyMapper.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
    }

    @Test
    @DisplayName("toProperties: minimal question writes only the finished flag and the original template")
    void toProperties_minimalQuestion_writesFinishedAndTemplate() {
        QuestionItem item = QuestionItem.builder()
                .question("Q")
                .originalAnswerTemplate("class A: pass")
                .lastModified("2025-01-15T14:30:00Z")
                .build();

        List<JsonLdPropertyValue> properties = mapper.toProperties(item);

        assertThat(properties).extracting(JsonLdPropertyValue::name)
                .containsExactly("finished", "original_answer_template");
        assertThat(properties.get(0).value().asBoolean()).isFalse();
        assertThat(properties).allSatisfy(property -> assertThat(property.type()).isEqualTo("PropertyValue"));
    }

    @Test
    @DisplayName("toProperties/applyProperties: optional fields survive the round trip")
    void roundTrip_optionalFields_arePreserved() {
        Map<String, String> custom = new LinkedHashMap<>();
        custom.put("difficulty", "hard");
        custom.put("domain", "geography");
        QuestionItem item = QuestionItem.builder()
                .question("Q")
                .finished(true)
                .originalAnswerTemplate("tmpl")
                .author(new Person("Ada", "ada@example.org", "Lab", null))
                .sources(List.of(new CreativeWork("ScholarlyArticle", "Atlas", null, null, "2020", null, "doi:10/1", null)))
                .fewShotExamples(List.of(new FewShotExample("What is 1+1?", "2")))
                .tags(List.of("geo", "easy"))
                .customMetadata(custom)
                .lastModified("2025-01-15T14:30:00Z")
                .build();

        List<JsonLdPropertyValue> properties = mapper.toProperties(item);
        QuestionItem.QuestionItemBuilder builder = QuestionItem.builder();
        mapper.applyProperties(properties, builder);
        QuestionItem restored = builder.build();

        assertThat(properties).extracting(JsonLdPropertyValue::name).contains("custom_difficulty", "custom_domain");
        assertThat(restored.finished()).isTrue();
        assertThat(restored.originalAnswerTemplate()).isEqualTo("tmpl");
        assertThat(restored.author()).isEqualTo(item.author());
        assertThat(restored.sources()).isEqualTo(item.sources());
        assertThat(restored.fewShotExamples()).isEqualTo(item.fewShotExamples());
        assertThat(restored.tags()).containsExactly("geo", "easy");
        assertThat(restored.customMetadata()).containsExactlyEntriesOf(custom);
    }

    @Test
    @DisplayName("applyProperties: unknown property names land in custom_metadata under their full name")
    void applyProperties_unknownNames_goToCustomMetadata() {
        JsonNode structured = JsonNodeFactory.instance.objectNode().put("level", 3);
        List<JsonLdPropertyValue> properties = List.of(
                JsonLdPropertyValue.of("reviewer", "bob"),
                JsonLdPropertyValue.of("scoring", structured));

        QuestionItem.QuestionItemBuilder builder = QuestionItem.builder();
        mapper.applyProperties(properties, builder);
        QuestionItem restored = builder.build();

        assertThat(restored.customMetadata())
                .containsEntry("reviewer", "bob")
                .containsEntry("scoring", "{\"level\":3}");
        assertThat(restored.originalAnswerTemplate()).isEmpty();
    }

    @Test
    @DisplayName("applyProperties: unreadable author is dropped with a warning")
    void applyProperties_malformedAuthor_logsAndSkips() {
        QuestionItem.QuestionItemBuilder builder = QuestionItem.builder();

        mapper.applyProperties(List.of(JsonLdPropertyValue.of("author", "{not json")), builder);

        assertThat(builder.build().author()).isNull();
        assertThat(logAppender.list)
                .anySatisfy(event -> {
                    assertThat(event.getLevel()).isEqualTo(Level.WARN);
                    assertThat(event.getFormattedMessage()).contains("author");
                });
    }

    @Test
    @DisplayName("applySiblingKeys: known keys on the Question node are read, others kept verbatim")
    void applySiblingKeys_knownKeys_areApplied() {
        Map<String, JsonNode> extensions = new LinkedHashMap<>();
        extensions.put("finished", BooleanNode.TRUE);
        extensions.put("tags", JsonNodeFactory.instance.arrayNode().add("alpha"));
        extensions.put("x-editor", TextNode.valueOf("vim"));

        QuestionItem.QuestionItemBuilder builder = QuestionItem.builder();
        mapper.applySiblingKeys(extensions, builder);
        QuestionItem restored = builder.build();

        assertThat(restored.finished()).isTrue();
        assertThat(restored.tags()).containsExactly("alpha");
        assertThat(restored.customMetadata()).isNull();
        assertThat(restored.jsonLdExtensions()).containsExactly(Map.entry("x-editor", TextNode.valueOf("vim")));
    }
}
