package uk.gegc.checkpointsync.features.checkpoint.domain.model.jsonld;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * schema.org {@code SoftwareSourceCode} holding a question's answer template.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"@type", "@id", "name", "text", "programmingLanguage", "codeRepository"})
public record JsonLdSourceCode(
        @JsonProperty("@type") String type,
        @JsonProperty("@id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("text") String text,
        @JsonProperty("programmingLanguage") String programmingLanguage,
        @JsonProperty("codeRepository") String codeRepository
) {
    public static final String TYPE = "SoftwareSourceCode";
    public static final String LANGUAGE_PYTHON = "Python";
}
