package uk.gegc.checkpointsync.features.checkpoint.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "Person", description = "schema.org Person")
public record Person(
        String name,
        String email,
        String affiliation,
        String url
) implements Creator {

    public static Person named(String name) {
        return new Person(name, null, null, null);
    }
}
