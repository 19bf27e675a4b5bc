package uk.gegc.checkpointsync.features.checkpoint.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * schema.org Organization. Read without an {@code @type} key when the declared type is already
 * {@code Organization}, as for a dataset publisher.
 */
@JsonTypeName("Organization")
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "@type", defaultImpl = Organization.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "Organization", description = "schema.org Organization")
public record Organization(
        String name,
        String description,
        String url,
        String email
) implements Creator {
}
