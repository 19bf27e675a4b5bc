package uk.gegc.checkpointsync.features.checkpoint.domain.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Creator of a dataset: a {@link Person} or an {@link Organization}, discriminated by the
 * schema.org {@code @type} key. A creator without {@code @type} reads as a person.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "@type", defaultImpl = Person.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = Person.class, name = "Person"),
        @JsonSubTypes.Type(value = Organization.class, name = "Organization")
})
public interface Creator {

    String name();
}
