package uk.gegc.checkpointsync.features.checkpoint.domain.model.jsonld;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * The schema.org {@code @context} written on every exported dataset.
 */
public final class JsonLdContext {

    public static final String SCHEMA_ORG_VOCAB = "http://schema.org/";

    private static final ObjectNode SCHEMA_ORG = buildSchemaOrgContext();

    private JsonLdContext() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Returns a fresh copy of the context.
     */
    public static ObjectNode schemaOrg() {
        return SCHEMA_ORG.deepCopy();
    }

    private static ObjectNode buildSchemaOrgContext() {
        JsonNodeFactory f = JsonNodeFactory.instance;
        ObjectNode ctx = f.objectNode();
        ctx.put("@version", 1.1);
        ctx.put("@vocab", SCHEMA_ORG_VOCAB);
        for (String term : new String[]{"Dataset", "DataFeedItem", "Question", "Answer", "SoftwareSourceCode",
                "Rating", "PropertyValue", "version", "name", "description", "creator", "license",
                "dateCreated", "dateModified", "text", "programmingLanguage", "codeRepository",
                "bestRating", "worstRating", "ratingExplanation", "additionalType", "value", "url", "identifier"}) {
            ctx.put(term, term);
        }
        ctx.set("hasPart", setContainer(f, "hasPart"));
        ctx.set("item", idReference(f, "item"));
        ctx.set("acceptedAnswer", idReference(f, "acceptedAnswer"));
        ctx.set("rating", setContainer(f, "rating"));
        ctx.set("additionalProperty", setContainer(f, "additionalProperty"));
        ctx.set("keywords", setContainer(f, "keywords"));
        return ctx;
    }

    private static ObjectNode setContainer(JsonNodeFactory f, String id) {
        return f.objectNode().put("@id", id).put("@container", "@set");
    }

    private static ObjectNode idReference(JsonNodeFactory f, String id) {
        return f.objectNode().put("@id", id).put("@type", "@id");
    }
}
