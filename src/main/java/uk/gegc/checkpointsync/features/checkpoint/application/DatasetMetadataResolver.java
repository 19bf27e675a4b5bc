package uk.gegc.checkpointsync.features.checkpoint.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.checkpointsync.features.checkpoint.config.CheckpointDefaultsProperties;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.Creator;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.DatasetMetadata;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.Person;
import uk.gegc.checkpointsync.shared.util.DateUtils;

/**
 * Fills in missing dataset metadata and applies the timestamp rules.
 * <p>
 * A field counts as provided when it is non-null and non-blank; provided values are kept
 * exactly as given, whatever they look like. {@code dateCreated} is generated only when absent.
 * {@code dateModified} is kept unless the conversion is a creation, in which case it is always
 * regenerated.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatasetMetadataResolver {

    private final CheckpointDefaultsProperties defaults;
    private final DateUtils dateUtils;

    public DatasetMetadata resolve(DatasetMetadata input, int questionCount, boolean isCreation) {
        DatasetMetadata source = input != null ? input : DatasetMetadata.builder().build();
        String now = dateUtils.nowIso();

        boolean defaulted = !isPresent(source.name()) || !isPresent(source.description())
                || !isPresent(source.version()) || source.creator() == null;
        if (defaulted) {
            log.debug("Filling default dataset metadata for checkpoint with {} questions", questionCount);
        }

        return source.toBuilder()
                .name(isPresent(source.name()) ? source.name() : defaults.getName())
                .description(isPresent(source.description())
                        ? source.description()
                        : defaultDescription(questionCount))
                .version(isPresent(source.version()) ? source.version() : defaults.getVersion())
                .creator(source.creator() != null ? source.creator() : Person.named(defaults.getCreator()))
                .dateCreated(isPresent(source.dateCreated()) ? source.dateCreated() : now)
                .dateModified(!isCreation && isPresent(source.dateModified()) ? source.dateModified() : now)
                .build();
    }

    /**
     * Carries the lineage of a stored benchmark into a newer candidate: the stored
     * {@code dateCreated} wins over whatever the candidate says, and fields the candidate
     * leaves empty fall back to the stored values.
     */
    public DatasetMetadata inheritLineage(DatasetMetadata candidate, DatasetMetadata persisted) {
        if (persisted == null) {
            return candidate;
        }
        if (candidate == null) {
            return persisted;
        }
        return candidate.toBuilder()
                .name(isPresent(candidate.name()) ? candidate.name() : persisted.name())
                .description(isPresent(candidate.description()) ? candidate.description() : persisted.description())
                .version(isPresent(candidate.version()) ? candidate.version() : persisted.version())
                .license(isPresent(candidate.license()) ? candidate.license() : persisted.license())
                .keywords(candidate.keywords() != null ? candidate.keywords() : persisted.keywords())
                .creator(candidate.creator() != null ? candidate.creator() : persisted.creator())
                .publisher(candidate.publisher() != null ? candidate.publisher() : persisted.publisher())
                .datePublished(isPresent(candidate.datePublished()) ? candidate.datePublished() : persisted.datePublished())
                .dateCreated(isPresent(persisted.dateCreated()) ? persisted.dateCreated() : candidate.dateCreated())
                .customProperties(candidate.customProperties() != null
                        ? candidate.customProperties()
                        : persisted.customProperties())
                .build();
    }

    /**
     * Display string for a creator as written to JSON-LD. Organization details beyond the name are dropped.
     */
    public String creatorDisplayName(Creator creator) {
        if (creator == null || !isPresent(creator.name())) {
            return defaults.getCreator();
        }
        return creator.name();
    }

    private String defaultDescription(int questionCount) {
        return String.format(defaults.getDescriptionTemplate(), questionCount);
    }

    static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
