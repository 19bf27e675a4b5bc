package uk.gegc.checkpointsync.features.checkpoint.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@Data
@Validated
@ConfigurationProperties(prefix = "checkpoint.import")
public class CheckpointImportProperties {

    @NotNull(message = "Property checkpoint.import.max-items must be configured")
    @Min(value = 1, message = "checkpoint.import.max-items must be at least 1")
    private Integer maxItems = 10_000;
}
