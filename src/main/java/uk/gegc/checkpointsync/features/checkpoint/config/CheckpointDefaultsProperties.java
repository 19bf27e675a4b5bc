package uk.gegc.checkpointsync.features.checkpoint.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Values written into exported dataset metadata when the checkpoint does not provide them.
 */
@Component
@Data
@Validated
@ConfigurationProperties(prefix = "checkpoint.defaults")
public class CheckpointDefaultsProperties {

    @NotBlank(message = "Property checkpoint.defaults.name must be configured")
    private String name = "Karenina LLM Benchmark Checkpoint";

    @NotBlank(message = "Property checkpoint.defaults.version must be configured")
    private String version = "0.1.0";

    @NotBlank(message = "Property checkpoint.defaults.creator must be configured")
    private String creator = "Karenina Benchmarking System";

    /**
     * Format string for the default description; receives the question count as its only argument.
     */
    @NotBlank(message = "Property checkpoint.defaults.description-template must be configured")
    private String descriptionTemplate =
            "Checkpoint containing %d benchmark questions with answer templates and rubric evaluations";
}
