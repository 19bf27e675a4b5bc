package uk.gegc.checkpointsync.shared.config;

import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation groups, one per feature.
 */
@Configuration
public class OpenApiGroupConfig {

    @Bean
    public GroupedOpenApi checkpointsGroup() {
        return GroupedOpenApi.builder()
                .group("checkpoints")
                .displayName("Checkpoint Conversion")
                .pathsToMatch("/api/v1/checkpoints/**")
                .build();
    }

    @Bean
    public GroupedOpenApi benchmarksGroup() {
        return GroupedOpenApi.builder()
                .group("benchmarks")
                .displayName("Benchmarks & Duplicate Resolution")
                .pathsToMatch("/api/v1/benchmarks/**")
                .build();
    }
}
