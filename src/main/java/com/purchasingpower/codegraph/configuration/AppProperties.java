package com.purchasingpower.codegraph.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private CacheProperties cache = new CacheProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private IngestionProperties ingestion = new IngestionProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private TraversalProperties traversal = new TraversalProperties();
}
