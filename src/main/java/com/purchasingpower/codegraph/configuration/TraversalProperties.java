package com.purchasingpower.codegraph.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;

@Data
public class TraversalProperties {

    @Min(1)
    private int defaultMaxDepth = 10;

    @Min(1)
    private int defaultLimit = 1000;

    /** Largest limit a traversal request may ask for. */
    @Min(1)
    private int maxLimit = 10_000;

    /** Bound on a single traversal or resolution pass before it fails with a timeout. */
    @NotNull
    private Duration queryTimeout = Duration.ofSeconds(30);
}
