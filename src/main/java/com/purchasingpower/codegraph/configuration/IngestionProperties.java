package com.purchasingpower.codegraph.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class IngestionProperties {

    @Min(1)
    private int fileBatchSize = 500;

    /** Symbols per insert batch, kept small to respect store parameter limits. */
    @Min(1)
    private int symbolBatchSize = 50;

    @Min(1)
    private int dependencyBatchSize = 1000;

    @Min(1)
    private int fileDependencyBatchSize = 1000;

    /** Maximum number of files parsed at the same time. */
    @Min(1)
    private int parserConcurrency = 10;

    @NotNull
    private List<String> supportedExtensions = new ArrayList<>(List.of(
            "ts", "tsx", "js", "jsx", "mjs", "cjs", "vue", "php", "cs",
            "java", "py", "go", "rb", "kt", "rs", "gd"));

    @NotNull
    private List<String> excludedDirectories = new ArrayList<>(List.of(
            ".git", "node_modules", "dist", "build", "target", "vendor", ".next"));
}
