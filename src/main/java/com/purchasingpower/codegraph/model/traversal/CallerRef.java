package com.purchasingpower.codegraph.model.traversal;

public record CallerRef(
        String name,
        String filePath,
        Integer lineNumber
) {
}
