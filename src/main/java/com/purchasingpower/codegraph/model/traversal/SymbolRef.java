package com.purchasingpower.codegraph.model.traversal;

import com.purchasingpower.codegraph.model.graph.SymbolType;

/**
 * Endpoint of a traversal edge, flattened with its owning file.
 */
public record SymbolRef(
        Long id,
        String name,
        SymbolType symbolType,
        String filePath
) {
}
