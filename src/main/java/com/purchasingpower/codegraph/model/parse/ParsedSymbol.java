package com.purchasingpower.codegraph.model.parse;

import com.purchasingpower.codegraph.model.graph.SymbolType;
import com.purchasingpower.codegraph.model.graph.Visibility;
import lombok.Builder;

/**
 * A symbol as reported by a language parser, before it is stored.
 */
@Builder
public record ParsedSymbol(
        String name,
        String qualifiedName,
        SymbolType symbolType,
        Visibility visibility,
        Integer startLine,
        Integer endLine,
        boolean exported,
        String signature,
        String description
) {
}
