package com.purchasingpower.codegraph.model.traversal;

import com.purchasingpower.codegraph.model.graph.DependencyType;

import java.util.List;

/**
 * One edge reached by a transitive traversal.
 *
 * @param dependencyId   id of the stored edge
 * @param depth          1 for edges touching the seed
 * @param dependencyType edge kind
 * @param lineNumber     line of the call site
 * @param from           source endpoint
 * @param to             target endpoint
 * @param path           symbol ids from the seed to the newly reached symbol
 */
public record TransitiveEdge(
        Long dependencyId,
        int depth,
        DependencyType dependencyType,
        Integer lineNumber,
        SymbolRef from,
        SymbolRef to,
        List<Long> path
) {
}
