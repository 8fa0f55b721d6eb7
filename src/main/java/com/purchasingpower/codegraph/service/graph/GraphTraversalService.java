package com.purchasingpower.codegraph.service.graph;

import com.purchasingpower.codegraph.model.graph.DependencyType;
import com.purchasingpower.codegraph.model.traversal.ParameterContextAnalysis;
import com.purchasingpower.codegraph.model.traversal.TransitiveEdge;
import com.purchasingpower.codegraph.model.traversal.TraversalDirection;

import java.util.List;
import java.util.Set;

/**
 * Graph traversal over symbol dependency edges.
 *
 * Enables:
 * - Impact analysis: "who is affected if I change this method?" (callers)
 * - Context gathering: "what does this method rely on?" (dependencies)
 * - Call pattern analysis: "how is this method invoked?" (parameter contexts)
 *
 * Results are cached in the query cache; the cache is cleared whenever an
 * analysis run modifies the graph.
 */
public interface GraphTraversalService {

    /**
     * Breadth-first traversal from a seed symbol.
     *
     * @param symbolId  seed symbol
     * @param direction which way edges are followed
     * @param maxDepth  maximum hop count, at least 1
     * @param kinds     edge kinds to follow; empty or null means all kinds
     * @param limit     maximum number of edges returned, at least 1
     * @return edges ordered by depth ascending, then edge id descending
     * @throws com.purchasingpower.codegraph.exception.GraphQueryTimeoutException if the traversal
     *         exceeds {@code app.traversal.query-timeout}
     */
    List<TransitiveEdge> traverse(Long symbolId, TraversalDirection direction, int maxDepth,
                                  Set<DependencyType> kinds, int limit);

    /**
     * Symbols that (transitively) depend on the given symbol, using the configured defaults.
     */
    List<TransitiveEdge> getTransitiveCallers(Long symbolId, Set<DependencyType> kinds);

    /**
     * Symbols the given symbol (transitively) depends on, using the configured defaults.
     */
    List<TransitiveEdge> getTransitiveDependencies(Long symbolId, Set<DependencyType> kinds);

    List<TransitiveEdge> getDirectCallers(Long symbolId);

    List<TransitiveEdge> getDirectDependencies(Long symbolId);

    /**
     * Groups the direct calls of a symbol by their literal argument pattern.
     *
     * @throws com.purchasingpower.codegraph.exception.SymbolNotFoundException if the symbol does not exist
     */
    ParameterContextAnalysis groupCallsByParameterContext(Long symbolId);
}
