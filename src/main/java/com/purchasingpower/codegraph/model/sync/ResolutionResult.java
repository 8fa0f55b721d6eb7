package com.purchasingpower.codegraph.model.sync;

/**
 * Outcome of a resolution pass over one repository.
 *
 * @param deduplicated   unresolved duplicates removed before binding
 * @param resolved       edges bound to a concrete target symbol
 * @param orphansRemoved edges deleted because they can never be resolved
 */
public record ResolutionResult(
        int deduplicated,
        int resolved,
        int orphansRemoved
) {

    public ResolutionResult withOrphansRemoved(int count) {
        return new ResolutionResult(deduplicated, resolved, count);
    }
}
