package com.purchasingpower.codegraph.service.graph;

import com.purchasingpower.codegraph.model.sync.ResolutionResult;

/**
 * Binds edges recorded by qualified name to concrete target symbols.
 *
 * <p>The pass runs three steps in a fixed order:
 * <ol>
 *   <li>dedup: among unresolved edges sharing (from, qualified name, kind, line) keep only the
 *       most recently created one, so duplicates cannot all bind to the same target and
 *       collide on the edge's unique key;</li>
 *   <li>bind: set the target of every unresolved edge whose qualified name matches exactly one
 *       symbol of the repository;</li>
 *   <li>orphan cleanup: delete edges that have no target at all, and non-import edges whose
 *       qualified name matches no symbol of the repository.</li>
 * </ol>
 * Cleaning up before binding would discard edges that were about to resolve.
 */
public interface QualifiedNameResolutionService {

    /**
     * Runs dedup and bind for a repository.
     *
     * @throws com.purchasingpower.codegraph.exception.GraphQueryTimeoutException if the pass
     *         exceeds {@code app.traversal.query-timeout}
     */
    ResolutionResult resolveQualifiedNames(Long repoId);

    /**
     * Deletes edges of a repository that can never be resolved.
     * Unresolved imports are kept: they may name packages outside the codebase.
     *
     * @return number of deleted edges
     */
    int cleanupOrphans(Long repoId);

    /**
     * Dedup, bind, then orphan cleanup.
     */
    ResolutionResult runResolutionPass(Long repoId);
}
