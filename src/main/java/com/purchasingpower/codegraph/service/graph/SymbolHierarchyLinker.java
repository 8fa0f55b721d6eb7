package com.purchasingpower.codegraph.service.graph;

import com.purchasingpower.codegraph.model.graph.CodeSymbol;

import java.util.Collection;
import java.util.List;

/**
 * Assigns parent symbols by structural containment.
 *
 * A method or property whose line range lies inside a class, interface or
 * trait of the same file gets that container as its parent. This is a
 * line-range heuristic, not semantic resolution: when several containers
 * enclose a member, the first one in store order wins.
 */
public interface SymbolHierarchyLinker {

    /**
     * Links the given stored symbols and persists the modified ones in one batch.
     *
     * @return number of symbols that received a parent
     */
    int linkHierarchy(Collection<CodeSymbol> symbols);

    /**
     * Links the stored symbols of the given files and persists the new parent references.
     *
     * @return number of symbols that received a parent
     */
    int linkFiles(Collection<Long> fileIds);

    /**
     * Sets {@code parentSymbolId} on members that have none yet. Does not persist.
     *
     * @param symbols stored symbols (ids assigned), in store order
     * @return the symbols that were modified
     */
    List<CodeSymbol> assignParents(Collection<CodeSymbol> symbols);
}
