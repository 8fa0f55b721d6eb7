package com.purchasingpower.codegraph.service.graph;

import com.purchasingpower.codegraph.model.graph.FileDependency;
import com.purchasingpower.codegraph.model.graph.SymbolDependency;
import com.purchasingpower.codegraph.model.parse.ParsedImport;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Derives file-level edges from symbol edges and import statements.
 *
 * <ul>
 *   <li>Cross-file: a bound symbol edge whose endpoints live in different files.</li>
 *   <li>External call: an unbound {@code CALLS} edge to a {@code Class::method} target, or an
 *       unbound import, recorded as a self-edge of the calling file.</li>
 *   <li>External import: an import of a bare package (not a relative or project path),
 *       recorded as an {@code IMPORTS} self-edge.</li>
 * </ul>
 */
public interface FileDependencyBuilder {

    /**
     * @param dependencies     persisted symbol edges of the batch
     * @param fileIdBySymbolId owning file of every symbol referenced by {@code dependencies}
     * @param importsByFileId  parsed imports per stored file
     * @return derived edges, possibly containing duplicates
     */
    List<FileDependency> build(Collection<SymbolDependency> dependencies,
                               Map<Long, Long> fileIdBySymbolId,
                               Map<Long, List<ParsedImport>> importsByFileId);

    /**
     * Keeps the first edge per (from file, to file, kind).
     */
    List<FileDependency> deduplicate(List<FileDependency> edges);
}
