package com.purchasingpower.codegraph.service.graph.impl;

import com.purchasingpower.codegraph.model.graph.CodeSymbol;
import com.purchasingpower.codegraph.model.graph.DependencyType;
import com.purchasingpower.codegraph.model.graph.FileDependency;
import com.purchasingpower.codegraph.model.graph.SymbolDependency;
import com.purchasingpower.codegraph.model.graph.SymbolType;

/**
 * Identity keys used for deduplication and merge-on-conflict.
 */
final class GraphKeys {

    private GraphKeys() {
    }

    /** Physical identity of a symbol. */
    record SymbolKey(Long fileId, String name, SymbolType symbolType, Integer startLine) {
    }

    /**
     * Identity of a symbol edge. Bound edges are keyed by target id; edges still
     * waiting for resolution are keyed by the qualified name they point at.
     */
    record DependencyKey(Long fromSymbolId, Long toSymbolId, String toQualifiedName,
                         DependencyType dependencyType, Integer lineNumber) {
    }

    /** Call site of an edge by target name, whether bound yet or not. */
    record QualifiedCallSiteKey(Long fromSymbolId, String toQualifiedName,
                                DependencyType dependencyType, Integer lineNumber) {
    }

    record FileDependencyKey(Long fromFileId, Long toFileId, DependencyType dependencyType) {
    }

    static SymbolKey of(CodeSymbol symbol) {
        return new SymbolKey(symbol.getFileId(), symbol.getName(), symbol.getSymbolType(), symbol.getStartLine());
    }

    static DependencyKey of(SymbolDependency dependency) {
        if (dependency.getToSymbolId() != null) {
            return new DependencyKey(dependency.getFromSymbolId(), dependency.getToSymbolId(), null,
                    dependency.getDependencyType(), dependency.getLineNumber());
        }
        return new DependencyKey(dependency.getFromSymbolId(), null, dependency.getToQualifiedName(),
                dependency.getDependencyType(), dependency.getLineNumber());
    }

    static QualifiedCallSiteKey callSiteOf(SymbolDependency dependency) {
        return new QualifiedCallSiteKey(dependency.getFromSymbolId(), dependency.getToQualifiedName(),
                dependency.getDependencyType(), dependency.getLineNumber());
    }

    static FileDependencyKey of(FileDependency dependency) {
        return new FileDependencyKey(dependency.getFromFileId(), dependency.getToFileId(),
                dependency.getDependencyType());
    }
}
