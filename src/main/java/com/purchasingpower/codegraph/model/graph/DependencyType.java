package com.purchasingpower.codegraph.model.graph;

/**
 * Kind of a directed edge between two symbols or two files.
 */
public enum DependencyType {

    /** Invocation of a function or method. */
    CALLS,

    /**
     * Module import. Unresolved imports are kept by orphan cleanup because
     * they may point at packages outside the analyzed codebase.
     */
    IMPORTS,

    /** Class extends class. */
    INHERITS,

    /** Class implements interface. */
    IMPLEMENTS,

    /** Any other use of a symbol (type reference, property access). */
    REFERENCES,

    /** Symbol re-exported by a module. */
    EXPORTS
}
