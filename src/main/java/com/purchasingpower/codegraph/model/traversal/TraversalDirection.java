package com.purchasingpower.codegraph.model.traversal;

/**
 * Direction in which dependency edges are followed from the seed symbol.
 */
public enum TraversalDirection {

    /** Follow edges backwards: who calls or references the seed. */
    CALLERS,

    /** Follow edges forwards: what the seed calls or references. */
    DEPENDENCIES
}
