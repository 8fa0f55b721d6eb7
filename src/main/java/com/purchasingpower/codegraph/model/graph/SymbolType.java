package com.purchasingpower.codegraph.model.graph;

import java.util.EnumSet;
import java.util.Set;

/**
 * Kind of a code symbol.
 */
public enum SymbolType {

    FUNCTION,
    CLASS,
    INTERFACE,

    /** PHP trait or similar mixin; acts as a container like a class. */
    TRAIT,

    VARIABLE,
    CONSTANT,
    TYPE_ALIAS,
    ENUM,
    METHOD,
    PROPERTY,

    /** UI component (Vue single-file component, React component). */
    COMPONENT;

    private static final Set<SymbolType> CONTAINERS = EnumSet.of(CLASS, INTERFACE, TRAIT);
    private static final Set<SymbolType> MEMBERS = EnumSet.of(METHOD, PROPERTY);

    /**
     * Returns true if symbols of this kind can own methods and properties.
     */
    public boolean isContainer() {
        return CONTAINERS.contains(this);
    }

    /**
     * Returns true if symbols of this kind are linked to an enclosing container.
     */
    public boolean isMember() {
        return MEMBERS.contains(this);
    }
}
