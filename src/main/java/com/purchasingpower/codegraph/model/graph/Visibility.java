package com.purchasingpower.codegraph.model.graph;

public enum Visibility {
    PUBLIC,
    PRIVATE,
    PROTECTED
}
