package com.purchasingpower.codegraph.model.traversal;

import java.util.List;

/**
 * Callers of a method grouped by how they invoke it.
 *
 * @param methodName name of the called symbol
 * @param groups     one group per distinct parameter context, in first-seen order
 * @param totalCalls number of call sites carrying a parameter context
 */
public record ParameterContextAnalysis(
        String methodName,
        List<CallerGroup> groups,
        int totalCalls
) {
}
