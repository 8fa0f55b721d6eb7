package com.purchasingpower.codegraph.model.traversal;

import java.util.List;

/**
 * Calls to one symbol that share the same literal argument pattern.
 */
public record CallerGroup(
        String parameterContext,
        List<String> callInstanceIds,
        int callCount,
        List<Integer> lineNumbers,
        List<CallerRef> callers,
        List<String> parameterTypes
) {
}
