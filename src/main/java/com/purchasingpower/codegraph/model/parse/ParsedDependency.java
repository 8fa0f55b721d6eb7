package com.purchasingpower.codegraph.model.parse;

import com.purchasingpower.codegraph.model.graph.DependencyType;
import lombok.Builder;

import java.util.List;

/**
 * An edge as reported by a language parser.
 *
 * {@code fromSymbol} names a symbol of the same file; {@code toSymbol} is a
 * plain or qualified name that may live anywhere, including outside the codebase.
 */
@Builder
public record ParsedDependency(
        String fromSymbol,
        String toSymbol,
        DependencyType dependencyType,
        Integer lineNumber,
        String callingObject,
        String resolvedClass,
        String qualifiedContext,
        String methodSignature,
        String fileContext,
        String namespaceContext,
        String parameterContext,
        List<String> parameterTypes,
        String callInstanceId
) {
}
