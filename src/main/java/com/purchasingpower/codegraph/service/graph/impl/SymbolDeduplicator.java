package com.purchasingpower.codegraph.service.graph.impl;

import com.purchasingpower.codegraph.model.graph.CodeSymbol;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses symbols sharing a physical key (file, name, kind, start line),
 * keeping the most complete variant at the position of the first occurrence.
 */
final class SymbolDeduplicator {

    private SymbolDeduplicator() {
    }

    static List<CodeSymbol> deduplicate(List<CodeSymbol> symbols) {
        Map<GraphKeys.SymbolKey, CodeSymbol> kept = new LinkedHashMap<>();
        for (CodeSymbol symbol : symbols) {
            kept.merge(GraphKeys.of(symbol), symbol,
                    (existing, candidate) -> isMoreComplete(candidate, existing) ? candidate : existing);
        }
        return new ArrayList<>(kept.values());
    }

    /**
     * Completeness order: signature, then exported flag, then description, then qualified name.
     * The first attribute on which the two differ decides.
     */
    static boolean isMoreComplete(CodeSymbol candidate, CodeSymbol existing) {
        boolean candidateSignature = hasText(candidate.getSignature());
        boolean existingSignature = hasText(existing.getSignature());
        if (candidateSignature != existingSignature) {
            return candidateSignature;
        }
        if (candidate.isExported() != existing.isExported()) {
            return candidate.isExported();
        }
        boolean candidateDescription = hasText(candidate.getDescription());
        boolean existingDescription = hasText(existing.getDescription());
        if (candidateDescription != existingDescription) {
            return candidateDescription;
        }
        return hasText(candidate.getQualifiedName()) && !hasText(existing.getQualifiedName());
    }

    /**
     * Merges a freshly parsed symbol into its stored row. A field set on the incoming
     * symbol replaces the stored one; a field the incoming symbol lacks keeps the
     * stored value, and the exported flag is never cleared.
     */
    static void mergeInto(CodeSymbol stored, CodeSymbol incoming) {
        if (hasText(incoming.getQualifiedName())) {
            stored.setQualifiedName(incoming.getQualifiedName());
        }
        if (incoming.getVisibility() != null) {
            stored.setVisibility(incoming.getVisibility());
        }
        if (incoming.getEndLine() != null) {
            stored.setEndLine(incoming.getEndLine());
        }
        if (hasText(incoming.getSignature())) {
            stored.setSignature(incoming.getSignature());
        }
        if (hasText(incoming.getDescription())) {
            stored.setDescription(incoming.getDescription());
        }
        stored.setExported(stored.isExported() || incoming.isExported());
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
