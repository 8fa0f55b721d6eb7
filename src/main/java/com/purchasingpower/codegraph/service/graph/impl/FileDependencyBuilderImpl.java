package com.purchasingpower.codegraph.service.graph.impl;

import com.purchasingpower.codegraph.model.graph.DependencyType;
import com.purchasingpower.codegraph.model.graph.FileDependency;
import com.purchasingpower.codegraph.model.graph.SymbolDependency;
import com.purchasingpower.codegraph.model.parse.ParsedImport;
import com.purchasingpower.codegraph.service.graph.FileDependencyBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class FileDependencyBuilderImpl implements FileDependencyBuilder {

    private static final String[] LOCAL_IMPORT_PREFIXES = {"./", "../", "/", "src/", "@/"};
    private static final String STATIC_CALL_SEPARATOR = "::";

    @Override
    public List<FileDependency> build(Collection<SymbolDependency> dependencies,
                                      Map<Long, Long> fileIdBySymbolId,
                                      Map<Long, List<ParsedImport>> importsByFileId) {
        List<FileDependency> edges = new ArrayList<>();

        for (SymbolDependency dependency : dependencies) {
            Long fromFileId = fileIdBySymbolId.get(dependency.getFromSymbolId());
            if (fromFileId == null) {
                continue;
            }

            if (dependency.getToSymbolId() != null) {
                Long toFileId = fileIdBySymbolId.get(dependency.getToSymbolId());
                if (toFileId != null && !toFileId.equals(fromFileId)) {
                    edges.add(edge(fromFileId, toFileId, dependency.getDependencyType(), dependency.getLineNumber()));
                }
            } else if (isExternalCall(dependency)) {
                edges.add(edge(fromFileId, fromFileId, dependency.getDependencyType(), dependency.getLineNumber()));
            }
        }

        importsByFileId.forEach((fileId, imports) -> {
            for (ParsedImport parsedImport : imports) {
                if (isExternalPackage(parsedImport.source())) {
                    Integer line = parsedImport.lineNumber() != null ? parsedImport.lineNumber() : 1;
                    edges.add(edge(fileId, fileId, DependencyType.IMPORTS, line));
                }
            }
        });

        return edges;
    }

    @Override
    public List<FileDependency> deduplicate(List<FileDependency> edges) {
        Map<GraphKeys.FileDependencyKey, FileDependency> unique = new LinkedHashMap<>();
        for (FileDependency edge : edges) {
            unique.putIfAbsent(GraphKeys.of(edge), edge);
        }
        int removed = edges.size() - unique.size();
        if (removed > 0) {
            log.warn("Removed {} duplicate file dependencies ({} -> {})", removed, edges.size(), unique.size());
        }
        return new ArrayList<>(unique.values());
    }

    private static boolean isExternalCall(SymbolDependency dependency) {
        String target = dependency.getToQualifiedName();
        if (target == null) {
            return false;
        }
        return dependency.getDependencyType() == DependencyType.IMPORTS
                || (dependency.getDependencyType() == DependencyType.CALLS && target.contains(STATIC_CALL_SEPARATOR));
    }

    private static boolean isExternalPackage(String source) {
        if (source == null || source.isBlank()) {
            return false;
        }
        for (String prefix : LOCAL_IMPORT_PREFIXES) {
            if (source.startsWith(prefix)) {
                return false;
            }
        }
        return true;
    }

    private static FileDependency edge(Long fromFileId, Long toFileId, DependencyType type, Integer line) {
        return FileDependency.builder()
                .fromFileId(fromFileId)
                .toFileId(toFileId)
                .dependencyType(type)
                .lineNumber(line)
                .build();
    }
}
