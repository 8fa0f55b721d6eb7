package com.purchasingpower.codegraph.service.graph.impl;

import com.purchasingpower.codegraph.model.graph.DependencyType;
import com.purchasingpower.codegraph.model.graph.FileDependency;
import com.purchasingpower.codegraph.model.graph.SymbolDependency;
import com.purchasingpower.codegraph.model.parse.ParsedImport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("File Dependency Builder Tests")
class FileDependencyBuilderTest {

    private final FileDependencyBuilderImpl builder = new FileDependencyBuilderImpl();

    // symbol id -> file id
    private final Map<Long, Long> files = Map.of(1L, 100L, 2L, 200L, 3L, 100L);

    @Test
    @DisplayName("Should derive cross-file edges and ignore same-file calls")
    void build_shouldLiftCrossFileEdges() {
        // Given
        List<SymbolDependency> deps = List.of(
                bound(1L, 2L, DependencyType.CALLS, 12),
                bound(1L, 3L, DependencyType.CALLS, 14));

        // When
        List<FileDependency> edges = builder.build(deps, files, Map.of());

        // Then
        assertThat(edges)
                .extracting(FileDependency::getFromFileId, FileDependency::getToFileId, FileDependency::getDependencyType)
                .containsExactly(tuple(100L, 200L, DependencyType.CALLS));
    }

    @Test
    @DisplayName("Should record static external calls and unresolved imports as self-edges")
    void build_shouldRecordExternalDependencies() {
        // Given
        List<SymbolDependency> deps = List.of(
                unresolved(1L, "Illuminate\\Support\\Facades\\DB::table", DependencyType.CALLS, 8),
                unresolved(1L, "lodash", DependencyType.IMPORTS, 1),
                unresolved(1L, "helpers.format", DependencyType.CALLS, 9));

        // When
        List<FileDependency> edges = builder.build(deps, files, Map.of());

        // Then
        assertThat(edges)
                .extracting(FileDependency::getFromFileId, FileDependency::getToFileId, FileDependency::getDependencyType)
                .containsExactly(
                        tuple(100L, 100L, DependencyType.CALLS),
                        tuple(100L, 100L, DependencyType.IMPORTS));
    }

    @Test
    @DisplayName("Should turn package imports into self-edges and skip relative ones")
    void build_shouldClassifyImports() {
        // Given
        Map<Long, List<ParsedImport>> imports = Map.of(200L, List.of(
                new ParsedImport("react", List.of("useState"), null),
                new ParsedImport("./utils", List.of("format"), 3),
                new ParsedImport("@/components/Button", List.of("Button"), 4)));

        // When
        List<FileDependency> edges = builder.build(List.of(), files, imports);

        // Then
        assertThat(edges).hasSize(1);
        assertThat(edges.get(0).getFromFileId()).isEqualTo(200L);
        assertThat(edges.get(0).getToFileId()).isEqualTo(200L);
        assertThat(edges.get(0).getDependencyType()).isEqualTo(DependencyType.IMPORTS);
        assertThat(edges.get(0).getLineNumber()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep the first edge per (from, to, kind)")
    void deduplicate_shouldKeepFirst() {
        // Given
        List<FileDependency> edges = builder.build(List.of(
                bound(1L, 2L, DependencyType.CALLS, 12),
                bound(3L, 2L, DependencyType.CALLS, 30),
                bound(1L, 2L, DependencyType.REFERENCES, 31)), files, Map.of());

        // When
        List<FileDependency> unique = builder.deduplicate(edges);

        // Then
        assertThat(unique)
                .extracting(FileDependency::getDependencyType, FileDependency::getLineNumber)
                .containsExactly(tuple(DependencyType.CALLS, 12), tuple(DependencyType.REFERENCES, 31));
    }

    private static SymbolDependency bound(Long from, Long to, DependencyType type, int line) {
        return SymbolDependency.builder()
                .fromSymbolId(from)
                .toSymbolId(to)
                .dependencyType(type)
                .lineNumber(line)
                .build();
    }

    private static SymbolDependency unresolved(Long from, String qualifiedName, DependencyType type, int line) {
        return SymbolDependency.builder()
                .fromSymbolId(from)
                .toQualifiedName(qualifiedName)
                .dependencyType(type)
                .lineNumber(line)
                .build();
    }
}
