package com.purchasingpower.codegraph.service.graph.impl;

import com.purchasingpower.codegraph.model.graph.CodeSymbol;
import com.purchasingpower.codegraph.model.graph.SymbolType;
import com.purchasingpower.codegraph.repository.CodeSymbolRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@DisplayName("Symbol Hierarchy Linker Tests")
class SymbolHierarchyLinkerTest {

    private final CodeSymbolRepository symbolRepository = mock(CodeSymbolRepository.class);
    private final SymbolHierarchyLinkerImpl linker = new SymbolHierarchyLinkerImpl(symbolRepository);

    @Test
    @DisplayName("Should link members to the first enclosing container of the same file")
    void linkHierarchy_shouldAssignFirstContainer() {
        // Given
        CodeSymbol outer = symbol(1L, 10L, "Outer", SymbolType.CLASS, 1, 100);
        CodeSymbol inner = symbol(2L, 10L, "Inner", SymbolType.INTERFACE, 20, 40);
        CodeSymbol method = symbol(3L, 10L, "run", SymbolType.METHOD, 25, 30);
        CodeSymbol property = symbol(4L, 10L, "name", SymbolType.PROPERTY, 50, 50);
        CodeSymbol function = symbol(5L, 10L, "helper", SymbolType.FUNCTION, 60, 70);

        // When
        int linked = linker.linkHierarchy(List.of(outer, inner, method, property, function));

        // Then
        assertThat(linked).isEqualTo(2);
        assertThat(method.getParentSymbolId()).isEqualTo(1L);
        assertThat(property.getParentSymbolId()).isEqualTo(1L);
        assertThat(function.getParentSymbolId()).isNull();
        assertThat(inner.getParentSymbolId()).isNull();
        verify(symbolRepository).saveAll(List.of(method, property));
    }

    @Test
    @DisplayName("Should not link across files or override existing parents")
    void linkHierarchy_shouldRespectFileAndExistingParent() {
        // Given
        CodeSymbol container = symbol(1L, 10L, "Service", SymbolType.CLASS, 1, 100);
        CodeSymbol otherFileMethod = symbol(2L, 11L, "run", SymbolType.METHOD, 5, 10);
        CodeSymbol alreadyLinked = symbol(3L, 10L, "stop", SymbolType.METHOD, 20, 25);
        alreadyLinked.setParentSymbolId(99L);
        CodeSymbol noLines = symbol(4L, 10L, "start", SymbolType.METHOD, null, null);

        // When
        int linked = linker.linkHierarchy(List.of(container, otherFileMethod, alreadyLinked, noLines));

        // Then
        assertThat(linked).isZero();
        assertThat(otherFileMethod.getParentSymbolId()).isNull();
        assertThat(alreadyLinked.getParentSymbolId()).isEqualTo(99L);
        verify(symbolRepository, never()).saveAll(anyList());
    }

    private static CodeSymbol symbol(Long id, Long fileId, String name, SymbolType type, Integer start, Integer end) {
        return CodeSymbol.builder()
                .id(id)
                .fileId(fileId)
                .name(name)
                .symbolType(type)
                .startLine(start)
                .endLine(end)
                .build();
    }
}
