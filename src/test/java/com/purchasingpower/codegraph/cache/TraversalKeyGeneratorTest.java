package com.purchasingpower.codegraph.cache;

import com.purchasingpower.codegraph.configuration.TraversalProperties;
import com.purchasingpower.codegraph.model.graph.DependencyType;
import com.purchasingpower.codegraph.model.traversal.TraversalDirection;
import com.purchasingpower.codegraph.service.graph.GraphTraversalService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Traversal Key Generator Tests")
class TraversalKeyGeneratorTest {

    private final TraversalProperties properties = new TraversalProperties();
    private final TraversalKeyGenerator keyGenerator = new TraversalKeyGenerator(properties);

    @Test
    @DisplayName("Should give a shortcut the same key as the traversal it runs")
    void generate_shortcut_shouldMatchTraverseKey() throws NoSuchMethodException {
        // Given
        Method traverse = GraphTraversalService.class.getMethod("traverse",
                Long.class, TraversalDirection.class, int.class, Set.class, int.class);
        Method directCallers = GraphTraversalService.class.getMethod("getDirectCallers", Long.class);
        Method transitiveDependencies = GraphTraversalService.class.getMethod("getTransitiveDependencies",
                Long.class, Set.class);

        // When / Then
        assertThat(keyGenerator.generate(null, directCallers, 5L))
                .isEqualTo(keyGenerator.generate(null, traverse,
                        5L, TraversalDirection.CALLERS, 1, Set.of(), properties.getDefaultLimit()));
        assertThat(keyGenerator.generate(null, transitiveDependencies, 5L, null))
                .isEqualTo(keyGenerator.generate(null, traverse,
                        5L, TraversalDirection.DEPENDENCIES, properties.getDefaultMaxDepth(), Set.of(),
                        properties.getDefaultLimit()));
    }

    @Test
    @DisplayName("Should ignore the order of edge kinds")
    void generate_kindsInAnyOrder_shouldMatch() throws NoSuchMethodException {
        // Given
        Method traverse = GraphTraversalService.class.getMethod("traverse",
                Long.class, TraversalDirection.class, int.class, Set.class, int.class);

        // When
        Object first = keyGenerator.generate(null, traverse, 5L, TraversalDirection.CALLERS, 3,
                EnumSet.of(DependencyType.CALLS, DependencyType.IMPORTS), 10);
        Object second = keyGenerator.generate(null, traverse, 5L, TraversalDirection.CALLERS, 3,
                new LinkedHashSet<>(List.of(DependencyType.IMPORTS, DependencyType.CALLS)), 10);
        Object other = keyGenerator.generate(null, traverse, 5L, TraversalDirection.CALLERS, 4,
                EnumSet.of(DependencyType.CALLS, DependencyType.IMPORTS), 10);

        // Then
        assertThat(first).isEqualTo(second);
        assertThat(first).isNotEqualTo(other);
    }
}
