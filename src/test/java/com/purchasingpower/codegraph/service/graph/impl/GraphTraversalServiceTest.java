package com.purchasingpower.codegraph.service.graph.impl;

import com.purchasingpower.codegraph.cache.QueryCache;
import com.purchasingpower.codegraph.exception.SymbolNotFoundException;
import com.purchasingpower.codegraph.model.graph.CodeSymbol;
import com.purchasingpower.codegraph.model.graph.DependencyType;
import com.purchasingpower.codegraph.model.graph.SymbolType;
import com.purchasingpower.codegraph.model.graph.TrackedRepository;
import com.purchasingpower.codegraph.model.parse.ParsedDependency;
import com.purchasingpower.codegraph.model.parse.ParsedFile;
import com.purchasingpower.codegraph.model.parse.ParsedSymbol;
import com.purchasingpower.codegraph.model.traversal.CallerGroup;
import com.purchasingpower.codegraph.model.traversal.CallerRef;
import com.purchasingpower.codegraph.model.traversal.ParameterContextAnalysis;
import com.purchasingpower.codegraph.model.traversal.TransitiveEdge;
import com.purchasingpower.codegraph.model.traversal.TraversalDirection;
import com.purchasingpower.codegraph.service.graph.GraphIngestionService;
import com.purchasingpower.codegraph.service.graph.GraphTraversalService;
import com.purchasingpower.codegraph.support.GraphTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Traversal over a small graph with a diamond and a cycle:
 *
 * <pre>
 *   a -> b -> d -> e -> e
 *   a -> c -> d -> a
 * </pre>
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Graph Traversal Service Tests")
class GraphTraversalServiceTest {

    private static final String GRAPH_FILE = "src/graph.ts";

    @Autowired
    private GraphTraversalService traversalService;

    @Autowired
    private GraphIngestionService ingestionService;

    @Autowired
    private QueryCache queryCache;

    @Autowired
    private GraphTestSupport testSupport;

    @TempDir
    Path root;

    private TrackedRepository repository;

    @BeforeEach
    void setUp() {
        testSupport.cleanDatabase();
        repository = testSupport.registerRepository("graph", root);
        ingestionService.ingest(repository.getId(), List.of(new ParsedFile(GRAPH_FILE, "graph",
                List.of(fn("a", 1), fn("b", 3), fn("c", 5), fn("d", 7), fn("e", 9)),
                List.of(
                        dep("a", "b", DependencyType.CALLS, 1),
                        dep("a", "c", DependencyType.CALLS, 1),
                        dep("a", "ext.track", DependencyType.CALLS, 2),
                        dep("b", "d", DependencyType.CALLS, 3),
                        dep("c", "d", DependencyType.CALLS, 5),
                        dep("d", "a", DependencyType.CALLS, 7),
                        dep("d", "e", DependencyType.REFERENCES, 8),
                        dep("e", "e", DependencyType.CALLS, 10)),
                List.of())));
    }

    @Test
    @DisplayName("Should report both diamond paths and stop at cycles")
    void traverse_dependencies_shouldHandleDiamondAndCycle() {
        // When
        List<TransitiveEdge> edges = traversalService.traverse(id("a"), TraversalDirection.DEPENDENCIES, 10, Set.of(), 100);

        // Then
        assertThat(edges)
                .extracting(edge -> edge.depth(), edge -> edge.from().name(), edge -> edge.to().name())
                .containsExactlyInAnyOrder(
                        tuple(1, "a", "b"),
                        tuple(1, "a", "c"),
                        tuple(2, "b", "d"),
                        tuple(2, "c", "d"),
                        tuple(3, "d", "e"),
                        tuple(3, "d", "e"));
        assertThat(edges).isSortedAccordingTo(Comparator.comparingInt(TransitiveEdge::depth));
        assertThat(edges.get(0).to().filePath()).isEqualTo(GRAPH_FILE);
        assertThat(edges).allSatisfy(edge -> assertThat(edge.path()).doesNotHaveDuplicates());
    }

    @Test
    @DisplayName("Should return direct callers at depth one, ignoring self-calls")
    void traverse_callersDepthOne_shouldReturnDirectCallers() {
        // When
        List<TransitiveEdge> dCallers = traversalService.getDirectCallers(id("d"));
        List<TransitiveEdge> eCallers = traversalService.traverse(id("e"), TraversalDirection.CALLERS, 1, Set.of(), 100);

        // Then
        assertThat(dCallers).extracting(edge -> edge.from().name()).containsExactlyInAnyOrder("b", "c");
        assertThat(dCallers).allSatisfy(edge -> assertThat(edge.depth()).isEqualTo(1));
        assertThat(eCallers).extracting(edge -> edge.from().name()).containsExactly("d");
    }

    @Test
    @DisplayName("Should follow only the requested edge kinds")
    void traverse_withKinds_shouldFilterEdges() {
        // When
        List<TransitiveEdge> calls = traversalService.traverse(id("a"), TraversalDirection.DEPENDENCIES, 10,
                Set.of(DependencyType.CALLS), 100);
        List<TransitiveEdge> references = traversalService.traverse(id("a"), TraversalDirection.DEPENDENCIES, 10,
                Set.of(DependencyType.REFERENCES), 100);

        // Then
        assertThat(calls).hasSize(4);
        assertThat(calls).allSatisfy(edge -> assertThat(edge.dependencyType()).isEqualTo(DependencyType.CALLS));
        assertThat(references).isEmpty();
    }

    @Test
    @DisplayName("Should order by depth then newest edge and truncate to the limit")
    void traverse_withLimit_shouldKeepNewestShallowEdge() {
        // When
        List<TransitiveEdge> edges = traversalService.traverse(id("a"), TraversalDirection.DEPENDENCIES, 10, Set.of(), 1);

        // Then: a -> c was stored after a -> b
        assertThat(edges).hasSize(1);
        assertThat(edges.get(0).to().name()).isEqualTo("c");
    }

    @Test
    @DisplayName("Should answer repeated traversals from the cache")
    void traverse_twice_shouldHitCache() {
        // When
        List<TransitiveEdge> first = traversalService.getTransitiveDependencies(id("b"), Set.of());
        List<TransitiveEdge> second = traversalService.getTransitiveDependencies(id("b"), Set.of());

        // Then
        assertThat(second).isEqualTo(first);
        assertThat(queryCache.getStats().hits()).isEqualTo(1);
        assertThat(queryCache.invalidateByPattern("traverse:")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject non-positive depth and limit")
    void traverse_withInvalidBounds_shouldThrow() {
        assertThatThrownBy(() -> traversalService.traverse(id("a"), TraversalDirection.CALLERS, 0, Set.of(), 10))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> traversalService.traverse(id("a"), TraversalDirection.CALLERS, 3, Set.of(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should group calls by parameter context")
    void groupCallsByParameterContext_shouldGroupInFirstSeenOrder() {
        // Given
        ingestionService.ingest(repository.getId(), List.of(new ParsedFile("src/users.ts", "users",
                List.of(fn("save", 1), fn("register", 11), fn("invite", 21), fn("purge", 31)),
                List.of(
                        call("register", 12, "user, true", "call-1", null),
                        call("invite", 22, "user, true", "call-2", null),
                        call("purge", 32, "null, false", "call-3", List.of("null", "boolean"))),
                List.of())));

        // When
        ParameterContextAnalysis analysis = traversalService.groupCallsByParameterContext(id("save"));

        // Then
        assertThat(analysis.methodName()).isEqualTo("save");
        assertThat(analysis.totalCalls()).isEqualTo(3);
        assertThat(analysis.groups()).extracting(CallerGroup::parameterContext)
                .containsExactly("user, true", "null, false");

        CallerGroup shared = analysis.groups().get(0);
        assertThat(shared.callCount()).isEqualTo(2);
        assertThat(shared.callInstanceIds()).containsExactly("call-1", "call-2");
        assertThat(shared.lineNumbers()).containsExactly(12, 22);
        assertThat(shared.callers()).extracting(CallerRef::name, CallerRef::filePath)
                .containsExactly(tuple("register", "src/users.ts"), tuple("invite", "src/users.ts"));
        assertThat(shared.parameterTypes()).isEmpty();
        assertThat(analysis.groups().get(1).parameterTypes()).containsExactly("null", "boolean");
    }

    @Test
    @DisplayName("Should fail for unknown symbols")
    void groupCallsByParameterContext_unknownSymbol_shouldThrow() {
        assertThatThrownBy(() -> traversalService.groupCallsByParameterContext(Long.MAX_VALUE))
                .isInstanceOf(SymbolNotFoundException.class)
                .hasMessageContaining(String.valueOf(Long.MAX_VALUE));
    }

    private Long id(String name) {
        CodeSymbol symbol = testSupport.findSymbol(repository.getId(), name);
        return symbol.getId();
    }

    private static ParsedSymbol fn(String name, int line) {
        return ParsedSymbol.builder()
                .name(name)
                .qualifiedName("graph." + name)
                .symbolType(SymbolType.FUNCTION)
                .startLine(line)
                .endLine(line + 1)
                .build();
    }

    private static ParsedDependency dep(String from, String to, DependencyType type, int line) {
        return ParsedDependency.builder()
                .fromSymbol(from)
                .toSymbol(to)
                .dependencyType(type)
                .lineNumber(line)
                .build();
    }

    private static ParsedDependency call(String from, int line, String context, String callId, List<String> types) {
        return ParsedDependency.builder()
                .fromSymbol(from)
                .toSymbol("save")
                .dependencyType(DependencyType.CALLS)
                .lineNumber(line)
                .parameterContext(context)
                .callInstanceId(callId)
                .parameterTypes(types)
                .build();
    }
}
