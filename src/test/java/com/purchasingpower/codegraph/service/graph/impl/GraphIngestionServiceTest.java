package com.purchasingpower.codegraph.service.graph.impl;

import com.purchasingpower.codegraph.exception.RepositoryNotFoundException;
import com.purchasingpower.codegraph.model.graph.CodeSymbol;
import com.purchasingpower.codegraph.model.graph.DependencyType;
import com.purchasingpower.codegraph.model.graph.FileDependency;
import com.purchasingpower.codegraph.model.graph.SourceFile;
import com.purchasingpower.codegraph.model.graph.SymbolDependency;
import com.purchasingpower.codegraph.model.graph.SymbolType;
import com.purchasingpower.codegraph.model.graph.TrackedRepository;
import com.purchasingpower.codegraph.model.parse.ParsedDependency;
import com.purchasingpower.codegraph.model.parse.ParsedFile;
import com.purchasingpower.codegraph.model.parse.ParsedImport;
import com.purchasingpower.codegraph.model.parse.ParsedSymbol;
import com.purchasingpower.codegraph.model.sync.IngestionCounts;
import com.purchasingpower.codegraph.repository.CodeSymbolRepository;
import com.purchasingpower.codegraph.repository.FileDependencyRepository;
import com.purchasingpower.codegraph.repository.SourceFileRepository;
import com.purchasingpower.codegraph.repository.SymbolDependencyRepository;
import com.purchasingpower.codegraph.service.graph.GraphIngestionService;
import com.purchasingpower.codegraph.support.GraphTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for ingestion against the in-memory store.
 *
 * Batch sizes are tiny in the test profile so that every write path
 * crosses several batches.
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Graph Ingestion Service Tests")
class GraphIngestionServiceTest {

    @Autowired
    private GraphIngestionService ingestionService;

    @Autowired
    private GraphTestSupport testSupport;

    @Autowired
    private SourceFileRepository fileRepository;

    @Autowired
    private CodeSymbolRepository symbolRepository;

    @Autowired
    private SymbolDependencyRepository dependencyRepository;

    @Autowired
    private FileDependencyRepository fileDependencyRepository;

    @TempDir
    Path root;

    private TrackedRepository repository;

    @BeforeEach
    void setUp() {
        testSupport.cleanDatabase();
        repository = testSupport.registerRepository("shop", root);
    }

    @Test
    @DisplayName("Should leave the store unchanged when the same files are ingested twice")
    void ingest_twice_shouldBeIdempotent() {
        // Given
        List<ParsedFile> files = sampleFiles();

        // When
        IngestionCounts first = ingestionService.ingest(repository.getId(), files);
        long symbols = symbolRepository.countByRepoId(repository.getId());
        long dependencies = dependencyRepository.countByRepoId(repository.getId());
        long fileDependencies = fileDependencyRepository.count();

        IngestionCounts second = ingestionService.ingest(repository.getId(), files);

        // Then
        assertThat(first.getFilesCreated()).isEqualTo(3);
        assertThat(first.getSymbolsCreated()).isEqualTo(4);
        assertThat(second.getFilesCreated()).isZero();
        assertThat(second.getFilesUpdated()).isEqualTo(3);
        assertThat(second.getSymbolsCreated()).isZero();
        assertThat(second.getSymbolsUpdated()).isEqualTo(4);
        assertThat(second.getDependenciesCreated()).isZero();

        assertThat(fileRepository.countByRepoId(repository.getId())).isEqualTo(3);
        assertThat(symbolRepository.countByRepoId(repository.getId())).isEqualTo(symbols);
        assertThat(dependencyRepository.countByRepoId(repository.getId())).isEqualTo(dependencies);
        assertThat(fileDependencyRepository.count()).isEqualTo(fileDependencies);
    }

    @Test
    @DisplayName("Should collapse duplicate symbols keeping the most complete variant")
    void ingest_withDuplicateSymbols_shouldKeepMostComplete() {
        // Given
        ParsedFile file = new ParsedFile("src/cart.ts", "cart", List.of(
                ParsedSymbol.builder().name("total").symbolType(SymbolType.FUNCTION).startLine(3).endLine(9).build(),
                ParsedSymbol.builder().name("total").symbolType(SymbolType.FUNCTION).startLine(3).endLine(9)
                        .signature("total(items: Item[]): number").build()),
                List.of(), List.of());

        // When
        IngestionCounts counts = ingestionService.ingest(repository.getId(), List.of(file));

        // Then
        assertThat(counts.getSymbolsDeduplicated()).isEqualTo(1);
        List<CodeSymbol> stored = symbolRepository.findAll();
        assertThat(stored).hasSize(1);
        assertThat(stored.get(0).getSignature()).isEqualTo("total(items: Item[]): number");
    }

    @Test
    @DisplayName("Should bind same-file targets and keep cross-file targets by qualified name")
    void ingest_shouldBindSameFileAndDeferCrossFile() {
        // When
        ingestionService.ingest(repository.getId(), sampleFiles());

        // Then
        CodeSymbol checkout = testSupport.findSymbol(repository.getId(), "checkout");
        CodeSymbol validate = testSupport.findSymbol(repository.getId(), "validate");
        Map<String, SymbolDependency> edges = dependencyRepository.findByFromSymbolIdIn(List.of(checkout.getId()))
                .stream()
                .collect(Collectors.toMap(SymbolDependency::getToQualifiedName, edge -> edge));

        assertThat(edges.get("validate").getToSymbolId()).isEqualTo(validate.getId());
        assertThat(edges.get("payments.charge").getToSymbolId()).isNull();
        assertThat(edges.get("payments.charge").getParameterTypes()).isEqualTo("[\"number\",\"string\"]");
    }

    @Test
    @DisplayName("Should link methods to their enclosing class")
    void ingest_shouldLinkHierarchy() {
        // When
        IngestionCounts counts = ingestionService.ingest(repository.getId(), sampleFiles());

        // Then
        CodeSymbol gateway = testSupport.findSymbol(repository.getId(), "Gateway");
        CodeSymbol charge = testSupport.findSymbol(repository.getId(), "charge");
        assertThat(counts.getHierarchyLinks()).isEqualTo(1);
        assertThat(charge.getParentSymbolId()).isEqualTo(gateway.getId());
    }

    @Test
    @DisplayName("Should derive file dependencies for package imports")
    void ingest_shouldStoreExternalImportSelfEdges() {
        // When
        ingestionService.ingest(repository.getId(), sampleFiles());

        // Then
        SourceFile checkoutFile = fileRepository.findByRepoIdAndPath(repository.getId(), "src/checkout.ts").orElseThrow();
        List<FileDependency> edges = fileDependencyRepository.findByFromFileIdIn(List.of(checkoutFile.getId()));
        assertThat(edges).hasSize(1);
        assertThat(edges.get(0).getToFileId()).isEqualTo(checkoutFile.getId());
        assertThat(edges.get(0).getDependencyType()).isEqualTo(DependencyType.IMPORTS);
    }

    @Test
    @DisplayName("Should track files without symbols and count unusable records")
    void ingest_shouldSkipUnusableRecords() {
        // Given
        ParsedFile file = new ParsedFile("src/broken.ts", "x",
                List.of(ParsedSymbol.builder().name(" ").symbolType(SymbolType.FUNCTION).startLine(1).build()),
                List.of(ParsedDependency.builder().fromSymbol("missing").toSymbol("other")
                        .dependencyType(DependencyType.CALLS).lineNumber(2).build()),
                List.of());

        // When
        IngestionCounts counts = ingestionService.ingest(repository.getId(), List.of(file, ParsedFile.empty("README.js", null)));

        // Then
        assertThat(counts.getFilesCreated()).isEqualTo(2);
        assertThat(counts.getRecordsSkipped()).isEqualTo(2);
        assertThat(symbolRepository.count()).isZero();
    }

    @Test
    @DisplayName("Should drop oversized call-site fields and skip oversized targets without failing the batch")
    void ingest_oversizedDependencyFields_shouldNotFail() {
        // Given
        String longContext = "x".repeat(SymbolDependency.MAX_PARAMETER_LENGTH + 500);
        String longTarget = "t".repeat(SymbolDependency.MAX_QUALIFIED_NAME_LENGTH + 1);
        ParsedFile file = new ParsedFile("src/cart.ts", "cart",
                List.of(symbol("total", SymbolType.FUNCTION, 1, 9, "cart.total")),
                List.of(
                        ParsedDependency.builder().fromSymbol("total").toSymbol("prices.sum")
                                .dependencyType(DependencyType.CALLS).lineNumber(3)
                                .parameterContext(longContext).callInstanceId("call-7").build(),
                        ParsedDependency.builder().fromSymbol("total").toSymbol(longTarget)
                                .dependencyType(DependencyType.CALLS).lineNumber(4).build()),
                List.of());

        // When
        IngestionCounts counts = ingestionService.ingest(repository.getId(), List.of(file));

        // Then
        assertThat(counts.getDependenciesCreated()).isEqualTo(1);
        assertThat(counts.getRecordsSkipped()).isEqualTo(1);
        assertThat(dependencyRepository.findAll()).singleElement().satisfies(edge -> {
            assertThat(edge.getToQualifiedName()).isEqualTo("prices.sum");
            assertThat(edge.getParameterContext()).isNull();
            assertThat(edge.getCallInstanceId()).isEqualTo("call-7");
        });
    }

    @Test
    @DisplayName("Should keep stored symbol details a later parse does not report")
    void ingest_again_shouldMergeSymbolFields() {
        // Given
        ParsedSymbol detailed = ParsedSymbol.builder().name("total").symbolType(SymbolType.FUNCTION)
                .startLine(3).endLine(9).signature("total(items: Item[]): number").exported(true).build();
        ParsedSymbol bare = ParsedSymbol.builder().name("total").symbolType(SymbolType.FUNCTION)
                .startLine(3).endLine(12).build();
        ingestionService.ingest(repository.getId(),
                List.of(new ParsedFile("src/cart.ts", "cart", List.of(detailed), List.of(), List.of())));

        // When
        IngestionCounts counts = ingestionService.ingest(repository.getId(),
                List.of(new ParsedFile("src/cart.ts", "cart", List.of(bare), List.of(), List.of())));

        // Then
        assertThat(counts.getSymbolsUpdated()).isEqualTo(1);
        CodeSymbol stored = testSupport.findSymbol(repository.getId(), "total");
        assertThat(stored.getSignature()).isEqualTo("total(items: Item[]): number");
        assertThat(stored.isExported()).isTrue();
        assertThat(stored.getEndLine()).isEqualTo(12);
    }

    @Test
    @DisplayName("Should reject unknown repositories")
    void ingest_unknownRepository_shouldThrow() {
        assertThatThrownBy(() -> ingestionService.ingest(-1L, sampleFiles()))
                .isInstanceOf(RepositoryNotFoundException.class);
    }

    private static List<ParsedFile> sampleFiles() {
        ParsedFile checkout = new ParsedFile("src/checkout.ts", "checkout",
                List.of(
                        symbol("checkout", SymbolType.FUNCTION, 1, 20, "checkout.checkout"),
                        symbol("validate", SymbolType.FUNCTION, 22, 30, "validate")),
                List.of(
                        ParsedDependency.builder().fromSymbol("checkout").toSymbol("validate")
                                .dependencyType(DependencyType.CALLS).lineNumber(5).build(),
                        ParsedDependency.builder().fromSymbol("checkout").toSymbol("payments.charge")
                                .dependencyType(DependencyType.CALLS).lineNumber(9)
                                .parameterContext("amount, 'EUR'").parameterTypes(List.of("number", "string"))
                                .build()),
                List.of(
                        new ParsedImport("stripe", List.of("Stripe"), 1),
                        new ParsedImport("./payments", List.of("charge"), 2)));

        ParsedFile payments = new ParsedFile("src/payments.ts", "payments",
                List.of(
                        symbol("Gateway", SymbolType.CLASS, 1, 40, "payments.Gateway"),
                        symbol("charge", SymbolType.METHOD, 5, 15, "payments.charge")),
                List.of(),
                List.of());

        return List.of(checkout, payments, ParsedFile.empty("src/legacy.js", "// legacy"));
    }

    private static ParsedSymbol symbol(String name, SymbolType type, int start, int end, String qualifiedName) {
        return ParsedSymbol.builder()
                .name(name)
                .qualifiedName(qualifiedName)
                .symbolType(type)
                .startLine(start)
                .endLine(end)
                .exported(true)
                .build();
    }
}
