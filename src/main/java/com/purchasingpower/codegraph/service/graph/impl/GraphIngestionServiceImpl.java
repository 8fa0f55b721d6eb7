package com.purchasingpower.codegraph.service.graph.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.Lists;
import com.purchasingpower.codegraph.configuration.AppProperties;
import com.purchasingpower.codegraph.configuration.IngestionProperties;
import com.purchasingpower.codegraph.exception.RepositoryNotFoundException;
import com.purchasingpower.codegraph.model.CallContext;
import com.purchasingpower.codegraph.model.ServiceType;
import com.purchasingpower.codegraph.model.graph.CodeSymbol;
import com.purchasingpower.codegraph.model.graph.FileDependency;
import com.purchasingpower.codegraph.model.graph.SourceFile;
import com.purchasingpower.codegraph.model.graph.SymbolDependency;
import com.purchasingpower.codegraph.model.graph.TrackedRepository;
import com.purchasingpower.codegraph.model.parse.ParsedDependency;
import com.purchasingpower.codegraph.model.parse.ParsedFile;
import com.purchasingpower.codegraph.model.parse.ParsedImport;
import com.purchasingpower.codegraph.model.parse.ParsedSymbol;
import com.purchasingpower.codegraph.model.sync.BatchWriteOutcome;
import com.purchasingpower.codegraph.model.sync.IngestionCounts;
import com.purchasingpower.codegraph.repository.CodeSymbolRepository;
import com.purchasingpower.codegraph.repository.TrackedRepositoryRepository;
import com.purchasingpower.codegraph.service.graph.FileDependencyBuilder;
import com.purchasingpower.codegraph.service.graph.GraphIngestionService;
import com.purchasingpower.codegraph.service.graph.SymbolHierarchyLinker;
import com.purchasingpower.codegraph.util.ConflictRecovery;
import com.purchasingpower.codegraph.util.ExternalCallLogger;
import com.purchasingpower.codegraph.util.SourceFileClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Batched, deduplicating writer of parser output.
 *
 * <p>Each batch is written in its own transaction by {@link GraphBatchWriter}.
 * A unique-key violation in one batch (another ingestion of the same
 * repository racing this one) is answered by reading the persisted rows back;
 * any other failure aborts the ingestion. Because every write merges into
 * existing rows by key, a retried ingestion converges to the same state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GraphIngestionServiceImpl implements GraphIngestionService {

    private final TrackedRepositoryRepository repositoryRepository;
    private final CodeSymbolRepository symbolRepository;
    private final GraphBatchWriter batchWriter;
    private final SymbolHierarchyLinker hierarchyLinker;
    private final FileDependencyBuilder fileDependencyBuilder;
    private final AppProperties appProperties;
    private final ObjectMapper objectMapper;

    @Override
    public IngestionCounts ingest(Long repoId, List<ParsedFile> parsedFiles) {
        TrackedRepository repository = repositoryRepository.findById(repoId)
                .orElseThrow(() -> new RepositoryNotFoundException(String.valueOf(repoId)));

        IngestionCounts counts = new IngestionCounts();
        List<ParsedFile> files = uniqueByPath(parsedFiles);
        if (files.isEmpty()) {
            return counts;
        }

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.DATABASE, "IngestBatch", log);
        ctx.logRequest("Ingesting parsed files",
                "Repository", repository.getName(),
                "Files", files.size());

        try {
            // 1. Files
            Map<String, SourceFile> storedFiles = storeFiles(repository, files, counts, ctx);

            // 2. Symbols
            List<CodeSymbol> symbols = storeSymbols(files, storedFiles, counts);

            // 3. Hierarchy links
            Set<Long> fileIds = new HashSet<>();
            storedFiles.values().forEach(file -> fileIds.add(file.getId()));
            counts.setHierarchyLinks(hierarchyLinker.linkFiles(fileIds));

            // 4. Symbol dependencies
            List<SymbolDependency> dependencies = storeDependencies(files, storedFiles, symbols, counts, ctx);

            // 5. File dependencies
            storeFileDependencies(files, storedFiles, symbols, dependencies, counts, ctx);

            ctx.logResponse(counts.summary());
            return counts;
        } catch (RuntimeException e) {
            ctx.logError("Ingestion failed for " + repository.getName(), e);
            throw e;
        }
    }

    // ================================================================
    // FILES
    // ================================================================

    private Map<String, SourceFile> storeFiles(TrackedRepository repository, List<ParsedFile> files,
                                               IngestionCounts counts, CallContext ctx) {
        Path root = Path.of(repository.getPath());
        List<SourceFile> rows = new ArrayList<>(files.size());
        for (ParsedFile parsed : files) {
            rows.add(toSourceFile(repository.getId(), root, parsed));
        }

        Map<String, SourceFile> stored = new LinkedHashMap<>();
        for (List<SourceFile> batch : Lists.partition(rows, ingestion().getFileBatchSize())) {
            BatchWriteOutcome<SourceFile> outcome = ConflictRecovery.writeOrRecover(
                    () -> batchWriter.upsertFiles(repository.getId(), batch),
                    () -> batchWriter.findPersistedFiles(repository.getId(), batch),
                    ctx);
            counts.setFilesCreated(counts.getFilesCreated() + outcome.created());
            counts.setFilesUpdated(counts.getFilesUpdated() + outcome.updated());
            if (outcome.isConflictRecovered()) {
                counts.setConflictsRecovered(counts.getConflictsRecovered() + 1);
            }
            outcome.rows().forEach(file -> stored.put(file.getPath(), file));
        }
        return stored;
    }

    private SourceFile toSourceFile(Long repoId, Path root, ParsedFile parsed) {
        String path = parsed.path();
        Long size = parsed.content() != null
                ? (long) parsed.content().getBytes(StandardCharsets.UTF_8).length
                : null;
        BasicFileAttributes attributes = readAttributes(root.resolve(path));

        return SourceFile.builder()
                .repoId(repoId)
                .path(path)
                .language(SourceFileClassifier.detectLanguage(path))
                .size(size != null ? size : attributes != null ? attributes.size() : null)
                .contentHash(SourceFileClassifier.contentHash(parsed.content()))
                .lastModified(attributes != null ? attributes.lastModifiedTime().toInstant() : null)
                .generated(SourceFileClassifier.isGeneratedFile(path))
                .test(SourceFileClassifier.isTestFile(path))
                .build();
    }

    private BasicFileAttributes readAttributes(Path file) {
        try {
            return Files.readAttributes(file, BasicFileAttributes.class);
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read attributes of " + file, e);
        }
    }

    // ================================================================
    // SYMBOLS
    // ================================================================

    private List<CodeSymbol> storeSymbols(List<ParsedFile> files, Map<String, SourceFile> storedFiles,
                                          IngestionCounts counts) {
        List<CodeSymbol> candidates = new ArrayList<>();
        for (ParsedFile parsed : files) {
            Long fileId = storedFiles.get(parsed.path()).getId();
            for (ParsedSymbol symbol : parsed.symbols()) {
                if (symbol.name() == null || symbol.name().isBlank() || symbol.symbolType() == null) {
                    log.debug("Skipping symbol without name or kind in {}", parsed.path());
                    counts.addRecordsSkipped(1);
                    continue;
                }
                candidates.add(toCodeSymbol(fileId, symbol));
            }
        }

        List<CodeSymbol> unique = SymbolDeduplicator.deduplicate(candidates);
        counts.setSymbolsDeduplicated(candidates.size() - unique.size());
        if (counts.getSymbolsDeduplicated() > 0) {
            log.info("Collapsed {} duplicate symbols ({} -> {})",
                    counts.getSymbolsDeduplicated(), candidates.size(), unique.size());
        }

        Set<Long> fileIds = new HashSet<>();
        storedFiles.values().forEach(file -> fileIds.add(file.getId()));
        Map<GraphKeys.SymbolKey, CodeSymbol> existing = new HashMap<>();
        for (CodeSymbol stored : symbolRepository.findByFileIdInOrderByIdAsc(fileIds)) {
            existing.putIfAbsent(GraphKeys.of(stored), stored);
        }

        List<CodeSymbol> rows = new ArrayList<>(unique.size());
        for (CodeSymbol candidate : unique) {
            CodeSymbol current = existing.get(GraphKeys.of(candidate));
            if (current == null) {
                rows.add(candidate);
                counts.setSymbolsCreated(counts.getSymbolsCreated() + 1);
            } else {
                SymbolDeduplicator.mergeInto(current, candidate);
                rows.add(current);
                counts.setSymbolsUpdated(counts.getSymbolsUpdated() + 1);
            }
        }

        List<CodeSymbol> saved = new ArrayList<>(rows.size());
        for (List<CodeSymbol> batch : Lists.partition(rows, ingestion().getSymbolBatchSize())) {
            saved.addAll(batchWriter.saveSymbols(batch));
        }
        return saved;
    }

    private static CodeSymbol toCodeSymbol(Long fileId, ParsedSymbol symbol) {
        return CodeSymbol.builder()
                .fileId(fileId)
                .name(symbol.name())
                .qualifiedName(symbol.qualifiedName())
                .symbolType(symbol.symbolType())
                .visibility(symbol.visibility())
                .startLine(symbol.startLine())
                .endLine(symbol.endLine())
                .exported(symbol.exported())
                .signature(symbol.signature())
                .description(symbol.description())
                .build();
    }

    // ================================================================
    // SYMBOL DEPENDENCIES
    // ================================================================

    private List<SymbolDependency> storeDependencies(List<ParsedFile> files, Map<String, SourceFile> storedFiles,
                                                     List<CodeSymbol> symbols, IngestionCounts counts,
                                                     CallContext ctx) {
        Map<Long, List<CodeSymbol>> symbolsByFile = groupByFile(symbols);

        List<SymbolDependency> candidates = new ArrayList<>();
        for (ParsedFile parsed : files) {
            Long fileId = storedFiles.get(parsed.path()).getId();
            List<CodeSymbol> fileSymbols = symbolsByFile.getOrDefault(fileId, List.of());

            Map<String, CodeSymbol> byName = new HashMap<>();
            Map<String, CodeSymbol> byQualifiedName = new HashMap<>();
            for (CodeSymbol symbol : fileSymbols) {
                byName.putIfAbsent(symbol.getName(), symbol);
                if (symbol.getQualifiedName() != null) {
                    byQualifiedName.putIfAbsent(symbol.getQualifiedName(), symbol);
                }
            }

            for (ParsedDependency dependency : parsed.dependencies()) {
                CodeSymbol caller = dependency.fromSymbol() != null ? byName.get(dependency.fromSymbol()) : null;
                if (caller == null || dependency.dependencyType() == null
                        || dependency.toSymbol() == null || dependency.toSymbol().isBlank()) {
                    log.debug("Skipping dependency {} -> {} in {}: no caller symbol or target",
                            dependency.fromSymbol(), dependency.toSymbol(), parsed.path());
                    counts.addRecordsSkipped(1);
                    continue;
                }

                if (dependency.toSymbol().length() > SymbolDependency.MAX_QUALIFIED_NAME_LENGTH) {
                    log.warn("Skipping dependency from {} in {}: target name of {} chars exceeds {}",
                            dependency.fromSymbol(), parsed.path(), dependency.toSymbol().length(),
                            SymbolDependency.MAX_QUALIFIED_NAME_LENGTH);
                    counts.addRecordsSkipped(1);
                    continue;
                }

                CodeSymbol target = byQualifiedName.get(dependency.toSymbol());
                if (target == null) {
                    target = byName.get(dependency.toSymbol());
                }
                candidates.add(toSymbolDependency(caller, target, dependency));
            }
        }

        Map<GraphKeys.DependencyKey, SymbolDependency> unique = new LinkedHashMap<>();
        for (SymbolDependency candidate : candidates) {
            unique.putIfAbsent(GraphKeys.of(candidate), candidate);
        }
        counts.setDependenciesDeduplicated(candidates.size() - unique.size());
        if (counts.getDependenciesDeduplicated() > 0) {
            log.info("Removed {} duplicate dependencies ({} -> {})",
                    counts.getDependenciesDeduplicated(), candidates.size(), unique.size());
        }

        List<SymbolDependency> persisted = new ArrayList<>(unique.size());
        List<SymbolDependency> rows = new ArrayList<>(unique.values());
        for (List<SymbolDependency> batch : Lists.partition(rows, ingestion().getDependencyBatchSize())) {
            BatchWriteOutcome<SymbolDependency> outcome = ConflictRecovery.writeOrRecover(
                    () -> batchWriter.mergeDependencies(batch),
                    () -> batchWriter.findPersistedDependencies(batch),
                    ctx);
            counts.setDependenciesCreated(counts.getDependenciesCreated() + outcome.created());
            counts.setDependenciesUpdated(counts.getDependenciesUpdated() + outcome.updated());
            if (outcome.isConflictRecovered()) {
                counts.setConflictsRecovered(counts.getConflictsRecovered() + 1);
            }
            persisted.addAll(outcome.rows());
        }
        return persisted;
    }

    private SymbolDependency toSymbolDependency(CodeSymbol caller, CodeSymbol target, ParsedDependency dependency) {
        return SymbolDependency.builder()
                .fromSymbolId(caller.getId())
                .toSymbolId(target != null ? target.getId() : null)
                .toQualifiedName(dependency.toSymbol())
                .dependencyType(dependency.dependencyType())
                .lineNumber(dependency.lineNumber())
                .callingObject(fit(dependency, "callingObject", dependency.callingObject(),
                        SymbolDependency.MAX_SHORT_CONTEXT_LENGTH))
                .resolvedClass(fit(dependency, "resolvedClass", dependency.resolvedClass(),
                        SymbolDependency.MAX_SHORT_CONTEXT_LENGTH))
                .qualifiedContext(fit(dependency, "qualifiedContext", dependency.qualifiedContext(),
                        SymbolDependency.MAX_CONTEXT_LENGTH))
                .methodSignature(fit(dependency, "methodSignature", dependency.methodSignature(),
                        SymbolDependency.MAX_CONTEXT_LENGTH))
                .fileContext(fit(dependency, "fileContext", dependency.fileContext(),
                        SymbolDependency.MAX_CONTEXT_LENGTH))
                .namespaceContext(fit(dependency, "namespaceContext", dependency.namespaceContext(),
                        SymbolDependency.MAX_SHORT_CONTEXT_LENGTH))
                .parameterContext(fit(dependency, "parameterContext", dependency.parameterContext(),
                        SymbolDependency.MAX_PARAMETER_LENGTH))
                .parameterTypes(fit(dependency, "parameterTypes", serializeParameterTypes(dependency),
                        SymbolDependency.MAX_PARAMETER_LENGTH))
                .callInstanceId(fit(dependency, "callInstanceId", dependency.callInstanceId(),
                        SymbolDependency.MAX_CALL_INSTANCE_ID_LENGTH))
                .build();
    }

    /**
     * Drops a call-site field that does not fit its column, keeping the edge itself.
     */
    private static String fit(ParsedDependency dependency, String field, String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        log.warn("Dropping {} of {} -> {}: {} chars exceeds {}",
                field, dependency.fromSymbol(), dependency.toSymbol(), value.length(), maxLength);
        return null;
    }

    private String serializeParameterTypes(ParsedDependency dependency) {
        if (dependency.parameterTypes() == null || dependency.parameterTypes().isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(dependency.parameterTypes());
        } catch (JsonProcessingException e) {
            log.warn("Dropping malformed parameter types of {} -> {}: {}",
                    dependency.fromSymbol(), dependency.toSymbol(), e.getOriginalMessage());
            return null;
        }
    }

    // ================================================================
    // FILE DEPENDENCIES
    // ================================================================

    private void storeFileDependencies(List<ParsedFile> files, Map<String, SourceFile> storedFiles,
                                       List<CodeSymbol> symbols, List<SymbolDependency> dependencies,
                                       IngestionCounts counts, CallContext ctx) {
        Map<Long, Long> fileIdBySymbolId = new HashMap<>();
        symbols.forEach(symbol -> fileIdBySymbolId.put(symbol.getId(), symbol.getFileId()));

        Set<Long> foreignTargets = new HashSet<>();
        for (SymbolDependency dependency : dependencies) {
            if (dependency.getToSymbolId() != null && !fileIdBySymbolId.containsKey(dependency.getToSymbolId())) {
                foreignTargets.add(dependency.getToSymbolId());
            }
        }
        for (List<Long> ids : Lists.partition(new ArrayList<>(foreignTargets), ingestion().getDependencyBatchSize())) {
            symbolRepository.findAllById(ids)
                    .forEach(symbol -> fileIdBySymbolId.put(symbol.getId(), symbol.getFileId()));
        }

        Map<Long, List<ParsedImport>> importsByFileId = new LinkedHashMap<>();
        for (ParsedFile parsed : files) {
            importsByFileId.put(storedFiles.get(parsed.path()).getId(), parsed.imports());
        }

        List<FileDependency> derived = fileDependencyBuilder.build(dependencies, fileIdBySymbolId, importsByFileId);
        List<FileDependency> unique = fileDependencyBuilder.deduplicate(derived);
        counts.setFileDependenciesDeduplicated(derived.size() - unique.size());

        for (List<FileDependency> batch : Lists.partition(unique, ingestion().getFileDependencyBatchSize())) {
            BatchWriteOutcome<FileDependency> outcome = ConflictRecovery.writeOrRecover(
                    () -> batchWriter.mergeFileDependencies(batch),
                    () -> batchWriter.findPersistedFileDependencies(batch),
                    ctx);
            counts.setFileDependenciesCreated(counts.getFileDependenciesCreated() + outcome.created());
            counts.setFileDependenciesUpdated(counts.getFileDependenciesUpdated() + outcome.updated());
            if (outcome.isConflictRecovered()) {
                counts.setConflictsRecovered(counts.getConflictsRecovered() + 1);
            }
        }
    }

    // ================================================================
    // HELPERS
    // ================================================================

    private List<ParsedFile> uniqueByPath(List<ParsedFile> parsedFiles) {
        Map<String, ParsedFile> byPath = new LinkedHashMap<>();
        for (ParsedFile parsed : parsedFiles) {
            if (byPath.putIfAbsent(parsed.path(), parsed) != null) {
                log.warn("Ignoring second parse result for {}", parsed.path());
            }
        }
        return new ArrayList<>(byPath.values());
    }

    private static Map<Long, List<CodeSymbol>> groupByFile(List<CodeSymbol> symbols) {
        Map<Long, List<CodeSymbol>> byFile = new HashMap<>();
        for (CodeSymbol symbol : symbols) {
            byFile.computeIfAbsent(symbol.getFileId(), id -> new ArrayList<>()).add(symbol);
        }
        byFile.values().forEach(list -> list.sort((a, b) -> Long.compare(a.getId(), b.getId())));
        return byFile;
    }

    private IngestionProperties ingestion() {
        return appProperties.getIngestion();
    }
}
