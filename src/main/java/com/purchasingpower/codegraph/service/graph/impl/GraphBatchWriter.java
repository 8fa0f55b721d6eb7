package com.purchasingpower.codegraph.service.graph.impl;

import com.purchasingpower.codegraph.model.graph.CodeSymbol;
import com.purchasingpower.codegraph.model.graph.FileDependency;
import com.purchasingpower.codegraph.model.graph.SourceFile;
import com.purchasingpower.codegraph.model.graph.SymbolDependency;
import com.purchasingpower.codegraph.model.sync.BatchWriteOutcome;
import com.purchasingpower.codegraph.repository.CodeSymbolRepository;
import com.purchasingpower.codegraph.repository.FileDependencyRepository;
import com.purchasingpower.codegraph.repository.SourceFileRepository;
import com.purchasingpower.codegraph.repository.SymbolDependencyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Writes one batch per transaction.
 *
 * <p>Each write runs in its own transaction so a unique-key violation only
 * rolls back that batch; the caller can then read the persisted rows back
 * in a fresh transaction (see {@link com.purchasingpower.codegraph.util.ConflictRecovery}).
 *
 * <p>Merges load the rows already stored under the batch's keys and update
 * their mutable fields in place; only rows with unseen keys are inserted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
class GraphBatchWriter {

    private final SourceFileRepository fileRepository;
    private final CodeSymbolRepository symbolRepository;
    private final SymbolDependencyRepository dependencyRepository;
    private final FileDependencyRepository fileDependencyRepository;

    // ================================================================
    // FILES
    // ================================================================

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public BatchWriteOutcome<SourceFile> upsertFiles(Long repoId, List<SourceFile> batch) {
        Map<String, SourceFile> existing = fileRepository
                .findByRepoIdAndPathIn(repoId, paths(batch)).stream()
                .collect(Collectors.toMap(SourceFile::getPath, f -> f));

        List<SourceFile> rows = new ArrayList<>(batch.size());
        int created = 0;
        int updated = 0;
        for (SourceFile incoming : batch) {
            SourceFile current = existing.get(incoming.getPath());
            if (current == null) {
                rows.add(incoming);
                created++;
            } else {
                current.setLanguage(incoming.getLanguage());
                current.setSize(incoming.getSize());
                current.setContentHash(incoming.getContentHash());
                current.setLastModified(incoming.getLastModified());
                current.setGenerated(incoming.isGenerated());
                current.setTest(incoming.isTest());
                rows.add(current);
                updated++;
            }
        }
        List<SourceFile> saved = fileRepository.saveAllAndFlush(rows);
        return BatchWriteOutcome.written(saved, created, updated);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public List<SourceFile> findPersistedFiles(Long repoId, List<SourceFile> batch) {
        return fileRepository.findByRepoIdAndPathIn(repoId, paths(batch));
    }

    // ================================================================
    // SYMBOLS
    // ================================================================

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<CodeSymbol> saveSymbols(List<CodeSymbol> batch) {
        return symbolRepository.saveAllAndFlush(batch);
    }

    // ================================================================
    // SYMBOL DEPENDENCIES
    // ================================================================

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public BatchWriteOutcome<SymbolDependency> mergeDependencies(List<SymbolDependency> batch) {
        List<SymbolDependency> stored = dependencyRepository.findByFromSymbolIdIn(fromSymbolIds(batch));

        Map<GraphKeys.DependencyKey, SymbolDependency> byKey = new HashMap<>();
        Map<GraphKeys.QualifiedCallSiteKey, SymbolDependency> byCallSite = new HashMap<>();
        for (SymbolDependency row : stored) {
            byKey.putIfAbsent(GraphKeys.of(row), row);
            if (row.getToQualifiedName() != null) {
                byCallSite.putIfAbsent(GraphKeys.callSiteOf(row), row);
            }
        }

        List<SymbolDependency> rows = new ArrayList<>(batch.size());
        int created = 0;
        int updated = 0;
        for (SymbolDependency incoming : batch) {
            SymbolDependency match = byKey.get(GraphKeys.of(incoming));
            if (match == null && incoming.getToSymbolId() == null && incoming.getToQualifiedName() != null) {
                // Already bound by an earlier resolution pass
                match = byCallSite.get(GraphKeys.callSiteOf(incoming));
            }
            if (match != null) {
                mergeCallContext(match, incoming);
                rows.add(match);
                updated++;
            } else {
                byKey.put(GraphKeys.of(incoming), incoming);
                rows.add(incoming);
                created++;
            }
        }

        List<SymbolDependency> saved = dependencyRepository.saveAllAndFlush(rows);
        return BatchWriteOutcome.written(saved, created, updated);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public List<SymbolDependency> findPersistedDependencies(List<SymbolDependency> batch) {
        Set<GraphKeys.DependencyKey> keys = batch.stream().map(GraphKeys::of).collect(Collectors.toSet());
        Set<GraphKeys.QualifiedCallSiteKey> callSites = batch.stream()
                .filter(SymbolDependency::isUnresolved)
                .map(GraphKeys::callSiteOf)
                .collect(Collectors.toSet());

        return dependencyRepository.findByFromSymbolIdIn(fromSymbolIds(batch)).stream()
                .filter(row -> keys.contains(GraphKeys.of(row))
                        || (row.getToQualifiedName() != null && callSites.contains(GraphKeys.callSiteOf(row))))
                .collect(Collectors.toList());
    }

    // ================================================================
    // FILE DEPENDENCIES
    // ================================================================

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public BatchWriteOutcome<FileDependency> mergeFileDependencies(List<FileDependency> batch) {
        Map<GraphKeys.FileDependencyKey, FileDependency> byKey = new HashMap<>();
        for (FileDependency row : fileDependencyRepository.findByFromFileIdIn(fromFileIds(batch))) {
            byKey.putIfAbsent(GraphKeys.of(row), row);
        }

        List<FileDependency> rows = new ArrayList<>(batch.size());
        int created = 0;
        int updated = 0;
        for (FileDependency incoming : batch) {
            FileDependency match = byKey.get(GraphKeys.of(incoming));
            if (match != null) {
                match.setLineNumber(incoming.getLineNumber());
                rows.add(match);
                updated++;
            } else {
                byKey.put(GraphKeys.of(incoming), incoming);
                rows.add(incoming);
                created++;
            }
        }

        List<FileDependency> saved = fileDependencyRepository.saveAllAndFlush(rows);
        return BatchWriteOutcome.written(saved, created, updated);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public List<FileDependency> findPersistedFileDependencies(List<FileDependency> batch) {
        Set<GraphKeys.FileDependencyKey> keys = batch.stream().map(GraphKeys::of).collect(Collectors.toSet());
        return fileDependencyRepository.findByFromFileIdIn(fromFileIds(batch)).stream()
                .filter(row -> keys.contains(GraphKeys.of(row)))
                .collect(Collectors.toList());
    }

    private static void mergeCallContext(SymbolDependency target, SymbolDependency source) {
        target.setLineNumber(source.getLineNumber());
        target.setParameterContext(source.getParameterContext());
        target.setParameterTypes(source.getParameterTypes());
        target.setCallInstanceId(source.getCallInstanceId());
        target.setCallingObject(source.getCallingObject());
        target.setResolvedClass(source.getResolvedClass());
        target.setQualifiedContext(source.getQualifiedContext());
        target.setMethodSignature(source.getMethodSignature());
        target.setFileContext(source.getFileContext());
        target.setNamespaceContext(source.getNamespaceContext());
    }

    private static Set<String> paths(List<SourceFile> batch) {
        return batch.stream().map(SourceFile::getPath).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static Set<Long> fromSymbolIds(List<SymbolDependency> batch) {
        return batch.stream().map(SymbolDependency::getFromSymbolId).collect(Collectors.toSet());
    }

    private static Set<Long> fromFileIds(List<FileDependency> batch) {
        return batch.stream().map(FileDependency::getFromFileId).collect(Collectors.toSet());
    }
}
