package com.purchasingpower.codegraph.service.graph.impl;

import com.google.common.collect.Lists;
import com.purchasingpower.codegraph.exception.GraphQueryTimeoutException;
import com.purchasingpower.codegraph.model.CallContext;
import com.purchasingpower.codegraph.model.ServiceType;
import com.purchasingpower.codegraph.model.graph.CodeSymbol;
import com.purchasingpower.codegraph.model.graph.DependencyType;
import com.purchasingpower.codegraph.model.graph.SymbolDependency;
import com.purchasingpower.codegraph.model.sync.ResolutionResult;
import com.purchasingpower.codegraph.repository.CodeSymbolRepository;
import com.purchasingpower.codegraph.repository.SymbolDependencyRepository;
import com.purchasingpower.codegraph.service.graph.QualifiedNameResolutionService;
import com.purchasingpower.codegraph.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionCallback;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
public class QualifiedNameResolutionServiceImpl implements QualifiedNameResolutionService {

    private static final int ID_CHUNK_SIZE = 1000;

    private static final Comparator<SymbolDependency> MOST_RECENT_FIRST = Comparator
            .comparing(SymbolDependency::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(SymbolDependency::getId)
            .reversed();

    private final SymbolDependencyRepository dependencyRepository;
    private final CodeSymbolRepository symbolRepository;
    private final GraphQueryRunner queryRunner;

    public QualifiedNameResolutionServiceImpl(SymbolDependencyRepository dependencyRepository,
                                              CodeSymbolRepository symbolRepository,
                                              GraphQueryRunner queryRunner) {
        this.dependencyRepository = dependencyRepository;
        this.symbolRepository = symbolRepository;
        this.queryRunner = queryRunner;
    }

    @Override
    public ResolutionResult resolveQualifiedNames(Long repoId) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.DATABASE, "ResolveQualifiedNames", log);
        ctx.logRequest("Binding unresolved edges", "Repository", repoId);

        ResolutionResult result = withTimeout("resolveQualifiedNames", status -> {
            int deduplicated = deduplicateUnresolved(repoId);
            int resolved = bindUnresolved(repoId);
            return new ResolutionResult(deduplicated, resolved, 0);
        }, ctx);

        ctx.logResponse("Resolution complete",
                "Deduplicated", result.deduplicated(),
                "Resolved", result.resolved());
        return result;
    }

    @Override
    public int cleanupOrphans(Long repoId) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.DATABASE, "CleanupOrphans", log);
        ctx.logRequest("Deleting unresolvable edges", "Repository", repoId);

        Integer deleted = withTimeout("cleanupOrphans", status -> {
            List<Long> targetless = dependencyRepository.findTargetlessIdsByRepoId(repoId);
            List<Long> unmatched = dependencyRepository.findUnmatchedIdsByRepoId(repoId, DependencyType.IMPORTS);

            Set<Long> orphanIds = new HashSet<>(targetless);
            orphanIds.addAll(unmatched);
            int removed = deleteByIds(orphanIds);

            log.debug("Orphans for repository {}: {} without target, {} with unmatched qualified name",
                    repoId, targetless.size(), unmatched.size());
            return removed;
        }, ctx);

        ctx.logResponse("Orphan cleanup complete", "Deleted", deleted);
        return deleted;
    }

    @Override
    public ResolutionResult runResolutionPass(Long repoId) {
        ResolutionResult result = resolveQualifiedNames(repoId);
        int orphans = cleanupOrphans(repoId);
        return result.withOrphansRemoved(orphans);
    }

    // ================================================================
    // STEPS
    // ================================================================

    /**
     * Keeps the most recently created unresolved edge per call site.
     */
    private int deduplicateUnresolved(Long repoId) {
        Map<GraphKeys.QualifiedCallSiteKey, List<SymbolDependency>> groups = new LinkedHashMap<>();
        for (SymbolDependency dependency : dependencyRepository.findUnresolvedByRepoId(repoId)) {
            groups.computeIfAbsent(GraphKeys.callSiteOf(dependency), key -> new ArrayList<>()).add(dependency);
        }

        List<Long> duplicates = new ArrayList<>();
        for (List<SymbolDependency> group : groups.values()) {
            if (group.size() < 2) {
                continue;
            }
            group.sort(MOST_RECENT_FIRST);
            group.subList(1, group.size()).forEach(dependency -> duplicates.add(dependency.getId()));
        }

        int removed = deleteByIds(duplicates);
        if (removed > 0) {
            log.info("Removed {} duplicate unresolved edges in repository {}", removed, repoId);
        }
        return removed;
    }

    /**
     * Binds unresolved edges whose qualified name identifies exactly one symbol.
     */
    private int bindUnresolved(Long repoId) {
        List<SymbolDependency> unresolved = dependencyRepository.findUnresolvedByRepoId(repoId);
        if (unresolved.isEmpty()) {
            return 0;
        }

        Set<String> names = new HashSet<>();
        unresolved.forEach(dependency -> names.add(dependency.getToQualifiedName()));
        Map<String, List<CodeSymbol>> candidates = new HashMap<>();
        for (List<String> chunk : Lists.partition(new ArrayList<>(names), ID_CHUNK_SIZE)) {
            for (CodeSymbol symbol : symbolRepository.findByRepoIdAndQualifiedNameIn(repoId, chunk)) {
                candidates.computeIfAbsent(symbol.getQualifiedName(), name -> new ArrayList<>()).add(symbol);
            }
        }

        // Bound edges that a newly bound edge could collide with
        Set<Long> fromIds = new HashSet<>();
        unresolved.forEach(dependency -> fromIds.add(dependency.getFromSymbolId()));
        Set<GraphKeys.DependencyKey> boundKeys = new HashSet<>();
        for (List<Long> chunk : Lists.partition(new ArrayList<>(fromIds), ID_CHUNK_SIZE)) {
            for (SymbolDependency existing : dependencyRepository.findByFromSymbolIdIn(chunk)) {
                if (existing.getToSymbolId() != null) {
                    boundKeys.add(GraphKeys.of(existing));
                }
            }
        }

        List<SymbolDependency> bound = new ArrayList<>();
        List<Long> collisions = new ArrayList<>();
        int ambiguous = 0;
        for (SymbolDependency dependency : unresolved) {
            List<CodeSymbol> matches = candidates.getOrDefault(dependency.getToQualifiedName(), List.of());
            if (matches.size() != 1) {
                if (matches.size() > 1) {
                    ambiguous++;
                }
                continue;
            }

            Long targetId = matches.get(0).getId();
            GraphKeys.DependencyKey boundKey = new GraphKeys.DependencyKey(dependency.getFromSymbolId(), targetId,
                    null, dependency.getDependencyType(), dependency.getLineNumber());
            if (!boundKeys.add(boundKey)) {
                collisions.add(dependency.getId());
            } else {
                dependency.setToSymbolId(targetId);
                bound.add(dependency);
            }
        }

        if (!collisions.isEmpty()) {
            deleteByIds(collisions);
            log.info("Dropped {} unresolved edges already present as bound edges", collisions.size());
        }
        dependencyRepository.saveAllAndFlush(bound);
        if (ambiguous > 0) {
            log.debug("{} edges left unresolved: qualified name matches several symbols", ambiguous);
        }
        return bound.size();
    }

    private int deleteByIds(Collection<Long> ids) {
        int removed = 0;
        for (List<Long> chunk : Lists.partition(new ArrayList<>(ids), ID_CHUNK_SIZE)) {
            removed += dependencyRepository.deleteByIdIn(chunk);
        }
        return removed;
    }

    private <T> T withTimeout(String operation, TransactionCallback<T> work, CallContext ctx) {
        try {
            return queryRunner.run(operation, false, work);
        } catch (GraphQueryTimeoutException e) {
            ctx.logError(operation + " timed out after " + e.getTimeout().toMillis() + "ms", e);
            throw e;
        } catch (RuntimeException e) {
            ctx.logError(operation + " failed", e);
            throw e;
        }
    }
}
