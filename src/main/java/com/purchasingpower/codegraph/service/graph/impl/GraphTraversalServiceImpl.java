package com.purchasingpower.codegraph.service.graph.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.purchasingpower.codegraph.configuration.AppProperties;
import com.purchasingpower.codegraph.configuration.CacheConfig;
import com.purchasingpower.codegraph.exception.GraphQueryTimeoutException;
import com.purchasingpower.codegraph.exception.SymbolNotFoundException;
import com.purchasingpower.codegraph.model.graph.CodeSymbol;
import com.purchasingpower.codegraph.model.graph.DependencyType;
import com.purchasingpower.codegraph.model.graph.SourceFile;
import com.purchasingpower.codegraph.model.graph.SymbolDependency;
import com.purchasingpower.codegraph.model.traversal.CallerGroup;
import com.purchasingpower.codegraph.model.traversal.CallerRef;
import com.purchasingpower.codegraph.model.traversal.ParameterContextAnalysis;
import com.purchasingpower.codegraph.model.traversal.SymbolRef;
import com.purchasingpower.codegraph.model.traversal.TransitiveEdge;
import com.purchasingpower.codegraph.model.traversal.TraversalDirection;
import com.purchasingpower.codegraph.repository.CodeSymbolRepository;
import com.purchasingpower.codegraph.repository.SourceFileRepository;
import com.purchasingpower.codegraph.repository.SymbolDependencyRepository;
import com.purchasingpower.codegraph.service.graph.GraphTraversalService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
public class GraphTraversalServiceImpl implements GraphTraversalService {

    static final String TRAVERSE_OPERATION = "traverse";

    /** Raw paths explored per requested result before expansion stops. */
    private static final int FAN_OUT_FACTOR = 4;

    private static final Comparator<TransitiveEdge> RESULT_ORDER = Comparator
            .comparingInt(TransitiveEdge::depth)
            .thenComparing(TransitiveEdge::dependencyId, Comparator.reverseOrder());

    private final SymbolDependencyRepository dependencyRepository;
    private final CodeSymbolRepository symbolRepository;
    private final SourceFileRepository fileRepository;
    private final GraphQueryRunner queryRunner;
    private final AppProperties appProperties;
    private final ObjectMapper objectMapper;

    public GraphTraversalServiceImpl(SymbolDependencyRepository dependencyRepository,
                                     CodeSymbolRepository symbolRepository,
                                     SourceFileRepository fileRepository,
                                     GraphQueryRunner queryRunner,
                                     AppProperties appProperties,
                                     ObjectMapper objectMapper) {
        this.dependencyRepository = dependencyRepository;
        this.symbolRepository = symbolRepository;
        this.fileRepository = fileRepository;
        this.queryRunner = queryRunner;
        this.appProperties = appProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    @Cacheable(cacheNames = CacheConfig.TRAVERSAL_CACHE, keyGenerator = CacheConfig.TRAVERSAL_KEY_GENERATOR)
    public List<TransitiveEdge> traverse(Long symbolId, TraversalDirection direction, int maxDepth,
                                         Set<DependencyType> kinds, int limit) {
        Preconditions.checkNotNull(symbolId, "symbolId is required");
        Preconditions.checkNotNull(direction, "direction is required");
        Preconditions.checkArgument(maxDepth >= 1, "maxDepth must be at least 1, got %s", maxDepth);
        Preconditions.checkArgument(limit >= 1, "limit must be at least 1, got %s", limit);

        Set<DependencyType> effectiveKinds = kinds == null ? Set.of() : kinds;
        try {
            return queryRunner.run(TRAVERSE_OPERATION, true,
                    status -> expand(symbolId, direction, maxDepth, effectiveKinds, limit));
        } catch (GraphQueryTimeoutException e) {
            log.error("Traversal from symbol {} ({}) timed out after {}ms",
                    symbolId, direction, e.getTimeout().toMillis());
            throw e;
        }
    }

    // The shortcuts below share cache entries with the equivalent traverse call

    @Override
    @Cacheable(cacheNames = CacheConfig.TRAVERSAL_CACHE, keyGenerator = CacheConfig.TRAVERSAL_KEY_GENERATOR)
    public List<TransitiveEdge> getTransitiveCallers(Long symbolId, Set<DependencyType> kinds) {
        return traverse(symbolId, TraversalDirection.CALLERS,
                appProperties.getTraversal().getDefaultMaxDepth(), kinds,
                appProperties.getTraversal().getDefaultLimit());
    }

    @Override
    @Cacheable(cacheNames = CacheConfig.TRAVERSAL_CACHE, keyGenerator = CacheConfig.TRAVERSAL_KEY_GENERATOR)
    public List<TransitiveEdge> getTransitiveDependencies(Long symbolId, Set<DependencyType> kinds) {
        return traverse(symbolId, TraversalDirection.DEPENDENCIES,
                appProperties.getTraversal().getDefaultMaxDepth(), kinds,
                appProperties.getTraversal().getDefaultLimit());
    }

    @Override
    @Cacheable(cacheNames = CacheConfig.TRAVERSAL_CACHE, keyGenerator = CacheConfig.TRAVERSAL_KEY_GENERATOR)
    public List<TransitiveEdge> getDirectCallers(Long symbolId) {
        return traverse(symbolId, TraversalDirection.CALLERS, 1, Set.of(),
                appProperties.getTraversal().getDefaultLimit());
    }

    @Override
    @Cacheable(cacheNames = CacheConfig.TRAVERSAL_CACHE, keyGenerator = CacheConfig.TRAVERSAL_KEY_GENERATOR)
    public List<TransitiveEdge> getDirectDependencies(Long symbolId) {
        return traverse(symbolId, TraversalDirection.DEPENDENCIES, 1, Set.of(),
                appProperties.getTraversal().getDefaultLimit());
    }

    @Override
    public ParameterContextAnalysis groupCallsByParameterContext(Long symbolId) {
        CodeSymbol target = symbolRepository.findById(symbolId)
                .orElseThrow(() -> new SymbolNotFoundException(symbolId));

        List<SymbolDependency> calls = dependencyRepository.findByToSymbolIdAndParameterContextIsNotNullOrderByIdAsc(symbolId);
        if (calls.isEmpty()) {
            return new ParameterContextAnalysis(target.getName(), List.of(), 0);
        }

        Map<Long, CodeSymbol> callers = loadSymbols(calls.stream().map(SymbolDependency::getFromSymbolId).collect(Collectors.toSet()));
        Map<Long, String> paths = loadFilePaths(callers.values());

        Map<String, List<SymbolDependency>> byContext = calls.stream()
                .collect(Collectors.groupingBy(SymbolDependency::getParameterContext, LinkedHashMap::new, Collectors.toList()));

        List<CallerGroup> groups = new ArrayList<>();
        for (Map.Entry<String, List<SymbolDependency>> entry : byContext.entrySet()) {
            List<SymbolDependency> group = entry.getValue();
            List<CallerRef> callerRefs = group.stream()
                    .map(call -> {
                        CodeSymbol caller = callers.get(call.getFromSymbolId());
                        return new CallerRef(
                                caller != null ? caller.getName() : null,
                                caller != null ? paths.get(caller.getFileId()) : null,
                                call.getLineNumber());
                    })
                    .collect(Collectors.toList());

            groups.add(new CallerGroup(
                    entry.getKey(),
                    group.stream().map(SymbolDependency::getCallInstanceId).filter(id -> id != null).collect(Collectors.toList()),
                    group.size(),
                    group.stream().map(SymbolDependency::getLineNumber).collect(Collectors.toList()),
                    callerRefs,
                    parameterTypesOf(group)));
        }

        log.debug("Grouped {} calls to {} into {} parameter contexts", calls.size(), target.getName(), groups.size());
        return new ParameterContextAnalysis(target.getName(), groups, calls.size());
    }

    // ================================================================
    // BREADTH-FIRST EXPANSION
    // ================================================================

    /**
     * Expands one frontier of paths per depth. A path never revisits a symbol,
     * so cycles terminate while a symbol reached over two different paths is
     * reported for each of them.
     */
    List<TransitiveEdge> expand(Long seedId, TraversalDirection direction, int maxDepth,
                                Set<DependencyType> kinds, int limit) {
        long start = System.currentTimeMillis();
        int maxRawPaths = (int) Math.min(Integer.MAX_VALUE, (long) limit * FAN_OUT_FACTOR);

        List<RawPath> results = new ArrayList<>();
        List<List<Long>> frontier = List.of(List.of(seedId));

        for (int depth = 1; depth <= maxDepth && !frontier.isEmpty() && results.size() < maxRawPaths; depth++) {
            Set<Long> frontierIds = frontier.stream()
                    .map(path -> path.get(path.size() - 1))
                    .collect(Collectors.toSet());
            Map<Long, List<SymbolDependency>> edgesByNode = loadEdges(frontierIds, direction, kinds);

            List<List<Long>> next = new ArrayList<>();
            expansion:
            for (List<Long> path : frontier) {
                Long node = path.get(path.size() - 1);
                for (SymbolDependency edge : edgesByNode.getOrDefault(node, List.of())) {
                    Long neighbor = direction == TraversalDirection.CALLERS ? edge.getFromSymbolId() : edge.getToSymbolId();
                    if (neighbor == null || path.contains(neighbor)) {
                        continue;
                    }
                    List<Long> extended = new ArrayList<>(path);
                    extended.add(neighbor);
                    results.add(new RawPath(edge, depth, extended));
                    next.add(extended);
                    if (results.size() >= maxRawPaths) {
                        break expansion;
                    }
                }
            }
            frontier = next;
        }

        List<TransitiveEdge> edges = enrich(results).stream()
                .sorted(RESULT_ORDER)
                .limit(limit)
                .collect(Collectors.toList());

        log.debug("Traversal from {} ({}, depth {}) reached {} paths, returning {} in {}ms",
                seedId, direction, maxDepth, results.size(), edges.size(), System.currentTimeMillis() - start);
        return List.copyOf(edges);
    }

    private Map<Long, List<SymbolDependency>> loadEdges(Set<Long> nodeIds, TraversalDirection direction,
                                                        Set<DependencyType> kinds) {
        List<SymbolDependency> edges;
        Function<SymbolDependency, Long> keyOf;
        if (direction == TraversalDirection.CALLERS) {
            edges = kinds.isEmpty()
                    ? dependencyRepository.findByToSymbolIdIn(nodeIds)
                    : dependencyRepository.findByToSymbolIdInAndDependencyTypeIn(nodeIds, kinds);
            keyOf = SymbolDependency::getToSymbolId;
        } else {
            edges = kinds.isEmpty()
                    ? dependencyRepository.findByFromSymbolIdIn(nodeIds)
                    : dependencyRepository.findByFromSymbolIdInAndDependencyTypeIn(nodeIds, kinds);
            keyOf = SymbolDependency::getFromSymbolId;
        }

        Map<Long, List<SymbolDependency>> byNode = new HashMap<>();
        for (SymbolDependency edge : edges) {
            if (direction == TraversalDirection.CALLERS && edge.getFromSymbolId().equals(edge.getToSymbolId())) {
                continue;
            }
            if (direction == TraversalDirection.DEPENDENCIES && edge.isUnresolved()) {
                continue;
            }
            byNode.computeIfAbsent(keyOf.apply(edge), id -> new ArrayList<>()).add(edge);
        }
        return byNode;
    }

    private List<TransitiveEdge> enrich(List<RawPath> paths) {
        Set<Long> symbolIds = new HashSet<>();
        for (RawPath path : paths) {
            symbolIds.add(path.edge().getFromSymbolId());
            symbolIds.add(path.edge().getToSymbolId());
        }
        Map<Long, CodeSymbol> symbols = loadSymbols(symbolIds);
        Map<Long, String> filePaths = loadFilePaths(symbols.values());

        return paths.stream()
                .map(path -> new TransitiveEdge(
                        path.edge().getId(),
                        path.depth(),
                        path.edge().getDependencyType(),
                        path.edge().getLineNumber(),
                        refOf(path.edge().getFromSymbolId(), symbols, filePaths),
                        refOf(path.edge().getToSymbolId(), symbols, filePaths),
                        List.copyOf(path.symbolIds())))
                .collect(Collectors.toList());
    }

    private static SymbolRef refOf(Long symbolId, Map<Long, CodeSymbol> symbols, Map<Long, String> filePaths) {
        CodeSymbol symbol = symbols.get(symbolId);
        if (symbol == null) {
            return new SymbolRef(symbolId, null, null, null);
        }
        return new SymbolRef(symbol.getId(), symbol.getName(), symbol.getSymbolType(), filePaths.get(symbol.getFileId()));
    }

    private Map<Long, CodeSymbol> loadSymbols(Collection<Long> ids) {
        Set<Long> present = ids.stream().filter(id -> id != null).collect(Collectors.toSet());
        if (present.isEmpty()) {
            return Map.of();
        }
        return symbolRepository.findAllById(present).stream()
                .collect(Collectors.toMap(CodeSymbol::getId, symbol -> symbol));
    }

    private Map<Long, String> loadFilePaths(Collection<CodeSymbol> symbols) {
        Set<Long> fileIds = symbols.stream().map(CodeSymbol::getFileId).collect(Collectors.toSet());
        if (fileIds.isEmpty()) {
            return Map.of();
        }
        return fileRepository.findAllById(fileIds).stream()
                .collect(Collectors.toMap(SourceFile::getId, SourceFile::getPath));
    }

    private List<String> parameterTypesOf(List<SymbolDependency> group) {
        for (SymbolDependency call : group) {
            if (call.getParameterTypes() == null) {
                continue;
            }
            try {
                return objectMapper.readValue(call.getParameterTypes(), new TypeReference<List<String>>() {});
            } catch (JsonProcessingException e) {
                log.warn("Ignoring malformed parameter types on dependency {}: {}", call.getId(), e.getOriginalMessage());
            }
        }
        return List.of();
    }

    private record RawPath(SymbolDependency edge, int depth, List<Long> symbolIds) {
    }
}
