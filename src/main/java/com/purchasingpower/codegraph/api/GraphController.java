package com.purchasingpower.codegraph.api;

import com.purchasingpower.codegraph.cache.CacheStats;
import com.purchasingpower.codegraph.cache.QueryCache;
import com.purchasingpower.codegraph.configuration.AppProperties;
import com.purchasingpower.codegraph.exception.GraphQueryTimeoutException;
import com.purchasingpower.codegraph.exception.SymbolNotFoundException;
import com.purchasingpower.codegraph.model.graph.DependencyType;
import com.purchasingpower.codegraph.model.sync.AnalysisResult;
import com.purchasingpower.codegraph.model.traversal.ParameterContextAnalysis;
import com.purchasingpower.codegraph.model.traversal.TransitiveEdge;
import com.purchasingpower.codegraph.model.traversal.TraversalDirection;
import com.purchasingpower.codegraph.service.graph.GraphCleanupService;
import com.purchasingpower.codegraph.service.graph.GraphTraversalService;
import com.purchasingpower.codegraph.service.sync.IncrementalAnalysisService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * REST controller for code graph analysis and traversal.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class GraphController {

    private final IncrementalAnalysisService analysisService;
    private final GraphTraversalService traversalService;
    private final GraphCleanupService cleanupService;
    private final QueryCache queryCache;
    private final AppProperties appProperties;

    /**
     * Analyze a repository, incrementally unless {@code force} is set.
     *
     * POST /api/v1/analysis
     */
    @PostMapping("/analysis")
    public ResponseEntity<AnalysisResponse> analyze(@RequestBody AnalysisRequest request) {
        if (request.getRepositoryPath() == null || request.getRepositoryPath().isBlank()) {
            return ResponseEntity.badRequest()
                .body(AnalysisResponse.error("Repository path is required"));
        }

        log.info("Analyzing repository: {} (force={})", request.getRepositoryPath(), request.isForce());
        AnalysisResult result = request.isForce()
            ? analysisService.forceFullReanalysis(request.getRepositoryPath(), request.getRepositoryName())
            : analysisService.analyze(request.getRepositoryPath(), request.getRepositoryName());

        return ResponseEntity.ok(AnalysisResponse.from(result));
    }

    /**
     * Transitive callers of a symbol.
     *
     * GET /api/v1/symbols/{id}/callers
     */
    @GetMapping("/symbols/{id}/callers")
    public ResponseEntity<List<TransitiveEdge>> getCallers(
            @PathVariable Long id,
            @RequestParam(required = false) Integer maxDepth,
            @RequestParam(required = false) List<DependencyType> types,
            @RequestParam(required = false) Integer limit) {
        return traverse(id, TraversalDirection.CALLERS, maxDepth, types, limit);
    }

    /**
     * Transitive dependencies of a symbol.
     *
     * GET /api/v1/symbols/{id}/dependencies
     */
    @GetMapping("/symbols/{id}/dependencies")
    public ResponseEntity<List<TransitiveEdge>> getDependencies(
            @PathVariable Long id,
            @RequestParam(required = false) Integer maxDepth,
            @RequestParam(required = false) List<DependencyType> types,
            @RequestParam(required = false) Integer limit) {
        return traverse(id, TraversalDirection.DEPENDENCIES, maxDepth, types, limit);
    }

    /**
     * Callers of a symbol grouped by argument pattern.
     *
     * GET /api/v1/symbols/{id}/parameter-contexts
     */
    @GetMapping("/symbols/{id}/parameter-contexts")
    public ResponseEntity<ParameterContextAnalysis> getParameterContexts(@PathVariable Long id) {
        try {
            return ResponseEntity.ok(traversalService.groupCallsByParameterContext(id));
        } catch (SymbolNotFoundException e) {
            log.debug("Parameter contexts requested for unknown symbol {}", id);
            return ResponseEntity.notFound().build();
        }
    }

    /**
     * GET /api/v1/cache/stats
     */
    @GetMapping("/cache/stats")
    public ResponseEntity<CacheStats> getCacheStats() {
        return ResponseEntity.ok(queryCache.getStats());
    }

    /**
     * DELETE /api/v1/cache
     */
    @DeleteMapping("/cache")
    public ResponseEntity<Void> clearCache() {
        queryCache.clear();
        log.info("Query cache cleared");
        return ResponseEntity.noContent().build();
    }

    /**
     * Delete a repository and its graph.
     *
     * DELETE /api/v1/repositories/{name}
     */
    @DeleteMapping("/repositories/{name}")
    public ResponseEntity<Void> deleteRepository(@PathVariable String name) {
        if (!cleanupService.deleteRepositoryByName(name)) {
            return ResponseEntity.notFound().build();
        }
        queryCache.clear();
        return ResponseEntity.noContent().build();
    }

    private ResponseEntity<List<TransitiveEdge>> traverse(Long id, TraversalDirection direction, Integer maxDepth,
                                                         List<DependencyType> types, Integer limit) {
        int depth = maxDepth != null ? maxDepth : appProperties.getTraversal().getDefaultMaxDepth();
        int max = limit != null ? limit : appProperties.getTraversal().getDefaultLimit();
        Set<DependencyType> kinds = types == null || types.isEmpty()
            ? Set.of()
            : EnumSet.copyOf(types);
        if (max > appProperties.getTraversal().getMaxLimit()) {
            log.debug("Rejected traversal request for {}: limit {} above {}",
                id, max, appProperties.getTraversal().getMaxLimit());
            return ResponseEntity.badRequest().build();
        }

        try {
            return ResponseEntity.ok(traversalService.traverse(id, direction, depth, kinds, max));
        } catch (IllegalArgumentException e) {
            log.debug("Rejected traversal request for {}: {}", id, e.getMessage());
            return ResponseEntity.badRequest().build();
        } catch (GraphQueryTimeoutException e) {
            log.warn("Traversal of {} from {} timed out", direction, id);
            return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT).build();
        } catch (TaskRejectedException e) {
            log.warn("Traversal of {} from {} rejected: query pool is saturated", direction, id);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
    }
}
