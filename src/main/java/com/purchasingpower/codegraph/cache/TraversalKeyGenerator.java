package com.purchasingpower.codegraph.cache;

import com.purchasingpower.codegraph.configuration.TraversalProperties;
import com.purchasingpower.codegraph.model.graph.DependencyType;
import com.purchasingpower.codegraph.model.traversal.TraversalDirection;
import org.springframework.cache.interceptor.KeyGenerator;

import java.lang.reflect.Method;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds one canonical cache key per traversal, whichever entry point requested it.
 *
 * <p>The shortcut methods of the traversal service are expanded to the depth, kinds
 * and limit they pass on, so {@code getDirectCallers(id)} and the matching
 * {@code traverse} call share an entry. Kinds are sorted by name; a null kind set
 * means all kinds, like an empty one.
 */
public class TraversalKeyGenerator implements KeyGenerator {

    private final TraversalProperties properties;

    public TraversalKeyGenerator(TraversalProperties properties) {
        this.properties = properties;
    }

    @Override
    public Object generate(Object target, Method method, Object... params) {
        switch (method.getName()) {
            case "traverse":
                return keyOf(params[0], (TraversalDirection) params[1], (Integer) params[2],
                        (Collection<?>) params[3], (Integer) params[4]);
            case "getTransitiveCallers":
                return keyOf(params[0], TraversalDirection.CALLERS, properties.getDefaultMaxDepth(),
                        (Collection<?>) params[1], properties.getDefaultLimit());
            case "getTransitiveDependencies":
                return keyOf(params[0], TraversalDirection.DEPENDENCIES, properties.getDefaultMaxDepth(),
                        (Collection<?>) params[1], properties.getDefaultLimit());
            case "getDirectCallers":
                return keyOf(params[0], TraversalDirection.CALLERS, 1, List.of(), properties.getDefaultLimit());
            case "getDirectDependencies":
                return keyOf(params[0], TraversalDirection.DEPENDENCIES, 1, List.of(), properties.getDefaultLimit());
            default:
                throw new IllegalStateException("No traversal cache key for " + method);
        }
    }

    static Map<String, Object> keyOf(Object symbolId, TraversalDirection direction, Integer maxDepth,
                                     Collection<?> kinds, Integer limit) {
        Map<String, Object> key = new LinkedHashMap<>();
        key.put("symbolId", symbolId);
        key.put("direction", direction != null ? direction.name() : null);
        key.put("maxDepth", maxDepth);
        key.put("kinds", kinds == null ? List.of() : kinds.stream()
                .map(kind -> ((DependencyType) kind).name())
                .sorted()
                .collect(Collectors.toList()));
        key.put("limit", limit);
        return key;
    }
}
