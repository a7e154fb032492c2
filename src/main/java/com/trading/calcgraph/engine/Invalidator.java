package com.trading.calcgraph.engine;

import com.trading.calcgraph.api.EvaluationListener;
import com.trading.calcgraph.api.NodeId;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Propagates "dirty" status from a changed identity to everything that read it.
 *
 * Invalidation only marks cache entries; it never recomputes. Recomputation is
 * demand-driven and happens the next time an invalid identity is requested, so
 * values nobody reads again are never rebuilt (push invalidation, pull
 * recomputation).
 *
 * Traversal Rules:
 * 1. The origin is always marked invalid and its dependents always visited,
 * whether or not the origin itself was valid.
 * 2. Every other identity is visited at most once per call (visited set), so
 * diamonds terminate and are walked once.
 * 3. A dependent that is already invalid is not expanded: its own dependents
 * were invalidated when it was.
 * 4. A dependent with an active override is marked invalid but not expanded:
 * what it presents to its readers is the override, which did not change.
 */
final class Invalidator {
    private static final Logger log = LogManager.getLogger(Invalidator.class);

    private final ValueStore store;
    private final DependencyGraph graph;
    private EvaluationListener listener;

    Invalidator(ValueStore store, DependencyGraph graph) {
        this.store = store;
        this.graph = graph;
    }

    void setListener(EvaluationListener listener) {
        this.listener = listener;
    }

    /**
     * Marks {@code origin} and its transitive dependents invalid.
     *
     * Idempotent: a second call with no intervening evaluation changes nothing.
     *
     * @return The number of cache entries that went from valid to invalid.
     */
    int invalidateTransitively(NodeId origin) {
        int invalidated = store.invalidate(origin) ? 1 : 0;

        Set<NodeId> visited = new HashSet<>();
        visited.add(origin);
        Deque<NodeId> work = new ArrayDeque<>();
        work.push(origin);

        while (!work.isEmpty()) {
            NodeId current = work.pop();
            for (NodeId dependent : graph.dependentsOf(current)) {
                if (!visited.add(dependent))
                    continue;
                if (!store.invalidate(dependent))
                    continue;
                invalidated++;
                if (store.hasOverride(dependent))
                    continue;
                work.push(dependent);
            }
        }

        if (log.isDebugEnabled())
            log.debug("Invalidated {}: {} entries dirtied", origin, invalidated);
        if (listener != null)
            listener.onInvalidated(origin, invalidated);
        return invalidated;
    }
}
