package com.trading.calcgraph.engine;

import com.trading.calcgraph.api.NodeId;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Forward and reverse dependency edges between identities.
 *
 * {@code deps[X]} is the set of identities X read during its last successful
 * computation; {@code dependents[Y]} is the set of identities whose last
 * successful computation read Y. The two maps are exact inverses of each other
 * at all times: {@link #replaceDeps(NodeId, Set)} is the only mutator and it
 * patches both sides.
 *
 * Edges are never declared up front. They are rebuilt from scratch on every
 * recomputation, which is what keeps dynamically changing dependency sets
 * correct: an identity that stops reading an input no longer hears about its
 * changes.
 */
public final class DependencyGraph {
    private final Map<NodeId, Set<NodeId>> deps = new HashMap<>();
    private final Map<NodeId, Set<NodeId>> dependents = new HashMap<>();
    private int edgeCount;

    /**
     * Replaces the dependency set of {@code id} with {@code newDeps}.
     *
     * Edges to identities no longer read are dropped from their dependents sets;
     * edges to newly read identities are added. The caller's set is copied.
     */
    public void replaceDeps(NodeId id, Set<NodeId> newDeps) {
        Set<NodeId> oldDeps = deps.getOrDefault(id, Set.of());

        for (NodeId old : oldDeps) {
            if (!newDeps.contains(old)) {
                Set<NodeId> rev = dependents.get(old);
                rev.remove(id);
                if (rev.isEmpty())
                    dependents.remove(old);
                edgeCount--;
            }
        }
        for (NodeId dep : newDeps) {
            if (!oldDeps.contains(dep)) {
                dependents.computeIfAbsent(dep, k -> new LinkedHashSet<>()).add(id);
                edgeCount++;
            }
        }

        if (newDeps.isEmpty())
            deps.remove(id);
        else
            deps.put(id, new LinkedHashSet<>(newDeps));
    }

    /** What {@code id} read during its last successful computation. */
    public Set<NodeId> dependenciesOf(NodeId id) {
        Set<NodeId> set = deps.get(id);
        return set == null ? Set.of() : Collections.unmodifiableSet(set);
    }

    /** Who read {@code id} during their last successful computation. */
    public Set<NodeId> dependentsOf(NodeId id) {
        Set<NodeId> set = dependents.get(id);
        return set == null ? Set.of() : Collections.unmodifiableSet(set);
    }

    public int edgeCount() {
        return edgeCount;
    }

    /** Every identity that appears on either end of an edge. */
    public Set<NodeId> identities() {
        Set<NodeId> ids = new LinkedHashSet<>(deps.keySet());
        ids.addAll(dependents.keySet());
        return ids;
    }
}
