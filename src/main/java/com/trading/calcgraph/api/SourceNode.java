package com.trading.calcgraph.api;

/**
 * A node whose value is set from outside the graph.
 *
 * Source nodes are the settable entry points for data into the graph, e.g.
 * the strike or expiry of an option being priced. They ignore the calculation
 * context and never depend on other nodes.
 *
 * Usage Contract:
 * Never call {@link #update(Object)} directly on a registered node. Go through
 * {@code CalcGraph.setValue(name, value)}, which updates the node and then
 * invalidates every identity that read it. A direct update is invisible to the
 * cache.
 *
 * @param <T> The type of value accepted by this source node.
 */
public interface SourceNode<T> extends Node<T> {

    /**
     * Replaces the stored value.
     *
     * @param value The new value.
     */
    void update(T value);
}
