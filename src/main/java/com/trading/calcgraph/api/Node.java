package com.trading.calcgraph.api;

import java.util.List;

/**
 * A node in the calculation graph.
 *
 * A node is a named, reusable definition of how to produce a value. It holds no
 * cached state of its own: the engine caches one value per {@link NodeId}, that
 * is per (name, arguments) pair, so a single node services every argument tuple
 * it is evaluated with.
 *
 * Key Responsibilities:
 *
 * 1. Identity: Every node has a name that is unique within its graph. The name
 * is the first half of every {@link NodeId} the node is evaluated under.
 *
 * 2. Computation: {@link #compute(CalcContext, List)} produces the value for
 * one argument tuple. Any other node the body needs must be read through the
 * supplied {@link CalcContext}; that is how the engine discovers dependency
 * edges. Values obtained any other way are invisible to invalidation.
 *
 * @param <T> The type of value produced by this node.
 */
public interface Node<T> {

    /**
     * Returns the unique name of this node.
     *
     * @return The identifier used to register and evaluate this node.
     */
    String name();

    /**
     * Computes the value of this node for one argument tuple.
     *
     * Called by the engine on a cache miss only. Implementations must not keep a
     * reference to {@code ctx} beyond the call: it is bound to this one
     * computation.
     *
     * @param ctx  Gateway for reading other nodes while computing.
     * @param args The immutable argument tuple of the identity being computed.
     * @return The computed value.
     */
    T compute(CalcContext ctx, List<Object> args);
}
