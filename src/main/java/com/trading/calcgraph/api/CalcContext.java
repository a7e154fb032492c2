package com.trading.calcgraph.api;

/**
 * The view of the engine handed to a node while it computes.
 *
 * Every read made through this interface is recorded as a dependency of the
 * identity currently being computed. Reads are discovered, not declared: only
 * the identities actually requested during one computation become edges, so a
 * body that branches on an input depends only on the branch it took.
 */
public interface CalcContext {

    /**
     * Evaluates another identity on behalf of the computing node.
     *
     * @param name The name of the node to read.
     * @param args The argument tuple, possibly empty.
     * @param <T>  Expected value type (unchecked).
     * @return The current value of {@code (name, args)}.
     * @throws UnknownNodeException if no node is registered under {@code name}.
     * @throws CycleException       if the identity is already being computed.
     */
    <T> T evaluate(String name, Object... args);
}
