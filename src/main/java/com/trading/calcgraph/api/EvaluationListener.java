package com.trading.calcgraph.api;

/**
 * Observability interface for monitoring evaluation and invalidation.
 *
 * Implementations can be registered with the engine to receive callbacks for
 * every request it serves. This is the primary mechanism for:
 *
 * - Profiling: Measuring how long each recomputation takes.
 * - Debugging: Tracing which identities are recomputed versus served from cache.
 * - Metrics: Counting recomputations or tracking the "blast radius" of an input
 * change.
 *
 * Callbacks run synchronously inside the evaluation that triggered them and
 * must not call back into the engine.
 */
public interface EvaluationListener {

    /**
     * Called after an identity was recomputed and its value cached.
     *
     * @param id            The identity.
     * @param durationNanos Wall time spent in the node's body, nested reads
     *                      included.
     */
    void onNodeComputed(NodeId id, long durationNanos);

    /**
     * Called when a request was served from a valid cache entry.
     */
    void onCacheHit(NodeId id);

    /**
     * Called when a request was served from an active override.
     */
    void onOverrideHit(NodeId id);

    /**
     * Called when a node's body failed. The error propagates after this returns.
     */
    void onNodeError(NodeId id, Throwable error);

    /**
     * Called after a transitive invalidation.
     *
     * @param origin      The identity whose effective value changed.
     * @param invalidated Number of cache entries that went from valid to invalid.
     */
    void onInvalidated(NodeId origin, int invalidated);
}
