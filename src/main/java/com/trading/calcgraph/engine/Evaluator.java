package com.trading.calcgraph.engine;

import com.trading.calcgraph.api.CalcContext;
import com.trading.calcgraph.api.CycleException;
import com.trading.calcgraph.api.EvaluationListener;
import com.trading.calcgraph.api.Node;
import com.trading.calcgraph.api.NodeId;

import lombok.extern.log4j.Log4j2;

/**
 * Resolves an identity to its value.
 *
 * Call Protocol, for a request of identity X made on behalf of caller C:
 *
 * 1. Cycle check: if X is on the evaluation stack, fail with
 * {@link CycleException} naming the cycle.
 * 2. Discovery: if C is present, X joins C's discovered dependency set. This
 * happens for every outcome below, so C stays attached to X whether X is
 * served from an override, the cache, or a fresh computation.
 * 3. Override: an active override is returned as is; the cache is neither
 * consulted nor recomputed.
 * 4. Cache hit: a valid cache entry is returned.
 * 5. Cache miss: X is pushed with a fresh discovered set, its node computes
 * with a context bound to X's frame, and on success the discovered set
 * replaces X's dependency edges and the value is cached. On failure the frame
 * is popped, neither edges nor cache are touched, and the error propagates
 * unchanged.
 *
 * Recursion depth equals the longest dependency chain being resolved.
 */
@Log4j2
final class Evaluator {
    private final NodeRegistry registry;
    private final ValueStore store;
    private final DependencyGraph graph;
    private final EvaluationStack stack;
    private EvaluationListener listener;

    Evaluator(NodeRegistry registry, ValueStore store, DependencyGraph graph, EvaluationStack stack) {
        this.registry = registry;
        this.store = store;
        this.graph = graph;
        this.stack = stack;
    }

    void setListener(EvaluationListener listener) {
        this.listener = listener;
    }

    /**
     * Evaluates {@code id}.
     *
     * @param id     The identity requested.
     * @param caller The frame of the computation making the request, or null
     *               for a top-level request.
     */
    Object evaluate(NodeId id, EvaluationStack.Frame caller) {
        if (stack.contains(id))
            throw new CycleException(stack.cycleTo(id));

        Node<?> node = registry.lookup(id.name());

        if (caller != null)
            caller.record(id);

        final EvaluationListener l = this.listener;

        if (store.hasOverride(id)) {
            if (l != null)
                l.onOverrideHit(id);
            return store.overrideValue(id);
        }

        ValueStore.CacheEntry entry = store.cacheEntry(id);
        if (entry != null && entry.isValid()) {
            if (l != null)
                l.onCacheHit(id);
            return entry.value();
        }

        return recompute(id, node, l);
    }

    private Object recompute(NodeId id, Node<?> node, EvaluationListener l) {
        EvaluationStack.Frame frame = stack.push(id);
        long start = System.nanoTime();
        Object value;
        try {
            value = node.compute(new FrameContext(frame), id.args());
        } catch (Throwable t) {
            log.debug("Computation of {} failed: {}", id, t.toString());
            if (l != null)
                l.onNodeError(id, t);
            throw t;
        } finally {
            stack.pop(frame);
        }
        long duration = System.nanoTime() - start;

        graph.replaceDeps(id, frame.discovered());
        store.putCache(id, value);

        if (log.isTraceEnabled())
            log.trace("Recomputed {} in {} ns, {} dependencies", id, duration, frame.discovered().size());
        if (l != null)
            l.onNodeComputed(id, duration);
        return value;
    }

    /**
     * The context handed to one computation. Valid only while its frame is the
     * innermost one on the stack.
     */
    private final class FrameContext implements CalcContext {
        private final EvaluationStack.Frame frame;

        FrameContext(EvaluationStack.Frame frame) {
            this.frame = frame;
        }

        @Override
        @SuppressWarnings("unchecked")
        public <T> T evaluate(String name, Object... args) {
            if (!frame.isOpen())
                throw new IllegalStateException("Context of " + frame.id() + " used after its computation finished");
            if (!stack.isTop(frame))
                throw new IllegalStateException("Context of " + frame.id() + " used from a nested computation");
            return (T) Evaluator.this.evaluate(NodeId.of(name, args), frame);
        }
    }
}
