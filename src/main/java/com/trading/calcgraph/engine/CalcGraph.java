package com.trading.calcgraph.engine;

import com.trading.calcgraph.api.EvaluationListener;
import com.trading.calcgraph.api.Node;
import com.trading.calcgraph.api.NodeArgumentsException;
import com.trading.calcgraph.api.NodeId;
import com.trading.calcgraph.api.NotVariableException;
import com.trading.calcgraph.api.SourceNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A demand-driven calculation graph.
 *
 * This is the public surface of the engine. It owns every piece of mutable
 * graph state (registry, cache, overrides, dependency edges, evaluation stack)
 * so independent graphs can coexist in one process and be tested in isolation.
 *
 * Algorithm Details:
 * The graph uses a "Push invalidation, Pull recomputation" strategy:
 *
 * 1. Evaluate: A request for (name, args) is served from an override, from a
 * valid cache entry, or by running the node's body. Every read the body makes
 * through its CalcContext is recorded as a dependency edge of the identity
 * being computed, replacing the edges of its previous computation.
 *
 * 2. Change: setValue on a variable, or adding, changing or removing an
 * override, changes the value an identity presents to its readers.
 *
 * 3. Invalidate: The changed identity and everything that transitively read it
 * are marked invalid. Nothing is recomputed yet.
 *
 * 4. Recompute Lazily: The next request for an invalid identity recomputes it,
 * pulling fresh values for whatever it reads this time.
 *
 * Error Handling:
 * Engine errors are unchecked {@code CalcGraphException}s; errors thrown by
 * calculation bodies reach the caller unchanged. A failed computation leaves the
 * identity's cache entry untouched, so a retry after fixing the cause works.
 *
 * Threading:
 * Single-threaded and non-reentrant from the outside. Calculation bodies read
 * other nodes through their CalcContext only; calling back into this object
 * while an evaluation is in progress fails with {@link IllegalStateException}.
 */
public final class CalcGraph {
    private static final Logger log = LogManager.getLogger(CalcGraph.class);

    private final String name;
    private final NodeRegistry registry = new NodeRegistry();
    private final ValueStore store = new ValueStore();
    private final DependencyGraph dependencies = new DependencyGraph();
    private final EvaluationStack stack = new EvaluationStack();
    private final Invalidator invalidator = new Invalidator(store, dependencies);
    private final Evaluator evaluator = new Evaluator(registry, store, dependencies, stack);

    public CalcGraph(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public CalcGraph() {
        this("calcgraph");
    }

    public String name() {
        return name;
    }

    /**
     * Sets the listener notified of evaluations and invalidations. Use a
     * {@code CompositeEvaluationListener} to attach several; null detaches.
     */
    public void setListener(EvaluationListener listener) {
        evaluator.setListener(listener);
        invalidator.setListener(listener);
    }

    // ── Definition ─────────────────────────────────────────────

    /**
     * Adds a node to the graph.
     *
     * @return The node, for fluent wiring.
     * @throws com.trading.calcgraph.api.DuplicateNodeException if the name is
     *                                                          taken.
     */
    public <N extends Node<?>> N register(N node) {
        checkIdle("register");
        registry.register(node);
        return node;
    }

    public boolean isRegistered(String nodeName) {
        return registry.contains(nodeName);
    }

    /**
     * Type-safe lookup of a node definition by name.
     *
     * @throws com.trading.calcgraph.api.UnknownNodeException if absent.
     */
    @SuppressWarnings("unchecked")
    public <N extends Node<?>> N node(String nodeName) {
        return (N) registry.lookup(nodeName);
    }

    /** Registered node names in registration order. */
    public Set<String> nodeNames() {
        return registry.names();
    }

    public int nodeCount() {
        return registry.size();
    }

    // ── Evaluation ─────────────────────────────────────────────

    /**
     * Evaluates {@code (nodeName, args)} as a top-level request.
     *
     * @param nodeName The node to evaluate.
     * @param args     The argument tuple, possibly empty.
     * @param <T>      Expected value type (unchecked).
     * @return A value consistent with the current inputs and overrides.
     */
    public <T> T evaluate(String nodeName, Object... args) {
        return evaluate(NodeId.of(nodeName, args));
    }

    @SuppressWarnings("unchecked")
    public <T> T evaluate(NodeId id) {
        checkIdle("evaluate");
        return (T) evaluator.evaluate(id, null);
    }

    // ── Inputs and overrides ───────────────────────────────────

    /**
     * Changes the value of a variable and invalidates everything that read it.
     *
     * @throws NotVariableException if the node is not a {@link SourceNode}.
     */
    @SuppressWarnings("unchecked")
    public void setValue(String nodeName, Object value) {
        checkIdle("setValue");
        Node<?> node = registry.lookup(nodeName);
        if (!(node instanceof SourceNode<?> source))
            throw new NotVariableException(nodeName, node.getClass());
        ((SourceNode<Object>) source).update(value);
        log.debug("{}: set {} = {}", name, nodeName, value);
        invalidator.invalidateTransitively(NodeId.of(nodeName));
    }

    /** Overrides the unparameterized identity {@code (nodeName, ())}. */
    public void override(String nodeName, Object value) {
        override(NodeId.of(nodeName), value);
    }

    /** Overrides the identity {@code (nodeName, args)}. */
    public void override(String nodeName, List<?> args, Object value) {
        override(new NodeId(nodeName, args == null ? null : new ArrayList<Object>(args)), value);
    }

    /**
     * Forces the value of an identity until the override is removed.
     *
     * Readers of the identity stay attached to it, so they are invalidated now
     * and again when the override changes or is removed.
     *
     * @throws IllegalArgumentException if {@code value} is null.
     * @throws NodeArgumentsException   if {@code id} addresses a variable with
     *                                  arguments.
     */
    public void override(NodeId id, Object value) {
        checkIdle("override");
        Node<?> node = registry.lookup(id.name());
        if (node instanceof SourceNode && id.hasArgs())
            throw new NodeArgumentsException("Variable " + id.name() + " does not take arguments, got " + id.args());
        store.setOverride(id, value);
        log.debug("{}: override {} = {}", name, id, value);
        invalidator.invalidateTransitively(id);
    }

    /** Removes the override of {@code (nodeName, args)}, if any. */
    public boolean removeOverride(String nodeName, Object... args) {
        return removeOverride(NodeId.of(nodeName, args));
    }

    /**
     * Removes an override. A no-op, with no invalidation, if none is active.
     *
     * @return true if an override was removed.
     */
    public boolean removeOverride(NodeId id) {
        checkIdle("removeOverride");
        registry.lookup(id.name());
        if (!store.clearOverride(id))
            return false;
        log.debug("{}: removed override of {}", name, id);
        invalidator.invalidateTransitively(id);
        return true;
    }

    /**
     * Marks {@code (nodeName, args)} and everything that read it invalid.
     *
     * @return The number of cache entries that went from valid to invalid.
     */
    public int invalidate(String nodeName, Object... args) {
        return invalidate(NodeId.of(nodeName, args));
    }

    public int invalidate(NodeId id) {
        checkIdle("invalidate");
        return invalidator.invalidateTransitively(id);
    }

    // ── Introspection ──────────────────────────────────────────

    /** True if {@code (nodeName, args)} has a valid cached value. */
    public boolean isCached(String nodeName, Object... args) {
        return store.isValid(NodeId.of(nodeName, args));
    }

    public boolean isOverridden(String nodeName, Object... args) {
        return store.hasOverride(NodeId.of(nodeName, args));
    }

    /** The cache entry of {@code id}, or null if it was never computed. */
    public ValueStore.CacheEntry cacheEntry(NodeId id) {
        return store.cacheEntry(id);
    }

    /** The active override value of {@code id}, or null. */
    public Object overrideValue(NodeId id) {
        return store.overrideValue(id);
    }

    public Set<NodeId> dependenciesOf(NodeId id) {
        return dependencies.dependenciesOf(id);
    }

    public Set<NodeId> dependentsOf(NodeId id) {
        return dependencies.dependentsOf(id);
    }

    public int edgeCount() {
        return dependencies.edgeCount();
    }

    /** Every identity the graph holds state for: cached, overridden or linked. */
    public Set<NodeId> identities() {
        Set<NodeId> ids = new LinkedHashSet<>(store.identities());
        ids.addAll(dependencies.identities());
        return ids;
    }

    /** Number of computations in progress; zero between top-level calls. */
    public int evaluationDepth() {
        return stack.depth();
    }

    private void checkIdle(String operation) {
        if (!stack.isEmpty())
            throw new IllegalStateException(operation + " called while evaluating " + stack.snapshot()
                    + "; calculation bodies must read through their CalcContext");
    }

    @Override
    public String toString() {
        return "CalcGraph[" + name + ", nodes=" + registry.size() + ", edges=" + dependencies.edgeCount() + "]";
    }
}
