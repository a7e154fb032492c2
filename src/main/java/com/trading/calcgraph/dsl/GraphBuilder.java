package com.trading.calcgraph.dsl;

import com.trading.calcgraph.api.DuplicateNodeException;
import com.trading.calcgraph.api.Node;
import com.trading.calcgraph.api.NodeId;
import com.trading.calcgraph.engine.CalcGraph;
import com.trading.calcgraph.fn.Fn0;
import com.trading.calcgraph.fn.Fn1;
import com.trading.calcgraph.fn.Fn2;
import com.trading.calcgraph.fn.Fn3;
import com.trading.calcgraph.fn.FnN;
import com.trading.calcgraph.node.CalcNode;
import com.trading.calcgraph.node.ConstantNode;
import com.trading.calcgraph.node.VariableNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Graph Builder -- primary quant-facing API.
 *
 * This class provides a fluent API for defining the nodes of a calculation
 * graph. Unlike a static DAG builder there are no edges to declare: a
 * calculated node depends on whatever its body reads, and the engine discovers
 * that at evaluation time.
 *
 * Usage Pattern:
 * 1. Create a builder: GraphBuilder g = GraphBuilder.create("pricing");
 * 2. Define inputs: g.constant("spot", 100.0); g.variable("strike", 105.0);
 * 3. Define calculations: g.compute("moneyness", c -> c.<Double>evaluate("spot") / c.<Double>evaluate("strike"));
 * 4. Build: CalcGraph graph = g.build();
 * 5. Evaluate: double m = graph.evaluate("moneyness");
 */
public final class GraphBuilder {
    private final String graphName;

    private final List<Node<?>> nodes = new ArrayList<>();
    private final Map<String, Node<?>> nodesByName = new HashMap<>();
    private final List<PendingOverride> overrides = new ArrayList<>();

    private boolean built;

    private GraphBuilder(String graphName) {
        this.graphName = graphName;
    }

    /**
     * Creates a new GraphBuilder instance.
     *
     * @param graphName A descriptive name for the graph, used in logs.
     */
    public static GraphBuilder create(String graphName) {
        return new GraphBuilder(graphName);
    }

    // ── Inputs ───────────────────────────────────────────────────

    /**
     * Defines a node whose value never changes (but can be overridden).
     */
    public <T> ConstantNode<T> constant(String name, T value) {
        return add(new ConstantNode<>(name, value));
    }

    /**
     * Defines a settable input node.
     *
     * @param name         Unique name of the node.
     * @param initialValue Starting value.
     */
    public <T> VariableNode<T> variable(String name, T initialValue) {
        return add(new VariableNode<>(name, initialValue));
    }

    // ── Calculations (0, 1, 2, 3, N arguments) ───────────────────

    /**
     * Defines an unparameterized calculation.
     *
     * @param name Unique name.
     * @param fn   Body: context -> value.
     */
    public <T> CalcNode<T> compute(String name, Fn0<T> fn) {
        return add(CalcNode.of(name, fn));
    }

    /**
     * Defines a calculation parameterized by one argument. Every distinct
     * argument value is cached separately.
     */
    public <A, T> CalcNode<T> compute(String name, Fn1<A, T> fn) {
        return add(CalcNode.of(name, fn));
    }

    public <A, B, T> CalcNode<T> compute(String name, Fn2<A, B, T> fn) {
        return add(CalcNode.of(name, fn));
    }

    public <A, B, C, T> CalcNode<T> compute(String name, Fn3<A, B, C, T> fn) {
        return add(CalcNode.of(name, fn));
    }

    /**
     * Defines a calculation that receives the raw argument tuple and checks its
     * own arity.
     */
    public <T> CalcNode<T> computeN(String name, FnN<T> fn) {
        return add(new CalcNode<>(name, fn));
    }

    /**
     * Adds a custom node implementation.
     */
    public <N extends Node<?>> N node(N node) {
        return add(node);
    }

    // ── Scenario ─────────────────────────────────────────────────

    /**
     * Overrides the unparameterized identity {@code (name, ())} as soon as the
     * graph is built.
     */
    public GraphBuilder override(String name, Object value) {
        return override(name, List.of(), value);
    }

    /**
     * Overrides {@code (name, args)} as soon as the graph is built.
     */
    public GraphBuilder override(String name, List<?> args, Object value) {
        checkNotBuilt();
        overrides.add(new PendingOverride(new NodeId(name, new ArrayList<Object>(args)), value));
        return this;
    }

    /**
     * Creates the graph, registers every node in definition order and applies
     * the overrides. If an override is rejected the partial graph is dropped
     * and the builder stays open, so a missing node can still be defined.
     *
     * @return The live graph.
     */
    public CalcGraph build() {
        checkNotBuilt();

        CalcGraph graph = new CalcGraph(graphName);
        for (Node<?> node : nodes)
            graph.register(node);
        for (PendingOverride o : overrides)
            graph.override(o.id(), o.value());

        built = true;
        return graph;
    }

    /**
     * Retrieve a node by name during the build phase.
     */
    @SuppressWarnings("unchecked")
    public <N extends Node<?>> N getNode(String name) {
        return (N) nodesByName.get(name);
    }

    private <N extends Node<?>> N add(N node) {
        checkNotBuilt();
        if (nodesByName.containsKey(node.name()))
            throw new DuplicateNodeException(node.name());
        nodes.add(node);
        nodesByName.put(node.name(), node);
        return node;
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("Graph already built");
    }

    private record PendingOverride(NodeId id, Object value) {
    }
}
