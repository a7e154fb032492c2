package com.trading.calcgraph;

import com.trading.calcgraph.dsl.GraphBuilder;
import com.trading.calcgraph.engine.CalcGraph;
import com.trading.calcgraph.io.JsonGraphLoader;

import java.io.IOException;
import java.nio.file.Path;

/**
 * CalcGraph -- demand-driven calculation graph for pricing models.
 *
 * <h2>Philosophy</h2>
 * <p>
 * Many derived quantities share expensive sub-calculations. The graph models
 * each quantity as a named, possibly parameterized node and caches one value
 * per (name, arguments) pair:
 * <ul>
 * <li><b>Nodes</b> define how to produce a value (e.g., d1 of Black-Scholes,
 * the price of an option type).</li>
 * <li><b>Edges</b> are discovered, not declared: whatever a node reads while
 * computing becomes its dependency, and only for that computation.</li>
 * <li><b>Invalidation</b> flows from a changed input to its transitive readers;
 * <b>recomputation</b> happens only when an invalid value is requested.</li>
 * </ul>
 *
 * <h3>Key Features</h3>
 * <ul>
 * <li><b>Consistent:</b> A value returned by the graph always reflects the
 * current inputs and overrides.</li>
 * <li><b>What-if:</b> Any identity can be overridden and restored without
 * touching the nodes that read it.</li>
 * <li><b>Dynamic:</b> A node that branches on an input depends only on the
 * branch it took last time.</li>
 * </ul>
 */
public final class CalcGraphs {

    private CalcGraphs() {
        // Prevent instantiation of utility class
    }

    /**
     * Entry point: create a new graph builder.
     *
     * @param graphName A descriptive name for the graph instance.
     * @return A new {@link GraphBuilder} instance.
     */
    public static GraphBuilder builder(String graphName) {
        return GraphBuilder.create(graphName);
    }

    /**
     * Creates an empty graph to register nodes on directly.
     */
    public static CalcGraph create(String graphName) {
        return new CalcGraph(graphName);
    }

    /**
     * Creates a graph holding the data nodes and overrides of a JSON
     * definition file.
     */
    public static CalcGraph fromJson(Path jsonPath) throws IOException {
        JsonGraphLoader loader = new JsonGraphLoader();
        return loader.compile(loader.parseFile(jsonPath));
    }
}
