package com.trading.calcgraph.util;

import com.trading.calcgraph.api.NodeId;
import com.trading.calcgraph.engine.CalcGraph;
import com.trading.calcgraph.engine.ValueStore;

import java.util.Set;

/**
 * Diagnostic utility for inspecting graph state and discovered dependencies.
 *
 * <p>
 * This class generates human-readable string representations of the edges the
 * engine recorded during past evaluations and of the state of individual
 * identities. It reads the graph without evaluating anything, so it never
 * changes cache state.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions, logging errors, or
 * "toString()" style diagnostics.
 */
public final class GraphExplain {
    private final CalcGraph graph;

    public GraphExplain(CalcGraph graph) {
        this.graph = graph;
    }

    /**
     * Dumps detailed state of a single identity.
     */
    public String explainNode(NodeId id) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("Identity: ").append(id).append('\n')
                .append("  Type: ").append(graph.node(id.name()).getClass().getSimpleName()).append('\n');

        ValueStore.CacheEntry entry = graph.cacheEntry(id);
        if (entry == null) {
            sb.append("  Cache: never computed\n");
        } else {
            sb.append("  Cache: ").append(entry.isValid() ? "valid" : "invalid")
                    .append(", last value ").append(entry.value()).append('\n');
        }
        if (graph.overrideValue(id) != null)
            sb.append("  Override: ").append(graph.overrideValue(id)).append('\n');

        appendSet(sb, "  Depends on", graph.dependenciesOf(id));
        appendSet(sb, "  Read by", graph.dependentsOf(id));
        return sb.toString();
    }

    public String explainNode(String name, Object... args) {
        return explainNode(NodeId.of(name, args));
    }

    /**
     * Dumps every identity with state and its recorded dependencies.
     */
    public String dumpDependencies() {
        Set<NodeId> ids = graph.identities();
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph ").append(graph.name()).append(" (").append(ids.size()).append(" identities, ")
                .append(graph.edgeCount()).append(" edges):\n");
        for (NodeId id : ids) {
            sb.append("  ").append(id);
            if (graph.overrideValue(id) != null)
                sb.append(" (OVR)");
            else if (graph.cacheEntry(id) == null || !graph.cacheEntry(id).isValid())
                sb.append(" (DIRTY)");
            Set<NodeId> deps = graph.dependenciesOf(id);
            if (!deps.isEmpty()) {
                sb.append(" <- ");
                join(sb, deps);
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram of the recorded edges, drawn from
     * input to reader.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        for (NodeId id : graph.identities()) {
            sb.append("  ").append(sanitize(id)).append("[\"").append(id.toString().replace("\"", "'"));
            ValueStore.CacheEntry entry = graph.cacheEntry(id);
            if (graph.overrideValue(id) != null)
                sb.append("<br/><i>override</i> ").append(graph.overrideValue(id));
            else if (entry != null && entry.isValid())
                sb.append("<br/>").append(entry.value());
            sb.append("\"];\n");
        }
        for (NodeId id : graph.identities()) {
            for (NodeId dep : graph.dependenciesOf(id))
                sb.append("  ").append(sanitize(dep)).append(" --> ").append(sanitize(id)).append(";\n");
        }
        return sb.toString();
    }

    private static void appendSet(StringBuilder sb, String label, Set<NodeId> ids) {
        sb.append(label).append(" (").append(ids.size()).append("): ");
        join(sb, ids);
        sb.append('\n');
    }

    private static void join(StringBuilder sb, Set<NodeId> ids) {
        boolean first = true;
        for (NodeId id : ids) {
            if (!first)
                sb.append(", ");
            sb.append(id);
            first = false;
        }
    }

    private static String sanitize(NodeId id) {
        return id.toString().replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
