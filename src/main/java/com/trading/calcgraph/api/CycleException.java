package com.trading.calcgraph.api;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when an identity is requested while it is still being computed.
 *
 * The cycle runs from the first occurrence of the re-entered identity on the
 * evaluation stack to the identity itself, e.g. {@code [X, Y, X]}.
 */
public class CycleException extends CalcGraphException {
    private final List<NodeId> cycle;

    public CycleException(List<NodeId> cycle) {
        super("Cycle detected: " + cycle.stream().map(NodeId::toString).collect(Collectors.joining(" -> ")));
        this.cycle = List.copyOf(cycle);
    }

    public List<NodeId> cycle() {
        return cycle;
    }
}
