package com.trading.calcgraph.api;

/** Raised when an operation names a node that was never registered. */
public class UnknownNodeException extends CalcGraphException {
    private final String nodeName;

    public UnknownNodeException(String nodeName) {
        super("Unknown node: " + nodeName);
        this.nodeName = nodeName;
    }

    public String nodeName() {
        return nodeName;
    }
}
