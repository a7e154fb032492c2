package com.trading.calcgraph.api;

/** Raised by {@code setValue} when the named node is not a {@link SourceNode}. */
public class NotVariableException extends CalcGraphException {
    private final String nodeName;

    public NotVariableException(String nodeName, Class<?> nodeClass) {
        super("Node " + nodeName + " is not settable (" + nodeClass.getSimpleName() + ")");
        this.nodeName = nodeName;
    }

    public String nodeName() {
        return nodeName;
    }
}
