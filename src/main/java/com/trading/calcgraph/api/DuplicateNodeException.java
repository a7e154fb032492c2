package com.trading.calcgraph.api;

/** Raised when registering a node under a name that is already taken. */
public class DuplicateNodeException extends CalcGraphException {
    private final String nodeName;

    public DuplicateNodeException(String nodeName) {
        super("Duplicate node name: " + nodeName);
        this.nodeName = nodeName;
    }

    public String nodeName() {
        return nodeName;
    }
}
