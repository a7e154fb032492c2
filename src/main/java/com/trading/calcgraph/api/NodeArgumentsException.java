package com.trading.calcgraph.api;

/**
 * Raised when a node is evaluated with an argument tuple it cannot accept,
 * e.g. a variable read with arguments or a two-argument body given three.
 */
public class NodeArgumentsException extends CalcGraphException {

    public NodeArgumentsException(String message) {
        super(message);
    }
}
