package com.trading.calcgraph.io;

import com.trading.calcgraph.api.Node;
import com.trading.calcgraph.node.ConstantNode;
import com.trading.calcgraph.node.VariableNode;

import java.util.function.BiFunction;

/** The node kinds a JSON graph definition can declare. */
public enum NodeType {
    CONSTANT(ConstantNode::new),
    VARIABLE(VariableNode::new);

    private final BiFunction<String, Object, Node<?>> factory;

    NodeType(BiFunction<String, Object, Node<?>> factory) {
        this.factory = factory;
    }

    public Node<?> create(String name, Object value) {
        return factory.apply(name, value);
    }

    public static NodeType fromString(String text) {
        for (NodeType t : NodeType.values()) {
            if (t.name().equalsIgnoreCase(text)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown NodeType: " + text);
    }
}
