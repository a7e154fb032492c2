package com.trading.calcgraph.node;

import com.trading.calcgraph.api.CalcContext;
import com.trading.calcgraph.api.Node;

import java.util.List;

/**
 * A node with a value fixed at construction.
 *
 * Used for externally determined data that a scenario may override but never
 * set, e.g. "vol" or "risk free rate". Arguments are ignored.
 */
public final class ConstantNode<T> implements Node<T> {
    private final String name;
    private final T value;

    public ConstantNode(String name, T value) {
        this.name = name;
        this.value = value;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public T compute(CalcContext ctx, List<Object> args) {
        return value;
    }

    public T value() {
        return value;
    }
}
