package com.trading.calcgraph.node;

import com.trading.calcgraph.api.CalcContext;
import com.trading.calcgraph.api.NodeArgumentsException;
import com.trading.calcgraph.api.SourceNode;

import java.util.List;

/**
 * A source node holding a mutable value.
 *
 * Used for user-chosen inputs such as "strike price" or "option type".
 * Variables are not parameterized: they are only ever addressed as
 * {@code (name, ())}, and reading one with arguments fails rather than
 * silently ignoring them.
 *
 * Dirty Contract:
 * Change the value through {@code CalcGraph.setValue(name, value)} so that the
 * engine invalidates every identity that read it.
 */
public final class VariableNode<T> implements SourceNode<T> {
    private final String name;
    private T currentValue;

    /**
     * Creates a named variable.
     *
     * @param name         Unique node name.
     * @param initialValue Value returned until the first update.
     */
    public VariableNode(String name, T initialValue) {
        this.name = name;
        this.currentValue = initialValue;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void update(T value) {
        this.currentValue = value;
    }

    @Override
    public T compute(CalcContext ctx, List<Object> args) {
        if (!args.isEmpty())
            throw new NodeArgumentsException("Variable " + name + " does not take arguments, got " + args);
        return currentValue;
    }

    public T value() {
        return currentValue;
    }
}
