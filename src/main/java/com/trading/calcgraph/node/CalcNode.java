package com.trading.calcgraph.node;

import com.trading.calcgraph.api.CalcContext;
import com.trading.calcgraph.api.Node;
import com.trading.calcgraph.api.NodeArgumentsException;
import com.trading.calcgraph.fn.Fn0;
import com.trading.calcgraph.fn.Fn1;
import com.trading.calcgraph.fn.Fn2;
import com.trading.calcgraph.fn.Fn3;
import com.trading.calcgraph.fn.FnN;

import java.util.List;
import java.util.Objects;

/**
 * A general-purpose node that delegates computation to a user-supplied body.
 *
 * The fixed-arity factories check the argument count of every identity before
 * invoking the body and cast each argument to the body's parameter type, so a
 * mismatch surfaces as {@link NodeArgumentsException} or
 * {@link ClassCastException} naming this node.
 */
public final class CalcNode<T> implements Node<T> {
    private final String name;
    private final FnN<T> fn;

    public CalcNode(String name, FnN<T> fn) {
        this.name = Objects.requireNonNull(name, "name");
        this.fn = Objects.requireNonNull(fn, "fn");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public T compute(CalcContext ctx, List<Object> args) {
        return fn.apply(ctx, args);
    }

    // ── Fixed-arity factories ───────────────────────────────────

    public static <T> CalcNode<T> of(String name, Fn0<T> fn) {
        return new CalcNode<>(name, (g, args) -> {
            checkArity(name, 0, args);
            return fn.apply(g);
        });
    }

    @SuppressWarnings("unchecked")
    public static <A, T> CalcNode<T> of(String name, Fn1<A, T> fn) {
        return new CalcNode<>(name, (g, args) -> {
            checkArity(name, 1, args);
            return fn.apply(g, (A) args.get(0));
        });
    }

    @SuppressWarnings("unchecked")
    public static <A, B, T> CalcNode<T> of(String name, Fn2<A, B, T> fn) {
        return new CalcNode<>(name, (g, args) -> {
            checkArity(name, 2, args);
            return fn.apply(g, (A) args.get(0), (B) args.get(1));
        });
    }

    @SuppressWarnings("unchecked")
    public static <A, B, C, T> CalcNode<T> of(String name, Fn3<A, B, C, T> fn) {
        return new CalcNode<>(name, (g, args) -> {
            checkArity(name, 3, args);
            return fn.apply(g, (A) args.get(0), (B) args.get(1), (C) args.get(2));
        });
    }

    private static void checkArity(String name, int expected, List<Object> args) {
        if (args.size() != expected)
            throw new NodeArgumentsException(
                    "Node " + name + " takes " + expected + " argument(s), got " + args.size() + ": " + args);
    }
}
