package com.trading.calcgraph.fn;

import com.trading.calcgraph.api.CalcContext;

import java.util.List;

/**
 * Calculation body taking any number of arguments.
 *
 * The argument list is the immutable argument tuple of the identity being
 * computed; the body decides what arities it accepts.
 */
@FunctionalInterface
public interface FnN<T> {
    /**
     * @param g    Context for reading other nodes.
     * @param args The argument tuple (read-only).
     * @return The result.
     */
    T apply(CalcContext g, List<Object> args);
}
