package com.trading.calcgraph.fn;

import com.trading.calcgraph.api.CalcContext;

/**
 * Calculation body taking one argument.
 *
 * <p>
 * Examples:
 * <ul>
 * <li>{@code (CalcContext g, Integer n) -> n * n}</li>
 * <li>{@code (CalcContext g, Integer years) -> Math.pow(1 + g.<Double>evaluate("real rate"), years) - 1}</li>
 * </ul>
 */
@FunctionalInterface
public interface Fn1<A, T> {
    /**
     * @param g Context for reading other nodes.
     * @param a First argument.
     * @return The result.
     */
    T apply(CalcContext g, A a);
}
