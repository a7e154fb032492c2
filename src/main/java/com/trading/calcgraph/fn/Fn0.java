package com.trading.calcgraph.fn;

import com.trading.calcgraph.api.CalcContext;

/**
 * Calculation body taking no arguments.
 *
 * <p>
 * Examples:
 * <ul>
 * <li>{@code g -> g.<Double>evaluate("a") + g.<Double>evaluate("b")}</li>
 * </ul>
 */
@FunctionalInterface
public interface Fn0<T> {
    /**
     * @param g Context for reading other nodes.
     * @return The result.
     */
    T apply(CalcContext g);
}
