package com.trading.calcgraph.fn;

import com.trading.calcgraph.api.CalcContext;

/** Calculation body taking three arguments. */
@FunctionalInterface
public interface Fn3<A, B, C, T> {
    T apply(CalcContext g, A a, B b, C c);
}
