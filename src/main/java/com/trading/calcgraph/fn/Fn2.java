package com.trading.calcgraph.fn;

import com.trading.calcgraph.api.CalcContext;

/** Calculation body taking two arguments. */
@FunctionalInterface
public interface Fn2<A, B, T> {
    T apply(CalcContext g, A a, B b);
}
