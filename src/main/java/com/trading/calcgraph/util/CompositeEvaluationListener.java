package com.trading.calcgraph.util;

import com.trading.calcgraph.api.EvaluationListener;
import com.trading.calcgraph.api.NodeId;

import java.util.Arrays;

/**
 * Aggregates multiple {@link EvaluationListener} instances.
 */
public class CompositeEvaluationListener implements EvaluationListener {
    private EvaluationListener[] listeners = new EvaluationListener[0];

    public CompositeEvaluationListener add(EvaluationListener listener) {
        EvaluationListener[] old = listeners;
        EvaluationListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onNodeComputed(NodeId id, long durationNanos) {
        for (EvaluationListener l : listeners)
            l.onNodeComputed(id, durationNanos);
    }

    @Override
    public void onCacheHit(NodeId id) {
        for (EvaluationListener l : listeners)
            l.onCacheHit(id);
    }

    @Override
    public void onOverrideHit(NodeId id) {
        for (EvaluationListener l : listeners)
            l.onOverrideHit(id);
    }

    @Override
    public void onNodeError(NodeId id, Throwable error) {
        for (EvaluationListener l : listeners)
            l.onNodeError(id, error);
    }

    @Override
    public void onInvalidated(NodeId origin, int invalidated) {
        for (EvaluationListener l : listeners)
            l.onInvalidated(origin, invalidated);
    }
}
