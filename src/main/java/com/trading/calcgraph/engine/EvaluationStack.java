package com.trading.calcgraph.engine;

import com.trading.calcgraph.api.NodeId;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The identities currently being computed, innermost last.
 *
 * Each frame collects the identities its computation reads; the evaluator
 * commits that set as the frame's dependency edges once the computation
 * succeeds. Empty between top-level calls.
 */
final class EvaluationStack {
    private final List<Frame> frames = new ArrayList<>();
    private final Set<NodeId> active = new HashSet<>();

    /** One in-flight computation. */
    static final class Frame {
        private final NodeId id;
        private final Set<NodeId> discovered = new LinkedHashSet<>();
        private boolean open = true;

        private Frame(NodeId id) {
            this.id = id;
        }

        NodeId id() {
            return id;
        }

        /** Records a read made by this frame's computation. */
        void record(NodeId dep) {
            discovered.add(dep);
        }

        Set<NodeId> discovered() {
            return discovered;
        }

        boolean isOpen() {
            return open;
        }
    }

    Frame push(NodeId id) {
        if (!active.add(id))
            throw new IllegalStateException("Already on the evaluation stack: " + id);
        Frame frame = new Frame(id);
        frames.add(frame);
        return frame;
    }

    /** Pops {@code frame}, which must be the innermost frame. */
    void pop(Frame frame) {
        int top = frames.size() - 1;
        if (top < 0 || frames.get(top) != frame)
            throw new IllegalStateException("Unbalanced evaluation stack at " + frame.id);
        frames.remove(top);
        active.remove(frame.id);
        frame.open = false;
    }

    boolean contains(NodeId id) {
        return active.contains(id);
    }

    boolean isTop(Frame frame) {
        return !frames.isEmpty() && frames.get(frames.size() - 1) == frame;
    }

    /**
     * The cycle closed by requesting {@code id} again: the stack from the
     * frame computing {@code id} to the top, followed by {@code id}.
     */
    List<NodeId> cycleTo(NodeId id) {
        List<NodeId> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (Frame f : frames) {
            if (f.id.equals(id))
                inCycle = true;
            if (inCycle)
                cycle.add(f.id);
        }
        cycle.add(id);
        return cycle;
    }

    int depth() {
        return frames.size();
    }

    boolean isEmpty() {
        return frames.isEmpty();
    }

    /** Identities on the stack, outermost first. */
    List<NodeId> snapshot() {
        List<NodeId> ids = new ArrayList<>(frames.size());
        for (Frame f : frames)
            ids.add(f.id);
        return ids;
    }
}
