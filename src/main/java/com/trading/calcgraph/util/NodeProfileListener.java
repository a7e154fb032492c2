package com.trading.calcgraph.util;

import com.trading.calcgraph.api.EvaluationListener;
import com.trading.calcgraph.api.NodeId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Aggregates per-identity statistics to find hot and expensive calculations. */
public class NodeProfileListener implements EvaluationListener {

    public static class NodeStats {
        public final NodeId id;
        public long computeCount;
        public long cacheHits;
        public long overrideHits;
        public long errors;
        public long totalDurationNanos;
        public long minDurationNanos = Long.MAX_VALUE;
        public long maxDurationNanos = Long.MIN_VALUE;
        public long lastDurationNanos;

        public NodeStats(NodeId id) {
            this.id = id;
        }

        void update(long duration) {
            computeCount++;
            totalDurationNanos += duration;
            lastDurationNanos = duration;
            if (duration < minDurationNanos)
                minDurationNanos = duration;
            if (duration > maxDurationNanos)
                maxDurationNanos = duration;
        }

        public double avgMicros() {
            return computeCount == 0 ? 0 : totalDurationNanos / (double) computeCount / 1000.0;
        }
    }

    private final Map<NodeId, NodeStats> stats = new LinkedHashMap<>();
    private long invalidations;
    private long invalidatedEntries;

    private NodeStats statsFor(NodeId id) {
        return stats.computeIfAbsent(id, NodeStats::new);
    }

    /** @return Stats of {@code id}, or null if it was never requested. */
    public NodeStats get(NodeId id) {
        return stats.get(id);
    }

    /** Number of recomputations of {@code id}. */
    public long computeCount(NodeId id) {
        NodeStats s = stats.get(id);
        return s == null ? 0 : s.computeCount;
    }

    public Map<NodeId, NodeStats> getStats() {
        return Collections.unmodifiableMap(stats);
    }

    public long invalidations() {
        return invalidations;
    }

    public long invalidatedEntries() {
        return invalidatedEntries;
    }

    @Override
    public void onNodeComputed(NodeId id, long durationNanos) {
        statsFor(id).update(durationNanos);
    }

    @Override
    public void onCacheHit(NodeId id) {
        statsFor(id).cacheHits++;
    }

    @Override
    public void onOverrideHit(NodeId id) {
        statsFor(id).overrideHits++;
    }

    @Override
    public void onNodeError(NodeId id, Throwable error) {
        statsFor(id).errors++;
    }

    @Override
    public void onInvalidated(NodeId origin, int invalidated) {
        invalidations++;
        invalidatedEntries += invalidated;
    }

    public void reset() {
        stats.clear();
        invalidations = 0;
        invalidatedEntries = 0;
    }

    /** Formats a profile report sorted by total compute time. */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-40s | %8s | %8s | %10s | %10s%n", "Identity", "Computed", "Hits", "Avg(us)",
                "Max(us)"));
        sb.append("-".repeat(88)).append('\n');

        List<NodeStats> sorted = new ArrayList<>(stats.values());
        sorted.sort(Comparator.comparingLong((NodeStats s) -> s.totalDurationNanos).reversed());

        for (NodeStats s : sorted) {
            sb.append(String.format("%-40s | %8d | %8d | %10.2f | %10.2f%n",
                    s.id, s.computeCount, s.cacheHits, s.avgMicros(),
                    s.computeCount == 0 ? 0.0 : s.maxDurationNanos / 1000.0));
        }
        return sb.toString();
    }
}
