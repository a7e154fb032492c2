package com.trading.calcgraph.engine;

import com.trading.calcgraph.api.NodeId;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Per-identity cached values and overrides.
 *
 * The cache slot and the override slot have independent lifecycles. A cache
 * entry is created on the first successful computation and afterwards only
 * toggles between valid and invalid; an invalid entry keeps its last value for
 * diagnostics but is never served. An override, while present, takes
 * precedence over the cache regardless of its validity.
 *
 * This class performs no invalidation of its own: {@link CalcGraph} pairs every
 * override mutation with a transitive invalidation of the identity.
 */
public final class ValueStore {
    private final Map<NodeId, CacheEntry> cache = new HashMap<>();
    private final Map<NodeId, Object> overrides = new HashMap<>();

    /** A cached value and whether it may be served. */
    public static final class CacheEntry {
        private Object value;
        private boolean valid;

        public Object value() {
            return value;
        }

        public boolean isValid() {
            return valid;
        }
    }

    // ── Cache ──────────────────────────────────────────────────

    /** Returns the cache entry of {@code id}, or null if it was never computed. */
    public CacheEntry cacheEntry(NodeId id) {
        return cache.get(id);
    }

    public boolean isValid(NodeId id) {
        CacheEntry entry = cache.get(id);
        return entry != null && entry.valid;
    }

    /** Stores a freshly computed value and marks it valid. */
    public void putCache(NodeId id, Object value) {
        CacheEntry entry = cache.computeIfAbsent(id, k -> new CacheEntry());
        entry.value = value;
        entry.valid = true;
    }

    /**
     * Marks the cache entry of {@code id} invalid.
     *
     * @return true if the entry was valid before this call.
     */
    public boolean invalidate(NodeId id) {
        CacheEntry entry = cache.get(id);
        if (entry == null || !entry.valid)
            return false;
        entry.valid = false;
        return true;
    }

    // ── Overrides ──────────────────────────────────────────────

    public boolean hasOverride(NodeId id) {
        return overrides.containsKey(id);
    }

    /** Returns the override value of {@code id}, or null if none is active. */
    public Object overrideValue(NodeId id) {
        return overrides.get(id);
    }

    /**
     * Activates an override.
     *
     * @return The previously active override value, or null.
     */
    public Object setOverride(NodeId id, Object value) {
        if (value == null)
            throw new IllegalArgumentException("Override value must not be null: " + id);
        return overrides.put(id, value);
    }

    /**
     * Deactivates an override.
     *
     * @return true if an override was active.
     */
    public boolean clearOverride(NodeId id) {
        return overrides.remove(id) != null;
    }

    /** Identities with an active override (read-only view). */
    public Set<NodeId> overriddenIdentities() {
        return Collections.unmodifiableSet(overrides.keySet());
    }

    /** Every identity with a cache entry or an override. */
    public Set<NodeId> identities() {
        Set<NodeId> ids = new LinkedHashSet<>(cache.keySet());
        ids.addAll(overrides.keySet());
        return ids;
    }
}
