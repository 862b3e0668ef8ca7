package com.planning.tdg.analysis;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Memo table for analysis results, bound to one graph version.
 *
 * An entry is served only while the graph version it was computed against is
 * current; the first lookup against a newer version drops every entry.
 */
public final class AnalysisCache {
    private final Map<String, Object> entries = new HashMap<>();
    private long version = -1;

    @SuppressWarnings("unchecked")
    public <T> T getOrCompute(String key, long graphVersion, Supplier<T> compute) {
        if (graphVersion != version) {
            entries.clear();
            version = graphVersion;
        }
        Object cached = entries.get(key);
        if (cached != null)
            return (T) cached;
        T value = compute.get();
        entries.put(key, value);
        return value;
    }

    public boolean contains(String key, long graphVersion) {
        return graphVersion == version && entries.containsKey(key);
    }

    public void clear() {
        entries.clear();
        version = -1;
    }

    public int size() {
        return entries.size();
    }
}
