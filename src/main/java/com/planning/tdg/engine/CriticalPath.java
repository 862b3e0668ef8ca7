package com.planning.tdg.engine;

import java.util.List;

/**
 * Result of the critical-path method: the longest duration-weighted chain of
 * nodes, in execution order, and its total duration.
 */
public record CriticalPath(List<String> nodeIds, double totalDuration) {

    public static final CriticalPath EMPTY = new CriticalPath(List.of(), 0.0);

    public CriticalPath {
        nodeIds = List.copyOf(nodeIds);
    }

    public boolean isEmpty() {
        return nodeIds.isEmpty();
    }

    public boolean contains(String nodeId) {
        return nodeIds.contains(nodeId);
    }
}
