package com.planning.tdg.engine;

/**
 * Inserting a cycle-significant edge would have closed a cycle. The insertion
 * has been rolled back.
 */
public class CycleException extends TaskGraphException {
    private final String sourceId;
    private final String targetId;

    public CycleException(String sourceId, String targetId) {
        super("Adding edge " + sourceId + " -> " + targetId + " creates cycle");
        this.sourceId = sourceId;
        this.targetId = targetId;
    }

    public String sourceId() {
        return sourceId;
    }

    public String targetId() {
        return targetId;
    }
}
