package com.planning.tdg.engine;

/** An edge was requested from a node to itself. */
public class SelfLoopException extends TaskGraphException {
    private final String nodeId;

    public SelfLoopException(String nodeId) {
        super("Self-loops not allowed in DAG: " + nodeId + " -> " + nodeId);
        this.nodeId = nodeId;
    }

    public String nodeId() {
        return nodeId;
    }
}
