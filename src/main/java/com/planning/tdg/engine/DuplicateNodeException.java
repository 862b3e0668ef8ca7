package com.planning.tdg.engine;

/** A node with the same id is already present in the graph. */
public class DuplicateNodeException extends TaskGraphException {
    private final String nodeId;

    public DuplicateNodeException(String nodeId) {
        super("Node " + nodeId + " already exists in graph");
        this.nodeId = nodeId;
    }

    public String nodeId() {
        return nodeId;
    }
}
