package com.planning.tdg.engine;

/** An operation referenced a node id that is not in the graph. */
public class NodeNotFoundException extends TaskGraphException {
    private final String nodeId;

    public NodeNotFoundException(String nodeId) {
        this(nodeId, "Node " + nodeId + " not found in graph");
    }

    public NodeNotFoundException(String nodeId, String message) {
        super(message);
        this.nodeId = nodeId;
    }

    public String nodeId() {
        return nodeId;
    }
}
