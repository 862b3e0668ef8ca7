package com.planning.tdg.util;

import com.planning.tdg.api.GraphListener;
import com.planning.tdg.api.NodeStatus;
import java.util.Arrays;

/**
 * Aggregates multiple {@link GraphListener} instances. Adding copies the
 * array, so notification iterates a stable snapshot without allocating.
 */
public class CompositeGraphListener implements GraphListener {
    private GraphListener[] listeners = new GraphListener[0];

    public void add(GraphListener listener) {
        GraphListener[] old = listeners;
        GraphListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public boolean remove(GraphListener listener) {
        GraphListener[] old = listeners;
        for (int i = 0; i < old.length; i++) {
            if (old[i] == listener) {
                GraphListener[] next = new GraphListener[old.length - 1];
                System.arraycopy(old, 0, next, 0, i);
                System.arraycopy(old, i + 1, next, i, old.length - i - 1);
                listeners = next;
                return true;
            }
        }
        return false;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onNodeStarted(String graphId, String nodeId) {
        for (GraphListener l : listeners)
            l.onNodeStarted(graphId, nodeId);
    }

    @Override
    public void onNodeCompleted(String graphId, String nodeId, Double durationSeconds) {
        for (GraphListener l : listeners)
            l.onNodeCompleted(graphId, nodeId, durationSeconds);
    }

    @Override
    public void onNodeFailed(String graphId, String nodeId, String errorMessage) {
        for (GraphListener l : listeners)
            l.onNodeFailed(graphId, nodeId, errorMessage);
    }

    @Override
    public void onStatusChanged(String graphId, String nodeId, NodeStatus from, NodeStatus to) {
        for (GraphListener l : listeners)
            l.onStatusChanged(graphId, nodeId, from, to);
    }
}
