package com.planning.tdg.dsl;

import com.planning.tdg.api.NodeStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A task as reported by an external task runner, before it becomes a graph
 * node.
 *
 * @param status the runner's status word: queued, running, done, error or
 *               cancelled.
 */
public record PipelineTask(
        String id,
        String name,
        String taskType,
        int priority,
        String status,
        Map<String, Object> context,
        Instant startedAt,
        Instant completedAt) {

    public PipelineTask {
        context = context != null ? Collections.unmodifiableMap(new LinkedHashMap<>(context)) : Map.of();
    }

    public static PipelineTask queued(String id, String name, String taskType) {
        return new PipelineTask(id, name, taskType, 5, "queued", null, null, null);
    }

    /** Maps the runner's status word; anything unrecognized is PENDING. */
    public NodeStatus nodeStatus() {
        if (status == null)
            return NodeStatus.PENDING;
        return switch (status.toLowerCase()) {
            case "running" -> NodeStatus.RUNNING;
            case "done" -> NodeStatus.COMPLETED;
            case "error" -> NodeStatus.FAILED;
            case "cancelled" -> NodeStatus.CANCELLED;
            default -> NodeStatus.PENDING;
        };
    }
}
