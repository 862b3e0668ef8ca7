package com.planning.tdg.io;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import lombok.Data;

/**
 * POJO representation of a declared workflow: an ordered list of task specs
 * and how to connect them.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class WorkflowDefinition {
    private String graphId = "workflow";
    private Mode mode = Mode.PATTERNS;
    private List<TaskSpec> tasks = new ArrayList<>();

    /** How edges between the tasks are derived. */
    public enum Mode {
        /** Edges come from the builder's dependency patterns. */
        PATTERNS,
        /** Each task depends on the one before it. */
        SEQUENTIAL;

        @JsonValue
        public String wireValue() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static Mode fromString(String text) {
            for (Mode m : values()) {
                if (m.name().equalsIgnoreCase(text))
                    return m;
            }
            throw new IllegalArgumentException("Unknown workflow mode: " + text);
        }
    }

    /** One task of the workflow. The {@code task_type} metadata entry selects its cost model. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class TaskSpec {
        public static final String TASK_TYPE_KEY = "task_type";

        private String task;
        private int priority = 5;
        private Map<String, Object> metadata = new LinkedHashMap<>();

        public TaskSpec() {
        }

        public TaskSpec(String task, int priority, Map<String, Object> metadata) {
            this.task = task;
            this.priority = priority;
            this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
        }

        public static TaskSpec of(String task) {
            return new TaskSpec(task, 5, null);
        }

        public static TaskSpec of(String task, String taskType) {
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put(TASK_TYPE_KEY, taskType);
            return new TaskSpec(task, 5, meta);
        }

        /** The task name, or {@code task_<index>} when unnamed. */
        public String nameOr(int index) {
            return task != null ? task : "task_" + index;
        }

        public String taskType() {
            Object type = metadata != null ? metadata.get(TASK_TYPE_KEY) : null;
            return type != null ? type.toString() : "generic";
        }
    }
}
