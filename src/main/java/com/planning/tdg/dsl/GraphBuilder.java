package com.planning.tdg.dsl;

import com.planning.tdg.engine.*;
import com.planning.tdg.io.WorkflowDefinition;
import com.planning.tdg.io.WorkflowDefinition.TaskSpec;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Graph Builder -- turns task lists and declared workflows into
 * {@link TaskGraph}s.
 *
 * Node estimates come from a {@link CostModelCatalog} keyed by task type; edges
 * come either from the task order or from the catalog's dependency patterns.
 *
 * Usage Pattern:
 * 1. Create a builder: GraphBuilder b = GraphBuilder.create();
 * 2. Optionally register estimates: b.addCostModel("etl", model);
 * 3. Build: TaskGraph g = b.fromWorkflow(specs, "nightly");
 */
@Log4j2
public final class GraphBuilder {
    public static final String DEFAULT_TASK_GRAPH_ID = "task_graph";
    public static final String DEFAULT_PIPELINE_ID = "task_pipeline";
    public static final String DEFAULT_WORKFLOW_ID = "workflow";
    public static final String DEFAULT_SEQUENTIAL_ID = "sequential_workflow";
    public static final String DEFAULT_MERGED_ID = "merged_graph";

    private final CostModelCatalog catalog;

    private GraphBuilder(CostModelCatalog catalog) {
        this.catalog = catalog;
    }

    public static GraphBuilder create() {
        return new GraphBuilder(new CostModelCatalog());
    }

    public static GraphBuilder create(CostModelCatalog catalog) {
        return new GraphBuilder(Objects.requireNonNull(catalog, "catalog"));
    }

    public CostModelCatalog catalog() {
        return catalog;
    }

    // ── Runner tasks ─────────────────────────────────────────────

    /** A single-node graph for one runner task, carrying its status and timing. */
    public TaskGraph fromTask(PipelineTask task) {
        return fromTask(task, DEFAULT_TASK_GRAPH_ID);
    }

    public TaskGraph fromTask(PipelineTask task, String graphId) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("source", "pipeline_task");
        meta.put("original_task_id", task.id());
        TaskGraph graph = new TaskGraph(graphId, meta);

        TaskNode node = toNode(task);
        if (task.startedAt() != null)
            node.setStartTime(task.startedAt());
        if (task.completedAt() != null)
            node.setEndTime(task.completedAt());
        graph.addNode(node);

        log.info("Converted task {} to graph {}", task.id(), graphId);
        return graph;
    }

    public TaskGraph fromTasks(List<PipelineTask> tasks) {
        return fromTasks(tasks, DEFAULT_PIPELINE_ID, true);
    }

    /**
     * One node per task. With {@code detectDependencies} each task depends on
     * the one before it.
     */
    public TaskGraph fromTasks(List<PipelineTask> tasks, String graphId, boolean detectDependencies) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("source", "pipeline_task");
        meta.put("task_count", tasks.size());
        TaskGraph graph = new TaskGraph(graphId, meta);

        for (PipelineTask task : tasks) {
            graph.addNode(toNode(task));
        }
        if (detectDependencies) {
            for (int i = 0; i + 1 < tasks.size(); i++) {
                graph.addEdge(tasks.get(i).id(), tasks.get(i + 1).id());
            }
        }

        log.info("Converted {} tasks to graph {} with {} edges", tasks.size(), graphId, graph.edgeCount());
        return graph;
    }

    private TaskNode toNode(PipelineTask task) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("context", task.context());
        TaskNode node = new TaskNode(task.id(), task.name(), task.taskType(), task.priority(),
                catalog.lookup(task.taskType()), meta);
        node.setStatus(task.nodeStatus());
        return node;
    }

    // ── Workflows ────────────────────────────────────────────────

    /** Builds a declared workflow in the mode it names. */
    public TaskGraph fromDefinition(WorkflowDefinition definition) {
        return switch (definition.getMode()) {
            case SEQUENTIAL -> fromSequential(definition.getTasks(), definition.getGraphId());
            case PATTERNS -> fromWorkflow(definition.getTasks(), definition.getGraphId());
        };
    }

    public TaskGraph fromWorkflow(List<TaskSpec> specs) {
        return fromWorkflow(specs, DEFAULT_WORKFLOW_ID);
    }

    /**
     * One node per spec, with id {@code <task>_<index>}. For each task that has
     * a dependency pattern, every earlier task whose name the pattern lists
     * becomes a dependency. An edge that would close a cycle is skipped.
     */
    public TaskGraph fromWorkflow(List<TaskSpec> specs, String graphId) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("source", "workflow");
        meta.put("task_count", specs.size());
        TaskGraph graph = new TaskGraph(graphId, meta);

        List<String> nodeIds = addSpecNodes(graph, specs);

        for (int idx = 0; idx < specs.size(); idx++) {
            String taskName = specs.get(idx).nameOr(idx);
            List<String> pattern = catalog.dependenciesOf(taskName);
            if (pattern.isEmpty())
                continue;
            for (String depName : pattern) {
                for (int prev = 0; prev < idx; prev++) {
                    if (!specs.get(prev).nameOr(prev).equals(depName))
                        continue;
                    try {
                        graph.addEdge(nodeIds.get(prev), nodeIds.get(idx));
                    } catch (CycleException e) {
                        log.warn("Skipping edge {} -> {} (cycle detected)", nodeIds.get(prev), nodeIds.get(idx));
                    }
                }
            }
        }

        log.info("Converted workflow with {} tasks to graph {} with {} edges", specs.size(), graphId,
                graph.edgeCount());
        return graph;
    }

    public TaskGraph fromSequential(List<TaskSpec> specs) {
        return fromSequential(specs, DEFAULT_SEQUENTIAL_ID);
    }

    /** A linear chain: each task depends on the one before it. */
    public TaskGraph fromSequential(List<TaskSpec> specs, String graphId) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("source", "workflow");
        meta.put("mode", "sequential");
        TaskGraph graph = new TaskGraph(graphId, meta);

        List<String> nodeIds = addSpecNodes(graph, specs);
        for (int i = 0; i + 1 < nodeIds.size(); i++) {
            graph.addEdge(nodeIds.get(i), nodeIds.get(i + 1));
        }

        log.info("Created sequential graph {} with {} nodes", graphId, nodeIds.size());
        return graph;
    }

    private List<String> addSpecNodes(TaskGraph graph, List<TaskSpec> specs) {
        List<String> nodeIds = new ArrayList<>(specs.size());
        for (int idx = 0; idx < specs.size(); idx++) {
            TaskSpec spec = specs.get(idx);
            String taskName = spec.nameOr(idx);
            String nodeId = taskName + "_" + idx;
            String taskType = spec.taskType();
            graph.addNode(new TaskNode(nodeId, taskName, taskType, spec.getPriority(), catalog.lookup(taskType),
                    spec.getMetadata()));
            nodeIds.add(nodeId);
        }
        return nodeIds;
    }

    // ── Merge ────────────────────────────────────────────────────

    public TaskGraph merge(List<TaskGraph> graphs) {
        return merge(graphs, DEFAULT_MERGED_ID);
    }

    /**
     * Copies every node and edge of {@code graphs} into one graph. Ids are
     * prefixed with {@code <sourceGraphId>_}, and each node records its
     * {@code source_graph} in metadata. Dependency and constraint edges are
     * copied before the other edge types.
     *
     * @throws DuplicateNodeException if two prefixed ids collide.
     */
    public TaskGraph merge(List<TaskGraph> graphs, String mergedId) {
        List<String> sourceIds = new ArrayList<>();
        for (TaskGraph g : graphs) {
            sourceIds.add(g.id());
        }
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("source", "merged");
        meta.put("source_graphs", sourceIds);
        TaskGraph merged = new TaskGraph(mergedId, meta);

        for (TaskGraph g : graphs) {
            for (TaskNode node : g.getAllNodes()) {
                Map<String, Object> nodeMeta = new LinkedHashMap<>(node.getMetadata());
                nodeMeta.put("source_graph", g.id());
                TaskNode copy = new TaskNode(prefixed(g, node.getId()), node.getName(), node.getNodeType(),
                        node.getPriority(), node.getCostModel().copy(), nodeMeta);
                copy.setStatus(node.getStatus());
                merged.addNode(copy);
            }
        }
        // Cycle-significant edges first: each source graph's are acyclic, so
        // they never trip the check on cycles closed by the remaining edges.
        copyEdges(graphs, merged, true);
        copyEdges(graphs, merged, false);

        log.info("Merged {} graphs into {}", graphs.size(), mergedId);
        return merged;
    }

    private static void copyEdges(List<TaskGraph> graphs, TaskGraph merged, boolean cycleSignificant) {
        for (TaskGraph g : graphs) {
            for (TaskEdge edge : g.getEdges()) {
                if (edge.isCycleSignificant() == cycleSignificant)
                    merged.addEdge(edge.relabel(prefixed(g, edge.sourceId()), prefixed(g, edge.targetId())));
            }
        }
    }

    private static String prefixed(TaskGraph g, String nodeId) {
        return g.id() + "_" + nodeId;
    }

    // ── Registration ─────────────────────────────────────────────

    public GraphBuilder addCostModel(String taskType, CostModel model) {
        catalog.register(taskType, model);
        log.info("Registered cost model for task type {}", taskType);
        return this;
    }

    public GraphBuilder addDependencyPattern(String taskName, List<String> dependencies) {
        catalog.registerPattern(taskName, dependencies);
        log.info("Registered dependency pattern for {}: {}", taskName, dependencies);
        return this;
    }
}
