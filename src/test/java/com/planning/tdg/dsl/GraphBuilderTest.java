package com.planning.tdg.dsl;

import com.planning.tdg.api.EdgeType;
import com.planning.tdg.api.NodeStatus;
import com.planning.tdg.engine.CostModel;
import com.planning.tdg.engine.DuplicateNodeException;
import com.planning.tdg.engine.TaskEdge;
import com.planning.tdg.engine.TaskGraph;
import com.planning.tdg.engine.TaskNode;
import com.planning.tdg.io.WorkflowDefinition;
import com.planning.tdg.io.WorkflowDefinition.TaskSpec;
import com.planning.tdg.io.WorkflowParser;
import org.junit.Before;
import org.junit.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class GraphBuilderTest {
    private GraphBuilder builder;

    @Before
    public void setUp() {
        builder = GraphBuilder.create();
    }

    @Test
    public void testWorkflowFromPatterns() {
        // fetch_data -> compute_sentiment -> aggregate_results -> generate_plot
        WorkflowDefinition def = WorkflowParser.parseResource("sentiment-workflow.json");
        TaskGraph g = builder.fromDefinition(def);

        assertEquals("sentiment", g.id());
        assertEquals(List.of("fetch_data_0", "compute_sentiment_1", "aggregate_results_2", "generate_plot_3"),
                List.copyOf(g.nodeIds()));
        assertEquals(3, g.edgeCount());
        assertTrue(g.hasEdge("fetch_data_0", "compute_sentiment_1"));
        assertTrue(g.hasEdge("compute_sentiment_1", "aggregate_results_2"));
        assertTrue(g.hasEdge("aggregate_results_2", "generate_plot_3"));

        TaskNode compute = g.getNode("compute_sentiment_1");
        assertEquals("compute_sentiment", compute.getName());
        assertEquals("computation", compute.getNodeType());
        assertEquals(6, compute.getPriority());
        assertEquals(5.0, compute.getCostModel().getEstimatedDuration(), 0.0);

        // 2 + 5 + 1 + 3
        assertEquals(11.0, g.calculateCriticalPath().totalDuration(), 1e-9);
    }

    @Test
    public void testRepeatedTaskNamesAllBecomeDependencies() {
        TaskGraph g = builder.fromWorkflow(List.of(
                TaskSpec.of("fetch_data"), TaskSpec.of("fetch_data"), TaskSpec.of("compute_sentiment")));
        assertTrue(g.hasEdge("fetch_data_0", "compute_sentiment_2"));
        assertTrue(g.hasEdge("fetch_data_1", "compute_sentiment_2"));
        assertEquals(2, g.edgeCount());
        assertEquals(GraphBuilder.DEFAULT_WORKFLOW_ID, g.id());
    }

    @Test
    public void testDependencyOnLaterTaskIsIgnored() {
        // Pattern lists fetch_data, but it comes after compute_sentiment
        TaskGraph g = builder.fromWorkflow(List.of(TaskSpec.of("compute_sentiment"), TaskSpec.of("fetch_data")));
        assertEquals(0, g.edgeCount());
    }

    @Test
    public void testCustomPattern() {
        builder.addDependencyPattern("publish", List.of("build", "test"));
        TaskGraph g = builder.fromWorkflow(
                List.of(TaskSpec.of("build"), TaskSpec.of("test"), TaskSpec.of("publish")), "release");
        assertEquals(List.of("build_0", "test_1"), List.copyOf(g.getNode("publish_2").getDependencies()));
    }

    @Test
    public void testSequential() {
        TaskGraph g = builder.fromSequential(List.of(
                TaskSpec.of("load", "data_io"), TaskSpec.of("train", "inference"), TaskSpec.of("save")));
        assertEquals(GraphBuilder.DEFAULT_SEQUENTIAL_ID, g.id());
        assertEquals(List.of("load_0", "train_1", "save_2"), g.topologicalSort());
        assertEquals(2, g.edgeCount());
        assertEquals("sequential", g.metadata().get("mode"));
        assertEquals(15.0, g.getNode("train_1").getCostModel().getEstimatedDuration(), 0.0);
        assertEquals("generic", g.getNode("save_2").getNodeType());
    }

    @Test
    public void testUnnamedTasks() {
        TaskGraph g = builder.fromSequential(List.of(new TaskSpec(), new TaskSpec()));
        assertTrue(g.hasEdge("task_0_0", "task_1_1"));
    }

    @Test
    public void testCostModelsAreCopiedPerNode() {
        TaskGraph g = builder.fromSequential(List.of(TaskSpec.of("a", "computation"), TaskSpec.of("b", "computation")));
        g.getNode("a_0").getCostModel().setEstimatedDuration(99);
        assertEquals(5.0, g.getNode("b_1").getCostModel().getEstimatedDuration(), 0.0);
        assertEquals(5.0, builder.catalog().lookup("computation").getEstimatedDuration(), 0.0);
    }

    @Test
    public void testFromTasks() {
        Instant started = Instant.parse("2024-01-01T00:00:00Z");
        List<PipelineTask> tasks = List.of(
                new PipelineTask("t1", "Load", "data_io", 8, "done", Map.of("rows", 10), started, started),
                new PipelineTask("t2", "Transform", "transformation", 5, "running", null, started, null),
                new PipelineTask("t3", "Report", "unknown_type", 5, "error", null, null, null),
                PipelineTask.queued("t4", "Notify", "generic"));

        TaskGraph g = builder.fromTasks(tasks);
        assertEquals(GraphBuilder.DEFAULT_PIPELINE_ID, g.id());
        assertEquals(3, g.edgeCount());
        assertEquals(NodeStatus.COMPLETED, g.getNode("t1").getStatus());
        assertEquals(NodeStatus.RUNNING, g.getNode("t2").getStatus());
        assertEquals(NodeStatus.FAILED, g.getNode("t3").getStatus());
        assertEquals(NodeStatus.PENDING, g.getNode("t4").getStatus());
        assertEquals(8, g.getNode("t1").getPriority());
        assertEquals(Map.of("rows", 10), g.getNode("t1").getMetadata("context"));
        assertEquals(1.0, g.getNode("t3").getCostModel().getEstimatedDuration(), 0.0);
        assertEquals(4, g.metadata().get("task_count"));

        TaskGraph unlinked = builder.fromTasks(tasks, "flat", false);
        assertEquals(0, unlinked.edgeCount());
    }

    @Test
    public void testFromTask() {
        Instant at = Instant.parse("2024-01-01T00:00:05Z");
        PipelineTask task = new PipelineTask("job", "Job", "pipeline", 5, "cancelled", null, at, at);
        TaskGraph g = builder.fromTask(task);
        assertEquals(GraphBuilder.DEFAULT_TASK_GRAPH_ID, g.id());
        assertEquals("job", g.metadata().get("original_task_id"));
        TaskNode node = g.getNode("job");
        assertEquals(NodeStatus.CANCELLED, node.getStatus());
        assertEquals(at, node.getStartTime());
        assertEquals(20.0, node.getCostModel().getEstimatedDuration(), 0.0);
    }

    @Test
    public void testMerge() {
        TaskGraph first = new TaskGraph("one");
        first.addNode(new TaskNode("a")).addNode(new TaskNode("b"));
        first.addEdge("a", "b");
        first.getNode("b").markCompleted();
        TaskGraph second = new TaskGraph("two");
        second.addNode(new TaskNode("a"));

        TaskGraph merged = builder.merge(List.of(first, second));
        assertEquals(GraphBuilder.DEFAULT_MERGED_ID, merged.id());
        assertEquals(List.of("one_a", "one_b", "two_a"), List.copyOf(merged.nodeIds()));
        assertTrue(merged.hasEdge("one_a", "one_b"));
        assertEquals("two", merged.getNode("two_a").getMetadata("source_graph"));
        assertEquals(NodeStatus.COMPLETED, merged.getNode("one_b").getStatus());
        assertEquals(List.of("one", "two"), merged.metadata().get("source_graphs"));
        assertTrue(merged.validate().valid());
    }

    @Test
    public void testMergeGraphWithDataFlowCycle() {
        // one: a -> b, b -data-> a; two: x -> y
        TaskGraph first = new TaskGraph("one");
        first.addNode(new TaskNode("a")).addNode(new TaskNode("b"));
        first.addEdge("a", "b");
        first.addEdge(new TaskEdge("b", "a", EdgeType.DATA_FLOW));
        TaskGraph second = new TaskGraph("two");
        second.addNode(new TaskNode("x")).addNode(new TaskNode("y"));
        second.addEdge("x", "y");

        TaskGraph merged = builder.merge(List.of(first, second));
        assertEquals(3, merged.edgeCount());
        assertTrue(merged.hasEdge("one_b", "one_a"));
        assertTrue(merged.hasEdge("two_x", "two_y"));
        assertTrue(merged.hasCycle());
        assertEquals(EdgeType.DATA_FLOW, merged.getEdgesFrom("one_b").get(0).edgeType());
    }

    @Test(expected = DuplicateNodeException.class)
    public void testMergeCollision() {
        TaskGraph first = new TaskGraph("x");
        first.addNode(new TaskNode("y_z"));
        TaskGraph second = new TaskGraph("x_y");
        second.addNode(new TaskNode("z"));
        builder.merge(List.of(first, second));
    }

    @Test
    public void testAddCostModel() {
        builder.addCostModel("etl", CostModel.ofDuration(42));
        TaskGraph g = builder.fromSequential(List.of(TaskSpec.of("nightly", "etl")));
        assertEquals(42.0, g.getNode("nightly_0").getCostModel().getEstimatedDuration(), 0.0);
    }
}
