package com.planning.tdg.analysis;

import com.planning.tdg.api.EdgeType;
import com.planning.tdg.engine.CostModel;
import com.planning.tdg.engine.TaskEdge;
import com.planning.tdg.engine.TaskGraph;
import com.planning.tdg.engine.TaskNode;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

import static org.junit.Assert.*;

public class GraphAnalyzerTest {

    private static TaskGraph nodes(String... ids) {
        TaskGraph g = new TaskGraph("g");
        for (String id : ids) {
            g.addNode(new TaskNode(id));
        }
        return g;
    }

    private static TaskGraph star() {
        // S1..S5 -> X
        TaskGraph g = nodes("X", "S1", "S2", "S3", "S4", "S5");
        for (int i = 1; i <= 5; i++) {
            g.addEdge("S" + i, "X");
        }
        return g;
    }

    // Cycle a -> b -> c -> a built from data-flow edges, which skip the cycle check
    private static TaskGraph cyclic() {
        TaskGraph g = nodes("a", "b", "c");
        g.addEdge("a", "b").addEdge("b", "c");
        g.addEdge(new TaskEdge("c", "a", EdgeType.DATA_FLOW));
        return g;
    }

    @Test
    public void testEmptyGraph() {
        GraphAnalyzer analyzer = new GraphAnalyzer(new TaskGraph());
        assertEquals(0.0, analyzer.calculateParallelizationIndex(), 0.0);
        HealthReport health = analyzer.calculateGraphHealth();
        assertEquals(100.0, health.score(), 0.0);
        assertEquals(HealthStatus.HEALTHY, health.status());
        assertTrue(health.issues().isEmpty());
        assertTrue(analyzer.findAllCycles().isEmpty());
        assertTrue(analyzer.calculateInfluenceScores().isEmpty());
        assertTrue(analyzer.calculateNodeCriticality().isEmpty());
        assertEquals(0.0, analyzer.calculateRedundancyScore(), 0.0);
        assertNotNull(analyzer.getAnalysisReport());
    }

    @Test
    public void testConvergenceBottleneck() {
        GraphAnalyzer analyzer = new GraphAnalyzer(star());
        List<Bottleneck> bottlenecks = analyzer.findBottlenecks(3);
        assertEquals(1, bottlenecks.size());
        Bottleneck b = bottlenecks.get(0);
        assertEquals("X", b.nodeId());
        assertEquals(5, b.fanIn());
        assertEquals(0, b.fanOut());
        assertEquals(5, b.score());
        assertEquals(BottleneckKind.CONVERGENCE, b.kind());
    }

    @Test
    public void testDivergenceBottleneckOrdering() {
        // R -> A, B, C, D and Q -> A, B, C
        TaskGraph g = nodes("R", "Q", "A", "B", "C", "D");
        for (String t : List.of("A", "B", "C", "D")) {
            g.addEdge("R", t);
        }
        for (String t : List.of("A", "B", "C")) {
            g.addEdge("Q", t);
        }
        List<Bottleneck> result = new GraphAnalyzer(g).findBottlenecks(3);
        assertEquals(2, result.size());
        assertEquals("R", result.get(0).nodeId());
        assertEquals(BottleneckKind.DIVERGENCE, result.get(0).kind());
        assertEquals("Q", result.get(1).nodeId());
    }

    @Test
    public void testFindAllCyclesReturnsClosedCycle() {
        GraphAnalyzer analyzer = new GraphAnalyzer(cyclic());
        List<List<String>> cycles = analyzer.findAllCycles();
        assertEquals(1, cycles.size());
        assertEquals(List.of("a", "b", "c", "a"), cycles.get(0));
        assertEquals(3, analyzer.findCycleNodes().size());
    }

    @Test
    public void testCyclicGraphAnalysesDoNotThrow() {
        GraphAnalyzer analyzer = new GraphAnalyzer(cyclic());
        assertEquals(0.0, analyzer.calculateParallelizationIndex(), 0.0);
        assertTrue(analyzer.findCriticalNodes().isEmpty());
        assertTrue(analyzer.findParallelStages().isEmpty());

        HealthReport health = analyzer.calculateGraphHealth();
        // -50 for the cycle, -10 for parallelization
        assertEquals(40.0, health.score(), 0.0);
        assertEquals(HealthStatus.UNHEALTHY, health.status());
        assertEquals(1, health.cycleCount());

        AnalysisReport report = analyzer.getAnalysisReport();
        assertFalse(report.stats().acyclic());
        assertTrue(report.parallelStages().isEmpty());
        assertEquals(0.0, report.costs().criticalPathDuration(), 0.0);
    }

    @Test
    public void testParallelizationIndexTwoChains() {
        // Two independent 3-node chains: 3 levels
        TaskGraph g = nodes("x1", "x2", "x3", "y1", "y2", "y3");
        g.addEdge("x1", "x2").addEdge("x2", "x3").addEdge("y1", "y2").addEdge("y2", "y3");
        GraphAnalyzer analyzer = new GraphAnalyzer(g);

        SortedMap<Integer, List<String>> stages = analyzer.findParallelStages();
        assertEquals(List.of("x1", "y1"), stages.get(0));
        assertEquals(1.0 / 3.0, analyzer.calculateParallelizationIndex(), 1e-9);

        Map<String, Double> factors = analyzer.calculateParallelizationFactors();
        assertEquals(1.0 / 6.0, factors.get("x2"), 1e-9);
        assertEquals(1.0 / 6.0, g.getNode("y3").getParallelizationFactor(), 1e-9);
    }

    @Test
    public void testParallelizationIndexAllIndependent() {
        GraphAnalyzer analyzer = new GraphAnalyzer(nodes("a", "b", "c", "d"));
        assertEquals(1.0, analyzer.calculateParallelizationIndex(), 0.0);
    }

    @Test
    public void testHealthPenalties() {
        // Long chain: low parallelization; plus isolated nodes i1, i2
        TaskGraph g = nodes("a", "b", "c", "d", "i1", "i2");
        g.addEdge("a", "b").addEdge("b", "c").addEdge("c", "d");
        HealthReport health = new GraphAnalyzer(g).calculateGraphHealth();
        // index = 1/4 < 0.3 -> -10; two isolated -> -10
        assertEquals(80.0, health.score(), 0.0);
        assertEquals(HealthStatus.HEALTHY, health.status());
        assertEquals(2, health.isolatedCount());
        assertEquals(List.of("Low parallelization potential", "Contains 2 isolated nodes"), health.issues());
    }

    @Test
    public void testSingleIsolatedNodeNotPenalized() {
        HealthReport health = new GraphAnalyzer(nodes("solo")).calculateGraphHealth();
        assertEquals(100.0, health.score(), 0.0);
        assertEquals(1, health.isolatedCount());
    }

    @Test
    public void testHealthBottleneckThresholdIsFive() {
        HealthReport health = new GraphAnalyzer(star()).calculateGraphHealth();
        assertEquals(1, health.bottleneckCount());
        // index = 1/2: no parallelization penalty
        assertEquals(90.0, health.score(), 0.0);
    }

    @Test
    public void testHealthNeverRisesAsDefectsAreAdded() {
        // r -> t keeps two levels, so the parallelization index stays at 0.5
        TaskGraph g = nodes("r", "t");
        g.addEdge("r", "t");
        GraphAnalyzer analyzer = new GraphAnalyzer(g);
        List<Double> scores = new ArrayList<>();
        scores.add(analyzer.calculateGraphHealth().score());

        // Bottlenecks: hubs with fan-in 5
        for (int hub = 0; hub < 4; hub++) {
            g.addNode(new TaskNode("hub" + hub));
            for (int s = 0; s < 5; s++) {
                String src = "h" + hub + "s" + s;
                g.addNode(new TaskNode(src));
                g.addEdge(src, "hub" + hub);
            }
            scores.add(analyzer.calculateGraphHealth().score());
        }
        assertEquals(3 * 10.0, 100.0 - scores.get(scores.size() - 1), 0.0);

        // Isolated nodes
        for (int i = 0; i < 6; i++) {
            g.addNode(new TaskNode("iso" + i));
            scores.add(analyzer.calculateGraphHealth().score());
        }

        // Cycle closed by a data-flow edge
        g.addEdge(new TaskEdge("t", "r", EdgeType.DATA_FLOW));
        HealthReport last = analyzer.calculateGraphHealth();
        scores.add(last.score());
        assertEquals(1, last.cycleCount());

        for (int i = 1; i < scores.size(); i++) {
            assertTrue("score rose at step " + i + ": " + scores, scores.get(i) <= scores.get(i - 1));
        }
        assertTrue(scores.get(scores.size() - 1) < scores.get(scores.size() - 2));
        assertEquals(0.0, last.score(), 0.0);
    }

    @Test
    public void testInfluenceNormalizedAndWritten() {
        GraphAnalyzer analyzer = new GraphAnalyzer(star());
        Map<String, Double> scores = analyzer.calculateInfluenceScores();
        assertEquals(1.0, scores.get("X"), 1e-9);
        assertTrue(scores.get("S1") < 1.0);
        assertEquals(scores.get("S1"), scores.get("S5"), 1e-12);
        assertEquals(1.0, analyzer.graph().getNode("X").getInfluenceScore(), 1e-9);

        List<InfluenceRank> top = analyzer.findMostInfluentialNodes(2);
        assertEquals(2, top.size());
        assertEquals("X", top.get(0).nodeId());
        assertEquals("S1", top.get(1).nodeId());
    }

    @Test
    public void testCacheFollowsGraphVersion() {
        TaskGraph g = star();
        GraphAnalyzer analyzer = new GraphAnalyzer(g);
        assertEquals(1, analyzer.findBottlenecks(3).size());
        assertSame(analyzer.findBottlenecks(3), analyzer.findBottlenecks(3));

        g.removeEdge("S1", "X");
        g.removeEdge("S2", "X");
        g.removeEdge("S3", "X");
        assertTrue(analyzer.findBottlenecks(3).isEmpty());

        analyzer.clearCache();
        assertEquals(0, analyzer.cache().size());
    }

    @Test
    public void testCriticality() {
        // A(10) -> B(1)
        TaskGraph g = new TaskGraph("g");
        g.addNode(TaskNode.withDuration("A", 10)).addNode(TaskNode.withDuration("B", 1));
        g.addEdge("A", "B");
        Map<String, Double> c = new GraphAnalyzer(g).calculateNodeCriticality();
        // A: on path 0.4 + 0.3 dependents + 0.3 cost
        assertEquals(1.0, c.get("A"), 1e-9);
        // B: on path 0.4 + 0 + 0.3 * 0.01 / 0.1
        assertEquals(0.43, c.get("B"), 1e-9);
    }

    @Test
    public void testTotalCost() {
        TaskGraph g = new TaskGraph("g");
        g.addNode(new TaskNode("A", "A", "x", 5, CostModel.builder().estimatedDuration(4).estimatedCost(1)
                .ioOperations(10).build(), null));
        g.addNode(new TaskNode("B", "B", "x", 5, CostModel.builder().estimatedDuration(6).estimatedCost(2)
                .ioOperations(5).build(), null));
        g.addNode(TaskNode.withDuration("C", 2));
        g.addEdge("A", "B");

        CostSummary costs = new GraphAnalyzer(g).calculateTotalCost();
        assertEquals(12.0, costs.sequentialDuration(), 1e-9);
        assertEquals(10.0, costs.criticalPathDuration(), 1e-9);
        assertEquals(3.0, costs.totalCost(), 1e-9);
        assertEquals(3.0, costs.totalCpuUnits(), 1e-9);
        assertEquals(384.0, costs.totalMemoryMb(), 1e-9);
        assertEquals(15L, costs.totalIoOperations());
        assertEquals(10.0 / 12.0, costs.efficiencyRatio(), 1e-9);
    }

    @Test
    public void testResourceHotspots() {
        TaskGraph g = new TaskGraph("g");
        g.addNode(TaskNode.withDuration("cheap", 1)).addNode(TaskNode.withDuration("heavy", 50))
                .addNode(TaskNode.withDuration("mid", 10));
        List<ResourceHotspot> hot = new GraphAnalyzer(g).findResourceHotspots(2);
        assertEquals(2, hot.size());
        assertEquals("heavy", hot.get(0).nodeId());
        assertEquals(0.5, hot.get(0).totalCost(), 1e-9);
        assertEquals("mid", hot.get(1).nodeId());
    }

    @Test
    public void testQuality() {
        QualityReport q = new GraphAnalyzer(star()).checkGraphQuality();
        assertEquals(6, q.nodeCount());
        assertEquals(5, q.edgeCount());
        assertEquals(5, q.maxFanIn());
        assertEquals(1, q.maxFanOut());
        assertEquals(5, q.rootCount());
        assertEquals(1, q.leafCount());
        assertFalse(q.balanced());
        assertEquals(5.0 / 30.0, q.density(), 1e-9);
    }

    @Test
    public void testRedundancyDiamond() {
        // A -> B -> D, A -> C -> D: two paths for one root/leaf pair
        TaskGraph g = nodes("A", "B", "C", "D");
        g.addEdge("A", "B").addEdge("A", "C").addEdge("B", "D").addEdge("C", "D");
        assertEquals(1.0, new GraphAnalyzer(g).calculateRedundancyScore(), 0.0);
    }

    @Test
    public void testRedundancyChain() {
        TaskGraph g = nodes("A", "B");
        g.addEdge("A", "B");
        assertEquals(0.5, new GraphAnalyzer(g).calculateRedundancyScore(), 0.0);
        assertEquals(0.0, new GraphAnalyzer(nodes("A")).calculateRedundancyScore(), 0.0);
    }

    @Test
    public void testRedundancyCyclicWithinLimit() {
        // r -> a -> b -> l, b -data-> a closes a cycle
        TaskGraph g = nodes("r", "a", "b", "l");
        g.addEdge("r", "a").addEdge("a", "b").addEdge("b", "l");
        g.addEdge(new TaskEdge("b", "a", EdgeType.DATA_FLOW));
        assertEquals(0.5, new GraphAnalyzer(g).calculateRedundancyScore(), 0.0);
    }

    @Test
    public void testRedundancyCyclicOverLimitScoresZero() {
        TaskGraph g = nodes("r", "a", "b", "l");
        g.addEdge("r", "a").addEdge("a", "b").addEdge("b", "l");
        g.addEdge(new TaskEdge("b", "a", EdgeType.DATA_FLOW));
        AnalyzerConfig config = AnalyzerConfig.builder().redundancyNodeLimit(3).build();
        assertEquals(0.0, new GraphAnalyzer(g, config).calculateRedundancyScore(), 0.0);

        AnalyzerConfig tiny = AnalyzerConfig.builder().redundancyExplorationBudget(1).build();
        assertEquals(0.0, new GraphAnalyzer(g, tiny).calculateRedundancyScore(), 0.0);
    }

    @Test
    public void testRedundancyLargeDagIsFast() {
        // 60 stacked diamonds: 2^60 paths, counted without enumeration
        TaskGraph g = new TaskGraph("wide");
        g.addNode(new TaskNode("n0"));
        for (int i = 0; i < 60; i++) {
            g.addNode(new TaskNode("l" + i)).addNode(new TaskNode("r" + i)).addNode(new TaskNode("n" + (i + 1)));
            g.addEdge("n" + i, "l" + i).addEdge("n" + i, "r" + i);
            g.addEdge("l" + i, "n" + (i + 1)).addEdge("r" + i, "n" + (i + 1));
        }
        assertEquals(1.0, new GraphAnalyzer(g).calculateRedundancyScore(), 0.0);
    }

    @Test
    public void testReportAggregates() {
        TaskGraph g = star();
        AnalysisReport report = new GraphAnalyzer(g).getAnalysisReport();
        assertEquals("g", report.graphId());
        assertEquals(6, report.stats().nodeCount());
        assertEquals(1, report.bottlenecks().size());
        assertEquals(2, report.parallelStages().size());
        assertEquals(0.5, report.parallelizationIndex(), 1e-9);
        assertEquals(5, report.influentialNodes().size());
        assertTrue(report.cycles().isEmpty());
        assertEquals(2, report.criticalNodes().size());
    }

    @Test
    public void testConfigFromJson() {
        AnalyzerConfig config = AnalyzerConfig.fromResource("analyzer-test.json");
        assertEquals(2, config.getBottleneckThreshold());
        assertEquals(30, config.getPagerankIterations());
        assertEquals(3, config.getTopN());
        assertEquals(5, config.getHealthBottleneckThreshold());
        assertEquals(0.85, config.getDampingFactor(), 0.0);

        assertEquals(AnalyzerConfig.defaults(), AnalyzerConfig.fromResource("missing.json"));
    }
}
