package com.planning.tdg.analysis;

import com.planning.tdg.engine.CostModel;
import com.planning.tdg.engine.CriticalPath;
import com.planning.tdg.engine.TaskGraph;
import com.planning.tdg.engine.TaskNode;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * GraphAnalyzer: read-mostly analytics over a {@link TaskGraph}.
 *
 * <p>
 * Computes cycles, bottlenecks, critical nodes, PageRank influence,
 * parallelization potential, path redundancy, cost totals and a composite
 * health score. Some analyses write derived values back onto the nodes
 * (influence score, parallelization factor, level, critical-path flag).
 *
 * <p>
 * Memoized results live in an {@link AnalysisCache} tagged with
 * {@link TaskGraph#version()}, so a structural change to the graph is never
 * answered from a stale entry. Analyses never throw for an empty or a cyclic
 * graph: order-dependent results come back empty or zero instead.
 *
 * <p>
 * Not thread-safe; use one analyzer per thread or guard externally.
 */
@Log4j2
public final class GraphAnalyzer {
    private final TaskGraph graph;
    private final AnalyzerConfig config;
    private final AnalysisCache cache = new AnalysisCache();

    public GraphAnalyzer(TaskGraph graph) {
        this(graph, AnalyzerConfig.defaults());
    }

    public GraphAnalyzer(TaskGraph graph, AnalyzerConfig config) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.config = Objects.requireNonNull(config, "config");
    }

    public TaskGraph graph() {
        return graph;
    }

    public AnalyzerConfig config() {
        return config;
    }

    /** Drops every memoized result regardless of graph version. */
    public void clearCache() {
        cache.clear();
    }

    AnalysisCache cache() {
        return cache;
    }

    // ---- Cycles ----

    private record Frame(String nodeId, Iterator<String> children) {
    }

    /**
     * Enumerates the cycles closed by DFS back edges. Each cycle is reported
     * closed: the slice of the DFS stack from the repeated node, followed by
     * that node again, e.g. {@code [a, b, c, a]}.
     */
    public List<List<String>> findAllCycles() {
        return cache.getOrCompute("cycles", graph.version(), () -> {
            List<List<String>> cycles = new ArrayList<>();
            Set<String> visited = new HashSet<>();
            List<String> path = new ArrayList<>();
            Set<String> onPath = new HashSet<>();
            Deque<Frame> stack = new ArrayDeque<>();

            for (String start : graph.nodeIds()) {
                if (!visited.add(start))
                    continue;
                path.add(start);
                onPath.add(start);
                stack.push(new Frame(start, graph.successors(start).iterator()));

                while (!stack.isEmpty()) {
                    Frame top = stack.peek();
                    if (top.children().hasNext()) {
                        String child = top.children().next();
                        if (visited.add(child)) {
                            path.add(child);
                            onPath.add(child);
                            stack.push(new Frame(child, graph.successors(child).iterator()));
                        } else if (onPath.contains(child)) {
                            List<String> cycle = new ArrayList<>(path.subList(path.indexOf(child), path.size()));
                            cycle.add(child);
                            cycles.add(Collections.unmodifiableList(cycle));
                        }
                    } else {
                        stack.pop();
                        path.remove(path.size() - 1);
                        onPath.remove(top.nodeId());
                    }
                }
            }
            log.info("Graph {}: found {} cycle(s)", graph.id(), cycles.size());
            return Collections.unmodifiableList(cycles);
        });
    }

    /** Every node that appears in some reported cycle. */
    public Set<String> findCycleNodes() {
        Set<String> result = new TreeSet<>();
        for (List<String> cycle : findAllCycles()) {
            result.addAll(cycle);
        }
        return result;
    }

    // ---- Bottlenecks & criticality ----

    public List<Bottleneck> findBottlenecks() {
        return findBottlenecks(config.getBottleneckThreshold());
    }

    /**
     * Nodes whose fan-in or fan-out is at least {@code threshold}, highest
     * score first, ties by node id.
     */
    public List<Bottleneck> findBottlenecks(int threshold) {
        return cache.getOrCompute("bottlenecks:" + threshold, graph.version(), () -> {
            List<Bottleneck> result = new ArrayList<>();
            for (TaskNode node : graph.getAllNodes()) {
                int fanIn = graph.predecessors(node.getId()).size();
                int fanOut = graph.successors(node.getId()).size();
                if (fanIn >= threshold || fanOut >= threshold) {
                    BottleneckKind kind = fanIn >= threshold ? BottleneckKind.CONVERGENCE : BottleneckKind.DIVERGENCE;
                    result.add(new Bottleneck(node.getId(), node.getName(), fanIn, fanOut, fanIn + fanOut, kind));
                }
            }
            result.sort(Comparator.comparingInt(Bottleneck::score).reversed()
                    .thenComparing(Bottleneck::nodeId));
            log.info("Graph {}: found {} bottleneck(s) at threshold {}", graph.id(), result.size(), threshold);
            return Collections.unmodifiableList(result);
        });
    }

    /** Ids on the critical path; empty for an empty or cyclic graph. */
    public List<String> findCriticalNodes() {
        return criticalPath().nodeIds();
    }

    private CriticalPath criticalPath() {
        if (graph.isEmpty() || graph.hasCycle())
            return CriticalPath.EMPTY;
        return graph.calculateCriticalPath();
    }

    /**
     * Per-node criticality in [0, 1]: 0.4 for lying on the critical path, plus
     * 0.3 weighted by dependent count and 0.3 weighted by total cost, each
     * relative to the graph maximum.
     */
    public Map<String, Double> calculateNodeCriticality() {
        Map<String, Double> result = new LinkedHashMap<>();
        if (graph.isEmpty())
            return result;

        Set<String> critical = new HashSet<>(findCriticalNodes());
        int maxDependents = 0;
        double maxCost = 0.0;
        for (TaskNode node : graph.getAllNodes()) {
            maxDependents = Math.max(maxDependents, graph.successors(node.getId()).size());
            maxCost = Math.max(maxCost, node.getCostModel().totalCost());
        }
        if (maxDependents == 0)
            maxDependents = 1;
        if (maxCost == 0.0)
            maxCost = 1.0;

        for (TaskNode node : graph.getAllNodes()) {
            double score = critical.contains(node.getId()) ? 0.4 : 0.0;
            score += 0.3 * graph.successors(node.getId()).size() / maxDependents;
            score += 0.3 * node.getCostModel().totalCost() / maxCost;
            result.put(node.getId(), Math.min(score, 1.0));
        }
        return result;
    }

    // ---- Influence ----

    public Map<String, Double> calculateInfluenceScores() {
        return calculateInfluenceScores(config.getPagerankIterations(), config.getDampingFactor());
    }

    /**
     * PageRank over the edge direction: rank flows from a dependency to its
     * dependents, each source sharing its rank equally over its distinct
     * successors. Scores are normalized so the maximum is 1.0 and written to
     * {@link TaskNode#setInfluenceScore(double)}.
     */
    public Map<String, Double> calculateInfluenceScores(int iterations, double damping) {
        return cache.getOrCompute("influence:" + iterations + ":" + damping, graph.version(), () -> {
            int n = graph.nodeCount();
            Map<String, Double> scores = new LinkedHashMap<>();
            if (n == 0)
                return Collections.unmodifiableMap(scores);

            for (String id : graph.nodeIds()) {
                scores.put(id, 1.0 / n);
            }
            for (int i = 0; i < iterations; i++) {
                Map<String, Double> next = new LinkedHashMap<>();
                for (String id : graph.nodeIds()) {
                    double rankSum = 0.0;
                    for (String source : graph.predecessors(id)) {
                        rankSum += scores.get(source) / graph.successors(source).size();
                    }
                    next.put(id, (1 - damping) / n + damping * rankSum);
                }
                scores = next;
            }

            double max = Collections.max(scores.values());
            if (max > 0) {
                for (Map.Entry<String, Double> e : scores.entrySet()) {
                    e.setValue(e.getValue() / max);
                }
            }
            for (Map.Entry<String, Double> e : scores.entrySet()) {
                graph.getNode(e.getKey()).setInfluenceScore(e.getValue());
            }
            log.info("Graph {}: calculated influence scores for {} node(s)", graph.id(), n);
            return Collections.unmodifiableMap(scores);
        });
    }

    public List<InfluenceRank> findMostInfluentialNodes() {
        return findMostInfluentialNodes(config.getTopN());
    }

    /** Highest influence first, ties by node id. */
    public List<InfluenceRank> findMostInfluentialNodes(int topN) {
        List<InfluenceRank> ranks = new ArrayList<>();
        for (Map.Entry<String, Double> e : calculateInfluenceScores().entrySet()) {
            ranks.add(new InfluenceRank(e.getKey(), e.getValue()));
        }
        ranks.sort(Comparator.comparingDouble(InfluenceRank::score).reversed()
                .thenComparing(InfluenceRank::nodeId));
        return List.copyOf(ranks.subList(0, Math.min(topN, ranks.size())));
    }

    // ---- Parallelization ----

    /**
     * Average nodes per level over node count: {@code 1 / levelCount}. 1.0 when
     * everything can run at once, approaching 0 for a long chain. 0.0 for an
     * empty or cyclic graph.
     */
    public double calculateParallelizationIndex() {
        int n = graph.nodeCount();
        if (n == 0 || graph.hasCycle())
            return 0.0;
        int levelCount = findParallelStages().size();
        double avgPerLevel = (double) n / levelCount;
        return Math.min(avgPerLevel / n, 1.0);
    }

    /** Level to the ids at that level; empty for a cyclic graph. */
    public SortedMap<Integer, List<String>> findParallelStages() {
        SortedMap<Integer, List<String>> stages = new TreeMap<>();
        if (graph.hasCycle())
            return stages;
        for (Map.Entry<String, Integer> e : graph.calculateNodeLevels().entrySet()) {
            stages.computeIfAbsent(e.getValue(), k -> new ArrayList<>()).add(e.getKey());
        }
        log.debug("Graph {}: {} parallel stage(s)", graph.id(), stages.size());
        return stages;
    }

    /**
     * Share of the graph that can run alongside each node:
     * {@code (nodesAtSameLevel - 1) / n}, 0 when there is at most one node.
     * Written to {@link TaskNode#setParallelizationFactor(double)}.
     */
    public Map<String, Double> calculateParallelizationFactors() {
        int n = graph.nodeCount();
        Map<String, Double> factors = new LinkedHashMap<>();
        for (List<String> stage : findParallelStages().values()) {
            double factor = n > 1 ? (stage.size() - 1) / (double) n : 0.0;
            for (String id : stage) {
                factors.put(id, factor);
                graph.getNode(id).setParallelizationFactor(factor);
            }
        }
        return factors;
    }

    // ---- Health & quality ----

    /**
     * Starts at 100 and deducts: 50 for any cycle; 10 per bottleneck at the
     * health threshold, at most 30; 10 for a non-empty graph with
     * parallelization index below 0.3; 5 per isolated node, at most 20, when
     * more than one node is isolated. Floors at 0.
     */
    public HealthReport calculateGraphHealth() {
        double score = 100.0;
        List<String> issues = new ArrayList<>();

        List<List<String>> cycles = findAllCycles();
        if (!cycles.isEmpty()) {
            score -= 50.0;
            issues.add("Contains " + cycles.size() + " cycles");
        }

        List<Bottleneck> bottlenecks = findBottlenecks(config.getHealthBottleneckThreshold());
        if (!bottlenecks.isEmpty()) {
            score -= Math.min(bottlenecks.size() * 10, 30);
            issues.add("Contains " + bottlenecks.size() + " bottlenecks");
        }

        double index = calculateParallelizationIndex();
        if (!graph.isEmpty() && index < 0.3) {
            score -= 10.0;
            issues.add("Low parallelization potential");
        }

        int isolated = 0;
        for (String id : graph.nodeIds()) {
            if (graph.predecessors(id).isEmpty() && graph.successors(id).isEmpty())
                isolated++;
        }
        if (isolated > 1) {
            score -= Math.min(isolated * 5, 20);
            issues.add("Contains " + isolated + " isolated nodes");
        }

        score = Math.max(score, 0.0);
        return new HealthReport(score, HealthStatus.forScore(score), issues, index, cycles.size(),
                bottlenecks.size(), isolated);
    }

    public QualityReport checkGraphQuality() {
        int n = graph.nodeCount();
        int e = graph.edgeCount();
        if (n == 0)
            return new QualityReport(0, e, 0.0, 0.0, 0, 0, 0, 0, true, 0.0);

        int sumIn = 0;
        int sumOut = 0;
        int maxIn = 0;
        int maxOut = 0;
        int roots = 0;
        int leaves = 0;
        for (String id : graph.nodeIds()) {
            int in = graph.predecessors(id).size();
            int out = graph.successors(id).size();
            sumIn += in;
            sumOut += out;
            maxIn = Math.max(maxIn, in);
            maxOut = Math.max(maxOut, out);
            if (in == 0)
                roots++;
            if (out == 0)
                leaves++;
        }
        double density = n > 1 ? (double) e / ((double) n * (n - 1)) : 0.0;
        return new QualityReport(n, e, (double) sumIn / n, (double) sumOut / n, maxIn, maxOut, roots, leaves,
                Math.abs(roots - leaves) <= 2, density);
    }

    // ---- Cost ----

    public CostSummary calculateTotalCost() {
        double duration = 0.0;
        double cost = 0.0;
        double cpu = 0.0;
        double memory = 0.0;
        long io = 0;
        for (TaskNode node : graph.getAllNodes()) {
            CostModel cm = node.getCostModel();
            duration += cm.getEstimatedDuration();
            cost += cm.getEstimatedCost();
            cpu += cm.getCpuUnits();
            memory += cm.getMemoryMb();
            io += cm.getIoOperations();
        }
        double critical = criticalPath().totalDuration();
        double efficiency = duration > 0 ? critical / duration : 0.0;
        return new CostSummary(duration, critical, cost, cpu, memory, io, efficiency);
    }

    public List<ResourceHotspot> findResourceHotspots() {
        return findResourceHotspots(config.getTopN());
    }

    /** Nodes by {@link CostModel#totalCost()}, highest first, ties by id. */
    public List<ResourceHotspot> findResourceHotspots(int topN) {
        List<ResourceHotspot> result = new ArrayList<>();
        for (TaskNode node : graph.getAllNodes()) {
            CostModel cm = node.getCostModel();
            result.add(new ResourceHotspot(node.getId(), node.getName(), cm.getEstimatedDuration(),
                    cm.getEstimatedCost(), cm.getCpuUnits(), cm.getMemoryMb(), cm.totalCost()));
        }
        result.sort(Comparator.comparingDouble(ResourceHotspot::totalCost).reversed()
                .thenComparing(ResourceHotspot::nodeId));
        return List.copyOf(result.subList(0, Math.min(topN, result.size())));
    }

    // ---- Redundancy ----

    /**
     * Ratio of distinct root-to-leaf paths to twice the number of root/leaf
     * pairs, capped at 1.0. An isolated node counts as one path to itself.
     *
     * <p>
     * On an acyclic graph the count is exact and linear: leaves are sinks, so
     * every maximal path from a root ends at exactly one leaf and the paths
     * can be counted once per node in reverse topological order. On a cyclic
     * graph simple paths are enumerated by DFS, only for graphs within
     * {@link AnalyzerConfig#getRedundancyNodeLimit()} nodes and within the
     * exploration budget; otherwise 0.0 is returned.
     */
    public double calculateRedundancyScore() {
        if (graph.nodeCount() < 2)
            return 0.0;
        List<TaskNode> roots = graph.getRootNodes();
        List<TaskNode> leaves = graph.getLeafNodes();
        if (roots.isEmpty() || leaves.isEmpty())
            return 0.0;

        double totalPaths;
        if (graph.hasCycle()) {
            OptionalLong counted = countPathsBounded(roots, leaves);
            if (counted.isEmpty())
                return 0.0;
            totalPaths = counted.getAsLong();
        } else {
            totalPaths = countPathsAcyclic(roots);
        }
        double possible = 2.0 * roots.size() * leaves.size();
        return Math.min(totalPaths / possible, 1.0);
    }

    private double countPathsAcyclic(List<TaskNode> roots) {
        List<String> order = graph.topologicalSort();
        Map<String, Double> pathsToLeaf = new HashMap<>();
        for (int i = order.size() - 1; i >= 0; i--) {
            String id = order.get(i);
            Set<String> succ = graph.successors(id);
            if (succ.isEmpty()) {
                pathsToLeaf.put(id, 1.0);
            } else {
                double sum = 0.0;
                for (String s : succ) {
                    sum += pathsToLeaf.get(s);
                }
                pathsToLeaf.put(id, sum);
            }
        }
        double total = 0.0;
        for (TaskNode root : roots) {
            total += pathsToLeaf.get(root.getId());
        }
        return total;
    }

    private OptionalLong countPathsBounded(List<TaskNode> roots, List<TaskNode> leaves) {
        if (graph.nodeCount() > config.getRedundancyNodeLimit()) {
            log.warn("Graph {}: cyclic graph of {} nodes exceeds redundancy node limit {}, scoring 0",
                    graph.id(), graph.nodeCount(), config.getRedundancyNodeLimit());
            return OptionalLong.empty();
        }
        long[] budget = { config.getRedundancyExplorationBudget() };
        long total = 0;
        for (TaskNode root : roots) {
            for (TaskNode leaf : leaves) {
                long paths = countSimplePaths(root.getId(), leaf.getId(), new HashSet<>(), budget);
                if (paths < 0) {
                    log.warn("Graph {}: redundancy exploration budget of {} exhausted, scoring 0",
                            graph.id(), config.getRedundancyExplorationBudget());
                    return OptionalLong.empty();
                }
                total += paths;
            }
        }
        return OptionalLong.of(total);
    }

    /** Simple paths from {@code from} to {@code to}, or -1 when the budget runs out. */
    private long countSimplePaths(String from, String to, Set<String> onPath, long[] budget) {
        Deque<Frame> stack = new ArrayDeque<>();
        long count = 0;
        if (from.equals(to))
            return 1;
        onPath.add(from);
        stack.push(new Frame(from, graph.successors(from).iterator()));
        while (!stack.isEmpty()) {
            if (--budget[0] < 0)
                return -1;
            Frame top = stack.peek();
            if (top.children().hasNext()) {
                String child = top.children().next();
                if (child.equals(to)) {
                    count++;
                } else if (onPath.add(child)) {
                    stack.push(new Frame(child, graph.successors(child).iterator()));
                }
            } else {
                onPath.remove(top.nodeId());
                stack.pop();
            }
        }
        return count;
    }

    // ---- Report ----

    public AnalysisReport getAnalysisReport() {
        AnalysisReport report = new AnalysisReport(
                graph.id(),
                graph.getStats(),
                calculateGraphHealth(),
                checkGraphQuality(),
                calculateTotalCost(),
                findBottlenecks(),
                findCriticalNodes(),
                findMostInfluentialNodes(),
                findResourceHotspots(),
                findParallelStages(),
                calculateParallelizationIndex(),
                calculateRedundancyScore(),
                findAllCycles());
        log.info("Graph {}: analysis report health={} ({})", graph.id(), report.health().score(),
                report.health().status().wireValue());
        return report;
    }
}
