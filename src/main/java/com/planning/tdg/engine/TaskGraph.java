package com.planning.tdg.engine;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * TaskGraph: mutable directed acyclic graph of {@link TaskNode}s.
 *
 * <p>
 * The graph keeps four mirrored views of its structure:
 * <ul>
 * <li><b>edges:</b> every {@link TaskEdge} in insertion order (parallel edges
 * between the same pair are allowed).</li>
 * <li><b>adjacency:</b> node id to the sorted set of successor ids.</li>
 * <li><b>reverseAdjacency:</b> node id to the sorted set of predecessor
 * ids.</li>
 * <li><b>node sets:</b> each node's dependency and dependent sets, equal to
 * its reverse and forward adjacency.</li>
 * </ul>
 * Every public mutation keeps these views consistent on return, including when
 * it throws.
 *
 * <h3>Acyclicity</h3>
 * Inserting a DEPENDENCY or CONSTRAINT edge runs a cycle check over the whole
 * adjacency. If the edge closes a cycle it is rolled back and a
 * {@link CycleException} is thrown. DATA_FLOW, CONDITIONAL and WEAK edges are
 * accepted without a check, so a graph holding only those may contain cycles;
 * {@link #hasCycle()} and {@link #validate()} still report them.
 *
 * <h3>Versioning</h3>
 * {@link #version()} increases on every successful structural mutation.
 * The topological order is cached against it; analyzers key their caches on
 * it too. Changes made directly to a node's cost model or status are not
 * structural and do not bump the version.
 *
 * <p>
 * Not thread-safe.
 */
@Log4j2
public final class TaskGraph {
    public static final String DEFAULT_ID = "default";

    private final String id;
    private final Map<String, Object> metadata;

    private final Map<String, TaskNode> nodes = new LinkedHashMap<>();
    private final List<TaskEdge> edges = new ArrayList<>();
    private final Map<String, SortedSet<String>> adjacency = new HashMap<>();
    private final Map<String, SortedSet<String>> reverseAdjacency = new HashMap<>();

    private long version;
    private long topoVersion = -1;
    private List<String> topoCache;

    public TaskGraph() {
        this(DEFAULT_ID);
    }

    public TaskGraph(String id) {
        this(id, null);
    }

    public TaskGraph(String id, Map<String, Object> metadata) {
        this.id = id != null ? id : DEFAULT_ID;
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
    }

    public String id() {
        return id;
    }

    /** Live view. */
    public Map<String, Object> metadata() {
        return metadata;
    }

    public long version() {
        return version;
    }

    // ---- Mutation ----

    public TaskGraph addNode(TaskNode node) {
        Objects.requireNonNull(node, "node");
        if (nodes.containsKey(node.getId()))
            throw new DuplicateNodeException(node.getId());
        nodes.put(node.getId(), node);
        adjacency.put(node.getId(), new TreeSet<>());
        reverseAdjacency.put(node.getId(), new TreeSet<>());
        version++;
        log.debug("Graph {}: added node {}", id, node.getId());
        return this;
    }

    /**
     * Removes a node together with every edge touching it.
     *
     * @return the removed node, detached from its former neighbours.
     */
    public TaskNode removeNode(String nodeId) {
        TaskNode node = requireNode(nodeId);

        for (String pred : reverseAdjacency.get(nodeId)) {
            adjacency.get(pred).remove(nodeId);
            nodes.get(pred).dependentSet().remove(nodeId);
        }
        for (String succ : adjacency.get(nodeId)) {
            reverseAdjacency.get(succ).remove(nodeId);
            nodes.get(succ).dependencySet().remove(nodeId);
        }
        int before = edges.size();
        edges.removeIf(e -> e.touches(nodeId));

        adjacency.remove(nodeId);
        reverseAdjacency.remove(nodeId);
        nodes.remove(nodeId);
        node.dependencySet().clear();
        node.dependentSet().clear();

        version++;
        log.debug("Graph {}: removed node {} and {} edge(s)", id, nodeId, before - edges.size());
        return node;
    }

    /**
     * Adds an edge. The edge is committed tentatively to all views; if its type
     * is cycle-significant and the graph now has a cycle, exactly the entries
     * this call introduced are rolled back.
     *
     * @throws NodeNotFoundException if either endpoint is missing.
     * @throws SelfLoopException     if source and target are the same node.
     * @throws CycleException        if the edge would close a cycle.
     */
    public TaskGraph addEdge(TaskEdge edge) {
        Objects.requireNonNull(edge, "edge");
        String s = edge.sourceId();
        String t = edge.targetId();
        if (!nodes.containsKey(s))
            throw new NodeNotFoundException(s, "Source node " + s + " not found");
        if (!nodes.containsKey(t))
            throw new NodeNotFoundException(t, "Target node " + t + " not found");
        if (s.equals(t))
            throw new SelfLoopException(s);

        TaskNode source = nodes.get(s);
        TaskNode target = nodes.get(t);

        edges.add(edge);
        boolean newForward = adjacency.get(s).add(t);
        boolean newReverse = reverseAdjacency.get(t).add(s);
        boolean newDependency = target.dependencySet().add(s);
        boolean newDependent = source.dependentSet().add(t);

        if (edge.isCycleSignificant()) {
            boolean cyclic;
            try {
                cyclic = hasCycle();
            } catch (RuntimeException e) {
                rollback(edge, newForward, newReverse, newDependency, newDependent);
                throw e;
            }
            if (cyclic) {
                rollback(edge, newForward, newReverse, newDependency, newDependent);
                log.debug("Graph {}: rejected {} (cycle)", id, edge);
                throw new CycleException(s, t);
            }
        }

        version++;
        log.debug("Graph {}: added edge {}", id, edge);
        return this;
    }

    /** Convenience for a plain DEPENDENCY edge. */
    public TaskGraph addEdge(String sourceId, String targetId) {
        return addEdge(new TaskEdge(sourceId, targetId));
    }

    private void rollback(TaskEdge edge, boolean forward, boolean reverse, boolean dependency, boolean dependent) {
        String s = edge.sourceId();
        String t = edge.targetId();
        // Remove this exact instance; an equal earlier edge must survive.
        for (int i = edges.size() - 1; i >= 0; i--) {
            if (edges.get(i) == edge) {
                edges.remove(i);
                break;
            }
        }
        if (forward)
            adjacency.get(s).remove(t);
        if (reverse)
            reverseAdjacency.get(t).remove(s);
        if (dependency)
            nodes.get(t).dependencySet().remove(s);
        if (dependent)
            nodes.get(s).dependentSet().remove(t);
    }

    /**
     * Removes every edge from {@code sourceId} to {@code targetId}.
     *
     * @return the number of edges removed; 0 leaves the graph untouched.
     */
    public int removeEdge(String sourceId, String targetId) {
        int before = edges.size();
        edges.removeIf(e -> e.connects(sourceId, targetId));
        int removed = before - edges.size();
        if (removed == 0)
            return 0;

        adjacency.get(sourceId).remove(targetId);
        reverseAdjacency.get(targetId).remove(sourceId);
        nodes.get(targetId).dependencySet().remove(sourceId);
        nodes.get(sourceId).dependentSet().remove(targetId);
        version++;
        log.debug("Graph {}: removed {} edge(s) {} -> {}", id, removed, sourceId, targetId);
        return removed;
    }

    // ---- Queries ----

    public TaskNode getNode(String nodeId) {
        return requireNode(nodeId);
    }

    public Optional<TaskNode> findNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public boolean hasNode(String nodeId) {
        return nodes.containsKey(nodeId);
    }

    /** All nodes in insertion order. */
    public Collection<TaskNode> getAllNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    /** Node ids in insertion order. */
    public Set<String> nodeIds() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    /** All edges in insertion order. */
    public List<TaskEdge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    public List<TaskEdge> getEdgesFrom(String nodeId) {
        requireNode(nodeId);
        List<TaskEdge> out = new ArrayList<>();
        for (TaskEdge e : edges) {
            if (e.sourceId().equals(nodeId))
                out.add(e);
        }
        return out;
    }

    public List<TaskEdge> getEdgesTo(String nodeId) {
        requireNode(nodeId);
        List<TaskEdge> out = new ArrayList<>();
        for (TaskEdge e : edges) {
            if (e.targetId().equals(nodeId))
                out.add(e);
        }
        return out;
    }

    public boolean hasEdge(String sourceId, String targetId) {
        SortedSet<String> succ = adjacency.get(sourceId);
        return succ != null && succ.contains(targetId);
    }

    public SortedSet<String> successors(String nodeId) {
        requireNode(nodeId);
        return Collections.unmodifiableSortedSet(adjacency.get(nodeId));
    }

    public SortedSet<String> predecessors(String nodeId) {
        requireNode(nodeId);
        return Collections.unmodifiableSortedSet(reverseAdjacency.get(nodeId));
    }

    /** Nodes with no dependencies, in insertion order. */
    public List<TaskNode> getRootNodes() {
        List<TaskNode> roots = new ArrayList<>();
        for (TaskNode n : nodes.values()) {
            if (reverseAdjacency.get(n.getId()).isEmpty())
                roots.add(n);
        }
        return roots;
    }

    /** Nodes with no dependents, in insertion order. */
    public List<TaskNode> getLeafNodes() {
        List<TaskNode> leaves = new ArrayList<>();
        for (TaskNode n : nodes.values()) {
            if (adjacency.get(n.getId()).isEmpty())
                leaves.add(n);
        }
        return leaves;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public GraphStats getStats() {
        return new GraphStats(id, nodes.size(), edges.size(), getRootNodes().size(), getLeafNodes().size(),
                isAcyclic());
    }

    private TaskNode requireNode(String nodeId) {
        TaskNode node = nodes.get(nodeId);
        if (node == null)
            throw new NodeNotFoundException(nodeId);
        return node;
    }

    // ---- Algorithms ----

    private record Frame(String nodeId, Iterator<String> children) {
    }

    /**
     * Iterative depth-first search over the full adjacency, regardless of edge
     * type. A successor found on the current DFS stack is a back edge.
     */
    public boolean hasCycle() {
        Set<String> visited = new HashSet<>();
        Set<String> onStack = new HashSet<>();
        Deque<Frame> stack = new ArrayDeque<>();

        for (String start : nodes.keySet()) {
            if (visited.contains(start))
                continue;
            visited.add(start);
            onStack.add(start);
            stack.push(new Frame(start, adjacency.get(start).iterator()));

            while (!stack.isEmpty()) {
                Frame top = stack.peek();
                if (top.children().hasNext()) {
                    String child = top.children().next();
                    if (onStack.contains(child))
                        return true;
                    if (visited.add(child)) {
                        onStack.add(child);
                        stack.push(new Frame(child, adjacency.get(child).iterator()));
                    }
                } else {
                    onStack.remove(top.nodeId());
                    stack.pop();
                }
            }
        }
        return false;
    }

    public boolean isAcyclic() {
        return !hasCycle();
    }

    /**
     * Kahn's algorithm. Zero in-degree nodes are seeded in insertion order and
     * successors are released in sorted id order, so the result is
     * deterministic for a given graph.
     *
     * @return node ids, every dependency before its dependents.
     * @throws GraphValidationException if the graph contains a cycle.
     */
    public List<String> topologicalSort() {
        if (topoCache != null && topoVersion == version)
            return topoCache;

        Map<String, Integer> inDegree = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        for (String nodeId : nodes.keySet()) {
            int deg = reverseAdjacency.get(nodeId).size();
            inDegree.put(nodeId, deg);
            if (deg == 0)
                queue.add(nodeId);
        }

        List<String> order = new ArrayList<>(nodes.size());
        while (!queue.isEmpty()) {
            String current = queue.poll();
            order.add(current);
            for (String child : adjacency.get(current)) {
                int deg = inDegree.merge(child, -1, Integer::sum);
                if (deg == 0)
                    queue.add(child);
            }
        }

        if (order.size() != nodes.size()) {
            List<String> remaining = new ArrayList<>();
            for (String nodeId : nodes.keySet()) {
                if (inDegree.get(nodeId) > 0)
                    remaining.add(nodeId);
            }
            throw new GraphValidationException("Cycle detected! Nodes involved: " + remaining);
        }

        topoCache = Collections.unmodifiableList(order);
        topoVersion = version;
        return topoCache;
    }

    /**
     * Assigns each node its level: 0 for roots, otherwise one more than the
     * deepest dependency. Written to {@link TaskNode#setLevel(Integer)}.
     *
     * @return node id to level, in topological order.
     */
    public Map<String, Integer> calculateNodeLevels() {
        Map<String, Integer> levels = new LinkedHashMap<>();
        for (String nodeId : topologicalSort()) {
            int level = 0;
            for (String dep : reverseAdjacency.get(nodeId)) {
                level = Math.max(level, levels.get(dep) + 1);
            }
            levels.put(nodeId, level);
            nodes.get(nodeId).setLevel(level);
        }
        return levels;
    }

    /**
     * Critical-path method forward pass. A node's finish time is its own
     * estimated duration plus the latest finish among its dependencies. The
     * path ends at the node with the latest finish and is walked back through
     * predecessors; ties on either choice go to the lowest node id.
     *
     * <p>
     * Clears every node's critical-path flag, then sets it on the path nodes.
     */
    public CriticalPath calculateCriticalPath() {
        for (TaskNode n : nodes.values()) {
            n.setOnCriticalPath(false);
        }
        if (nodes.isEmpty())
            return CriticalPath.EMPTY;

        Map<String, Double> finish = new HashMap<>();
        Map<String, String> pred = new HashMap<>();
        for (String nodeId : topologicalSort()) {
            double start = 0.0;
            String best = null;
            for (String dep : reverseAdjacency.get(nodeId)) {
                double f = finish.get(dep);
                if (best == null || f > start) {
                    start = f;
                    best = dep;
                }
            }
            finish.put(nodeId, start + nodes.get(nodeId).getCostModel().getEstimatedDuration());
            if (best != null)
                pred.put(nodeId, best);
        }

        String end = null;
        double total = 0.0;
        for (String nodeId : new TreeSet<>(nodes.keySet())) {
            double f = finish.get(nodeId);
            if (end == null || f > total) {
                end = nodeId;
                total = f;
            }
        }

        LinkedList<String> path = new LinkedList<>();
        for (String cur = end; cur != null; cur = pred.get(cur)) {
            path.addFirst(cur);
            nodes.get(cur).setOnCriticalPath(true);
        }
        return new CriticalPath(path, total);
    }

    /**
     * Checks structural consistency: cycles, edges whose endpoints are not in
     * the graph, and disagreement between node dependency sets and the
     * adjacency indices in either direction.
     */
    public ValidationResult validate() {
        List<String> errors = new ArrayList<>();

        if (hasCycle())
            errors.add("Graph contains cycles");

        for (TaskEdge e : edges) {
            if (!nodes.containsKey(e.sourceId()))
                errors.add("Edge source " + e.sourceId() + " not found");
            if (!nodes.containsKey(e.targetId()))
                errors.add("Edge target " + e.targetId() + " not found");
        }

        for (TaskNode n : nodes.values()) {
            String nodeId = n.getId();
            SortedSet<String> preds = reverseAdjacency.get(nodeId);
            SortedSet<String> succs = adjacency.get(nodeId);

            for (String dep : n.dependencySet()) {
                if (!preds.contains(dep))
                    errors.add("Node " + nodeId + " lists dependency " + dep + " without a matching edge");
            }
            for (String dep : preds) {
                if (!n.dependencySet().contains(dep))
                    errors.add("Edge " + dep + " -> " + nodeId + " missing from dependencies of " + nodeId);
            }
            for (String child : n.dependentSet()) {
                if (!succs.contains(child))
                    errors.add("Node " + nodeId + " lists dependent " + child + " without a matching edge");
            }
            for (String child : succs) {
                if (!n.dependentSet().contains(child))
                    errors.add("Edge " + nodeId + " -> " + child + " missing from dependents of " + nodeId);
            }
        }

        return ValidationResult.of(errors);
    }

    /** @throws GraphValidationException carrying every error found by {@link #validate()}. */
    public void validateOrThrow() {
        ValidationResult result = validate();
        if (!result.valid())
            throw new GraphValidationException("Graph " + id + " is invalid: " + result.errors(), result.errors());
    }

    @Override
    public String toString() {
        return "TaskGraph{" + id + ", nodes=" + nodes.size() + ", edges=" + edges.size() + "}";
    }
}
