package com.planning.tdg.util;

import com.planning.tdg.analysis.AnalysisReport;
import com.planning.tdg.analysis.Bottleneck;
import com.planning.tdg.analysis.CostSummary;
import com.planning.tdg.analysis.GraphAnalyzer;
import com.planning.tdg.analysis.HealthReport;
import com.planning.tdg.api.EdgeType;
import com.planning.tdg.api.NodeStatus;
import com.planning.tdg.engine.CriticalPath;
import com.planning.tdg.engine.GraphStats;
import com.planning.tdg.engine.TaskEdge;
import com.planning.tdg.engine.TaskGraph;
import com.planning.tdg.engine.TaskNode;
import com.planning.tdg.io.GraphCodec;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.JsonProcessingException;

import lombok.extern.log4j.Log4j2;

/**
 * Renders a graph, optionally with its analysis report, as text.
 *
 * <p>
 * JSON, DOT, Markdown, Mermaid and a YAML-like outline are supported. Output
 * is deterministic: nodes and edges appear in insertion order.
 *
 * <p>
 * <b>Usage:</b> intended for reports and diagnostics. Rendering with analysis
 * runs the analyzer and therefore writes derived fields onto the nodes.
 */
@Log4j2
public final class GraphExporter {
    private static final Pattern PLAIN_SCALAR = Pattern.compile("[A-Za-z_][A-Za-z0-9_./-]*");
    private static final Set<String> RESERVED_WORDS = Set.of("true", "false", "null", "yes", "no", "on", "off",
            "y", "n");

    private final TaskGraph graph;
    private GraphAnalyzer analyzer;

    public GraphExporter(TaskGraph graph) {
        this(graph, null);
    }

    public GraphExporter(TaskGraph graph, GraphAnalyzer analyzer) {
        this.graph = graph;
        this.analyzer = analyzer;
    }

    private GraphAnalyzer analyzer() {
        if (analyzer == null)
            analyzer = new GraphAnalyzer(graph);
        return analyzer;
    }

    // ── JSON ─────────────────────────────────────────────────────

    /** The serialized graph document, plus an {@code analysis} entry when asked. */
    public String exportJson(boolean includeAnalysis) {
        Map<String, Object> data = GraphCodec.toMap(graph);
        if (includeAnalysis)
            data.put("analysis", analyzer().getAnalysisReport());
        try {
            return GraphCodec.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render graph " + graph.id() + " as JSON", e);
        }
    }

    // ── DOT ──────────────────────────────────────────────────────

    /**
     * GraphViz digraph. Nodes are filled by status and drawn bold when on the
     * critical path; edge style follows the edge type.
     */
    public String exportDot(boolean includeLabels) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("digraph TaskGraph {\n");
        sb.append("  label=\"").append(escape(graph.id())).append("\";\n");
        sb.append("  rankdir=TB;\n");
        sb.append("  node [shape=box];\n\n");

        for (TaskNode node : graph.getAllNodes()) {
            String label = escape(node.getName());
            if (includeLabels) {
                label += "\\n[" + escape(node.getNodeType()) + "]"
                        + "\\nPri: " + node.getPriority()
                        + "\\n" + node.getCostModel().getEstimatedDuration() + "s";
            }
            String style = node.isOnCriticalPath() ? "filled,bold" : "filled";
            sb.append("  \"").append(escape(node.getId())).append("\" [label=\"").append(label)
                    .append("\", fillcolor=").append(statusColor(node.getStatus()))
                    .append(", style=\"").append(style).append("\"];\n");
        }
        sb.append('\n');

        for (TaskEdge edge : graph.getEdges()) {
            sb.append("  \"").append(escape(edge.sourceId())).append("\" -> \"").append(escape(edge.targetId()))
                    .append("\" [style=").append(edgeStyle(edge.edgeType()));
            if (edge.weight() != 1.0)
                sb.append(", label=\"").append(edge.weight()).append('"');
            sb.append("];\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    static String statusColor(NodeStatus status) {
        return switch (status) {
            case PENDING -> "lightgray";
            case READY -> "lightblue";
            case RUNNING -> "yellow";
            case COMPLETED -> "lightgreen";
            case FAILED -> "red";
            case CANCELLED -> "orange";
            case BLOCKED -> "pink";
        };
    }

    static String edgeStyle(EdgeType type) {
        return switch (type) {
            case DEPENDENCY -> "solid";
            case CONSTRAINT, CONDITIONAL -> "dashed";
            case DATA_FLOW, WEAK -> "dotted";
        };
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    // ── Markdown ─────────────────────────────────────────────────

    public String exportMarkdown(boolean includeAnalysis) {
        StringBuilder sb = new StringBuilder(2048);
        sb.append("# TaskGraph: ").append(graph.id()).append("\n\n");

        GraphStats stats = graph.getStats();
        sb.append("## Statistics\n");
        sb.append("- **Nodes**: ").append(stats.nodeCount()).append('\n');
        sb.append("- **Edges**: ").append(stats.edgeCount()).append('\n');
        sb.append("- **Root Nodes**: ").append(stats.rootCount()).append('\n');
        sb.append("- **Leaf Nodes**: ").append(stats.leafCount()).append('\n');
        sb.append("- **Is Acyclic**: ").append(stats.acyclic()).append("\n\n");

        sb.append("## Nodes\n\n");
        sb.append("| Node ID | Name | Type | Priority | Status | Duration |\n");
        sb.append("|---------|------|------|----------|--------|----------|\n");
        for (TaskNode node : graph.getAllNodes()) {
            sb.append("| ").append(node.getId()).append(" | ").append(node.getName()).append(" | ")
                    .append(node.getNodeType()).append(" | ").append(node.getPriority()).append(" | ")
                    .append(node.getStatus().wireValue()).append(" | ")
                    .append(node.getCostModel().getEstimatedDuration()).append("s |\n");
        }
        sb.append('\n');

        sb.append("## Edges\n\n");
        sb.append("| Source | Target | Type | Weight |\n");
        sb.append("|--------|--------|------|--------|\n");
        for (TaskEdge edge : graph.getEdges()) {
            sb.append("| ").append(edge.sourceId()).append(" | ").append(edge.targetId()).append(" | ")
                    .append(edge.edgeType().wireValue()).append(" | ").append(edge.weight()).append(" |\n");
        }
        sb.append('\n');

        sb.append("## Critical Path\n");
        if (stats.acyclic()) {
            CriticalPath path = graph.calculateCriticalPath();
            sb.append("**Duration**: ").append(fmt2(path.totalDuration())).append("s\n\n");
            sb.append("```\n").append(String.join(" -> ", path.nodeIds())).append("\n```\n\n");
        } else {
            sb.append("_Not available: graph contains cycles._\n\n");
        }

        if (includeAnalysis)
            appendAnalysisMarkdown(sb, analyzer().getAnalysisReport());
        return sb.toString();
    }

    private static void appendAnalysisMarkdown(StringBuilder sb, AnalysisReport report) {
        sb.append("## Analysis\n\n");

        HealthReport health = report.health();
        sb.append("### Health: ").append(health.status().name()).append(" (")
                .append(String.format(Locale.ROOT, "%.1f", health.score())).append("/100)\n");
        if (!health.issues().isEmpty()) {
            sb.append("**Issues:**\n");
            for (String issue : health.issues()) {
                sb.append("- ").append(issue).append('\n');
            }
        }
        sb.append('\n');

        CostSummary costs = report.costs();
        sb.append("### Resource Costs\n");
        sb.append("- **Sequential Duration**: ").append(fmt2(costs.sequentialDuration())).append("s\n");
        sb.append("- **Critical Path Duration**: ").append(fmt2(costs.criticalPathDuration())).append("s\n");
        sb.append("- **Total Cost**: $").append(fmt2(costs.totalCost())).append('\n');
        sb.append("- **Efficiency Ratio**: ").append(fmt2(costs.efficiencyRatio() * 100)).append("%\n\n");

        List<Bottleneck> bottlenecks = report.bottlenecks();
        if (!bottlenecks.isEmpty()) {
            sb.append("### Bottlenecks\n");
            for (Bottleneck b : bottlenecks.subList(0, Math.min(3, bottlenecks.size()))) {
                sb.append("- **").append(b.nodeName()).append("**: ").append(b.kind().wireValue())
                        .append(" (fan-in: ").append(b.fanIn()).append(", fan-out: ").append(b.fanOut())
                        .append(")\n");
            }
            sb.append('\n');
        }
    }

    private static String fmt2(double v) {
        return String.format(Locale.ROOT, "%.2f", v);
    }

    // ── Mermaid ──────────────────────────────────────────────────

    /**
     * Mermaid flowchart, suitable for embedding in Markdown. Critical-path
     * nodes get the {@code critical} class.
     */
    public String exportMermaid() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("graph TD;\n");

        Map<String, String> ids = mermaidIds();

        // 1. Declare nodes in insertion order
        for (TaskNode node : graph.getAllNodes()) {
            sb.append("  ").append(ids.get(node.getId())).append("[\"").append(node.getName().replace("\"", "'"))
                    .append("<br/>").append(node.getNodeType())
                    .append("<br/>").append(node.getCostModel().getEstimatedDuration()).append("s\"]");
            if (node.isOnCriticalPath())
                sb.append(":::critical");
            sb.append(";\n");
        }

        // 2. Declare all edges afterwards
        for (TaskEdge edge : graph.getEdges()) {
            sb.append("  ").append(ids.get(edge.sourceId()));
            if (edge.edgeType() == EdgeType.DEPENDENCY)
                sb.append(" --> ");
            else
                sb.append(" -. \"").append(edge.edgeType().wireValue()).append("\" .-> ");
            sb.append(ids.get(edge.targetId())).append(";\n");
        }
        sb.append("  classDef critical stroke-width:3px,stroke:#d33;\n");
        return sb.toString();
    }

    /** Node id to a unique Mermaid id; ids that sanitize alike get a numeric suffix. */
    private Map<String, String> mermaidIds() {
        Map<String, String> ids = new LinkedHashMap<>();
        Set<String> used = new HashSet<>();
        for (String nodeId : graph.nodeIds()) {
            String base = sanitize(nodeId);
            String candidate = base;
            for (int n = 2; !used.add(candidate); n++) {
                candidate = base + "_" + n;
            }
            ids.put(nodeId, candidate);
        }
        return ids;
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }

    // ── YAML ─────────────────────────────────────────────────────

    /**
     * A YAML outline of the graph. Strings that are not safe as plain scalars
     * are written double-quoted, and collection values in JSON flow style;
     * both are valid YAML.
     */
    public String exportYaml(boolean includeAnalysis) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("graph_id: ").append(yamlScalar(graph.id())).append('\n');
        if (!graph.metadata().isEmpty()) {
            sb.append("metadata:\n");
            graph.metadata().forEach((k, v) -> sb.append("  ").append(yamlScalar(k)).append(": ")
                    .append(yamlScalar(v)).append('\n'));
        }

        sb.append("node_count: ").append(graph.nodeCount()).append('\n');
        sb.append("nodes:\n");
        for (TaskNode node : graph.getAllNodes()) {
            sb.append("  ").append(yamlScalar(node.getId())).append(":\n");
            sb.append("    name: ").append(yamlScalar(node.getName())).append('\n');
            sb.append("    type: ").append(yamlScalar(node.getNodeType())).append('\n');
            sb.append("    priority: ").append(node.getPriority()).append('\n');
            sb.append("    status: ").append(node.getStatus().wireValue()).append('\n');
        }

        sb.append("edge_count: ").append(graph.edgeCount()).append('\n');
        sb.append("edges:\n");
        for (TaskEdge edge : graph.getEdges()) {
            sb.append("  - source: ").append(yamlScalar(edge.sourceId())).append('\n');
            sb.append("    target: ").append(yamlScalar(edge.targetId())).append('\n');
            sb.append("    type: ").append(edge.edgeType().wireValue()).append('\n');
            sb.append("    weight: ").append(edge.weight()).append('\n');
        }

        if (includeAnalysis) {
            AnalysisReport report = analyzer().getAnalysisReport();
            sb.append("analysis:\n");
            sb.append("  health_score: ").append(report.health().score()).append('\n');
            sb.append("  status: ").append(report.health().status().wireValue()).append('\n');
            sb.append("  parallelization_index: ").append(report.parallelizationIndex()).append('\n');
            sb.append("  redundancy_score: ").append(report.redundancyScore()).append('\n');
            sb.append("  critical_nodes: ").append(yamlScalar(report.criticalNodes())).append('\n');
        }
        return sb.toString();
    }

    static String yamlScalar(Object value) {
        if (value == null)
            return "null";
        if (value instanceof Number || value instanceof Boolean)
            return value.toString();
        if (value instanceof String) {
            String text = (String) value;
            if (PLAIN_SCALAR.matcher(text).matches() && !RESERVED_WORDS.contains(text.toLowerCase(Locale.ROOT)))
                return text;
        }
        try {
            return GraphCodec.mapper().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render YAML value for graph export", e);
        }
    }

    // ── Dispatch ─────────────────────────────────────────────────

    public String export(ExportFormat format, boolean includeAnalysis) {
        return switch (format) {
            case JSON -> exportJson(includeAnalysis);
            case DOT -> exportDot(true);
            case MARKDOWN -> exportMarkdown(includeAnalysis);
            case MERMAID -> exportMermaid();
            case YAML -> exportYaml(includeAnalysis);
        };
    }

    /** @throws IllegalArgumentException for an unknown format name. */
    public String export(String format, boolean includeAnalysis) {
        return export(ExportFormat.fromString(format), includeAnalysis);
    }

    /** Renders with the full analysis; only formats that can carry it are accepted. */
    public String exportWithAnalysis(ExportFormat format) {
        if (!format.supportsAnalysis())
            throw new IllegalArgumentException("Format " + format + " doesn't support analysis inclusion");
        return export(format, true);
    }

    /** Renders and writes to {@code path}, creating parent directories. */
    public void saveToFile(Path path, String format, boolean includeAnalysis) {
        String content = export(format, includeAnalysis);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null)
                Files.createDirectories(parent);
            Files.writeString(path, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + path, e);
        }
        log.info("Exported graph {} to {} ({} format)", graph.id(), path, format);
    }
}
