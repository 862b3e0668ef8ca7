package com.planning.tdg;

import com.planning.tdg.analysis.AnalysisReport;
import com.planning.tdg.analysis.AnalyzerConfig;
import com.planning.tdg.analysis.GraphAnalyzer;
import com.planning.tdg.api.GraphListener;
import com.planning.tdg.dsl.GraphBuilder;
import com.planning.tdg.engine.TaskGraph;
import com.planning.tdg.io.WorkflowDefinition;
import com.planning.tdg.io.WorkflowParser;
import com.planning.tdg.monitor.GraphMonitor;
import com.planning.tdg.util.ExportFormat;
import com.planning.tdg.util.GraphExporter;
import com.planning.tdg.wiring.StatusFeed;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;

/**
 * A high-level wrapper that wires one task graph to its analyzer, exporter
 * and monitor.
 * <p>
 * This class handles:
 * <ul>
 * <li>Parsing JSON workflow definitions</li>
 * <li>Building the graph with {@link GraphBuilder} and the built-in cost
 * catalog</li>
 * <li>Sharing one {@link GraphAnalyzer} between reports, exports and
 * monitoring</li>
 * <li>Opening a {@link StatusFeed} for cross-thread status reporting</li>
 * </ul>
 */
public class TaskPlanner {
    private static final Logger log = LogManager.getLogger(TaskPlanner.class);

    private final TaskGraph graph;
    private final GraphAnalyzer analyzer;
    private final GraphExporter exporter;
    private final GraphMonitor monitor;

    /**
     * Creates a planner from a JSON workflow definition file.
     *
     * @param workflowPath Path to the workflow definition.
     */
    public TaskPlanner(Path workflowPath) {
        this(load(workflowPath), AnalyzerConfig.defaults());
    }

    public TaskPlanner(WorkflowDefinition definition, AnalyzerConfig config) {
        this(GraphBuilder.create().fromDefinition(definition), config);
    }

    public TaskPlanner(TaskGraph graph, AnalyzerConfig config) {
        this(graph, config, Clock.systemUTC());
    }

    public TaskPlanner(TaskGraph graph, AnalyzerConfig config, Clock clock) {
        this.graph = graph;
        this.analyzer = new GraphAnalyzer(graph, config);
        this.exporter = new GraphExporter(graph, analyzer);
        this.monitor = new GraphMonitor(graph, analyzer, clock);
        log.info("Planner ready for graph {} ({} nodes, {} edges)", graph.id(), graph.nodeCount(),
                graph.edgeCount());
    }

    private static WorkflowDefinition load(Path workflowPath) {
        try {
            return WorkflowParser.parseFile(workflowPath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load workflow definition from " + workflowPath, e);
        }
    }

    public TaskGraph graph() {
        return graph;
    }

    public GraphAnalyzer analyzer() {
        return analyzer;
    }

    public GraphExporter exporter() {
        return exporter;
    }

    public GraphMonitor monitor() {
        return monitor;
    }

    /**
     * Registers a listener for status transitions applied through the monitor.
     *
     * @param listener The listener to register.
     */
    public void addListener(GraphListener listener) {
        monitor.addListener(listener);
    }

    public AnalysisReport analyze() {
        return analyzer.getAnalysisReport();
    }

    public String export(ExportFormat format, boolean includeAnalysis) {
        return exporter.export(format, includeAnalysis);
    }

    /** Writes a Mermaid rendering of the graph next to other reports. */
    public Path writeMermaid(Path directory) {
        Path out = directory.resolve(graph.id() + "." + ExportFormat.MERMAID.extension());
        exporter.saveToFile(out, ExportFormat.MERMAID.name(), false);
        return out;
    }

    /**
     * Starts a status feed bound to this planner's monitor. Once it is open,
     * report status only through the feed until it is shut down.
     */
    public StatusFeed openStatusFeed(int bufferSize) {
        monitor.startMonitoring();
        StatusFeed feed = new StatusFeed(monitor, bufferSize);
        feed.start();
        return feed;
    }
}
