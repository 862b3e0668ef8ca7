package com.planning.tdg.io;

import com.planning.tdg.engine.TaskEdge;
import com.planning.tdg.engine.TaskGraph;
import com.planning.tdg.engine.TaskNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import lombok.extern.log4j.Log4j2;

/**
 * Converts between {@link TaskGraph} and its {@link GraphDocument} form, and
 * from there to plain maps or JSON text.
 *
 * <p>
 * Restoring replays the document through the graph's public API: nodes first,
 * then edges, both in document order. Every invariant is therefore re-checked,
 * and a document describing a cycle of dependency edges is rejected with the
 * same {@code CycleException} the API would throw. Status, timing and derived
 * fields are copied after the structure is rebuilt.
 */
@Log4j2
public final class GraphCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private GraphCodec() {
        // Utility class
    }

    /** Shared mapper, configured for the wire format. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static GraphDocument toDocument(TaskGraph graph) {
        GraphDocument doc = new GraphDocument();
        doc.setGraphId(graph.id());
        doc.setMetadata(new LinkedHashMap<>(graph.metadata()));

        for (TaskNode node : graph.getAllNodes()) {
            GraphDocument.NodeDoc nd = new GraphDocument.NodeDoc();
            nd.setNodeId(node.getId());
            nd.setName(node.getName());
            nd.setNodeType(node.getNodeType());
            nd.setPriority(node.getPriority());
            nd.setStatus(node.getStatus());
            nd.setCostModel(node.getCostModel().copy());
            nd.setMetadata(new LinkedHashMap<>(node.getMetadata()));
            nd.setDependencies(new ArrayList<>(node.getDependencies()));
            nd.setDependents(new ArrayList<>(node.getDependents()));
            nd.setLevel(node.getLevel());
            nd.setCriticalPath(node.isOnCriticalPath());
            nd.setInfluenceScore(node.getInfluenceScore());
            nd.setParallelizationFactor(node.getParallelizationFactor());
            nd.setStartTime(node.getStartTime());
            nd.setEndTime(node.getEndTime());
            nd.setActualDuration(node.getActualDuration());
            nd.setErrorMessage(node.getErrorMessage());
            doc.getNodes().put(node.getId(), nd);
        }

        for (TaskEdge edge : graph.getEdges()) {
            GraphDocument.EdgeDoc ed = new GraphDocument.EdgeDoc();
            ed.setSourceId(edge.sourceId());
            ed.setTargetId(edge.targetId());
            ed.setEdgeType(edge.edgeType());
            ed.setWeight(edge.weight());
            ed.setConstraints(new LinkedHashMap<>(edge.constraints()));
            ed.setMetadata(new LinkedHashMap<>(edge.metadata()));
            doc.getEdges().add(ed);
        }

        doc.setNodeCount(graph.nodeCount());
        doc.setEdgeCount(graph.edgeCount());
        return doc;
    }

    /**
     * Rebuilds a graph. The map key of a node entry is used when the entry has
     * no {@code node_id}.
     */
    public static TaskGraph fromDocument(GraphDocument doc) {
        TaskGraph graph = new TaskGraph(doc.getGraphId(), doc.getMetadata());

        for (Map.Entry<String, GraphDocument.NodeDoc> e : doc.getNodes().entrySet()) {
            GraphDocument.NodeDoc nd = e.getValue();
            String nodeId = nd.getNodeId() != null ? nd.getNodeId() : e.getKey();
            graph.addNode(new TaskNode(nodeId, nd.getName(), nd.getNodeType(), nd.getPriority(),
                    nd.getCostModel() != null ? nd.getCostModel().copy() : null, nd.getMetadata()));
        }

        for (GraphDocument.EdgeDoc ed : doc.getEdges()) {
            graph.addEdge(new TaskEdge(ed.getSourceId(), ed.getTargetId(), ed.getEdgeType(), ed.getWeight(),
                    ed.getConstraints(), ed.getMetadata()));
        }

        for (Map.Entry<String, GraphDocument.NodeDoc> e : doc.getNodes().entrySet()) {
            GraphDocument.NodeDoc nd = e.getValue();
            TaskNode node = graph.getNode(nd.getNodeId() != null ? nd.getNodeId() : e.getKey());
            if (nd.getStatus() != null)
                node.setStatus(nd.getStatus());
            node.setLevel(nd.getLevel());
            node.setOnCriticalPath(nd.isCriticalPath());
            node.setInfluenceScore(nd.getInfluenceScore());
            node.setParallelizationFactor(nd.getParallelizationFactor());
            node.setStartTime(nd.getStartTime());
            node.setEndTime(nd.getEndTime());
            node.setActualDuration(nd.getActualDuration());
            node.setErrorMessage(nd.getErrorMessage());
        }

        if (doc.getNodeCount() != graph.nodeCount() || doc.getEdgeCount() != graph.edgeCount()) {
            log.warn("Graph {}: document declares {} nodes / {} edges, restored {} / {}", graph.id(),
                    doc.getNodeCount(), doc.getEdgeCount(), graph.nodeCount(), graph.edgeCount());
        }
        log.debug("Restored graph {} with {} nodes and {} edges", graph.id(), graph.nodeCount(), graph.edgeCount());
        return graph;
    }

    public static Map<String, Object> toMap(TaskGraph graph) {
        return MAPPER.convertValue(toDocument(graph), MAP_TYPE);
    }

    public static TaskGraph fromMap(Map<String, ?> map) {
        return fromDocument(MAPPER.convertValue(map, GraphDocument.class));
    }

    public static String toJson(TaskGraph graph) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toDocument(graph));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize graph " + graph.id(), e);
        }
    }

    public static TaskGraph fromJson(String json) {
        try {
            return fromDocument(MAPPER.readValue(json, GraphDocument.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse graph document", e);
        }
    }
}
