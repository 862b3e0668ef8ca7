package com.planning.tdg.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reads {@link WorkflowDefinition}s from JSON. */
public final class WorkflowParser {
    private WorkflowParser() {
        // Utility class
    }

    /** Parses a JSON file into a WorkflowDefinition. */
    public static WorkflowDefinition parseFile(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return GraphCodec.mapper().readValue(in, WorkflowDefinition.class);
        }
    }

    /** Parses a JSON string into a WorkflowDefinition. */
    public static WorkflowDefinition parse(String json) {
        try {
            return GraphCodec.mapper().readValue(json, WorkflowDefinition.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Invalid workflow definition", e);
        }
    }

    /** Parses a classpath resource into a WorkflowDefinition. */
    public static WorkflowDefinition parseResource(String resource) {
        try (InputStream in = WorkflowParser.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalArgumentException("Workflow resource not found: " + resource);
            return GraphCodec.mapper().readValue(in, WorkflowDefinition.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Invalid workflow definition " + resource, e);
        }
    }
}
