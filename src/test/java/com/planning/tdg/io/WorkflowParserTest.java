package com.planning.tdg.io;

import com.planning.tdg.io.WorkflowDefinition.Mode;
import com.planning.tdg.io.WorkflowDefinition.TaskSpec;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class WorkflowParserTest {
    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void testParseResource() {
        WorkflowDefinition def = WorkflowParser.parseResource("sentiment-workflow.json");
        assertEquals("sentiment", def.getGraphId());
        assertEquals(Mode.PATTERNS, def.getMode());
        assertEquals(4, def.getTasks().size());

        TaskSpec first = def.getTasks().get(0);
        assertEquals("fetch_data", first.getTask());
        assertEquals(7, first.getPriority());
        assertEquals("data_fetch", first.taskType());
        assertEquals(5, def.getTasks().get(2).getPriority());
    }

    @Test
    public void testDefaults() {
        WorkflowDefinition def = WorkflowParser.parse("{\"tasks\": [{}], \"extra\": 1}");
        assertEquals("workflow", def.getGraphId());
        assertEquals(Mode.PATTERNS, def.getMode());
        TaskSpec spec = def.getTasks().get(0);
        assertEquals("task_0", spec.nameOr(0));
        assertEquals("generic", spec.taskType());
    }

    @Test
    public void testParseFile() throws IOException {
        Path file = tmp.newFile("flow.json").toPath();
        Files.write(file, "{\"graph_id\": \"seq\", \"mode\": \"SEQUENTIAL\", \"tasks\": [{\"task\": \"a\"}]}"
                .getBytes(StandardCharsets.UTF_8));
        WorkflowDefinition def = WorkflowParser.parseFile(file);
        assertEquals("seq", def.getGraphId());
        assertEquals(Mode.SEQUENTIAL, def.getMode());
    }

    @Test(expected = UncheckedIOException.class)
    public void testUnknownMode() {
        WorkflowParser.parse("{\"mode\": \"random\"}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingResource() {
        WorkflowParser.parseResource("no-such-workflow.json");
    }
}
