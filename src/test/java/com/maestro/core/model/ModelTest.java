package com.maestro.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Nested
    @DisplayName("Status transitions")
    class Transitions {

        @Test
        @DisplayName("terminal execution statuses never transition")
        void terminalExecution() {
            for (ExecutionStatus terminal : List.of(ExecutionStatus.COMPLETED, ExecutionStatus.FAILED,
                    ExecutionStatus.CANCELLED)) {
                assertTrue(terminal.isTerminal());
                for (ExecutionStatus next : ExecutionStatus.values()) {
                    assertFalse(terminal.canTransitionTo(next), terminal + " -> " + next);
                }
            }
        }

        @Test
        @DisplayName("pending executions can start or be cancelled only")
        void pendingExecution() {
            assertTrue(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.RUNNING));
            assertTrue(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.CANCELLED));
            assertFalse(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.COMPLETED));
            assertFalse(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.FAILED));
        }

        @Test
        @DisplayName("step transitions follow the lifecycle")
        void stepTransitions() {
            assertTrue(StepStatus.BLOCKED.canTransitionTo(StepStatus.PENDING));
            assertFalse(StepStatus.BLOCKED.canTransitionTo(StepStatus.RUNNING));
            assertTrue(StepStatus.RUNNING.canTransitionTo(StepStatus.SKIPPED));
            assertFalse(StepStatus.PENDING.canTransitionTo(StepStatus.COMPLETED));
            assertFalse(StepStatus.SKIPPED.canTransitionTo(StepStatus.PENDING));
            assertFalse(StepStatus.FAILED.canTransitionTo(StepStatus.RUNNING));
        }
    }

    @Test
    @DisplayName("mode parsing is case-insensitive")
    void modeParse() {
        assertEquals(ExecutionMode.PARALLEL, ExecutionMode.parse(" parallel "));
        assertThrows(IllegalArgumentException.class, () -> ExecutionMode.parse("turbo"));
        assertThrows(IllegalArgumentException.class, () -> ExecutionMode.parse(""));
    }

    @Test
    @DisplayName("export format defaults to CSV")
    void exportFormatParse() {
        assertEquals(ExportFormat.CSV, ExportFormat.parse(null));
        assertEquals(ExportFormat.PDF, ExportFormat.parse("pdf"));
        assertThrows(IllegalArgumentException.class, () -> ExportFormat.parse("xlsx"));
    }

    @Test
    @DisplayName("steps with dependencies start blocked")
    void initialStepStatus() {
        assertEquals(StepStatus.PENDING,
                Step.fromDefinition("E1", new StepDefinition("A", "w", "t", List.of())).status());
        assertEquals(StepStatus.BLOCKED,
                Step.fromDefinition("E1", new StepDefinition("B", "w", "t", List.of("A"))).status());
    }

    @Test
    @DisplayName("execution status changes stamp start and completion once")
    void executionTimestamps() {
        Instant t0 = Instant.parse("2026-01-01T00:00:00Z");
        var execution = new Execution("E1", null, ExecutionMode.STAGED, null, ExecutionStatus.PENDING, t0,
                null, null, null);

        var running = execution.withStatus(ExecutionStatus.RUNNING, t0.plusSeconds(1));
        var done = running.withStatus(ExecutionStatus.COMPLETED, t0.plusSeconds(5));

        assertEquals(t0.plusSeconds(1), done.startedAt());
        assertEquals(t0.plusSeconds(5), done.completedAt());
        assertTrue(execution.workingContext().isEmpty());
        assertTrue(execution.steps().isEmpty());
    }

    @Test
    @DisplayName("step definitions bind snake_case JSON")
    void stepDefinitionJson() throws Exception {
        var json = "{\"id\":\"B\",\"agent\":\"writer\",\"task\":\"Write\",\"depends_on\":[\"A\"],\"timeout_seconds\":30}";

        var definition = new ObjectMapper().readValue(json, StepDefinition.class);

        assertEquals(new StepDefinition("B", "writer", "Write", List.of("A"), 30), definition);
    }

    @Test
    @DisplayName("communication ids are derived from execution, step and target")
    void communicationId() {
        assertEquals("COMM-E1.A.reviewer", CommunicationRecord.idFor("E1", "A", "reviewer"));
        var record = new CommunicationRecord("id", "E1", "A", "writer", "reviewer", "m", null, Instant.now(), null);
        assertFalse(record.isAnswered());
        assertTrue(record.withResponse("ok", Instant.now()).isAnswered());
    }

    @Test
    @DisplayName("communication ids stay distinct when ids contain separators")
    void communicationIdsDoNotCollide() {
        assertNotEquals(CommunicationRecord.idFor("E1", "a-b", "c"), CommunicationRecord.idFor("E1", "a", "b-c"));
        assertNotEquals(CommunicationRecord.idFor("E1", "a.b", "c"), CommunicationRecord.idFor("E1", "a", "b.c"));
        assertNotEquals(CommunicationRecord.idFor("E1", "a~", "b"), CommunicationRecord.idFor("E1", "a", "~b"));
        assertEquals("COMM-EXEC-2026-0007-3fa2.a-b.c", CommunicationRecord.idFor("EXEC-2026-0007-3fa2", "a-b", "c"));
        assertEquals("COMM-E1.a~.b.c", CommunicationRecord.idFor("E1", "a.b", "c"));
    }

    @Test
    @DisplayName("working context keeps null values")
    void contextWithNullValue() {
        var context = new HashMap<String, Object>();
        context.put("note", null);
        context.put("topic", "billing");

        var execution = new Execution("E1", null, ExecutionMode.STAGED, context, ExecutionStatus.PENDING,
                Instant.now(), null, null, List.of());

        assertTrue(execution.workingContext().containsKey("note"));
        assertNull(execution.workingContext().get("note"));
        assertEquals("billing", execution.workingContext().get("topic"));
        assertThrows(UnsupportedOperationException.class, () -> execution.workingContext().put("x", 1));
    }

    @Test
    @DisplayName("null dependency entries survive construction for validation to reject")
    void nullDependencyEntry() {
        var definition = new StepDefinition("B", "writer", "Write", Arrays.asList("A", null));

        assertEquals(2, definition.dependsOn().size());
        assertNull(definition.dependsOn().get(1));
        assertEquals(definition.dependsOn(), Step.fromDefinition("E1", definition).dependsOn());
    }

    @Test
    @DisplayName("step results count retries as attempts minus one")
    void retryCount() {
        assertEquals(0, StepResult.completed("A", "out", 1, 10).retryCount());
        assertEquals(2, StepResult.failed("A", "err", 3, 10).retryCount());
    }

    @Test
    @DisplayName("template summaries list distinct agents")
    void templateSummary() {
        var template = new WorkflowTemplate("t", "T", "d", List.of(
                new StepDefinition("A", "writer", "x", List.of()),
                new StepDefinition("B", "writer", "y", List.of("A")),
                new StepDefinition("C", "reviewer", "z", List.of("B"))));

        var summary = TemplateSummary.of(template);

        assertEquals(3, summary.stepCount());
        assertEquals(List.of("writer", "reviewer"), summary.agents());
    }
}
