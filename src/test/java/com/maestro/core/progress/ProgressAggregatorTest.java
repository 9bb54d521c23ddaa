package com.maestro.core.progress;

import com.maestro.core.model.Execution;
import com.maestro.core.model.ExecutionMode;
import com.maestro.core.model.ExecutionStatus;
import com.maestro.core.model.Step;
import com.maestro.core.model.StepDefinition;
import com.maestro.core.model.StepStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProgressAggregatorTest {

    private final ProgressAggregator aggregator = new ProgressAggregator();

    private static Execution execution(ExecutionStatus status, Instant startedAt, Instant completedAt,
                                       StepStatus... statuses) {
        var steps = new ArrayList<Step>();
        for (int i = 0; i < statuses.length; i++) {
            Step step = Step.fromDefinition("E1", new StepDefinition("S" + i, "writer", "t", List.of()));
            steps.add(step.withStatus(statuses[i])
                    .withCompletion(null, null, statuses[i] == StepStatus.FAILED ? "boom " + i : null));
        }
        return new Execution("E1", null, ExecutionMode.PARALLEL, Map.of(), status, Instant.now(),
                startedAt, completedAt, steps);
    }

    @Test
    @DisplayName("counts completed and skipped steps as progress")
    void countsTerminalSteps() {
        var progress = aggregator.progress(execution(ExecutionStatus.RUNNING, null, null,
                StepStatus.COMPLETED, StepStatus.SKIPPED, StepStatus.RUNNING, StepStatus.BLOCKED));

        assertEquals(50, progress.percent());
        assertEquals(4, progress.total());
        assertEquals(1, progress.completed());
        assertEquals(1, progress.skipped());
        assertEquals(1, progress.running());
        assertEquals(1, progress.waiting());
        assertEquals(ExecutionStatus.RUNNING, progress.status());
    }

    @Test
    @DisplayName("failed steps do not count as progress")
    void failedNotCounted() {
        var progress = aggregator.progress(execution(ExecutionStatus.FAILED, null, null,
                StepStatus.COMPLETED, StepStatus.FAILED));

        assertEquals(50, progress.percent());
        assertEquals(1, progress.failed());
    }

    @Test
    @DisplayName("percent is rounded")
    void rounded() {
        assertEquals(33, aggregator.progress(execution(ExecutionStatus.RUNNING, null, null,
                StepStatus.COMPLETED, StepStatus.PENDING, StepStatus.PENDING)).percent());
        assertEquals(67, aggregator.progress(execution(ExecutionStatus.RUNNING, null, null,
                StepStatus.COMPLETED, StepStatus.COMPLETED, StepStatus.PENDING)).percent());
    }

    @Test
    @DisplayName("an execution without steps is complete")
    void emptyExecution() {
        assertEquals(100, aggregator.progress(execution(ExecutionStatus.COMPLETED, null, null)).percent());
    }

    @Test
    @DisplayName("view lists failures and duration once finished")
    void view() {
        Instant start = Instant.parse("2026-03-01T10:00:00Z");
        var view = aggregator.view(execution(ExecutionStatus.FAILED, start, start.plusSeconds(90),
                StepStatus.COMPLETED, StepStatus.FAILED), List.of(List.of("S0", "S1")));

        assertEquals(Map.of("S1", "boom 1"), view.failures());
        assertEquals(90_000L, view.durationMs());
        assertEquals(List.of(List.of("S0", "S1")), view.stages());
    }

    @Test
    @DisplayName("running executions have no duration")
    void noDurationWhileRunning() {
        var view = aggregator.view(execution(ExecutionStatus.RUNNING, Instant.now(), null, StepStatus.RUNNING), List.of());
        assertNull(view.durationMs());
    }
}
