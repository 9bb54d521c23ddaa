package com.maestro.core.progress;

import com.maestro.core.model.Execution;
import com.maestro.core.model.ExecutionView;
import com.maestro.core.model.Progress;
import com.maestro.core.model.Step;
import com.maestro.core.model.StepStatus;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives completion figures from step state. Stateless and safe for concurrent readers.
 * <p>
 * Only terminal steps count toward the percentage, and a terminal step never leaves its
 * status, so the value never decreases over the life of an execution. Failed steps are not
 * counted as progress; a failed execution therefore reports less than 100%.
 */
@Component
public class ProgressAggregator {

    public Progress progress(Execution execution) {
        int total = execution.steps().size();
        int completed = 0, skipped = 0, failed = 0, running = 0, waiting = 0;
        for (Step step : execution.steps()) {
            switch (step.status()) {
                case COMPLETED -> completed++;
                case SKIPPED -> skipped++;
                case FAILED -> failed++;
                case RUNNING -> running++;
                case PENDING, BLOCKED -> waiting++;
            }
        }
        int percent = total == 0 ? 100 : (int) Math.round(100.0 * (completed + skipped) / total);
        return new Progress(percent, execution.status(), total, completed, skipped, failed, running, waiting);
    }

    public ExecutionView view(Execution execution, List<List<String>> stages) {
        Map<String, String> failures = new LinkedHashMap<>();
        for (Step step : execution.steps()) {
            if (step.status() == StepStatus.FAILED) {
                failures.put(step.id(), step.error() != null ? step.error() : "unknown error");
            }
        }
        Long durationMs = execution.startedAt() != null && execution.completedAt() != null
                ? Duration.between(execution.startedAt(), execution.completedAt()).toMillis()
                : null;
        return new ExecutionView(execution.id(), execution.templateId(), execution.mode(), execution.status(),
                progress(execution), execution.steps(), stages, failures,
                execution.createdAt(), execution.startedAt(), execution.completedAt(), durationMs);
    }
}
