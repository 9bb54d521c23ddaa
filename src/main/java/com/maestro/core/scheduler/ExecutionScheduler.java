package com.maestro.core.scheduler;

import com.maestro.agent.AgentCatalog;
import com.maestro.agent.AttemptListener;
import com.maestro.agent.StepDispatcher;
import com.maestro.core.audit.AuditRecorder;
import com.maestro.core.events.EventBus;
import com.maestro.core.events.ExecutionEvent;
import com.maestro.core.logging.MdcContext;
import com.maestro.core.metrics.MaestroMetrics;
import com.maestro.core.model.AlreadyRunningException;
import com.maestro.core.model.AuditAction;
import com.maestro.core.model.Execution;
import com.maestro.core.model.ExecutionMode;
import com.maestro.core.model.ExecutionNotFoundException;
import com.maestro.core.model.ExecutionStatus;
import com.maestro.core.model.ExecutionView;
import com.maestro.core.model.MaestroException;
import com.maestro.core.model.Step;
import com.maestro.core.model.StepDefinition;
import com.maestro.core.model.StepResult;
import com.maestro.core.model.StepStatus;
import com.maestro.core.model.ValidationException;
import com.maestro.core.persistence.ExecutionRepository;
import com.maestro.core.progress.ProgressAggregator;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives executions from {@code pending} to a terminal status.
 *
 * <p>Each started execution gets exactly one control loop running on its own thread. The loop
 * promotes blocked steps whose dependencies completed, picks the steps the execution mode allows
 * to run, hands them to the {@link StepDispatcher} on the shared worker pool and then waits for
 * the next outcome. Workers report both finished steps and individual retry attempts through the
 * run's queue; the loop thread alone applies them, audits them and publishes their events, so step
 * state of one execution is never written by two threads at once.
 *
 * <ul>
 *   <li>{@code SEQUENTIAL}: one step at a time, lowest definition order first.</li>
 *   <li>{@code PARALLEL}: every runnable step, bounded by {@code maxInFlight}; capacity is
 *       refilled as soon as any step finishes.</li>
 *   <li>{@code STAGED}: one dependency stage at a time, with a barrier until every step of the
 *       stage is terminal.</li>
 * </ul>
 *
 * <p>A failed step skips everything downstream of it and leaves other branches running.
 * Cancellation is cooperative: nothing new is dispatched, and results of steps still in flight
 * are discarded when they arrive. {@code execution_cancelled} is published after that, as the
 * execution's last event.
 */
@Service
public class ExecutionScheduler {

    private static final Logger log = LoggerFactory.getLogger(ExecutionScheduler.class);

    private final ExecutionRepository repository;
    private final DependencyResolver resolver;
    private final StepDispatcher dispatcher;
    private final AuditRecorder auditRecorder;
    private final EventBus eventBus;
    private final ProgressAggregator progressAggregator;
    private final AgentCatalog agentCatalog;
    private final MaestroMetrics metrics;
    private final SchedulerProperties properties;

    private final ConcurrentHashMap<String, ExecutionRun> runs = new ConcurrentHashMap<>();
    private final Object publishLock = new Object();
    private final ExecutorService loopExecutor;
    private final ExecutorService stepExecutor;

    public ExecutionScheduler(ExecutionRepository repository, DependencyResolver resolver,
                              StepDispatcher dispatcher, AuditRecorder auditRecorder, EventBus eventBus,
                              ProgressAggregator progressAggregator, AgentCatalog agentCatalog,
                              MaestroMetrics metrics, SchedulerProperties properties) {
        this.repository = repository;
        this.resolver = resolver;
        this.dispatcher = dispatcher;
        this.auditRecorder = auditRecorder;
        this.eventBus = eventBus;
        this.progressAggregator = progressAggregator;
        this.agentCatalog = agentCatalog;
        this.metrics = metrics;
        this.properties = properties;
        this.loopExecutor = Executors.newCachedThreadPool(daemonThreads("maestro-loop-"));
        int workers = Math.max(1, properties.getWorkerThreads());
        this.stepExecutor = new ThreadPoolExecutor(workers, workers, 60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), daemonThreads("maestro-step-"));
    }

    /**
     * Checks a step graph without running it.
     *
     * @return the dependency stages
     * @throws ValidationException if the graph is empty, malformed, cyclic or names unknown agents
     */
    public List<List<String>> validate(List<StepDefinition> steps) {
        if (steps == null || steps.isEmpty()) {
            throw new ValidationException("Workflow must contain at least one step");
        }
        List<List<String>> stages = resolver.resolve(steps);
        List<String> unknownAgents = agentCatalog.unresolvable(steps.stream().map(StepDefinition::agentId).toList());
        if (!unknownAgents.isEmpty()) {
            throw new ValidationException("Unknown agent(s): " + String.join(", ", unknownAgents));
        }
        return stages;
    }

    /**
     * Validates an execution, stores it if new, moves it to {@code running} and starts its control loop.
     * If a cancel lands between storing and starting, the execution stays cancelled, its waiting steps
     * are skipped and no loop is started.
     *
     * @throws ValidationException     if the graph is invalid or the execution already finished
     * @throws AlreadyRunningException if a control loop already exists for this execution id
     */
    public void start(Execution execution) {
        String id = execution.id();
        if (runs.containsKey(id)) {
            throw new AlreadyRunningException(id);
        }
        var stored = repository.findById(id);
        if (stored.isPresent()) {
            ExecutionStatus status = stored.get().status();
            if (status == ExecutionStatus.RUNNING) {
                throw new AlreadyRunningException(id);
            }
            if (status.isTerminal()) {
                throw new ValidationException("Execution " + id + " is already " + status.name().toLowerCase());
            }
        }

        List<List<String>> stages = validate(execution.stepDefinitions());
        if (stored.isEmpty()) {
            repository.save(execution);
        }

        var run = new ExecutionRun(id, execution.mode(), stages, properties.getMaxInFlight());
        if (runs.putIfAbsent(id, run) != null) {
            throw new AlreadyRunningException(id);
        }
        if (repository.updateExecutionStatus(id, ExecutionStatus.RUNNING, Instant.now()).isEmpty()) {
            // no loop will run; a cancel that reached the run before its removal leaves settling to us
            runs.remove(id, run);
            if (run.isCancelRequested()) {
                log.info("Execution {} was cancelled before its control loop started", id);
                settleCancelled(id);
                run.done.complete(null);
                return;
            }
            run.done.complete(null);
            ExecutionStatus current = load(id).status();
            if (current == ExecutionStatus.CANCELLED) {
                // the cancelling caller found no run and settles the execution itself
                return;
            }
            if (current == ExecutionStatus.RUNNING) {
                throw new AlreadyRunningException(id);
            }
            throw new ValidationException("Execution " + id + " cannot start from " + current.name().toLowerCase());
        }

        log.info("Starting execution {} ({} steps, mode={}, {} stage(s))",
                id, execution.steps().size(), execution.mode(), stages.size());
        auditRecorder.record(id, null, null, AuditAction.EXECUTION_STARTED, "running",
                "Started in " + execution.mode().name().toLowerCase() + " mode with "
                        + execution.steps().size() + " step(s)");
        publish(ExecutionEvent.EXECUTION_STARTED, id, null, payload(
                "mode", execution.mode().name().toLowerCase(),
                "total_steps", execution.steps().size(),
                "stages", stages));

        try {
            loopExecutor.submit(() -> drive(run));
        } catch (RejectedExecutionException e) {
            runs.remove(id, run);
            run.done.complete(null);
            throw new MaestroException("Scheduler is shutting down; execution " + id + " not started", e);
        }
    }

    /**
     * Marks an execution cancelled. Steps still in flight finish but their results are discarded.
     * The {@code execution_cancelled} event follows once every step is settled, so it is the last
     * event of the execution.
     *
     * @return true if this call cancelled the execution, false if it had already finished
     * @throws ExecutionNotFoundException if no such execution exists
     */
    public boolean cancel(String executionId) {
        Execution execution = repository.findById(executionId)
                .orElseThrow(() -> new ExecutionNotFoundException(executionId));
        if (execution.status().isTerminal()) {
            log.info("Execution {} already {}; nothing to cancel", executionId, execution.status());
            return false;
        }
        if (repository.updateExecutionStatus(executionId, ExecutionStatus.CANCELLED, Instant.now()).isEmpty()) {
            return false;
        }

        log.info("Execution {} cancelled", executionId);
        auditRecorder.record(executionId, null, null, AuditAction.EXECUTION_CANCELLED, "cancelled",
                "Cancelled by request");
        metrics.recordExecutionResult("cancelled");

        // atomic with start() giving up and the loop closing, so exactly one side settles
        var handedOff = new AtomicBoolean();
        runs.computeIfPresent(executionId, (id, active) -> {
            if (!active.closed) {
                active.cancel();
                handedOff.set(true);
            }
            return active;
        });
        if (!handedOff.get()) {
            settleCancelled(executionId);
        }
        return true;
    }

    /**
     * Read-only snapshot of an execution.
     *
     * @throws ExecutionNotFoundException if no such execution exists
     */
    public ExecutionView getStatus(String executionId) {
        Execution execution = repository.findById(executionId)
                .orElseThrow(() -> new ExecutionNotFoundException(executionId));
        return progressAggregator.view(execution, stagesOf(execution));
    }

    public boolean isRunning(String executionId) {
        return runs.containsKey(executionId);
    }

    /**
     * Waits for the control loop of an execution to finish.
     *
     * @return true if no loop is active for the execution when this returns
     */
    public boolean awaitCompletion(String executionId, Duration timeout) throws InterruptedException {
        ExecutionRun run = runs.get(executionId);
        if (run == null) {
            return true;
        }
        try {
            run.done.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            return true;
        }
    }

    // --- Control loop ---

    private void drive(ExecutionRun run) {
        MdcContext.setExecution(run.executionId);
        try {
            loop(run);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Control loop for execution {} interrupted", run.executionId);
            abort(run, "Interrupted: orchestrator shutting down");
        } catch (Exception e) {
            log.error("Control loop for execution {} crashed: {}", run.executionId, e.getMessage(), e);
            abort(run, "Scheduler error: " + e.getMessage());
        } finally {
            close(run);
        }
    }

    private void close(ExecutionRun run) {
        try {
            runs.computeIfPresent(run.executionId, (id, active) -> {
                active.closed = true;
                return active;
            });
            if (run.isCancelRequested() && !run.cancelAnnounced) {
                // cancelled after the loop's last check; the canceller handed it to us
                settleCancelled(run.executionId);
            }
        } catch (RuntimeException e) {
            log.error("Could not settle cancelled execution {}: {}", run.executionId, e.getMessage(), e);
        } finally {
            runs.remove(run.executionId, run);
            run.done.complete(null);
            MdcContext.clear();
        }
    }

    private void loop(ExecutionRun run) throws InterruptedException {
        while (true) {
            Execution execution = load(run.executionId);
            if (run.isCancelRequested() || execution.status() == ExecutionStatus.CANCELLED) {
                drainAfterCancel(run);
                return;
            }

            execution = promoteUnblocked(execution);
            int dispatched = 0;
            for (Step step : selectDispatchable(run, execution)) {
                if (dispatch(run, execution, step)) {
                    dispatched++;
                }
            }

            if (dispatched == 0 && run.inFlight.get() == 0) {
                finish(run);
                return;
            }

            StepOutcome outcome = run.awaitOutcome();
            if (outcome == null) {
                continue;
            }
            if (outcome.isAttempt()) {
                recordAttempt(run, outcome.attempt());
            } else {
                apply(run, outcome);
            }
        }
    }

    private Execution promoteUnblocked(Execution execution) {
        boolean changed = false;
        for (Step step : execution.steps()) {
            if (step.status() == StepStatus.BLOCKED && dependenciesCompleted(execution, step)) {
                var promoted = repository.transitionStep(execution.id(), step.id(), StepStatus.PENDING, s -> s);
                if (promoted.isPresent()) {
                    changed = true;
                    log.debug("Step {} unblocked", step.id());
                    auditRecorder.record(execution.id(), step.id(), step.agentId(), AuditAction.STEP_UNBLOCKED,
                            "pending", "All dependencies completed");
                } else {
                    log.warn("Rejected transition of step {} to PENDING", step.id());
                }
            }
        }
        return changed ? load(execution.id()) : execution;
    }

    private List<Step> selectDispatchable(ExecutionRun run, Execution execution) {
        List<Step> runnable = execution.steps().stream()
                .filter(s -> s.status() == StepStatus.PENDING)
                .filter(s -> dependenciesCompleted(execution, s))
                .toList();

        return switch (run.mode) {
            case SEQUENTIAL -> run.inFlight.get() == 0 && !runnable.isEmpty() ? List.of(runnable.get(0)) : List.of();
            case PARALLEL -> {
                var selected = new ArrayList<Step>();
                for (Step step : runnable) {
                    if (!run.permits.tryAcquire()) break;
                    selected.add(step);
                }
                if (!selected.isEmpty()) {
                    metrics.recordStageSize(selected.size(), "parallel");
                }
                yield selected;
            }
            case STAGED -> selectStage(run, execution, runnable);
        };
    }

    private List<Step> selectStage(ExecutionRun run, Execution execution, List<Step> runnable) {
        if (run.inFlight.get() > 0) {
            return List.of();
        }
        while (run.stageIndex < run.stages.size() && stageTerminal(execution, run.stages.get(run.stageIndex))) {
            run.stageIndex++;
        }
        if (run.stageIndex >= run.stages.size()) {
            return List.of();
        }
        List<String> stage = run.stages.get(run.stageIndex);
        List<Step> selected = runnable.stream().filter(s -> stage.contains(s.id())).toList();
        if (!selected.isEmpty()) {
            MdcContext.setStage(run.executionId, run.stageIndex);
            log.info("Dispatching stage {}/{}: {}", run.stageIndex + 1, run.stages.size(),
                    selected.stream().map(Step::id).toList());
            metrics.recordStageSize(selected.size(), "staged");
        }
        return selected;
    }

    private boolean dispatch(ExecutionRun run, Execution execution, Step step) {
        if (run.isCancelRequested()) {
            releasePermit(run);
            return false;
        }
        var running = repository.transitionStep(execution.id(), step.id(), StepStatus.RUNNING,
                s -> s.withStartedAt(Instant.now()));
        if (running.isEmpty()) {
            log.warn("Rejected transition of step {} to RUNNING", step.id());
            releasePermit(run);
            return false;
        }
        run.inFlight.incrementAndGet();

        Step runningStep = running.get();
        log.info("Step {} started on agent {}", step.id(), step.agentId());
        auditRecorder.record(execution.id(), step.id(), step.agentId(), AuditAction.STEP_STARTED, "running",
                "Dispatched to " + step.agentId());
        publish(ExecutionEvent.STEP_STARTED, execution.id(), step.id(), payload("agent", step.agentId()));

        Map<String, Object> context = stepContext(execution, step);
        List<String> participants = execution.steps().stream().map(Step::agentId).distinct().toList();
        AttemptListener listener = new RunAttemptListener(run);
        Map<String, String> mdc = MdcContext.snapshot();
        try {
            stepExecutor.submit(() -> {
                MdcContext.restore(mdc);
                MdcContext.setStep(run.executionId, step.id(), step.agentId());
                StepResult result;
                try {
                    result = dispatcher.dispatch(runningStep, context, participants, listener);
                } catch (Exception e) {
                    log.error("Dispatcher error on step {}: {}", step.id(), e.getMessage(), e);
                    result = StepResult.failed(step.id(), "Dispatcher error: " + e.getMessage(), 1, 0);
                } finally {
                    MdcContext.clear();
                }
                run.deliver(StepOutcome.finished(step.id(), result));
            });
        } catch (RejectedExecutionException e) {
            run.deliver(StepOutcome.finished(step.id(),
                    StepResult.failed(step.id(), "Worker pool rejected step: " + e.getMessage(), 0, 0)));
        }
        return true;
    }

    private void apply(ExecutionRun run, StepOutcome outcome) {
        run.inFlight.decrementAndGet();
        releasePermit(run);
        if (run.isCancelRequested()) {
            discard(run, outcome);
            return;
        }

        StepResult result = outcome.result();
        Instant now = Instant.now();
        Step finished;
        if (result.isSuccess()) {
            var completed = repository.transitionStep(run.executionId, outcome.stepId(), StepStatus.COMPLETED,
                    s -> s.withCompletion(now, result.output(), null).withRetryCount(result.retryCount()));
            if (completed.isEmpty()) {
                log.warn("Rejected transition of step {} to COMPLETED", outcome.stepId());
                return;
            }
            finished = completed.get();
            log.info("Step {} completed after {} attempt(s) in {}ms", finished.id(), result.attempts(), result.elapsedMs());
            auditRecorder.record(run.executionId, finished.id(), finished.agentId(), AuditAction.STEP_COMPLETED,
                    "completed", "Completed after " + result.attempts() + " attempt(s) in " + result.elapsedMs() + "ms");
            publish(ExecutionEvent.STEP_COMPLETED, run.executionId, finished.id(), payload(
                    "agent", finished.agentId(),
                    "retry_count", finished.retryCount(),
                    "duration_ms", result.elapsedMs()));
        } else {
            var failed = repository.transitionStep(run.executionId, outcome.stepId(), StepStatus.FAILED,
                    s -> s.withCompletion(now, null, result.error()).withRetryCount(result.retryCount()));
            if (failed.isEmpty()) {
                log.warn("Rejected transition of step {} to FAILED", outcome.stepId());
                return;
            }
            finished = failed.get();
            log.warn("Step {} failed: {}", finished.id(), result.error());
            auditRecorder.record(run.executionId, finished.id(), finished.agentId(), AuditAction.STEP_FAILED,
                    "failed", result.error());
            publish(ExecutionEvent.STEP_FAILED, run.executionId, finished.id(), payload(
                    "agent", finished.agentId(),
                    "retry_count", finished.retryCount(),
                    "error", result.error()));
            skipDependents(run.executionId, finished.id());
        }
        metrics.recordStepResult(finished.status().name().toLowerCase());
        metrics.recordStepDuration(finished.agentId(), result.elapsedMs());
        metrics.recordRetryCount(result.retryCount());
    }

    /** Audits one invocation attempt; retries of a live run are also announced as progress events. */
    private void recordAttempt(ExecutionRun run, StepOutcome.AttemptNotice notice) {
        Step step = notice.step();
        String status = notice.outcome().name().toLowerCase();
        String message = notice.outcome() == AttemptListener.Outcome.SUCCEEDED
                ? "Attempt " + notice.attempt() + " succeeded"
                : "Attempt " + notice.attempt() + " " + status + ": " + notice.error();
        auditRecorder.record(run.executionId, step.id(), step.agentId(), AuditAction.STEP_ATTEMPT, status, message);
        metrics.recordStepAttempt(status);
        if (notice.willRetry() && !run.isCancelRequested()) {
            publish(ExecutionEvent.STEP_PROGRESS, run.executionId, step.id(), payload(
                    "agent", step.agentId(),
                    "attempt", notice.attempt(),
                    "retry_count", notice.attempt(),
                    "error", notice.error()));
        }
    }

    private void skipDependents(String executionId, String failedStepId) {
        Execution execution = load(executionId);
        for (String dependentId : resolver.transitiveDependents(execution.stepDefinitions(), failedStepId)) {
            Step dependent = execution.step(dependentId).orElseThrow();
            if (dependent.status() == StepStatus.PENDING || dependent.status() == StepStatus.BLOCKED) {
                skip(executionId, dependent, "Skipped: upstream step " + failedStepId + " failed");
            }
        }
    }

    private void drainAfterCancel(ExecutionRun run) throws InterruptedException {
        skipWaitingSteps(run.executionId, "Skipped: execution cancelled");
        while (run.inFlight.get() > 0) {
            StepOutcome outcome = run.awaitOutcome();
            if (outcome == null) {
                continue;
            }
            if (outcome.isAttempt()) {
                recordAttempt(run, outcome.attempt());
            } else {
                run.inFlight.decrementAndGet();
                releasePermit(run);
                discard(run, outcome);
            }
        }
        log.info("Execution {} stopped after cancellation", run.executionId);
        publish(ExecutionEvent.EXECUTION_CANCELLED, run.executionId, null, payload());
        run.cancelAnnounced = true;
    }

    private void discard(ExecutionRun run, StepOutcome outcome) {
        Execution execution = load(run.executionId);
        execution.step(outcome.stepId()).ifPresent(step ->
                skip(run.executionId, step, "Result discarded: execution cancelled"));
    }

    private void finish(ExecutionRun run) {
        Execution execution = load(run.executionId);
        for (Step step : execution.steps()) {
            if (step.status() == StepStatus.PENDING || step.status() == StepStatus.BLOCKED) {
                skip(run.executionId, step, "Skipped: no runnable path");
            }
        }
        execution = load(run.executionId);
        boolean allCompleted = execution.steps().stream().allMatch(s -> s.status() == StepStatus.COMPLETED);
        ExecutionStatus target = allCompleted ? ExecutionStatus.COMPLETED : ExecutionStatus.FAILED;
        var updated = repository.updateExecutionStatus(run.executionId, target, Instant.now());
        if (updated.isEmpty()) {
            log.warn("Rejected transition of execution {} to {}", run.executionId, target);
            return;
        }
        conclude(updated.get());
    }

    /** Fails an execution whose loop cannot continue, skipping what has not finished. */
    private void abort(ExecutionRun run, String reason) {
        try {
            Execution execution = load(run.executionId);
            for (Step step : execution.steps()) {
                if (!step.status().isTerminal()) {
                    skip(run.executionId, step, reason);
                }
            }
            repository.updateExecutionStatus(run.executionId, ExecutionStatus.FAILED, Instant.now())
                    .ifPresent(this::conclude);
        } catch (RuntimeException e) {
            log.error("Could not mark execution {} failed: {}", run.executionId, e.getMessage(), e);
        }
    }

    private void conclude(Execution execution) {
        ExecutionView view = progressAggregator.view(execution, List.of());
        boolean completed = execution.status() == ExecutionStatus.COMPLETED;
        String message = completed
                ? "All " + execution.steps().size() + " step(s) completed"
                : view.failures().size() + " step(s) failed, " + view.progress().skipped() + " skipped";
        log.info("Execution {} {}: {}", execution.id(), execution.status().name().toLowerCase(), message);
        auditRecorder.record(execution.id(), null, null,
                completed ? AuditAction.EXECUTION_COMPLETED : AuditAction.EXECUTION_FAILED,
                execution.status().name().toLowerCase(), message);
        publish(completed ? ExecutionEvent.EXECUTION_COMPLETED : ExecutionEvent.EXECUTION_FAILED,
                execution.id(), null, payload(
                        "completed_steps", view.progress().completed(),
                        "failed_steps", view.progress().failed(),
                        "skipped_steps", view.progress().skipped(),
                        "failures", view.failures(),
                        "duration_ms", view.durationMs()));
        metrics.recordExecutionResult(execution.status().name().toLowerCase());
        if (view.durationMs() != null) {
            metrics.recordExecutionDuration(execution.mode().name().toLowerCase(), view.durationMs());
        }
    }

    // --- Helpers ---

    /** Skips the steps of a cancelled execution that no loop will pick up, then announces the cancel. */
    private void settleCancelled(String executionId) {
        skipWaitingSteps(executionId, "Skipped: execution cancelled");
        publish(ExecutionEvent.EXECUTION_CANCELLED, executionId, null, payload());
    }

    private void skipWaitingSteps(String executionId, String reason) {
        Execution execution = load(executionId);
        for (Step step : execution.steps()) {
            if (step.status() == StepStatus.PENDING || step.status() == StepStatus.BLOCKED) {
                skip(executionId, step, reason);
            }
        }
    }

    private void skip(String executionId, Step step, String reason) {
        var skipped = repository.transitionStep(executionId, step.id(), StepStatus.SKIPPED,
                s -> s.withCompletion(Instant.now(), null, reason));
        if (skipped.isEmpty()) {
            log.warn("Rejected transition of step {} from {} to SKIPPED", step.id(), step.status());
            return;
        }
        log.info("Step {} skipped ({})", step.id(), reason);
        auditRecorder.record(executionId, step.id(), step.agentId(), AuditAction.STEP_SKIPPED, "skipped", reason);
        publish(ExecutionEvent.STEP_SKIPPED, executionId, step.id(), payload("agent", step.agentId(), "reason", reason));
        metrics.recordStepResult("skipped");
    }

    private Map<String, Object> stepContext(Execution execution, Step step) {
        var context = new LinkedHashMap<String, Object>(execution.workingContext());
        context.put("execution_id", execution.id());
        context.put("step_id", step.id());
        var upstream = new LinkedHashMap<String, Object>();
        for (String dep : step.dependsOn()) {
            execution.step(dep).map(Step::result).ifPresent(result -> upstream.put(dep, result));
        }
        context.put("dependency_results", upstream);
        return context;
    }

    private List<List<String>> stagesOf(Execution execution) {
        ExecutionRun run = runs.get(execution.id());
        if (run != null) {
            return run.stages;
        }
        try {
            return resolver.resolve(execution.stepDefinitions());
        } catch (ValidationException e) {
            return List.of();
        }
    }

    private static boolean dependenciesCompleted(Execution execution, Step step) {
        for (String dep : step.dependsOn()) {
            if (execution.step(dep).map(Step::status).orElse(null) != StepStatus.COMPLETED) {
                return false;
            }
        }
        return true;
    }

    private static boolean stageTerminal(Execution execution, List<String> stage) {
        return stage.stream().allMatch(id -> execution.step(id).map(s -> s.status().isTerminal()).orElse(true));
    }

    private static void releasePermit(ExecutionRun run) {
        if (run.mode == ExecutionMode.PARALLEL) {
            run.permits.release();
        }
    }

    private Execution load(String executionId) {
        return repository.findById(executionId).orElseThrow(() -> new ExecutionNotFoundException(executionId));
    }

    /**
     * Publishes an event stamped with the execution's current progress. Reading the progress and
     * publishing happen under one lock per execution, so subscribers see progress in the order
     * it was read.
     */
    private void publish(String eventType, String executionId, String stepId, Map<String, Object> payload) {
        ExecutionRun run = runs.get(executionId);
        Object lock = run != null ? run : publishLock;
        try {
            synchronized (lock) {
                payload.put("progress", progressAggregator.progress(load(executionId)).percent());
                eventBus.publish(new ExecutionEvent(eventType, executionId, stepId, payload, Instant.now()));
            }
        } catch (RuntimeException e) {
            log.warn("Failed to publish {} for execution {}: {}", eventType, executionId, e.getMessage(), e);
        }
    }

    /** Builds a mutable payload from alternating keys and values; null values are dropped. */
    private static Map<String, Object> payload(Object... keyValues) {
        var map = new LinkedHashMap<String, Object>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                map.put((String) keyValues[i], keyValues[i + 1]);
            }
        }
        return map;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @PreDestroy
    void shutdown() {
        loopExecutor.shutdownNow();
        stepExecutor.shutdownNow();
    }

    /**
     * Hands every invocation attempt to the control loop, which audits it. Runs on a worker thread.
     */
    private final class RunAttemptListener implements AttemptListener {

        private final ExecutionRun run;

        RunAttemptListener(ExecutionRun run) {
            this.run = run;
        }

        @Override
        public void onAttempt(Step step, int attempt, Outcome outcome, String error, boolean willRetry) {
            run.deliver(StepOutcome.attempt(step, attempt, outcome, error, willRetry));
        }

        @Override
        public boolean shouldContinue() {
            return !run.isCancelRequested();
        }
    }
}
