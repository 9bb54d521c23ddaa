package com.maestro.core.scheduler;

import com.maestro.core.model.ExecutionMode;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Control-loop state of one active execution.
 * <p>
 * Worker threads only ever touch {@link #outcomes}; {@link #cancel()} may be called from any
 * thread. {@link #closed} is guarded by the scheduler's run map. Everything else is owned by the
 * loop thread.
 */
final class ExecutionRun {

    private static final StepOutcome WAKE = new StepOutcome(null, null, null);

    final String executionId;
    final ExecutionMode mode;
    final List<List<String>> stages;
    final Semaphore permits;
    final LinkedBlockingQueue<StepOutcome> outcomes = new LinkedBlockingQueue<>();
    final AtomicInteger inFlight = new AtomicInteger();
    final CompletableFuture<Void> done = new CompletableFuture<>();
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    int stageIndex;
    boolean cancelAnnounced;
    /** Set once the loop stops taking cancels; read and written only inside {@code runs.compute*}. */
    boolean closed;

    ExecutionRun(String executionId, ExecutionMode mode, List<List<String>> stages, int maxInFlight) {
        this.executionId = executionId;
        this.mode = mode;
        this.stages = stages;
        this.permits = new Semaphore(Math.max(1, maxInFlight));
    }

    void cancel() {
        cancelRequested.set(true);
        outcomes.offer(WAKE);
    }

    boolean isCancelRequested() {
        return cancelRequested.get();
    }

    void deliver(StepOutcome outcome) {
        outcomes.offer(outcome);
    }

    /** Blocks until a step outcome, an attempt notice or a wake-up arrives; returns null for a wake-up. */
    StepOutcome awaitOutcome() throws InterruptedException {
        StepOutcome outcome = outcomes.take();
        return outcome == WAKE ? null : outcome;
    }
}
