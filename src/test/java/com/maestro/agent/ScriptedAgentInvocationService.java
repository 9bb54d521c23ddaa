package com.maestro.agent;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test double for {@link AgentInvocationService} whose behaviour is scripted per task text.
 * Tasks without a script succeed immediately with {@code "done <task>"}.
 * <p>
 * Records the order invocations start and end in, the context each task last received and the
 * highest number of concurrent invocations observed.
 */
public class ScriptedAgentInvocationService implements AgentInvocationService {

    @FunctionalInterface
    public interface Script {
        AgentInvocation attempt(int attempt) throws Exception;
    }

    private final Map<String, Script> scripts = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> attempts = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Object>> contexts = new ConcurrentHashMap<>();
    private final List<String> timeline = new CopyOnWriteArrayList<>();
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger maxActive = new AtomicInteger();

    public ScriptedAgentInvocationService on(String task, Script script) {
        scripts.put(task, script);
        return this;
    }

    @Override
    public AgentInvocation invoke(String agentId, String taskText, Map<String, Object> context, Duration timeout) {
        int attempt = attempts.computeIfAbsent(taskText, k -> new AtomicInteger()).incrementAndGet();
        contexts.put(taskText, context);
        maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
        timeline.add("start:" + taskText);
        try {
            Script script = scripts.get(taskText);
            return script != null ? script.attempt(attempt) : AgentInvocation.success("done " + taskText);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return AgentInvocation.failure("interrupted");
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException(e);
        } finally {
            active.decrementAndGet();
            timeline.add("end:" + taskText);
        }
    }

    public int attempts(String task) {
        AtomicInteger count = attempts.get(task);
        return count != null ? count.get() : 0;
    }

    public Map<String, Object> contextOf(String task) {
        return contexts.get(task);
    }

    public List<String> timeline() {
        return List.copyOf(timeline);
    }

    public int maxConcurrent() {
        return maxActive.get();
    }

    // -- Scripts --------------------------------------------------------------

    public static Script failing(String error) {
        return attempt -> AgentInvocation.failure(error);
    }

    public static Script sleeping(long ms, String output) {
        return attempt -> {
            Thread.sleep(ms);
            return AgentInvocation.success(output);
        };
    }

    public static Script awaiting(CountDownLatch latch, String output) {
        return attempt -> {
            if (!latch.await(10, TimeUnit.SECONDS)) {
                return AgentInvocation.failure("latch never released");
            }
            return AgentInvocation.success(output);
        };
    }

    /** Sleeps past any short timeout on the first {@code slowAttempts} attempts, then succeeds. */
    public static Script slowFor(int slowAttempts, long sleepMs, String output) {
        return attempt -> {
            if (attempt <= slowAttempts) {
                Thread.sleep(sleepMs);
            }
            return AgentInvocation.success(output);
        };
    }
}
