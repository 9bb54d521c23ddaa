package com.maestro.core.scheduler;

import com.maestro.core.model.ExecutionMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "maestro.scheduler")
public class SchedulerProperties {

    /** Upper bound on concurrently running steps of one execution in parallel mode. */
    private int maxInFlight = 4;
    private ExecutionMode defaultMode = ExecutionMode.STAGED;
    /** Threads shared by all executions for step invocations. */
    private int workerThreads = 16;

    public int getMaxInFlight() { return maxInFlight; }
    public void setMaxInFlight(int maxInFlight) { this.maxInFlight = maxInFlight; }
    public ExecutionMode getDefaultMode() { return defaultMode; }
    public void setDefaultMode(ExecutionMode defaultMode) { this.defaultMode = defaultMode; }
    public int getWorkerThreads() { return workerThreads; }
    public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
}
