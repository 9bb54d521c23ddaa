package com.maestro.dispatch.api;

import com.maestro.core.events.EventBus;
import com.maestro.core.events.ExecutionEvent;
import com.maestro.core.model.ExecutionView;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Streams execution events to HTTP clients as Server-Sent Events.
 * <p>
 * Every stream opens with an {@value #SNAPSHOT_EVENT} frame describing the execution as it
 * is at connect time, so a client that attaches mid-run starts from the current progress
 * instead of zero. Live events follow as named frames until the terminal event, after
 * which the stream is completed. Streams for executions that already finished carry only
 * the snapshot.
 * <p>
 * A heartbeat comment is written to every open stream each {@value #HEARTBEAT_INTERVAL_SECONDS}
 * seconds so that proxies with idle timeouts keep long-running streams open.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    static final String SNAPSHOT_EVENT = "execution_snapshot";

    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final long timeoutMs;

    /** Open streams mapped to the execution they follow. */
    private final Map<SseEmitter, Stream> streams = new ConcurrentHashMap<>();

    private final ScheduledExecutorService heartbeats = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeats.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeats.shutdownNow();
        streams.keySet().forEach(SseEmitter::complete);
        streams.clear();
    }

    /**
     * Opens a stream for the execution described by {@code current}.
     *
     * @param current the execution as it is now; must exist
     * @return an emitter that has already been handed the snapshot frame
     */
    public SseEmitter createEmitter(ExecutionView current) {
        String executionId = current.executionId();
        SseEmitter emitter = new SseEmitter(timeoutMs);

        if (current.status().isTerminal()) {
            send(emitter, SNAPSHOT_EVENT, snapshot(current));
            emitter.complete();
            log.debug("Execution {} already {}; stream carries the snapshot only", executionId, current.status());
            return emitter;
        }

        // subscribe before the snapshot so nothing published in between is lost
        EventBus.Subscription subscription = eventBus.subscribe(executionId, event -> forward(emitter, event));
        streams.put(emitter, new Stream(executionId, subscription));
        emitter.onCompletion(() -> close(emitter));
        emitter.onTimeout(() -> close(emitter));
        emitter.onError(ex -> close(emitter));

        send(emitter, SNAPSHOT_EVENT, snapshot(current));
        log.info("Streaming events for execution {} (timeout={}ms)", executionId, timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return streams.size();
    }

    void sendHeartbeats() {
        streams.forEach((emitter, stream) -> {
            try {
                emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                log.debug("Heartbeat failed for execution {}: {}", stream.executionId(), e.getMessage());
            }
        });
    }

    /**
     * Flattens an event into the JSON object sent as the frame's data.
     */
    static Map<String, Object> frame(ExecutionEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("executionId", event.executionId());
        if (event.stepId() != null) {
            data.put("stepId", event.stepId());
        }
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        return data;
    }

    static Map<String, Object> snapshot(ExecutionView view) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("executionId", view.executionId());
        data.put("status", view.status().name().toLowerCase());
        data.put("progress", view.progress().percent());
        data.put("completed", view.progress().completed());
        data.put("failed", view.progress().failed());
        data.put("skipped", view.progress().skipped());
        data.put("total", view.progress().total());
        return data;
    }

    private void forward(SseEmitter emitter, ExecutionEvent event) {
        if (send(emitter, event.eventType(), frame(event)) && event.isTerminal()) {
            emitter.complete();
        }
    }

    private boolean send(SseEmitter emitter, String name, Map<String, Object> data) {
        try {
            emitter.send(SseEmitter.event().name(name).data(data));
            return true;
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropped {} frame for execution {}: {}", name, data.get("executionId"), e.getMessage());
            return false;
        }
    }

    private void close(SseEmitter emitter) {
        Stream stream = streams.remove(emitter);
        if (stream != null) {
            stream.subscription().unsubscribe();
            log.debug("Closed event stream for execution {}", stream.executionId());
        }
    }

    private record Stream(String executionId, EventBus.Subscription subscription) {}
}
