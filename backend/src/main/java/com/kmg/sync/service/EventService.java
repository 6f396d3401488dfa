package com.kmg.sync.service;

import com.kmg.sync.dto.EventMessage;
import com.kmg.sync.repo.SqlTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pushes run lifecycle events to SSE subscribers. A subscriber may follow a single job or all of them.
 */
@Service
public class EventService {
    private static final Logger log = LoggerFactory.getLogger(EventService.class);
    private static final long ALL_JOBS = -1L;

    private final Map<SseEmitter, Long> subscribers = new ConcurrentHashMap<>();

    public SseEmitter subscribe(Long jobId) {
        SseEmitter emitter = new SseEmitter(0L);
        subscribers.put(emitter, jobId == null ? ALL_JOBS : jobId);

        emitter.onCompletion(() -> subscribers.remove(emitter));
        emitter.onTimeout(() -> subscribers.remove(emitter));
        emitter.onError(ex -> subscribers.remove(emitter));
        log.debug("SSE subscriber added for {}", jobId == null ? "all jobs" : "job " + jobId);
        return emitter;
    }

    public void publish(RunEvent event, long jobId, long executionId, String message) {
        if (subscribers.isEmpty()) {
            return;
        }
        EventMessage payload = new EventMessage(event.eventName(), jobId, executionId, message, SqlTime.nowText());
        subscribers.forEach((emitter, followed) -> {
            if (followed != ALL_JOBS && followed != jobId) {
                return;
            }
            try {
                emitter.send(SseEmitter.event().name(event.eventName()).data(payload));
            } catch (IOException | IllegalStateException e) {
                log.debug("Dropping SSE subscriber after failed send: {}", e.getMessage());
                subscribers.remove(emitter);
            }
        });
    }

    public int subscriberCount() {
        return subscribers.size();
    }
}
