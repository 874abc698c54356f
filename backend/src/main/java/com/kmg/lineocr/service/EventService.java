package com.kmg.lineocr.service;

import com.kmg.lineocr.dto.JobEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans job lifecycle and progress events out to every connected server-sent-events client.
 */
@Service
public class EventService {
    public static final String JOB_CREATED = "job-created";
    public static final String JOB_STARTED = "job-started";
    public static final String JOB_PHASE = "job-phase";
    public static final String PAGE_PROGRESS = "page-progress";
    public static final String JOB_FINISHED = "job-finished";
    public static final String RETRY_STARTED = "retry-started";

    private static final Logger log = LoggerFactory.getLogger(EventService.class);
    private final List<SseEmitter> emitters = new CopyOnWriteArrayList<>();

    public SseEmitter subscribe() {
        SseEmitter emitter = new SseEmitter(0L);
        emitters.add(emitter);

        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(() -> emitters.remove(emitter));
        emitter.onError(ex -> emitters.remove(emitter));

        return emitter;
    }

    public int subscriberCount() {
        return emitters.size();
    }

    public void publish(String type, String jobId, String message, Object payload) {
        if (emitters.isEmpty()) {
            return;
        }
        JobEvent event = new JobEvent(type, jobId, message, OffsetDateTime.now(ZoneOffset.UTC).toString(), payload);
        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event().name(type).data(event));
            } catch (IOException | IllegalStateException e) {
                log.debug("Removing SSE emitter after send failure: {}", e.getMessage());
                emitters.remove(emitter);
            }
        }
    }
}
