package com.synthgen.perftuner.service;

import com.synthgen.perftuner.dto.MetricsSnapshot;
import com.synthgen.perftuner.model.Sample;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Push side of the monitoring surface: fans each emitted Sample out to the
 * connected server-sent-event subscribers.
 */
@Service
@Slf4j
public class MetricsBroadcaster {

    static final String SNAPSHOT_EVENT = "snapshot";
    static final String SAMPLE_EVENT = "sample";

    private final List<SseEmitter> emitters = new CopyOnWriteArrayList<>();
    private final AtomicReference<Sample> latest = new AtomicReference<>();

    /**
     * Registers a new subscriber and sends it the current snapshot first.
     * A zero timeout keeps the stream open until the client disconnects.
     */
    public SseEmitter subscribe(MetricsSnapshot initial) {
        SseEmitter emitter = new SseEmitter(0L);
        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(() -> emitters.remove(emitter));
        emitter.onError(e -> emitters.remove(emitter));

        try {
            emitter.send(SseEmitter.event().name(SNAPSHOT_EVENT).data(initial, MediaType.APPLICATION_JSON));
            emitters.add(emitter);
            log.debug("Metrics subscriber connected ({} active)", emitters.size());
        } catch (IOException e) {
            log.debug("Metrics subscriber dropped before first event: {}", e.getMessage());
            emitter.completeWithError(e);
        }
        return emitter;
    }

    public void publish(Sample sample) {
        latest.set(sample);
        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event().name(SAMPLE_EVENT).data(sample, MediaType.APPLICATION_JSON));
            } catch (IOException | IllegalStateException e) {
                log.debug("Dropping metrics subscriber: {}", e.getMessage());
                emitters.remove(emitter);
                emitter.completeWithError(e);
            }
        }
    }

    /**
     * Last published sample, or null before the first tick.
     */
    public Sample latest() {
        return latest.get();
    }

    /**
     * Clears the last sample; called when a new run starts.
     */
    public void reset() {
        latest.set(null);
    }

    public int subscriberCount() {
        return emitters.size();
    }
}
