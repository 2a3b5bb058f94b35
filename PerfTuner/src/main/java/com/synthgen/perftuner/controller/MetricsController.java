package com.synthgen.perftuner.controller;

import com.synthgen.perftuner.dto.MetricsSnapshot;
import com.synthgen.perftuner.service.MetricsBroadcaster;
import com.synthgen.perftuner.service.PerfTunerLifecycleManager;
import com.synthgen.perftuner.service.TelemetryStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Monitoring surface: pull snapshot, push stream, liveness.
 */
@RestController
@Slf4j
public class MetricsController {

    private final PerfTunerLifecycleManager lifecycleManager;
    private final MetricsBroadcaster broadcaster;
    private final TelemetryStore telemetryStore;

    public MetricsController(PerfTunerLifecycleManager lifecycleManager,
                             MetricsBroadcaster broadcaster,
                             TelemetryStore telemetryStore) {
        this.lifecycleManager = lifecycleManager;
        this.broadcaster = broadcaster;
        this.telemetryStore = telemetryStore;
    }

    /** Current pool state plus the latest sample. */
    @GetMapping("/metrics")
    public ResponseEntity<MetricsSnapshot> metrics() {
        return ResponseEntity.ok(lifecycleManager.snapshot());
    }

    /** Snapshot on connect, then one "sample" event per tick. */
    @GetMapping(path = "/metrics/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream() {
        log.debug("Metrics stream subscription");
        return broadcaster.subscribe(lifecycleManager.snapshot());
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("running", lifecycleManager.isRunning());
        body.put("telemetry", telemetryStore.isAvailable() ? "database" : "logging-only");
        body.put("subscribers", broadcaster.subscriberCount());
        return ResponseEntity.ok(body);
    }
}
