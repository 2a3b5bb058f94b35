package com.synthgen.perftuner.controller;

import com.synthgen.perftuner.config.PerfTunerProperties;
import com.synthgen.perftuner.dto.JobSubmission;
import com.synthgen.perftuner.dto.LifecycleStatus;
import com.synthgen.perftuner.dto.RunSummary;
import com.synthgen.perftuner.dto.SubmissionResponse;
import com.synthgen.perftuner.model.Job;
import com.synthgen.perftuner.model.TuningDecision;
import com.synthgen.perftuner.service.AdmissionResult;
import com.synthgen.perftuner.service.ConcurrencyTuner;
import com.synthgen.perftuner.service.PerfTunerLifecycleManager;
import com.synthgen.perftuner.service.TelemetryStore;
import com.synthgen.perftuner.service.WorkerPool;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Control surface for runs and job submission.
 */
@RestController
@RequestMapping("/api/perf")
@Slf4j
public class PerfControlController {

    private final PerfTunerLifecycleManager lifecycleManager;
    private final WorkerPool workerPool;
    private final ConcurrencyTuner tuner;
    private final TelemetryStore telemetryStore;
    private final PerfTunerProperties props;

    public PerfControlController(PerfTunerLifecycleManager lifecycleManager,
                                 WorkerPool workerPool,
                                 ConcurrencyTuner tuner,
                                 TelemetryStore telemetryStore,
                                 PerfTunerProperties props) {
        this.lifecycleManager = lifecycleManager;
        this.workerPool = workerPool;
        this.tuner = tuner;
        this.telemetryStore = telemetryStore;
        this.props = props;
    }

    @PostMapping("/start")
    public ResponseEntity<LifecycleStatus> start(@RequestParam(required = false) String notes) {
        log.info("Start requested via API");
        lifecycleManager.start(notes);
        return ResponseEntity.ok(lifecycleManager.status());
    }

    /** Graceful stop; drainSeconds overrides perf.drain-timeout. */
    @PostMapping("/stop")
    public ResponseEntity<LifecycleStatus> stop(@RequestParam(required = false) Long drainSeconds) {
        Duration drain = drainSeconds != null ? Duration.ofSeconds(Math.max(0, drainSeconds)) : props.getDrainTimeout();
        log.info("Stop requested via API (drain {}s)", drain.toSeconds());
        lifecycleManager.stop(drain);
        return ResponseEntity.ok(lifecycleManager.status());
    }

    /**
     * Non-blocking admission: 202 when queued, 429 when saturated,
     * 503 when no run is accepting work.
     */
    @PostMapping("/jobs")
    public ResponseEntity<SubmissionResponse> submit(@Valid @RequestBody JobSubmission submission) {
        Job job = submission.toJob(props.getUpstream());
        AdmissionResult result = workerPool.submit(job);

        SubmissionResponse body = SubmissionResponse.builder()
                .jobId(job.getJobId())
                .result(result)
                .queueDepth(workerPool.queueDepth())
                .build();

        switch (result) {
            case ACCEPTED:
                return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
            case REJECTED_FULL:
                return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(body);
            default:
                return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }
    }

    @GetMapping("/status")
    public ResponseEntity<LifecycleStatus> status() {
        return ResponseEntity.ok(lifecycleManager.status());
    }

    @GetMapping("/runs/{runId}/summary")
    public ResponseEntity<RunSummary> summary(@PathVariable String runId) {
        return telemetryStore.summarize(runId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/tuner/history")
    public ResponseEntity<List<TuningDecision>> history() {
        return ResponseEntity.ok(tuner.history());
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, String>> handleIllegalState(IllegalStateException e) {
        log.error("Lifecycle operation failed: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", String.valueOf(e.getMessage())));
    }
}
