package com.synthgen.perftuner.service;

import com.synthgen.perftuner.config.PerfTunerProperties;
import com.synthgen.perftuner.dto.LifecycleStatus;
import com.synthgen.perftuner.dto.MetricsSnapshot;
import com.synthgen.perftuner.dto.PoolStatus;
import com.synthgen.perftuner.model.Run;
import com.synthgen.perftuner.model.Sample;
import com.synthgen.perftuner.model.TuningDecision;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the run lifecycle: opens a Run, starts the worker pool and the
 * periodic tick, and on stop drains the pool and closes the Run.
 *
 * The tick is the only place where samples are taken and the tuner is
 * evaluated, so the two always run in the same order at the same cadence.
 */
@Service
@Slf4j
public class PerfTunerLifecycleManager {

    private final PerfTunerProperties props;
    private final WorkerPool workerPool;
    private final SampleAggregator aggregator;
    private final ConcurrencyTuner tuner;
    private final TelemetryStore telemetryStore;
    private final MetricsBroadcaster broadcaster;
    private final Clock clock = Clock.systemUTC();

    private final ReentrantLock lifecycleLock = new ReentrantLock();

    private volatile Run currentRun;
    private volatile ScheduledExecutorService ticker;

    public PerfTunerLifecycleManager(PerfTunerProperties props,
                                     WorkerPool workerPool,
                                     SampleAggregator aggregator,
                                     ConcurrencyTuner tuner,
                                     TelemetryStore telemetryStore,
                                     MetricsBroadcaster broadcaster) {
        this.props = props;
        this.workerPool = workerPool;
        this.aggregator = aggregator;
        this.tuner = tuner;
        this.telemetryStore = telemetryStore;
        this.broadcaster = broadcaster;
    }

    @PostConstruct
    public void init() {
        props.validate();
        log.info("PerfTunerLifecycleManager initialising: bounds [{}, {}], target p95 {}ms, target error rate {}, "
                        + "window {}s, tick {}s",
                props.getConcurrencyMin(), props.getConcurrencyMax(), props.getTargetP95Ms(),
                props.getTargetErrorRate(), props.getSampleWindow().toSeconds(), props.getTuneInterval().toSeconds());

        if (props.getBenchmark().isEnabled()) {
            log.info("Benchmark mode: the run is started by the benchmark driver");
        } else if (props.isAutoStart()) {
            start(props.getNotes());
        }
    }

    @PreDestroy
    public void destroy() {
        log.info("PerfTunerLifecycleManager shutting down...");
        stop(props.getDrainTimeout());
    }

    /**
     * Opens a new Run and starts workers and ticks. When a run is already
     * active it is returned unchanged.
     *
     * @throws IllegalStateException if the minimum number of workers cannot be launched
     */
    public Run start(String notes) {
        lifecycleLock.lock();
        try {
            if (isRunning()) {
                log.warn("Run {} already active - call stop() first.", currentRun.getRunId());
                return currentRun;
            }

            aggregator.reset();
            tuner.reset();
            broadcaster.reset();

            Run run = Run.builder()
                    .runId(UUID.randomUUID().toString())
                    .startedAt(now())
                    .modelId(props.getUpstream().getModelId())
                    .host(resolveHost())
                    .notes(notes != null && !notes.isBlank() ? notes : props.getNotes())
                    .build();

            telemetryStore.startRun(run);
            try {
                workerPool.start(props.getConcurrencyStart());
            } catch (IllegalStateException e) {
                telemetryStore.finishRun(run.getRunId(), now());
                throw e;
            }
            currentRun = run;

            ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "perf-tuner-tick");
                t.setDaemon(true);
                return t;
            });
            long interval = props.getTuneInterval().toMillis();
            scheduler.scheduleAtFixedRate(this::safeTick, interval, interval, TimeUnit.MILLISECONDS);
            ticker = scheduler;

            log.info("Run {} started: model={}, host={}, concurrency={}, tick every {}ms",
                    run.getRunId(), run.getModelId(), run.getHost(), workerPool.concurrency(), interval);
            return run;
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Stops ticking, drains the pool within {@code drainTimeout} and closes
     * the active Run.
     *
     * @return the finished run, empty when nothing was running
     */
    public Optional<Run> stop(Duration drainTimeout) {
        lifecycleLock.lock();
        try {
            Run run = currentRun;
            if (run == null || !run.isActive()) {
                return Optional.empty();
            }

            ScheduledExecutorService scheduler = ticker;
            ticker = null;
            if (scheduler != null) {
                scheduler.shutdownNow();
            }

            workerPool.shutdown(drainTimeout);

            Run finished = run.finish(now());
            currentRun = finished;
            telemetryStore.finishRun(finished.getRunId(), finished.getFinishedAt());

            log.info("Run {} finished after {}s", finished.getRunId(),
                    finished.elapsed(finished.getFinishedAt()).toSeconds());
            return Optional.of(finished);
        } finally {
            lifecycleLock.unlock();
        }
    }

    public boolean isRunning() {
        Run run = currentRun;
        return run != null && run.isActive();
    }

    /**
     * Active run, or the last finished one.
     */
    public Optional<Run> currentRun() {
        return Optional.ofNullable(currentRun);
    }

    public LifecycleStatus status() {
        return LifecycleStatus.builder()
                .state(isRunning() ? "RUNNING" : "STOPPED")
                .run(currentRun)
                .pool(workerPool.status())
                .telemetryAvailable(telemetryStore.isAvailable())
                .build();
    }

    public MetricsSnapshot snapshot() {
        Run run = currentRun;
        PoolStatus pool = workerPool.status();
        return MetricsSnapshot.of(run != null ? run.getRunId() : null, pool, broadcaster.latest());
    }

    /**
     * One aggregator/tuner step. Package-visible so tests can drive it
     * without the scheduler.
     */
    Sample tick() {
        Run run = currentRun;
        Sample sample = aggregator.sample(workerPool.concurrency(), workerPool.queueDepth());
        TuningDecision decision = tuner.tick(sample);
        if (run != null) {
            telemetryStore.recordSample(run.getRunId(), sample);
        }
        broadcaster.publish(sample);

        log.debug("Sample: jobs={} failed={} rps={} p50={}ms p95={}ms tokensOut={} -> concurrency {}",
                sample.getTotalJobs(), sample.getFailedJobs(), String.format("%.2f", sample.getThroughputRps()),
                sample.getP50Ms(), sample.getP95Ms(), sample.getTokensOut(), decision.getTo());
        return sample;
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("Tick failed: {}", e.getMessage(), e);
        }
    }

    private String resolveHost() {
        if (props.getHost() != null && !props.getHost().isBlank()) {
            return props.getHost();
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Cannot resolve local hostname: {}", e.getMessage());
            return "unknown";
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
