package com.synthgen.perftuner.benchmark;

import com.synthgen.perftuner.config.PerfTunerProperties;
import com.synthgen.perftuner.dto.JobSubmission;
import com.synthgen.perftuner.dto.RunSummary;
import com.synthgen.perftuner.model.Job;
import com.synthgen.perftuner.model.JobRecord;
import com.synthgen.perftuner.model.Run;
import com.synthgen.perftuner.model.Sample;
import com.synthgen.perftuner.service.AdmissionResult;
import com.synthgen.perftuner.service.JobRecordListener;
import com.synthgen.perftuner.service.PerfTunerLifecycleManager;
import com.synthgen.perftuner.service.SampleAggregator;
import com.synthgen.perftuner.service.TelemetryStore;
import com.synthgen.perftuner.service.WorkerPool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives a bounded load against the worker pool inside its own Run.
 *
 * Prompts are submitted round-robin until the job count or the duration
 * is reached. Rejected submissions back off briefly and are retried with
 * the same prompt. After submission stops the driver waits for the queue
 * and in-flight work to drain, then closes the Run.
 */
@Component
@Slf4j
public class BenchmarkDriver {

    private static final Duration DRAIN_POLL = Duration.ofMillis(50);

    private final PerfTunerLifecycleManager lifecycleManager;
    private final WorkerPool workerPool;
    private final SampleAggregator aggregator;
    private final TelemetryStore telemetryStore;
    private final PerfTunerProperties props;

    public BenchmarkDriver(PerfTunerLifecycleManager lifecycleManager,
                           WorkerPool workerPool,
                           SampleAggregator aggregator,
                           TelemetryStore telemetryStore,
                           PerfTunerProperties props) {
        this.lifecycleManager = lifecycleManager;
        this.workerPool = workerPool;
        this.aggregator = aggregator;
        this.telemetryStore = telemetryStore;
        this.props = props;
    }

    /**
     * @throws IllegalArgumentException for invalid options
     * @throws IllegalStateException if a run is already active
     */
    public synchronized BenchmarkReport run(BenchmarkOptions options) throws InterruptedException {
        options.validate();
        if (lifecycleManager.isRunning()) {
            throw new IllegalStateException("A run is already active; stop it before benchmarking");
        }

        List<String> prompts = options.getPrompts();
        log.info("Starting benchmark with {} prompt variations", prompts.size());
        log.info("Target: {} jobs, {} seconds",
                options.getJobs() != null ? options.getJobs() : "unlimited",
                options.getDuration() != null ? options.getDuration().toSeconds() : "unlimited");

        Tally tally = new Tally();
        workerPool.addListener(tally);
        try {
            Run run = lifecycleManager.start(options.getNotes());
            Instant start = Instant.now();

            long submitted = 0;
            long rejected = 0;
            int promptIndex = 0;
            long intervalNanos = options.getRatePerSecond() > 0 ? (long) (1_000_000_000L / options.getRatePerSecond()) : 0;
            long nextSubmission = System.nanoTime();

            while (!limitReached(options, start, submitted)) {
                if (intervalNanos > 0) {
                    long wait = nextSubmission - System.nanoTime();
                    if (wait > 0) {
                        Thread.sleep(wait / 1_000_000L, (int) (wait % 1_000_000L));
                    }
                }

                Job job = JobSubmission.ofPrompt(prompts.get(promptIndex % prompts.size()))
                        .toJob(props.getUpstream());
                AdmissionResult result = workerPool.submit(job);

                if (result.isAccepted()) {
                    submitted++;
                    promptIndex++;
                    nextSubmission += intervalNanos;
                    if (options.getProgressEvery() > 0 && submitted % options.getProgressEvery() == 0) {
                        double elapsed = Math.max(0.001, Duration.between(start, Instant.now()).toMillis() / 1000.0);
                        log.info("Submitted: {} jobs, Rate: {} jobs/sec, Concurrency: {}, Queue: {}",
                                submitted, String.format("%.1f", submitted / elapsed),
                                workerPool.concurrency(), workerPool.queueDepth());
                    }
                } else if (result == AdmissionResult.REJECTED_CLOSED) {
                    log.warn("Admission closed during benchmark, stopping submission");
                    break;
                } else {
                    rejected++;
                    Thread.sleep(options.getRejectBackoff().toMillis());
                }
            }

            Sample finalSample = aggregator.peek(workerPool.concurrency(), workerPool.queueDepth());
            int finalConcurrency = workerPool.concurrency();
            log.info("Submitted {} jobs, waiting for completion...", submitted);

            awaitDrain(tally, submitted, props.getDrainTimeout());
            int finalQueueDepth = workerPool.queueDepth();

            Run finished = lifecycleManager.stop(props.getDrainTimeout()).orElse(run);
            Instant finishedAt = finished.getFinishedAt() != null ? finished.getFinishedAt() : Instant.now();
            double durationSec = Duration.between(finished.getStartedAt(), finishedAt).toMillis() / 1000.0;

            telemetryStore.flush(Duration.ofSeconds(10));
            RunSummary summary = telemetryStore.summarize(finished.getRunId()).orElse(null);

            return BenchmarkReport.builder()
                    .runId(finished.getRunId())
                    .startedAt(finished.getStartedAt())
                    .finishedAt(finishedAt)
                    .durationSec(durationSec)
                    .submitted(submitted)
                    .rejected(rejected)
                    .completed(tally.completed.get())
                    .failed(tally.failed.get())
                    .overallThroughputRps(durationSec > 0 ? tally.completed.get() / durationSec : 0)
                    .finalSample(finalSample)
                    .finalConcurrency(finalConcurrency)
                    .finalQueueDepth(finalQueueDepth)
                    .summary(summary)
                    .build();
        } finally {
            workerPool.removeListener(tally);
            if (lifecycleManager.isRunning()) {
                lifecycleManager.stop(props.getDrainTimeout());
            }
        }
    }

    private static boolean limitReached(BenchmarkOptions options, Instant start, long submitted) {
        if (options.getJobs() != null && submitted >= options.getJobs()) {
            return true;
        }
        return options.getDuration() != null
                && !Duration.between(start, Instant.now()).minus(options.getDuration()).isNegative();
    }

    private void awaitDrain(Tally tally, long submitted, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        long lastLog = 0;
        while (tally.completed.get() < submitted && System.nanoTime() < deadline) {
            long now = System.nanoTime();
            if (now - lastLog > Duration.ofSeconds(2).toNanos()) {
                Sample latest = aggregator.peek(workerPool.concurrency(), workerPool.queueDepth());
                log.info("Queue depth: {}, in flight: {}, Throughput: {} RPS",
                        workerPool.queueDepth(), workerPool.inFlight(),
                        String.format("%.2f", latest.getThroughputRps()));
                lastLog = now;
            }
            Thread.sleep(DRAIN_POLL.toMillis());
        }
        if (tally.completed.get() < submitted) {
            log.warn("Benchmark drain wait timed out: {}/{} jobs completed", tally.completed.get(), submitted);
        }
    }

    private static final class Tally implements JobRecordListener {
        private final AtomicLong completed = new AtomicLong();
        private final AtomicLong failed = new AtomicLong();

        @Override
        public void onJobRecord(JobRecord record) {
            completed.incrementAndGet();
            if (!record.succeeded()) {
                failed.incrementAndGet();
            }
        }
    }
}
