package com.synthgen.perftuner.benchmark;

import com.synthgen.perftuner.dto.RunSummary;
import com.synthgen.perftuner.model.Sample;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;

/**
 * Result of one benchmark invocation.
 */
@Value
@Builder
@Slf4j
public class BenchmarkReport {

    String runId;

    Instant startedAt;

    Instant finishedAt;

    double durationSec;

    long submitted;

    long rejected;

    long completed;

    long failed;

    /** Completed jobs over the whole run duration. */
    double overallThroughputRps;

    /** Rolling-window sample taken when submission stopped. */
    Sample finalSample;

    int finalConcurrency;

    int finalQueueDepth;

    /** Null when telemetry runs in logging-only mode. */
    RunSummary summary;

    public void log() {
        log.info("============================================================");
        log.info("BENCHMARK SUMMARY");
        log.info("============================================================");
        log.info("Run ID: {}", runId);
        log.info("Duration: {} seconds", String.format("%.1f", durationSec));
        log.info("Jobs Submitted: {} (rejected attempts: {})", submitted, rejected);
        log.info("Jobs Completed: {} (failed: {})", completed, failed);
        log.info("Overall Throughput: {} RPS", String.format("%.2f", overallThroughputRps));
        if (finalSample != null) {
            log.info("Final Window: {} RPS, p50 {} ms, p95 {} ms, error rate {}",
                    String.format("%.2f", finalSample.getThroughputRps()), finalSample.getP50Ms(),
                    finalSample.getP95Ms(), String.format("%.3f", finalSample.getErrorRate()));
        }
        if (summary != null) {
            log.info("Model: {}  Host: {}", summary.getModelId(), summary.getHost());
            log.info("Average Latency: {} ms", String.format("%.1f", summary.getAvgLatencyMs()));
            log.info("Max Latency: {} ms", summary.getMaxLatencyMs());
            log.info("Total Completion Tokens: {}", summary.getTotalCompletionTokens());
            log.info("Best Throughput: {} RPS at concurrency {} (p95 {} ms)",
                    String.format("%.2f", summary.getBestThroughputRps()), summary.getBestConcurrency(),
                    summary.getBestP95Ms());
        } else {
            log.info("No database summary available (logging-only telemetry)");
        }
        log.info("Final Concurrency: {}", finalConcurrency);
        log.info("Final Queue Depth: {}", finalQueueDepth);
    }
}
