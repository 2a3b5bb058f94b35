package com.synthgen.perftuner.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Aggregate view of one run as stored in the telemetry database.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunSummary {

    private String runId;
    private String modelId;
    private String host;
    private Instant startedAt;
    private Instant finishedAt;
    private long totalJobs;
    private long failedJobs;
    private double avgLatencyMs;
    private long maxLatencyMs;
    private long totalCompletionTokens;
    private long sampleCount;
    private double bestThroughputRps;
    private int bestConcurrency;
    private long bestP95Ms;
}
