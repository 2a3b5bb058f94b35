package com.synthgen.perftuner.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Aggregate snapshot of one rolling window, emitted once per tuning tick.
 */
@Value
@Builder
public class Sample {

    Instant ts;

    long windowSec;

    /** Worker target in effect when the sample was taken. */
    int concurrency;

    int queueDepth;

    double throughputRps;

    long p50Ms;

    long p95Ms;

    double errorRate;

    long tokensIn;

    long tokensOut;

    int totalJobs;

    int failedJobs;

    /**
     * True when no job finished inside the window.
     */
    public boolean isEmpty() {
        return totalJobs == 0;
    }
}
