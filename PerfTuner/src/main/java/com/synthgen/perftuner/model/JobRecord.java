package com.synthgen.perftuner.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Terminal outcome of one job, written exactly once.
 *
 * Latency covers the whole job, retries and backoff included, so the
 * tuner sees delivered latency rather than per-attempt latency.
 */
@Value
@Builder
public class JobRecord {

    String jobId;

    Instant startedAt;

    Instant finishedAt;

    long latencyMs;

    String modelId;

    int promptTokens;

    int completionTokens;

    /** HTTP status of the final attempt; null on pure transport failure. */
    Integer httpStatus;

    /** Null on success. */
    String errorText;

    int attempts;

    JobOutcome outcome;

    public boolean succeeded() {
        return outcome == JobOutcome.SUCCEEDED;
    }
}
