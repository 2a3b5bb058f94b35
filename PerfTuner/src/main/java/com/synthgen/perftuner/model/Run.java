package com.synthgen.perftuner.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * One bounded telemetry session.
 */
@Value
@Builder(toBuilder = true)
public class Run {

    String runId;

    Instant startedAt;

    /** Null while the run is active. */
    Instant finishedAt;

    String modelId;

    String host;

    String notes;

    public boolean isActive() {
        return finishedAt == null;
    }

    public Run finish(Instant at) {
        if (finishedAt != null) {
            throw new IllegalStateException("Run " + runId + " already finished at " + finishedAt);
        }
        return toBuilder().finishedAt(at).build();
    }

    public Duration elapsed(Instant now) {
        return Duration.between(startedAt, finishedAt != null ? finishedAt : now);
    }
}
