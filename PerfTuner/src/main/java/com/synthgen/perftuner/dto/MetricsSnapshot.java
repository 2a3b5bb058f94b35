package com.synthgen.perftuner.dto;

import com.synthgen.perftuner.model.Sample;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * DTO returned by GET /metrics and sent first on every stream subscription.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricsSnapshot {

    private String runId;

    private int concurrency;

    private int queueDepth;

    private int liveWorkers;

    private int idleWorkers;

    private int inFlight;

    private long acceptedTotal;

    private long rejectedTotal;

    /** Latest emitted sample; null before the first tick. */
    private Sample latestSample;

    private double tokensPerSecIn;

    private double tokensPerSecOut;

    private Instant lastUpdated;

    public static MetricsSnapshot of(String runId, PoolStatus pool, Sample latest) {
        double inRate = 0;
        double outRate = 0;
        if (latest != null && latest.getWindowSec() > 0) {
            inRate = (double) latest.getTokensIn() / latest.getWindowSec();
            outRate = (double) latest.getTokensOut() / latest.getWindowSec();
        }
        return MetricsSnapshot.builder()
                .runId(runId)
                .concurrency(pool.getConcurrency())
                .queueDepth(pool.getQueueDepth())
                .liveWorkers(pool.getLiveWorkers())
                .idleWorkers(pool.getIdleWorkers())
                .inFlight(pool.getInFlight())
                .acceptedTotal(pool.getAcceptedTotal())
                .rejectedTotal(pool.getRejectedTotal())
                .latestSample(latest)
                .tokensPerSecIn(inRate)
                .tokensPerSecOut(outRate)
                .lastUpdated(latest != null ? latest.getTs() : Instant.now())
                .build();
    }
}
