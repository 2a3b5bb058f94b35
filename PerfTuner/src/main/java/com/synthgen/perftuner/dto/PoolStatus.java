package com.synthgen.perftuner.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Live worker pool state (lock-consistent snapshot).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PoolStatus {

    private boolean running;

    /** Target concurrency. */
    private int concurrency;

    private int liveWorkers;

    private int idleWorkers;

    private int inFlight;

    private int queueDepth;

    private int queueCapacity;

    private long acceptedTotal;

    private long rejectedTotal;

    private long completedTotal;
}
