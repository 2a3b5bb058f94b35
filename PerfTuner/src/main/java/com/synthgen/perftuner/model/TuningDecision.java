package com.synthgen.perftuner.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Result of one tuner evaluation.
 */
@Value
@Builder
public class TuningDecision {

    public enum Direction { UP, DOWN, HOLD }

    Instant ts;

    int from;

    int to;

    Direction direction;

    String reason;

    public boolean changed() {
        return from != to;
    }
}
