package com.synthgen.perftuner.model;

/**
 * Terminal state of a job.
 */
public enum JobOutcome {
    SUCCEEDED,
    FAILED,
    /** Force-terminated at shutdown after the drain timeout. */
    CANCELLED
}
