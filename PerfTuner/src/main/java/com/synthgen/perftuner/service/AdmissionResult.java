package com.synthgen.perftuner.service;

/**
 * Immediate answer to a submission. Rejections are not job failures:
 * a rejected job never started and never produces a JobRecord.
 */
public enum AdmissionResult {
    ACCEPTED,
    /** Queue at capacity and no worker idle. */
    REJECTED_FULL,
    /** Pool stopped or draining. */
    REJECTED_CLOSED;

    public boolean isAccepted() {
        return this == ACCEPTED;
    }
}
