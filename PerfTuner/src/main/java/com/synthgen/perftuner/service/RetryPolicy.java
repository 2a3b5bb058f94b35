package com.synthgen.perftuner.service;

import com.synthgen.perftuner.config.PerfTunerProperties;
import com.synthgen.perftuner.exception.UpstreamException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Retry classification and backoff for upstream calls.
 *
 * Transient: rate limit (429), request timeout (408), 5xx and transport
 * failures. Every other status is permanent and never retried.
 * Delay for retry n (0-based) is base * 2^n plus uniform jitter in
 * [0, base), capped at maxDelay.
 */
@Component
public class RetryPolicy {

    private final int maxRetries;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final DoubleSupplier jitter;

    @Autowired
    public RetryPolicy(PerfTunerProperties properties) {
        this(properties.getRetry().getMaxRetries(),
                properties.getRetry().getBaseDelay(),
                properties.getRetry().getMaxDelay(),
                () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryPolicy(int maxRetries, Duration baseDelay, Duration maxDelay, DoubleSupplier jitter) {
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitter = jitter;
    }

    public boolean isTransient(UpstreamException e) {
        Integer status = e.getStatus();
        if (status == null) {
            return true;
        }
        return status == 429 || status == 408 || status >= 500;
    }

    /**
     * @param retriesSoFar retries already performed for this job
     */
    public boolean shouldRetry(UpstreamException e, int retriesSoFar) {
        return isTransient(e) && retriesSoFar < maxRetries;
    }

    public Duration backoff(int retryIndex) {
        long base = baseDelay.toMillis();
        long exponential = base << Math.min(retryIndex, 20);
        long withJitter = exponential + (long) (jitter.getAsDouble() * base);
        return Duration.ofMillis(Math.min(withJitter, maxDelay.toMillis()));
    }

    public int getMaxRetries() {
        return maxRetries;
    }
}
