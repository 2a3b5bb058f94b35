package com.synthgen.perftuner.client;

import com.synthgen.perftuner.exception.UpstreamException;
import com.synthgen.perftuner.model.Job;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * In-process stand-in for the completion endpoint with a fixed latency and
 * a configurable failure ratio. Used by benchmark runs that validate the
 * tuner offline.
 */
public class SimulatedCompletionClient implements CompletionClient {

    private final Duration latency;
    private final double errorRate;
    private final int errorStatus;
    private final DoubleSupplier random;

    public SimulatedCompletionClient(Duration latency, double errorRate, int errorStatus) {
        this(latency, errorRate, errorStatus, () -> ThreadLocalRandom.current().nextDouble());
    }

    public SimulatedCompletionClient(Duration latency, double errorRate, int errorStatus, DoubleSupplier random) {
        this.latency = latency;
        this.errorRate = errorRate;
        this.errorStatus = errorStatus;
        this.random = random;
    }

    @Override
    public CompletionResult complete(Job job) throws UpstreamException {
        try {
            Thread.sleep(latency.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw UpstreamException.transport("Simulated call interrupted", e);
        }

        if (errorRate > 0 && random.getAsDouble() < errorRate) {
            throw new UpstreamException(errorStatus, "Simulated upstream error " + errorStatus);
        }

        int promptTokens = job.estimatedPromptTokens();
        return CompletionResult.builder()
                .text("simulated completion")
                .promptTokens(promptTokens)
                .completionTokens(Math.min(job.getMaxTokens(), 64))
                .httpStatus(200)
                .build();
    }
}
