package com.synthgen.perftuner.benchmark;

import com.synthgen.perftuner.config.PerfTunerProperties;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * One benchmark invocation: job-count bound, duration bound, or both
 * (whichever is reached first).
 */
@Value
@Builder
public class BenchmarkOptions {

    Integer jobs;

    Duration duration;

    @Singular
    List<String> prompts;

    /** Submissions per second; 0 submits as fast as admission allows. */
    double ratePerSecond;

    @Builder.Default
    Duration rejectBackoff = Duration.ofMillis(20);

    @Builder.Default
    int progressEvery = 100;

    String notes;

    public static BenchmarkOptions fromProperties(PerfTunerProperties.Benchmark benchmark) {
        return BenchmarkOptions.builder()
                .jobs(benchmark.getJobs())
                .duration(benchmark.getDuration())
                .prompts(PromptSource.load(benchmark.getPromptFile()))
                .ratePerSecond(benchmark.getRatePerSecond())
                .rejectBackoff(benchmark.getRejectBackoff())
                .progressEvery(benchmark.getProgressEvery())
                .notes("Benchmark run")
                .build();
    }

    /**
     * @throws IllegalArgumentException when no bound is given or a value is out of range
     */
    public void validate() {
        if (jobs == null && duration == null) {
            throw new IllegalArgumentException("Benchmark needs a job count or a duration");
        }
        if (jobs != null && jobs < 1) {
            throw new IllegalArgumentException("Benchmark job count must be positive, got " + jobs);
        }
        if (duration != null && (duration.isZero() || duration.isNegative())) {
            throw new IllegalArgumentException("Benchmark duration must be positive, got " + duration);
        }
        if (prompts == null || prompts.isEmpty()) {
            throw new IllegalArgumentException("Benchmark needs at least one prompt");
        }
        if (ratePerSecond < 0) {
            throw new IllegalArgumentException("Benchmark rate must not be negative");
        }
        if (rejectBackoff == null || rejectBackoff.isNegative()) {
            throw new IllegalArgumentException("Benchmark reject backoff must not be negative");
        }
    }
}
