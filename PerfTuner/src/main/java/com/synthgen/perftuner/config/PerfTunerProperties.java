package com.synthgen.perftuner.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed binding for all perf.* configuration.
 * Centralises every tunable knob of the worker pool, the tuner and the
 * telemetry store. Environment overrides keep the historical variable
 * names (CONCURRENCY_MIN, TARGET_P95_MS, ...) via application.yml.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "perf")
public class PerfTunerProperties {

    /** Lower bound for the worker count. */
    @Min(1)
    private int concurrencyMin = 2;

    /** Upper bound for the worker count. */
    @Min(1)
    private int concurrencyMax = 6;

    /** Worker count launched on start (clamped to [min, max]). */
    @Min(1)
    private int concurrencyStart = 2;

    /** Latency ceiling (p95, ms) the tuner steers towards. */
    @Min(1)
    private long targetP95Ms = 2500;

    /** Error-rate ceiling, fraction in [0,1]. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double targetErrorRate = 0.03;

    /** Rolling aggregation window. */
    private Duration sampleWindow = Duration.ofSeconds(30);

    /** Interval between aggregator/tuner ticks. */
    private Duration tuneInterval = Duration.ofSeconds(15);

    /** Workers added per UP decision. */
    @Min(1)
    private int increaseStep = 1;

    /** Workers removed per DOWN decision. */
    @Min(1)
    private int decreaseStep = 1;

    /** Pending-job capacity of the request queue. */
    @Min(1)
    private int queueCapacity = 8;

    /** Bounded wait of an idle worker on the queue. */
    private Duration workerPollTimeout = Duration.ofSeconds(1);

    /** Time allowed for in-flight jobs to finish on stop. */
    private Duration drainTimeout = Duration.ofSeconds(30);

    /** Start a run as soon as the application context is up. */
    private boolean autoStart = true;

    /** Host label stored on each run. Empty = local hostname. */
    private String host = "";

    /** Free-form notes stored on runs started automatically. */
    private String notes = "Automated performance run";

    @Valid
    private Upstream upstream = new Upstream();

    @Valid
    private Retry retry = new Retry();

    private IdleScaleDown idleScaleDown = new IdleScaleDown();

    private Telemetry telemetry = new Telemetry();

    private Benchmark benchmark = new Benchmark();

    /**
     * Cross-field checks that annotations cannot express.
     * An invalid configuration is a fatal startup condition.
     */
    public void validate() {
        if (concurrencyMin > concurrencyMax) {
            throw new IllegalStateException("perf.concurrency-min (" + concurrencyMin
                    + ") exceeds perf.concurrency-max (" + concurrencyMax + ")");
        }
        if (concurrencyMin < 1) {
            throw new IllegalStateException("perf.concurrency-min must be at least 1");
        }
        if (targetErrorRate < 0.0 || targetErrorRate > 1.0) {
            throw new IllegalStateException("perf.target-error-rate must be within [0,1]");
        }
        requirePositive(sampleWindow, "perf.sample-window");
        if (sampleWindow.toMillis() % 1000 != 0) {
            throw new IllegalStateException("perf.sample-window must be a whole number of seconds");
        }
        requirePositive(tuneInterval, "perf.tune-interval");
        requirePositive(workerPollTimeout, "perf.worker-poll-timeout");
        if (queueCapacity < 1) {
            throw new IllegalStateException("perf.queue-capacity must be at least 1");
        }
        if (increaseStep < 1 || decreaseStep < 1) {
            throw new IllegalStateException("perf.increase-step and perf.decrease-step must be at least 1");
        }
        if (retry.getMaxRetries() < 0) {
            throw new IllegalStateException("perf.retry.max-retries must not be negative");
        }
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalStateException(name + " must be a positive duration");
        }
    }

    public int clamp(int concurrency) {
        return Math.max(concurrencyMin, Math.min(concurrencyMax, concurrency));
    }

    @Data
    public static class Upstream {

        /** OpenAI-compatible chat completions URL. */
        @NotBlank
        private String endpoint = "http://127.0.0.1:1234/v1/chat/completions";

        /** Model identifier sent with every request. */
        @NotBlank
        private String modelId = "meta-llama-3-8b-instruct";

        /** Optional bearer token. */
        private String apiKey;

        private int maxTokens = 128;

        private double temperature = 0.7;

        private Duration connectTimeout = Duration.ofSeconds(5);

        /** Read timeout of one upstream call. */
        private Duration requestTimeout = Duration.ofSeconds(60);

        /** In-process endpoint used for offline validation. */
        private Simulated simulated = new Simulated();
    }

    @Data
    public static class Simulated {
        private boolean enabled = false;
        private Duration latency = Duration.ofMillis(50);
        private double errorRate = 0.0;
        private int errorStatus = 503;
    }

    @Data
    public static class Retry {

        /** Retries after the first attempt for transient failures. */
        private int maxRetries = 3;

        private Duration baseDelay = Duration.ofSeconds(1);

        private Duration maxDelay = Duration.ofSeconds(30);
    }

    @Data
    public static class IdleScaleDown {

        /** Shed one step when the queue stays empty and latency is low. */
        private boolean enabled = true;

        /** Consecutive idle ticks required before shedding. */
        private int ticks = 3;
    }

    @Data
    public static class Telemetry {

        /** Persist runs, samples and jobs. false = logging-only. */
        private boolean enabled = true;

        /** Apply schema/perf-telemetry.sql on startup. */
        private boolean applySchema = true;

        /** Max pending writes before new ones are dropped. */
        private int writeQueueCapacity = 10_000;

        /** How long startup waits for the first connection. */
        private Duration connectTimeout = Duration.ofSeconds(15);

        /** How long a read waits behind queued writes. */
        private Duration readTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Benchmark {
        private boolean enabled = false;
        private Integer jobs;
        private Duration duration;
        private String promptFile;

        /** Submissions per second; 0 = as fast as admission allows. */
        private double ratePerSecond = 0;

        /** Pause after a rejected submission. */
        private Duration rejectBackoff = Duration.ofMillis(20);

        private int progressEvery = 100;

        private boolean exitOnCompletion = true;
    }
}
