package com.synthgen.perftuner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * PerfTuner - Performance layer for synthetic transcript generation
 *
 * Dispatches completion requests to an OpenAI-compatible endpoint through a
 * bounded worker pool whose size is tuned from rolling-window telemetry.
 *
 * Features:
 * - Non-blocking admission with a bounded request queue
 * - Hill-climbing concurrency tuner (one step per tick)
 * - Run / sample / job persistence via ActiveJDBC
 * - Live metrics snapshot and Server-Sent Events stream
 * - Benchmark mode (perf.benchmark.enabled=true)
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class PerfTunerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PerfTunerApplication.class, args);
    }
}
