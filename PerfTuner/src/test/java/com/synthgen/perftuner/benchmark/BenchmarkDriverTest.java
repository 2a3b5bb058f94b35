package com.synthgen.perftuner.benchmark;

import com.synthgen.perftuner.client.SimulatedCompletionClient;
import com.synthgen.perftuner.config.ActiveJDBCConfig;
import com.synthgen.perftuner.config.PerfTunerProperties;
import com.synthgen.perftuner.service.ConcurrencyTuner;
import com.synthgen.perftuner.service.MetricsBroadcaster;
import com.synthgen.perftuner.service.PerfTunerLifecycleManager;
import com.synthgen.perftuner.service.RetryPolicy;
import com.synthgen.perftuner.service.SampleAggregator;
import com.synthgen.perftuner.service.TelemetryStore;
import com.synthgen.perftuner.service.WorkerPool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Fixed-latency endpoint, zero errors: throughput should settle near
 * concurrency-max / latency and the run should last as long as requested.
 * Intervals are scaled down (1s window, 200ms tick) to keep the test short.
 */
class BenchmarkDriverTest {

    private static final Duration LATENCY = Duration.ofMillis(50);

    private PerfTunerProperties props;
    private PerfTunerLifecycleManager lifecycleManager;
    private WorkerPool pool;
    private BenchmarkDriver driver;

    @BeforeEach
    void setUp() {
        props = new PerfTunerProperties();
        props.setConcurrencyMin(2);
        props.setConcurrencyMax(4);
        props.setConcurrencyStart(2);
        props.setSampleWindow(Duration.ofSeconds(1));
        props.setTuneInterval(Duration.ofMillis(200));
        props.setQueueCapacity(8);
        props.setWorkerPollTimeout(Duration.ofMillis(20));
        props.setDrainTimeout(Duration.ofSeconds(5));
        props.setAutoStart(false);
        props.getTelemetry().setEnabled(false);

        TelemetryStore store = new TelemetryStore(props, new ActiveJDBCConfig("", "", "", "org.h2.Driver"));
        store.init();
        SampleAggregator aggregator = new SampleAggregator(props);
        pool = new WorkerPool(new SimulatedCompletionClient(LATENCY, 0.0, 503),
                new RetryPolicy(props), props, List.of(aggregator, store));
        ConcurrencyTuner tuner = new ConcurrencyTuner(props, pool);
        lifecycleManager = new PerfTunerLifecycleManager(props, pool, aggregator, tuner, store,
                new MetricsBroadcaster());
        driver = new BenchmarkDriver(lifecycleManager, pool, aggregator, store, props);
    }

    @AfterEach
    void tearDown() {
        lifecycleManager.stop(Duration.ofSeconds(1));
    }

    @Test
    void durationBoundRunShouldReachMaxThroughput() throws Exception {
        BenchmarkReport report = driver.run(BenchmarkOptions.builder()
                .duration(Duration.ofSeconds(3))
                .prompts(PromptSource.DEFAULT_PROMPTS)
                .build());

        double ideal = props.getConcurrencyMax() / (LATENCY.toMillis() / 1000.0);

        assertEquals(4, report.getFinalConcurrency());
        assertTrue(report.getFinalSample().getThroughputRps() > ideal * 0.5,
                "throughput " + report.getFinalSample().getThroughputRps());
        assertTrue(report.getFinalSample().getThroughputRps() <= ideal * 1.1,
                "throughput " + report.getFinalSample().getThroughputRps());
        assertTrue(report.getDurationSec() >= 3.0 && report.getDurationSec() < 5.0,
                "duration " + report.getDurationSec());
        assertEquals(report.getSubmitted(), report.getCompleted());
        assertEquals(0, report.getFailed());
        assertNull(report.getSummary());
        assertFalse(lifecycleManager.isRunning());
    }

    @Test
    void jobBoundRunShouldSubmitExactCount() throws Exception {
        BenchmarkReport report = driver.run(BenchmarkOptions.builder()
                .jobs(25)
                .prompt("only prompt")
                .build());

        assertEquals(25, report.getSubmitted());
        assertEquals(25, report.getCompleted());
        assertEquals(0, report.getFinalQueueDepth());
        report.log();
    }

    @Test
    void shouldRefuseWhileAnotherRunIsActive() {
        lifecycleManager.start("manual");

        assertThrows(IllegalStateException.class, () -> driver.run(BenchmarkOptions.builder()
                .jobs(1)
                .prompt("p")
                .build()));
    }

    @Test
    void shouldRejectOptionsWithoutBound() {
        assertThrows(IllegalArgumentException.class, () -> driver.run(BenchmarkOptions.builder()
                .prompt("p")
                .build()));
    }
}
