package com.synthgen.perftuner.service;

import com.synthgen.perftuner.model.JobOutcome;
import com.synthgen.perftuner.model.JobRecord;
import com.synthgen.perftuner.model.Sample;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SampleAggregatorTest {

    private MutableClock clock;
    private SampleAggregator aggregator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        aggregator = new SampleAggregator(Duration.ofSeconds(10), clock);
    }

    private JobRecord record(long latencyMs, JobOutcome outcome) {
        Instant finished = clock.instant();
        return JobRecord.builder()
                .jobId(UUID.randomUUID().toString())
                .startedAt(finished.minusMillis(latencyMs))
                .finishedAt(finished)
                .latencyMs(latencyMs)
                .modelId("m")
                .promptTokens(10)
                .completionTokens(outcome == JobOutcome.SUCCEEDED ? 20 : 0)
                .httpStatus(outcome == JobOutcome.SUCCEEDED ? 200 : 500)
                .attempts(1)
                .outcome(outcome)
                .build();
    }

    @Test
    void shouldComputeWindowStatistics() {
        for (int i = 1; i <= 20; i++) {
            aggregator.onJobRecord(record(i * 100L, i <= 2 ? JobOutcome.FAILED : JobOutcome.SUCCEEDED));
        }

        Sample s = aggregator.sample(3, 4);

        assertEquals(20, s.getTotalJobs());
        assertEquals(2, s.getFailedJobs());
        assertEquals(0.1, s.getErrorRate(), 1e-9);
        assertEquals(2.0, s.getThroughputRps(), 1e-9);
        assertEquals(1000, s.getP50Ms());
        assertEquals(1900, s.getP95Ms());
        assertEquals(200, s.getTokensIn());
        assertEquals(360, s.getTokensOut());
        assertEquals(3, s.getConcurrency());
        assertEquals(4, s.getQueueDepth());
        assertEquals(10, s.getWindowSec());
    }

    @Test
    void shouldRejectFractionalWindow() {
        assertThrows(IllegalArgumentException.class,
                () -> new SampleAggregator(Duration.ofMillis(1500), clock));
    }

    @Test
    void shouldReportZeroedSampleForEmptyWindow() {
        Sample s = aggregator.sample(2, 0);

        assertTrue(s.isEmpty());
        assertEquals(0.0, s.getThroughputRps());
        assertEquals(0, s.getP95Ms());
        assertEquals(0.0, s.getErrorRate());
    }

    @Test
    void shouldEvictRecordsOutsideWindow() {
        aggregator.onJobRecord(record(100, JobOutcome.FAILED));
        clock.advance(Duration.ofSeconds(11));
        aggregator.onJobRecord(record(200, JobOutcome.SUCCEEDED));

        Sample s = aggregator.sample(2, 0);

        assertEquals(1, s.getTotalJobs());
        assertEquals(0.0, s.getErrorRate());
        assertEquals(200, s.getP95Ms());
    }

    @Test
    void shouldEmitStrictlyIncreasingTimestamps() {
        Sample first = aggregator.sample(2, 0);
        Sample second = aggregator.sample(2, 0);
        clock.advance(Duration.ofSeconds(1));
        Sample third = aggregator.sample(2, 0);

        assertTrue(second.getTs().isAfter(first.getTs()));
        assertTrue(third.getTs().isAfter(second.getTs()));
    }

    @Test
    void peekShouldNotAdvanceEmissionOrder() {
        Sample first = aggregator.sample(2, 0);
        aggregator.peek(2, 0);
        Sample second = aggregator.sample(2, 0);

        assertEquals(first.getTs().plusMillis(1), second.getTs());
    }

    @Test
    void resetShouldForgetRecords() {
        aggregator.onJobRecord(record(100, JobOutcome.SUCCEEDED));
        aggregator.reset();

        assertTrue(aggregator.sample(2, 0).isEmpty());
    }

    @Test
    void percentileShouldUseNearestRank() {
        long[] values = {10, 20, 30, 40, 50, 60, 70, 80, 90, 100};

        assertEquals(50, SampleAggregator.percentile(values, 50));
        assertEquals(100, SampleAggregator.percentile(values, 95));
        assertEquals(10, SampleAggregator.percentile(values, 1));
        assertEquals(0, SampleAggregator.percentile(new long[0], 95));
        assertEquals(7, SampleAggregator.percentile(new long[]{7}, 95));
    }
}
