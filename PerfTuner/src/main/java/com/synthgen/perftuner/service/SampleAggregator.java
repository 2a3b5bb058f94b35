package com.synthgen.perftuner.service;

import com.synthgen.perftuner.config.PerfTunerProperties;
import com.synthgen.perftuner.model.JobRecord;
import com.synthgen.perftuner.model.Sample;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Rolling-window statistics over recent JobRecords.
 *
 * Records are kept while their finish time is inside the window. Each call
 * to {@link #sample} produces one immutable Sample with a timestamp strictly
 * later than the previous one.
 */
@Service
public class SampleAggregator implements JobRecordListener {

    private final Duration window;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<JobRecord> records = new ArrayDeque<>();
    private Instant lastEmitted;

    @Autowired
    public SampleAggregator(PerfTunerProperties props) {
        this(props.getSampleWindow(), Clock.systemUTC());
    }

    public SampleAggregator(Duration window, Clock clock) {
        if (window.isNegative() || window.isZero() || window.toMillis() % 1000 != 0) {
            throw new IllegalArgumentException("window must be a positive whole number of seconds: " + window);
        }
        this.window = window;
        this.clock = clock;
    }

    @Override
    public void onJobRecord(JobRecord record) {
        lock.lock();
        try {
            records.addLast(record);
            evict(now());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Emits the sample for the current window. Advances the emission clock,
     * so this is reserved for the tuning tick.
     */
    public Sample sample(int concurrency, int queueDepth) {
        lock.lock();
        try {
            Instant ts = now();
            if (lastEmitted != null && !ts.isAfter(lastEmitted)) {
                ts = lastEmitted.plusMillis(1);
            }
            lastEmitted = ts;
            return compute(ts, concurrency, queueDepth);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Same statistics as {@link #sample} without touching the emission
     * order; used for reports outside the tick sequence.
     */
    public Sample peek(int concurrency, int queueDepth) {
        lock.lock();
        try {
            return compute(now(), concurrency, queueDepth);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forgets all records; called when a new run starts.
     */
    public void reset() {
        lock.lock();
        try {
            records.clear();
            lastEmitted = null;
        } finally {
            lock.unlock();
        }
    }

    private Sample compute(Instant ts, int concurrency, int queueDepth) {
        evict(ts);
        Instant cutoff = ts.minus(window);

        List<JobRecord> inWindow = new ArrayList<>(records.size());
        for (JobRecord r : records) {
            if (!r.getFinishedAt().isBefore(cutoff) && !r.getFinishedAt().isAfter(ts)) {
                inWindow.add(r);
            }
        }

        long windowSec = window.toSeconds();
        Sample.SampleBuilder builder = Sample.builder()
                .ts(ts)
                .windowSec(windowSec)
                .concurrency(concurrency)
                .queueDepth(Math.max(0, queueDepth));

        if (inWindow.isEmpty()) {
            return builder.build();
        }

        long[] latencies = new long[inWindow.size()];
        int failed = 0;
        long tokensIn = 0;
        long tokensOut = 0;
        for (int i = 0; i < inWindow.size(); i++) {
            JobRecord r = inWindow.get(i);
            latencies[i] = r.getLatencyMs();
            if (!r.succeeded()) {
                failed++;
            }
            tokensIn += r.getPromptTokens();
            tokensOut += r.getCompletionTokens();
        }
        Arrays.sort(latencies);

        return builder
                .throughputRps((double) inWindow.size() / windowSec)
                .p50Ms(percentile(latencies, 50))
                .p95Ms(percentile(latencies, 95))
                .errorRate((double) failed / inWindow.size())
                .tokensIn(tokensIn)
                .tokensOut(tokensOut)
                .totalJobs(inWindow.size())
                .failedJobs(failed)
                .build();
    }

    private void evict(Instant now) {
        Instant cutoff = now.minus(window);
        while (!records.isEmpty() && records.peekFirst().getFinishedAt().isBefore(cutoff)) {
            records.pollFirst();
        }
    }

    /**
     * Nearest-rank percentile over sorted values.
     */
    static long percentile(long[] sorted, int percentile) {
        if (sorted.length == 0) {
            return 0;
        }
        int rank = (int) Math.ceil(percentile / 100.0 * sorted.length);
        return sorted[Math.max(0, Math.min(sorted.length - 1, rank - 1))];
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
