package com.synthgen.perftuner.service;

import com.synthgen.perftuner.config.ActiveJDBCConfig;
import com.synthgen.perftuner.config.PerfTunerProperties;
import com.synthgen.perftuner.dto.RunSummary;
import com.synthgen.perftuner.model.JobOutcome;
import com.synthgen.perftuner.model.JobRecord;
import com.synthgen.perftuner.model.Run;
import com.synthgen.perftuner.model.Sample;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.javalite.activejdbc.Base;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Persists Runs, Samples and JobRecords through ActiveJDBC.
 *
 * All database access happens on one dedicated writer thread, which owns the
 * thread-bound ActiveJDBC connection. Writes are queued and never block the
 * caller; a failed write is logged and discarded. When the database cannot be
 * reached at startup the store stays in logging-only mode.
 */
@Service
@Slf4j
public class TelemetryStore implements JobRecordListener {

    static final String SCHEMA_RESOURCE = "schema/perf-telemetry.sql";

    private final PerfTunerProperties.Telemetry settings;
    private final ActiveJDBCConfig dbConfig;

    private ThreadPoolExecutor writer;
    private volatile boolean available;
    private volatile String activeRunId;

    public TelemetryStore(PerfTunerProperties props, ActiveJDBCConfig dbConfig) {
        this.settings = props.getTelemetry();
        this.dbConfig = dbConfig;
    }

    @PostConstruct
    public void init() {
        if (!settings.isEnabled()) {
            log.info("Telemetry persistence disabled, logging-only mode");
            return;
        }
        if (!dbConfig.isConfigured()) {
            log.warn("No telemetry datasource configured, degrading to logging-only mode");
            return;
        }

        writer = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(settings.getWriteQueueCapacity()),
                r -> {
                    Thread t = new Thread(r, "perf-telemetry-writer");
                    t.setDaemon(true);
                    return t;
                },
                (task, executor) -> log.warn("Telemetry write queue full ({} pending), dropping write",
                        executor.getQueue().size()));

        Future<?> connect = writer.submit(() -> {
            dbConfig.openConnection();
            if (settings.isApplySchema()) {
                applySchema();
            }
        });

        try {
            connect.get(settings.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS);
            available = true;
            log.info("Telemetry store connected: url={}", dbConfig.getDbUrl());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            degrade(e);
        } catch (ExecutionException | TimeoutException e) {
            degrade(e);
        }
    }

    private void degrade(Exception cause) {
        Throwable root = cause instanceof ExecutionException && cause.getCause() != null ? cause.getCause() : cause;
        log.warn("Telemetry store unreachable at startup ({}), degrading to logging-only mode", root.toString());
        writer.shutdownNow();
        writer = null;
    }

    @PreDestroy
    public void shutdown() {
        if (writer == null) {
            return;
        }
        available = false;
        writer.execute(dbConfig::closeConnection);
        writer.shutdown();
        try {
            if (!writer.awaitTermination(settings.getReadTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Telemetry writer did not terminate, {} writes abandoned", writer.shutdownNow().size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writer.shutdownNow();
        }
        log.info("Telemetry store shut down");
    }

    public boolean isAvailable() {
        return available;
    }

    // ---- writes ----

    public void startRun(Run run) {
        activeRunId = run.getRunId();
        if (!available) {
            log.info("Run started (not persisted): runId={}, model={}, host={}",
                    run.getRunId(), run.getModelId(), run.getHost());
            return;
        }
        write("insert run " + run.getRunId(), () -> Base.exec(
                "INSERT INTO runs (run_id, started_at, model_id, host, notes) VALUES (?, ?, ?, ?, ?)",
                run.getRunId(), ts(run.getStartedAt()), run.getModelId(), run.getHost(), run.getNotes()));
    }

    /**
     * Sets finished_at once; later calls for the same run leave it untouched.
     */
    public void finishRun(String runId, Instant finishedAt) {
        if (runId.equals(activeRunId)) {
            activeRunId = null;
        }
        if (!available) {
            log.info("Run finished (not persisted): runId={}, finishedAt={}", runId, finishedAt);
            return;
        }
        write("finish run " + runId, () -> {
            int updated = Base.exec("UPDATE runs SET finished_at = ? WHERE run_id = ? AND finished_at IS NULL",
                    ts(finishedAt), runId);
            if (updated == 0) {
                log.debug("Run {} already finished or unknown, finish ignored", runId);
            }
        });
    }

    /**
     * Stores a sample; a repeated write of the same (run, ts) is ignored.
     */
    public void recordSample(String runId, Sample sample) {
        if (!available) {
            return;
        }
        write("insert sample " + sample.getTs(), () -> {
            Object existing = Base.firstCell("SELECT COUNT(*) FROM samples WHERE run_id = ? AND ts = ?",
                    runId, ts(sample.getTs()));
            if (toLong(existing) > 0) {
                log.debug("Sample {} for run {} already stored", sample.getTs(), runId);
                return;
            }
            Base.exec("INSERT INTO samples (run_id, ts, window_sec, concurrency, queue_depth, throughput_rps, "
                            + "p50_ms, p95_ms, error_rate, tokens_in, tokens_out, total_jobs, failed_jobs) "
                            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    runId, ts(sample.getTs()), sample.getWindowSec(), sample.getConcurrency(),
                    sample.getQueueDepth(), sample.getThroughputRps(), sample.getP50Ms(), sample.getP95Ms(),
                    sample.getErrorRate(), sample.getTokensIn(), sample.getTokensOut(),
                    sample.getTotalJobs(), sample.getFailedJobs());
        });
    }

    /**
     * Stores a job record; keyed by job id so a repeated write is ignored.
     */
    public void recordJob(String runId, JobRecord record) {
        if (!available) {
            return;
        }
        write("insert job " + record.getJobId(), () -> {
            Object existing = Base.firstCell("SELECT COUNT(*) FROM jobs WHERE job_id = ?", record.getJobId());
            if (toLong(existing) > 0) {
                log.debug("Job {} already stored", record.getJobId());
                return;
            }
            Base.exec("INSERT INTO jobs (run_id, job_id, started_at, finished_at, latency_ms, model_id, "
                            + "prompt_tokens, completion_tokens, http_status, error_text, attempts, outcome) "
                            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    runId, record.getJobId(), ts(record.getStartedAt()), ts(record.getFinishedAt()),
                    record.getLatencyMs(), record.getModelId(), record.getPromptTokens(),
                    record.getCompletionTokens(), record.getHttpStatus(), record.getErrorText(),
                    record.getAttempts(), record.getOutcome().name());
        });
    }

    @Override
    public void onJobRecord(JobRecord record) {
        String runId = activeRunId;
        if (runId == null) {
            log.debug("Job {} finished outside of a run, not persisted", record.getJobId());
            return;
        }
        recordJob(runId, record);
    }

    /**
     * Waits until every write queued so far has been applied.
     */
    public boolean flush(Duration timeout) {
        if (!available) {
            return true;
        }
        try {
            writer.submit(() -> { }).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException | TimeoutException | RejectedExecutionException e) {
            log.warn("Telemetry flush did not complete: {}", e.toString());
            return false;
        }
    }

    // ---- reads ----

    public Optional<Run> findRun(String runId) {
        return read("find run " + runId, () -> {
            List<Map<String, Object>> rows = Base.findAll(
                    "SELECT run_id, started_at, finished_at, model_id, host, notes FROM runs WHERE run_id = ?", runId);
            if (rows.isEmpty()) {
                return Optional.<Run>empty();
            }
            Map<String, Object> row = row(rows.get(0));
            return Optional.of(Run.builder()
                    .runId((String) row.get("run_id"))
                    .startedAt(toInstant(row.get("started_at")))
                    .finishedAt(toInstant(row.get("finished_at")))
                    .modelId((String) row.get("model_id"))
                    .host((String) row.get("host"))
                    .notes((String) row.get("notes"))
                    .build());
        }, Optional.empty());
    }

    public List<JobRecord> findJobs(String runId) {
        return read("find jobs " + runId, () -> {
            List<JobRecord> result = new ArrayList<>();
            for (Map<String, Object> raw : Base.findAll(
                    "SELECT job_id, started_at, finished_at, latency_ms, model_id, prompt_tokens, completion_tokens, "
                            + "http_status, error_text, attempts, outcome FROM jobs WHERE run_id = ? ORDER BY id", runId)) {
                Map<String, Object> row = row(raw);
                Object status = row.get("http_status");
                result.add(JobRecord.builder()
                        .jobId((String) row.get("job_id"))
                        .startedAt(toInstant(row.get("started_at")))
                        .finishedAt(toInstant(row.get("finished_at")))
                        .latencyMs(toLong(row.get("latency_ms")))
                        .modelId((String) row.get("model_id"))
                        .promptTokens((int) toLong(row.get("prompt_tokens")))
                        .completionTokens((int) toLong(row.get("completion_tokens")))
                        .httpStatus(status == null ? null : (int) toLong(status))
                        .errorText((String) row.get("error_text"))
                        .attempts((int) toLong(row.get("attempts")))
                        .outcome(JobOutcome.valueOf((String) row.get("outcome")))
                        .build());
            }
            return result;
        }, Collections.emptyList());
    }

    public List<Sample> findSamples(String runId) {
        return read("find samples " + runId, () -> {
            List<Sample> result = new ArrayList<>();
            for (Map<String, Object> raw : Base.findAll(
                    "SELECT ts, window_sec, concurrency, queue_depth, throughput_rps, p50_ms, p95_ms, error_rate, "
                            + "tokens_in, tokens_out, total_jobs, failed_jobs FROM samples WHERE run_id = ? ORDER BY ts",
                    runId)) {
                Map<String, Object> row = row(raw);
                result.add(Sample.builder()
                        .ts(toInstant(row.get("ts")))
                        .windowSec(toLong(row.get("window_sec")))
                        .concurrency((int) toLong(row.get("concurrency")))
                        .queueDepth((int) toLong(row.get("queue_depth")))
                        .throughputRps(toDouble(row.get("throughput_rps")))
                        .p50Ms(toLong(row.get("p50_ms")))
                        .p95Ms(toLong(row.get("p95_ms")))
                        .errorRate(toDouble(row.get("error_rate")))
                        .tokensIn(toLong(row.get("tokens_in")))
                        .tokensOut(toLong(row.get("tokens_out")))
                        .totalJobs((int) toLong(row.get("total_jobs")))
                        .failedJobs((int) toLong(row.get("failed_jobs")))
                        .build());
            }
            return result;
        }, Collections.emptyList());
    }

    /**
     * Aggregates over everything stored for a run. Empty when the run is
     * unknown or the store is not available.
     */
    public Optional<RunSummary> summarize(String runId) {
        return read("summarize run " + runId, () -> {
            List<Map<String, Object>> runs = Base.findAll(
                    "SELECT run_id, started_at, finished_at, model_id, host FROM runs WHERE run_id = ?", runId);
            if (runs.isEmpty()) {
                return Optional.<RunSummary>empty();
            }
            Map<String, Object> run = row(runs.get(0));

            Map<String, Object> jobs = row(Base.findAll(
                    "SELECT COUNT(*) AS total_jobs, "
                            + "SUM(CASE WHEN outcome <> 'SUCCEEDED' THEN 1 ELSE 0 END) AS failed_jobs, "
                            + "AVG(latency_ms) AS avg_latency, MAX(latency_ms) AS max_latency, "
                            + "SUM(completion_tokens) AS completion_tokens FROM jobs WHERE run_id = ?", runId).get(0));

            long sampleCount = toLong(Base.firstCell("SELECT COUNT(*) FROM samples WHERE run_id = ?", runId));

            RunSummary.RunSummaryBuilder summary = RunSummary.builder()
                    .runId(runId)
                    .modelId((String) run.get("model_id"))
                    .host((String) run.get("host"))
                    .startedAt(toInstant(run.get("started_at")))
                    .finishedAt(toInstant(run.get("finished_at")))
                    .totalJobs(toLong(jobs.get("total_jobs")))
                    .failedJobs(toLong(jobs.get("failed_jobs")))
                    .avgLatencyMs(toDouble(jobs.get("avg_latency")))
                    .maxLatencyMs(toLong(jobs.get("max_latency")))
                    .totalCompletionTokens(toLong(jobs.get("completion_tokens")))
                    .sampleCount(sampleCount);

            List<Map<String, Object>> best = Base.findAll(
                    "SELECT concurrency, throughput_rps, p95_ms FROM samples WHERE run_id = ? AND total_jobs > 0 "
                            + "ORDER BY throughput_rps DESC, ts ASC LIMIT 1", runId);
            if (!best.isEmpty()) {
                Map<String, Object> b = row(best.get(0));
                summary.bestConcurrency((int) toLong(b.get("concurrency")))
                        .bestThroughputRps(toDouble(b.get("throughput_rps")))
                        .bestP95Ms(toLong(b.get("p95_ms")));
            }
            return Optional.of(summary.build());
        }, Optional.empty());
    }

    // ---- plumbing ----

    private void write(String description, Runnable statement) {
        ThreadPoolExecutor executor = writer;
        if (!available || executor == null) {
            return;
        }
        executor.execute(() -> {
            try {
                dbConfig.openConnection();
                statement.run();
            } catch (Exception e) {
                log.warn("Telemetry write failed ({}), discarded: {}", description, e.getMessage());
                resetConnection();
            }
        });
    }

    private <T> T read(String description, Callable<T> query, T fallback) {
        ThreadPoolExecutor executor = writer;
        if (!available || executor == null) {
            return fallback;
        }
        try {
            Future<T> future = executor.submit(() -> {
                try {
                    dbConfig.openConnection();
                    return query.call();
                } catch (Exception e) {
                    resetConnection();
                    throw e;
                }
            });
            return future.get(settings.getReadTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fallback;
        } catch (ExecutionException | TimeoutException | RejectedExecutionException e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            log.warn("Telemetry read failed ({}): {}", description, cause.toString());
            return fallback;
        }
    }

    private void resetConnection() {
        try {
            dbConfig.closeConnection();
        } catch (RuntimeException closeError) {
            log.debug("Closing broken telemetry connection failed: {}", closeError.getMessage());
        }
    }

    private void applySchema() {
        String script;
        try {
            script = StreamUtils.copyToString(new ClassPathResource(SCHEMA_RESOURCE).getInputStream(),
                    StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + SCHEMA_RESOURCE, e);
        }

        StringBuilder cleaned = new StringBuilder();
        for (String line : script.split("\\R")) {
            if (!line.trim().startsWith("--")) {
                cleaned.append(line).append('\n');
            }
        }

        int applied = 0;
        for (String statement : cleaned.toString().split(";")) {
            if (!statement.isBlank()) {
                Base.exec(statement.trim());
                applied++;
            }
        }
        log.info("Telemetry schema applied ({} statements)", applied);
    }

    private static Map<String, Object> row(Map<String, Object> raw) {
        Map<String, Object> row = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        row.putAll(raw);
        return row;
    }

    private static Timestamp ts(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    static Instant toInstant(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toInstant();
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant();
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).atZone(ZoneId.systemDefault()).toInstant();
        }
        if (value instanceof java.util.Date) {
            return ((java.util.Date) value).toInstant();
        }
        return Instant.parse(value.toString());
    }

    private static long toLong(Object value) {
        return value == null ? 0L : ((Number) value).longValue();
    }

    private static double toDouble(Object value) {
        return value == null ? 0.0 : ((Number) value).doubleValue();
    }
}
