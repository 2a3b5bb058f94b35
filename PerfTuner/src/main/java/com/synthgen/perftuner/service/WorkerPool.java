package com.synthgen.perftuner.service;

import com.synthgen.perftuner.client.CompletionClient;
import com.synthgen.perftuner.client.CompletionResult;
import com.synthgen.perftuner.config.PerfTunerProperties;
import com.synthgen.perftuner.dto.PoolStatus;
import com.synthgen.perftuner.exception.UpstreamException;
import com.synthgen.perftuner.model.Job;
import com.synthgen.perftuner.model.JobOutcome;
import com.synthgen.perftuner.model.JobRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Resizable set of worker threads dispatching jobs to the upstream endpoint.
 *
 * Single owner of the two pieces of shared mutable state: the request queue
 * and the worker target. Growing spawns workers; shrinking marks the excess
 * for retirement once their current job is recorded, so no in-flight job is
 * ever aborted by a resize. Every accepted job produces exactly one
 * JobRecord, delivered to all registered listeners.
 */
@Service
@Slf4j
public class WorkerPool {

    private final CompletionClient client;
    private final RetryPolicy retryPolicy;
    private final PerfTunerProperties props;
    private final List<JobRecordListener> listeners;
    private final Clock clock;

    private final ReentrantLock poolLock = new ReentrantLock();
    private final AtomicInteger target = new AtomicInteger();
    private final AtomicInteger idleWorkers = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger threadSeq = new AtomicInteger();
    private final AtomicLong acceptedTotal = new AtomicLong();
    private final AtomicLong rejectedTotal = new AtomicLong();
    private final AtomicLong completedTotal = new AtomicLong();
    private final Set<Worker> workers = ConcurrentHashMap.newKeySet();

    // guarded by poolLock
    private boolean running;
    private int generation;
    private int liveWorkers;
    private int pendingRetirements;

    private volatile RequestQueue queue;
    private volatile ExecutorService executor;
    private volatile boolean draining;
    private volatile boolean forceStopped;

    @Autowired
    public WorkerPool(CompletionClient client,
                      RetryPolicy retryPolicy,
                      PerfTunerProperties props,
                      List<JobRecordListener> listeners) {
        this(client, retryPolicy, props, listeners, Clock.systemUTC());
    }

    public WorkerPool(CompletionClient client,
                      RetryPolicy retryPolicy,
                      PerfTunerProperties props,
                      List<JobRecordListener> listeners,
                      Clock clock) {
        this.client = client;
        this.retryPolicy = retryPolicy;
        this.props = props;
        this.listeners = new CopyOnWriteArrayList<>(listeners);
        this.clock = clock;
        this.target.set(props.clamp(props.getConcurrencyStart()));

        // closed until start()
        RequestQueue initial = new RequestQueue(props.getQueueCapacity());
        initial.close();
        this.queue = initial;
    }

    public void addListener(JobRecordListener listener) {
        listeners.add(listener);
    }

    public void removeListener(JobRecordListener listener) {
        listeners.remove(listener);
    }

    /**
     * Opens admission and launches the initial workers (clamped to [min, max]).
     *
     * @throws IllegalStateException if the workers cannot be launched
     */
    public void start(int initialConcurrency) {
        poolLock.lock();
        try {
            if (running) {
                log.warn("Worker pool already running - call shutdown() first.");
                return;
            }

            generation++;
            liveWorkers = 0;
            pendingRetirements = 0;
            draining = false;
            forceStopped = false;
            queue = new RequestQueue(props.getQueueCapacity());
            executor = Executors.newCachedThreadPool(r -> {
                Thread t = new Thread(r, "perf-worker-" + threadSeq.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
            running = true;

            int count = props.clamp(initialConcurrency);
            try {
                for (int i = 0; i < count; i++) {
                    spawnWorker();
                }
            } catch (RuntimeException e) {
                running = false;
                queue.close();
                executor.shutdownNow();
                throw new IllegalStateException("Unable to launch " + count + " worker(s)", e);
            }
            target.set(count);

            log.info("Worker pool started with {} workers (bounds [{}, {}], queue capacity {})",
                    count, props.getConcurrencyMin(), props.getConcurrencyMax(), props.getQueueCapacity());
        } finally {
            poolLock.unlock();
        }
    }

    /**
     * Non-blocking admission.
     */
    public AdmissionResult submit(Job job) {
        AdmissionResult result = queue.submit(job);
        if (result.isAccepted()) {
            acceptedTotal.incrementAndGet();
            log.trace(" -- Accepted job {} (queue depth {})", job.getJobId(), queue.depth());
        } else {
            rejectedTotal.incrementAndGet();
            log.debug("Rejected job {}: {}", job.getJobId(), result);
        }
        return result;
    }

    /**
     * Sets the worker target, clamped to [min, max].
     *
     * @return the target actually applied
     */
    public int resize(int requested) {
        poolLock.lock();
        try {
            int clamped = props.clamp(requested);
            int previous = target.getAndSet(clamped);

            if (running) {
                int effective = liveWorkers - pendingRetirements;
                if (clamped > effective) {
                    int toAdd = clamped - effective;
                    int revoked = Math.min(toAdd, pendingRetirements);
                    pendingRetirements -= revoked;
                    toAdd -= revoked;
                    for (int i = 0; i < toAdd; i++) {
                        try {
                            spawnWorker();
                        } catch (RuntimeException e) {
                            log.error("Failed to spawn worker: {}", e.getMessage(), e);
                            break;
                        }
                    }
                } else if (clamped < effective) {
                    pendingRetirements += effective - clamped;
                }
            }

            if (previous != clamped) {
                log.info("Scaling workers: {} -> {}", previous, clamped);
            }
            return clamped;
        } finally {
            poolLock.unlock();
        }
    }

    /**
     * Stops admission and drains. Queued and in-flight jobs get up to
     * {@code drainTimeout} to finish; after that running jobs are interrupted
     * and recorded CANCELLED, as are queued jobs that never started.
     */
    public void shutdown(Duration drainTimeout) {
        RequestQueue closing;
        ExecutorService exec;

        poolLock.lock();
        try {
            if (!running) {
                return;
            }
            running = false;
            draining = true;
            closing = queue;
            exec = executor;
            closing.close();
            exec.shutdown();
        } finally {
            poolLock.unlock();
        }

        log.info("Draining worker pool: queued={}, inFlight={}, timeout={}ms",
                closing.depth(), inFlight.get(), drainTimeout.toMillis());

        if (!awaitTermination(exec, drainTimeout)) {
            forceStopped = true;
            int cancelled = 0;
            for (Worker worker : workers) {
                InFlight flight = worker.current;
                if (flight != null && flight.claim()) {
                    emit(buildRecord(flight.job, flight.startedAt, JobOutcome.CANCELLED, null,
                            "Cancelled: drain timeout exceeded", 0, 0, flight.attempts));
                    cancelled++;
                }
            }
            exec.shutdownNow();
            awaitTermination(exec, Duration.ofSeconds(1));
            log.warn("Drain timeout exceeded: {} in-flight job(s) force-terminated", cancelled);
        }

        List<Job> leftovers = closing.drainRemaining();
        for (Job job : leftovers) {
            Instant now = now();
            emit(buildRecord(job, now, JobOutcome.CANCELLED, null,
                    "Cancelled before start: drain timeout exceeded", 0, 0, 0));
        }
        if (!leftovers.isEmpty()) {
            log.warn("{} queued job(s) cancelled before start", leftovers.size());
        }

        log.info("Worker pool stopped.");
    }

    public PoolStatus status() {
        poolLock.lock();
        try {
            RequestQueue q = queue;
            return PoolStatus.builder()
                    .running(running)
                    .concurrency(target.get())
                    .liveWorkers(liveWorkers)
                    .idleWorkers(Math.max(0, idleWorkers.get()))
                    .inFlight(inFlight.get())
                    .queueDepth(q.depth())
                    .queueCapacity(q.capacity())
                    .acceptedTotal(acceptedTotal.get())
                    .rejectedTotal(rejectedTotal.get())
                    .completedTotal(completedTotal.get())
                    .build();
        } finally {
            poolLock.unlock();
        }
    }

    public boolean isRunning() {
        poolLock.lock();
        try {
            return running;
        } finally {
            poolLock.unlock();
        }
    }

    /** Current worker target. */
    public int concurrency() {
        return target.get();
    }

    public int queueDepth() {
        return queue.depth();
    }

    public int inFlight() {
        return inFlight.get();
    }

    // --- internal helpers ---

    private void spawnWorker() {
        Worker worker = new Worker(queue, generation);
        workers.add(worker);
        liveWorkers++;
        try {
            executor.execute(worker);
        } catch (RuntimeException e) {
            workers.remove(worker);
            liveWorkers--;
            throw e;
        }
    }

    private boolean tryRetire(Worker worker) {
        poolLock.lock();
        try {
            if (worker.generation == generation && pendingRetirements > 0) {
                pendingRetirements--;
                liveWorkers--;
                return true;
            }
            return false;
        } finally {
            poolLock.unlock();
        }
    }

    private void workerExited(Worker worker) {
        poolLock.lock();
        try {
            if (worker.generation == generation) {
                liveWorkers--;
            }
        } finally {
            poolLock.unlock();
        }
    }

    private void execute(Worker worker, Job job) {
        InFlight flight = new InFlight(job, now());
        worker.current = flight;
        inFlight.incrementAndGet();
        try {
            JobRecord record = callWithRetry(job, flight);
            if (flight.claim()) {
                emit(record);
            } else {
                log.debug("Discarding late outcome of job {} (already recorded as cancelled)", job.getJobId());
            }
        } finally {
            worker.current = null;
            inFlight.decrementAndGet();
        }
    }

    private JobRecord callWithRetry(Job job, InFlight flight) {
        while (true) {
            flight.attempts++;
            try {
                CompletionResult result = client.complete(job);
                return buildRecord(job, flight.startedAt, JobOutcome.SUCCEEDED, result.getHttpStatus(), null,
                        result.getPromptTokens(), result.getCompletionTokens(), flight.attempts);
            } catch (UpstreamException e) {
                if (Thread.currentThread().isInterrupted()) {
                    return cancelled(job, flight, "Cancelled: interrupted during upstream call");
                }
                int retriesSoFar = flight.attempts - 1;
                if (!retryPolicy.shouldRetry(e, retriesSoFar)) {
                    log.debug("Job {} failed after {} attempt(s): status={}, error={}",
                            job.getJobId(), flight.attempts, e.getStatus(), e.getMessage());
                    return buildRecord(job, flight.startedAt, JobOutcome.FAILED, e.getStatus(), e.getMessage(),
                            job.estimatedPromptTokens(), 0, flight.attempts);
                }
                Duration delay = retryPolicy.backoff(retriesSoFar);
                log.debug("Attempt {} failed for job {} (status={}): {} - retrying in {}ms",
                        flight.attempts, job.getJobId(), e.getStatus(), e.getMessage(), delay.toMillis());
                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return cancelled(job, flight, "Cancelled: interrupted during retry backoff");
                }
            } catch (RuntimeException e) {
                log.warn("Unexpected error calling upstream for job {}: {}", job.getJobId(), e.getMessage(), e);
                return buildRecord(job, flight.startedAt, JobOutcome.FAILED, null,
                        e.getClass().getSimpleName() + ": " + e.getMessage(),
                        job.estimatedPromptTokens(), 0, flight.attempts);
            }
        }
    }

    private JobRecord cancelled(Job job, InFlight flight, String reason) {
        return buildRecord(job, flight.startedAt, JobOutcome.CANCELLED, null, reason, 0, 0, flight.attempts);
    }

    private JobRecord buildRecord(Job job, Instant startedAt, JobOutcome outcome, Integer httpStatus,
                                  String errorText, int promptTokens, int completionTokens, int attempts) {
        Instant finishedAt = now();
        return JobRecord.builder()
                .jobId(job.getJobId())
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .latencyMs(Duration.between(startedAt, finishedAt).toMillis())
                .modelId(job.getModelId())
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .httpStatus(httpStatus)
                .errorText(errorText)
                .attempts(attempts)
                .outcome(outcome)
                .build();
    }

    private void emit(JobRecord record) {
        completedTotal.incrementAndGet();
        for (JobRecordListener listener : listeners) {
            try {
                listener.onJobRecord(record);
            } catch (RuntimeException e) {
                log.warn("JobRecord listener {} failed for job {}: {}",
                        listener.getClass().getSimpleName(), record.getJobId(), e.getMessage());
            }
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static boolean awaitTermination(ExecutorService exec, Duration timeout) {
        try {
            return exec.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static final class InFlight {
        private final Job job;
        private final Instant startedAt;
        private final AtomicBoolean recorded = new AtomicBoolean();
        private volatile int attempts;

        private InFlight(Job job, Instant startedAt) {
            this.job = job;
            this.startedAt = startedAt;
        }

        /** First caller wins the right to emit the record. */
        private boolean claim() {
            return recorded.compareAndSet(false, true);
        }
    }

    private final class Worker implements Runnable {
        private final RequestQueue source;
        private final int generation;
        private volatile InFlight current;

        private Worker(RequestQueue source, int generation) {
            this.source = source;
            this.generation = generation;
        }

        @Override
        public void run() {
            String name = Thread.currentThread().getName();
            boolean retired = false;
            idleWorkers.incrementAndGet();
            log.debug("Worker {} started", name);
            try {
                while (true) {
                    if (tryRetire(this)) {
                        retired = true;
                        break;
                    }
                    Job job = source.poll(props.getWorkerPollTimeout());
                    if (job == null) {
                        if (draining) {
                            break;
                        }
                        continue;
                    }
                    idleWorkers.decrementAndGet();
                    try {
                        if (forceStopped) {
                            Instant now = now();
                            emit(buildRecord(job, now, JobOutcome.CANCELLED, null,
                                    "Cancelled before start: drain timeout exceeded", 0, 0, 0));
                        } else {
                            execute(this, job);
                        }
                    } finally {
                        idleWorkers.incrementAndGet();
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                idleWorkers.decrementAndGet();
                workers.remove(this);
                if (!retired) {
                    workerExited(this);
                }
                log.debug("Worker {} exited ({})", name, retired ? "retired" : "stopped");
            }
        }
    }
}
