package com.synthgen.perftuner.service;

import com.synthgen.perftuner.config.PerfTunerProperties;
import com.synthgen.perftuner.model.Sample;
import com.synthgen.perftuner.model.TuningDecision;
import com.synthgen.perftuner.model.TuningDecision.Direction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Single-step hill-climbing controller for the worker target.
 *
 * Evaluated once per tick against the latest sample only:
 * - error rate or p95 above target: step down
 * - p95 under 70% of target, no errors and a non-empty queue: step up
 * - queue empty with low latency for N consecutive ticks: step down (idle rule)
 * - otherwise hold
 * Empty windows never move the target. Bounds are re-applied after every step.
 */
@Service
@Slf4j
public class ConcurrencyTuner {

    static final double HEADROOM_FACTOR = 0.7;
    private static final double ZERO_ERROR_EPSILON = 1e-9;
    private static final int MAX_HISTORY = 100;

    private final PerfTunerProperties props;
    private final WorkerPool workerPool;

    private final Deque<TuningDecision> history = new ArrayDeque<>();
    private int idleStreak;

    public ConcurrencyTuner(PerfTunerProperties props, WorkerPool workerPool) {
        this.props = props;
        this.workerPool = workerPool;
    }

    /**
     * Evaluates the sample against the pool's current target and applies
     * the resulting step.
     */
    public TuningDecision tick(Sample sample) {
        TuningDecision decision = decide(sample, workerPool.concurrency());
        if (decision.changed()) {
            workerPool.resize(decision.getTo());
        }
        return decision;
    }

    /**
     * Pure decision for the given sample and current concurrency; records
     * the decision in the history.
     */
    public synchronized TuningDecision decide(Sample sample, int current) {
        TuningDecision decision = evaluate(sample, props.clamp(current));
        remember(decision);

        log.info("Tuner decision: conc={}->{} q={} rps={} p95={}ms err={} decision={} ({})",
                decision.getFrom(), decision.getTo(), sample.getQueueDepth(),
                String.format("%.2f", sample.getThroughputRps()), sample.getP95Ms(),
                String.format("%.3f", sample.getErrorRate()), decision.getDirection(), decision.getReason());
        return decision;
    }

    public synchronized List<TuningDecision> history() {
        return new ArrayList<>(history);
    }

    /**
     * Clears per-run state.
     */
    public synchronized void reset() {
        history.clear();
        idleStreak = 0;
    }

    private TuningDecision evaluate(Sample sample, int current) {
        if (sample.isEmpty()) {
            idleStreak = 0;
            return hold(sample, current, "empty window");
        }

        long targetP95 = props.getTargetP95Ms();
        boolean errorsOver = sample.getErrorRate() > props.getTargetErrorRate();
        boolean latencyOver = sample.getP95Ms() > targetP95;
        if (errorsOver || latencyOver) {
            idleStreak = 0;
            String reason = errorsOver ? "error rate above target" : "p95 above target";
            return step(sample, current, -props.getDecreaseStep(), reason);
        }

        boolean headroom = sample.getP95Ms() < HEADROOM_FACTOR * targetP95;
        boolean clean = sample.getErrorRate() <= ZERO_ERROR_EPSILON;
        if (headroom && clean && sample.getQueueDepth() > 0) {
            idleStreak = 0;
            return step(sample, current, props.getIncreaseStep(), "unmet demand with latency headroom");
        }

        PerfTunerProperties.IdleScaleDown idle = props.getIdleScaleDown();
        if (idle.isEnabled() && headroom && sample.getQueueDepth() == 0) {
            idleStreak++;
            if (idleStreak >= idle.getTicks()) {
                idleStreak = 0;
                return step(sample, current, -props.getDecreaseStep(), "idle for " + idle.getTicks() + " ticks");
            }
            return hold(sample, current, "idle " + idleStreak + "/" + idle.getTicks());
        }

        idleStreak = 0;
        return hold(sample, current, "within targets");
    }

    private TuningDecision step(Sample sample, int current, int delta, String reason) {
        int next = props.clamp(current + delta);
        if (next == current) {
            return hold(sample, current, reason + ", at bound");
        }
        return TuningDecision.builder()
                .ts(sample.getTs())
                .from(current)
                .to(next)
                .direction(next > current ? Direction.UP : Direction.DOWN)
                .reason(reason)
                .build();
    }

    private TuningDecision hold(Sample sample, int current, String reason) {
        return TuningDecision.builder()
                .ts(sample.getTs())
                .from(current)
                .to(current)
                .direction(Direction.HOLD)
                .reason(reason)
                .build();
    }

    private void remember(TuningDecision decision) {
        history.addLast(decision);
        while (history.size() > MAX_HISTORY) {
            history.pollFirst();
        }
    }
}
