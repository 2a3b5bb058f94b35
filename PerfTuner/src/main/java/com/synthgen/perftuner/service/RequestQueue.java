package com.synthgen.perftuner.service;

import com.synthgen.perftuner.model.Job;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.LinkedTransferQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO intake buffer.
 *
 * A submission is handed straight to a worker blocked in {@link #poll} when
 * there is one; otherwise it is queued while below capacity. Only a full
 * queue with no waiting worker rejects. Producers never block.
 */
public class RequestQueue {

    private final LinkedTransferQueue<Job> jobs = new LinkedTransferQueue<>();
    private final ReentrantLock admissionLock = new ReentrantLock();
    private final int capacity;

    private volatile boolean closed;

    public RequestQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        this.capacity = capacity;
    }

    public AdmissionResult submit(Job job) {
        admissionLock.lock();
        try {
            if (closed) {
                return AdmissionResult.REJECTED_CLOSED;
            }
            if (jobs.tryTransfer(job)) {
                return AdmissionResult.ACCEPTED;
            }
            if (jobs.size() >= capacity) {
                return AdmissionResult.REJECTED_FULL;
            }
            jobs.offer(job);
            return AdmissionResult.ACCEPTED;
        } finally {
            admissionLock.unlock();
        }
    }

    /**
     * Waits up to {@code timeout} for the next job; null when none arrived.
     */
    public Job poll(Duration timeout) throws InterruptedException {
        return jobs.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Stops admission; queued jobs stay available to {@link #poll}.
     */
    public void close() {
        admissionLock.lock();
        try {
            closed = true;
        } finally {
            admissionLock.unlock();
        }
    }

    /**
     * Removes and returns every job still queued.
     */
    public List<Job> drainRemaining() {
        List<Job> remaining = new ArrayList<>();
        jobs.drainTo(remaining);
        return remaining;
    }

    public boolean isClosed() {
        return closed;
    }

    public boolean hasWaitingWorker() {
        return jobs.hasWaitingConsumer();
    }

    public int depth() {
        return jobs.size();
    }

    public int capacity() {
        return capacity;
    }
}
