package com.synthgen.perftuner.service;

import com.synthgen.perftuner.model.Job;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RequestQueueTest {

    private static Job job(String prompt) {
        return Job.builder().prompt(prompt).modelId("m").maxTokens(16).build();
    }

    @Test
    void shouldRejectWhenAtCapacityWithoutIdleWorker() {
        RequestQueue queue = new RequestQueue(2);

        assertEquals(AdmissionResult.ACCEPTED, queue.submit(job("a")));
        assertEquals(AdmissionResult.ACCEPTED, queue.submit(job("b")));
        assertEquals(AdmissionResult.REJECTED_FULL, queue.submit(job("c")));
        assertEquals(2, queue.depth());
    }

    @Test
    void shouldHandOffDirectlyToWaitingWorker() throws Exception {
        RequestQueue queue = new RequestQueue(1);
        CompletableFuture<Job> taken = CompletableFuture.supplyAsync(() -> {
            try {
                return queue.poll(Duration.ofSeconds(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
        });

        long deadline = System.currentTimeMillis() + 5000;
        while (!queue.hasWaitingWorker() && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertTrue(queue.hasWaitingWorker());

        Job handed = job("direct");
        assertEquals(AdmissionResult.ACCEPTED, queue.submit(handed));
        assertSame(handed, taken.get(5, TimeUnit.SECONDS));
        assertEquals(0, queue.depth());
    }

    @Test
    void shouldRejectAfterCloseButKeepQueuedJobs() throws Exception {
        RequestQueue queue = new RequestQueue(4);
        Job queued = job("queued");
        queue.submit(queued);
        queue.close();

        assertTrue(queue.isClosed());
        assertEquals(AdmissionResult.REJECTED_CLOSED, queue.submit(job("late")));
        assertSame(queued, queue.poll(Duration.ofMillis(10)));
        assertNull(queue.poll(Duration.ofMillis(10)));
    }

    @Test
    void drainRemainingShouldEmptyQueue() {
        RequestQueue queue = new RequestQueue(3);
        queue.submit(job("a"));
        queue.submit(job("b"));

        assertEquals(2, queue.drainRemaining().size());
        assertEquals(0, queue.depth());
    }

    @Test
    void shouldRequirePositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new RequestQueue(0));
    }
}
