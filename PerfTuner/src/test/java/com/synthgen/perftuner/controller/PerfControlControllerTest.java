package com.synthgen.perftuner.controller;

import com.synthgen.perftuner.config.JacksonConfig;
import com.synthgen.perftuner.config.PerfTunerProperties;
import com.synthgen.perftuner.dto.LifecycleStatus;
import com.synthgen.perftuner.dto.RunSummary;
import com.synthgen.perftuner.model.Job;
import com.synthgen.perftuner.model.TuningDecision;
import com.synthgen.perftuner.service.AdmissionResult;
import com.synthgen.perftuner.service.ConcurrencyTuner;
import com.synthgen.perftuner.service.PerfTunerLifecycleManager;
import com.synthgen.perftuner.service.TelemetryStore;
import com.synthgen.perftuner.service.WorkerPool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class PerfControlControllerTest {

    private PerfTunerLifecycleManager lifecycleManager;
    private WorkerPool workerPool;
    private ConcurrencyTuner tuner;
    private TelemetryStore telemetryStore;
    private PerfTunerProperties props;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        lifecycleManager = mock(PerfTunerLifecycleManager.class);
        workerPool = mock(WorkerPool.class);
        tuner = mock(ConcurrencyTuner.class);
        telemetryStore = mock(TelemetryStore.class);
        props = new PerfTunerProperties();
        props.getUpstream().setModelId("default-model");

        when(lifecycleManager.status()).thenReturn(LifecycleStatus.builder().state("RUNNING").build());

        PerfControlController controller =
                new PerfControlController(lifecycleManager, workerPool, tuner, telemetryStore, props);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setMessageConverters(new StringHttpMessageConverter(),
                        new MappingJackson2HttpMessageConverter(new JacksonConfig().objectMapper()))
                .build();
    }

    @Test
    void acceptedJobShouldReturn202WithDefaults() throws Exception {
        when(workerPool.submit(any(Job.class))).thenReturn(AdmissionResult.ACCEPTED);
        when(workerPool.queueDepth()).thenReturn(1);

        mockMvc.perform(post("/api/perf/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\":\"hello there\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.result").value("ACCEPTED"))
                .andExpect(jsonPath("$.queueDepth").value(1));

        ArgumentCaptor<Job> captor = ArgumentCaptor.forClass(Job.class);
        verify(workerPool).submit(captor.capture());
        Job job = captor.getValue();
        assertEquals("hello there", job.getPrompt());
        assertEquals("default-model", job.getModelId());
        assertEquals(props.getUpstream().getMaxTokens(), job.getMaxTokens());
    }

    @Test
    void saturatedQueueShouldReturn429() throws Exception {
        when(workerPool.submit(any(Job.class))).thenReturn(AdmissionResult.REJECTED_FULL);

        mockMvc.perform(post("/api/perf/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\":\"hello\",\"maxTokens\":32}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.result").value("REJECTED_FULL"));
    }

    @Test
    void closedQueueShouldReturn503() throws Exception {
        when(workerPool.submit(any(Job.class))).thenReturn(AdmissionResult.REJECTED_CLOSED);

        mockMvc.perform(post("/api/perf/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void submissionWithoutContentShouldReturn400() throws Exception {
        mockMvc.perform(post("/api/perf/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"model\":\"x\"}"))
                .andExpect(status().isBadRequest());

        verify(workerPool, never()).submit(any(Job.class));
    }

    @Test
    void stopShouldUseRequestedDrainTimeout() throws Exception {
        mockMvc.perform(post("/api/perf/stop").param("drainSeconds", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("RUNNING"));

        verify(lifecycleManager).stop(Duration.ofSeconds(5));
    }

    @Test
    void stopShouldDefaultToConfiguredDrainTimeout() throws Exception {
        mockMvc.perform(post("/api/perf/stop")).andExpect(status().isOk());

        verify(lifecycleManager).stop(props.getDrainTimeout());
    }

    @Test
    void startFailureShouldReturn503() throws Exception {
        when(lifecycleManager.start(anyString())).thenThrow(new IllegalStateException("Unable to launch 2 worker(s)"));

        mockMvc.perform(post("/api/perf/start").param("notes", "manual"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("Unable to launch 2 worker(s)"));
    }

    @Test
    void summaryShouldReturn404ForUnknownRun() throws Exception {
        when(telemetryStore.summarize("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/perf/runs/nope/summary")).andExpect(status().isNotFound());
    }

    @Test
    void summaryShouldReturnStoredAggregates() throws Exception {
        when(telemetryStore.summarize("run-1")).thenReturn(Optional.of(RunSummary.builder()
                .runId("run-1").totalJobs(42).bestConcurrency(6).bestThroughputRps(118.5).build()));

        mockMvc.perform(get("/api/perf/runs/run-1/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalJobs").value(42))
                .andExpect(jsonPath("$.bestConcurrency").value(6));
    }

    @Test
    void historyShouldListDecisions() throws Exception {
        when(tuner.history()).thenReturn(List.of(TuningDecision.builder()
                .ts(Instant.parse("2026-01-01T00:00:15Z")).from(2).to(3)
                .direction(TuningDecision.Direction.UP).reason("unmet demand with latency headroom").build()));

        mockMvc.perform(get("/api/perf/tuner/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].direction").value("UP"))
                .andExpect(jsonPath("$[0].to").value(3))
                .andExpect(jsonPath("$[0].ts").value("2026-01-01T00:00:15Z"));
    }
}
