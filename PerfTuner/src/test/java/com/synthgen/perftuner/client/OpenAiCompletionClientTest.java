package com.synthgen.perftuner.client;

import com.synthgen.perftuner.config.JacksonConfig;
import com.synthgen.perftuner.config.PerfTunerProperties;
import com.synthgen.perftuner.config.UpstreamClientConfig;
import com.synthgen.perftuner.exception.UpstreamException;
import com.synthgen.perftuner.model.Job;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OpenAiCompletionClientTest {

    private static final String ENDPOINT = "http://llm.local/v1/chat/completions";

    private PerfTunerProperties props;
    private MockRestServiceServer server;
    private OpenAiCompletionClient client;

    @BeforeEach
    void setUp() {
        props = new PerfTunerProperties();
        props.getUpstream().setEndpoint(ENDPOINT);
        props.getUpstream().setApiKey("secret-key");
        RestTemplate restTemplate = new UpstreamClientConfig()
                .upstreamRestTemplate(props, new JacksonConfig().objectMapper());
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new OpenAiCompletionClient(restTemplate, ENDPOINT);
    }

    private static Job job() {
        return Job.builder()
                .prompt("Write a short dialogue")
                .modelId("llama-test")
                .maxTokens(64)
                .temperature(0.2)
                .build();
    }

    @Test
    void shouldSendChatRequestAndReadUsage() throws Exception {
        server.expect(requestTo(ENDPOINT))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer secret-key"))
                .andExpect(jsonPath("$.model").value("llama-test"))
                .andExpect(jsonPath("$.max_tokens").value(64))
                .andExpect(jsonPath("$.messages[0].role").value("user"))
                .andExpect(jsonPath("$.messages[0].content").value("Write a short dialogue"))
                .andRespond(withSuccess("{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"Hello\"}}],"
                        + "\"usage\":{\"prompt_tokens\":9,\"completion_tokens\":31,\"total_tokens\":40}}",
                        MediaType.APPLICATION_JSON));

        CompletionResult result = client.complete(job());

        assertEquals("Hello", result.getText());
        assertEquals(9, result.getPromptTokens());
        assertEquals(31, result.getCompletionTokens());
        assertEquals(200, result.getHttpStatus());
        server.verify();
    }

    @Test
    void shouldEstimateTokensWhenUsageMissing() throws Exception {
        server.expect(requestTo(ENDPOINT))
                .andRespond(withSuccess("{\"choices\":[{\"message\":{\"content\":\"Hi\"}}]}",
                        MediaType.APPLICATION_JSON));

        CompletionResult result = client.complete(job());

        assertEquals(4, result.getPromptTokens());
        assertEquals(0, result.getCompletionTokens());
    }

    @Test
    void shouldMapServerErrorToStatus() {
        server.expect(requestTo(ENDPOINT))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE).body("model loading"));

        UpstreamException e = assertThrows(UpstreamException.class, () -> client.complete(job()));

        assertEquals(503, e.getStatus());
        assertEquals("model loading", e.getMessage());
    }

    @Test
    void shouldMapRateLimitToStatus() {
        server.expect(requestTo(ENDPOINT)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        UpstreamException e = assertThrows(UpstreamException.class, () -> client.complete(job()));

        assertEquals(429, e.getStatus());
    }

    @Test
    void shouldMapIoErrorToTransportFailure() {
        server.expect(requestTo(ENDPOINT)).andRespond(withException(new IOException("connection reset")));

        UpstreamException e = assertThrows(UpstreamException.class, () -> client.complete(job()));

        assertTrue(e.isTransportFailure());
        assertNull(e.getStatus());
    }

    @Test
    void truncateShouldLimitErrorText() {
        assertEquals(500, OpenAiCompletionClient.truncate("x".repeat(2000)).length());
        assertEquals("short", OpenAiCompletionClient.truncate("short"));
        assertNull(OpenAiCompletionClient.truncate(null));
    }
}
