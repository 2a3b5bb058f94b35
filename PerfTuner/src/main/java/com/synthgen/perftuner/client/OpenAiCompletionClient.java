package com.synthgen.perftuner.client;

import com.synthgen.perftuner.dto.CompletionRequest;
import com.synthgen.perftuner.dto.CompletionResponse;
import com.synthgen.perftuner.exception.UpstreamException;
import com.synthgen.perftuner.model.Job;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * RestTemplate client for an OpenAI-compatible chat completions endpoint.
 *
 * Non-2xx answers become an {@link UpstreamException} carrying the status;
 * connect errors and read timeouts become transport failures (no status).
 */
@Slf4j
public class OpenAiCompletionClient implements CompletionClient {

    private static final int MAX_ERROR_TEXT = 500;

    private final RestTemplate restTemplate;
    private final String endpoint;

    public OpenAiCompletionClient(RestTemplate restTemplate, String endpoint) {
        this.restTemplate = restTemplate;
        this.endpoint = endpoint;
    }

    @Override
    public CompletionResult complete(Job job) throws UpstreamException {
        CompletionRequest request = CompletionRequest.builder()
                .model(job.getModelId())
                .messages(job.effectiveMessages())
                .maxTokens(job.getMaxTokens())
                .temperature(job.getTemperature())
                .build();

        ResponseEntity<CompletionResponse> response;
        try {
            response = restTemplate.postForEntity(endpoint, request, CompletionResponse.class);
        } catch (HttpStatusCodeException e) {
            log.debug("Upstream answered {} for job {}", e.getStatusCode().value(), job.getJobId());
            throw new UpstreamException(e.getStatusCode().value(),
                    truncate(e.getResponseBodyAsString().isBlank() ? e.getMessage() : e.getResponseBodyAsString()), e);
        } catch (ResourceAccessException e) {
            throw UpstreamException.transport(truncate("I/O error: " + e.getMessage()), e);
        } catch (RestClientException e) {
            // 2xx with an unreadable body
            throw new UpstreamException(200, truncate("Malformed completion response: " + e.getMessage()), e);
        }

        CompletionResponse body = response.getBody();
        if (body == null) {
            throw new UpstreamException(response.getStatusCode().value(), "Empty completion response");
        }

        CompletionResponse.Usage usage = body.getUsage();
        int promptTokens = usage != null && usage.getPromptTokens() != null
                ? usage.getPromptTokens()
                : job.estimatedPromptTokens();
        int completionTokens = usage != null && usage.getCompletionTokens() != null
                ? usage.getCompletionTokens()
                : 0;

        return CompletionResult.builder()
                .text(body.firstContent())
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .httpStatus(response.getStatusCode().value())
                .build();
    }

    static String truncate(String text) {
        if (text == null) {
            return null;
        }
        return text.length() <= MAX_ERROR_TEXT ? text : text.substring(0, MAX_ERROR_TEXT);
    }
}
