package com.synthgen.perftuner.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.synthgen.perftuner.client.CompletionClient;
import com.synthgen.perftuner.client.OpenAiCompletionClient;
import com.synthgen.perftuner.client.SimulatedCompletionClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * Upstream completion client wiring.
 *
 * Builds the RestTemplate with connect/read timeouts and an optional bearer
 * token, and picks the simulated endpoint when perf.upstream.simulated.enabled
 * is set.
 */
@Configuration
@Slf4j
public class UpstreamClientConfig {

    @Bean
    public RestTemplate upstreamRestTemplate(PerfTunerProperties properties, ObjectMapper objectMapper) {
        PerfTunerProperties.Upstream upstream = properties.getUpstream();

        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) upstream.getConnectTimeout().toMillis());
        factory.setReadTimeout((int) upstream.getRequestTimeout().toMillis());

        RestTemplate restTemplate = new RestTemplate(factory);
        restTemplate.getMessageConverters().add(0, new MappingJackson2HttpMessageConverter(objectMapper));

        String apiKey = upstream.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            ClientHttpRequestInterceptor bearerInterceptor = (request, body, execution) -> {
                request.getHeaders().setBearerAuth(apiKey);
                return execution.execute(request, body);
            };
            restTemplate.setInterceptors(List.of(bearerInterceptor));
        }

        return restTemplate;
    }

    @Bean
    public CompletionClient completionClient(PerfTunerProperties properties, RestTemplate upstreamRestTemplate) {
        PerfTunerProperties.Upstream upstream = properties.getUpstream();
        PerfTunerProperties.Simulated simulated = upstream.getSimulated();

        if (simulated.isEnabled()) {
            log.info("Using simulated upstream: latency={}ms, errorRate={}, errorStatus={}",
                    simulated.getLatency().toMillis(), simulated.getErrorRate(), simulated.getErrorStatus());
            return new SimulatedCompletionClient(simulated.getLatency(), simulated.getErrorRate(),
                    simulated.getErrorStatus());
        }

        log.info("Using upstream endpoint: {} (model={}, timeout={}s)",
                upstream.getEndpoint(), upstream.getModelId(), upstream.getRequestTimeout().toSeconds());
        return new OpenAiCompletionClient(upstreamRestTemplate, upstream.getEndpoint());
    }
}
