package com.synthgen.perftuner.client;

import com.synthgen.perftuner.exception.UpstreamException;
import com.synthgen.perftuner.model.Job;

/**
 * One blocking call to the upstream completion endpoint.
 * Implementations must not retry; the worker pool applies the retry policy.
 */
public interface CompletionClient {

    CompletionResult complete(Job job) throws UpstreamException;
}
