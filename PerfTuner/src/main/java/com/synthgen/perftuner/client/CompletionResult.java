package com.synthgen.perftuner.client;

import lombok.Builder;
import lombok.Value;

/**
 * Successful completion: text plus token usage.
 */
@Value
@Builder
public class CompletionResult {

    String text;

    int promptTokens;

    int completionTokens;

    int httpStatus;
}
