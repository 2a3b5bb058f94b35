package com.synthgen.perftuner.model;

import com.synthgen.perftuner.dto.ChatMessage;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A pending completion request.
 *
 * Either a plain prompt or an explicit message list; when no messages are
 * given the prompt is sent as a single user turn.
 */
@Value
@Builder
public class Job {

    @Builder.Default
    String jobId = UUID.randomUUID().toString();

    String prompt;

    @Singular
    List<ChatMessage> messages;

    String modelId;

    int maxTokens;

    double temperature;

    @Builder.Default
    Instant submittedAt = Instant.now();

    /**
     * Messages to send upstream.
     */
    public List<ChatMessage> effectiveMessages() {
        if (messages != null && !messages.isEmpty()) {
            return messages;
        }
        return List.of(ChatMessage.user(prompt != null ? prompt : ""));
    }

    /**
     * Rough prompt size used when the endpoint reports no usage.
     */
    public int estimatedPromptTokens() {
        int words = 0;
        for (ChatMessage m : effectiveMessages()) {
            String content = m.getContent();
            if (content != null && !content.isBlank()) {
                words += content.trim().split("\\s+").length;
            }
        }
        return words;
    }
}
