package com.synthgen.perftuner.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One chat turn in OpenAI wire format.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage {

    /** system, user or assistant. */
    private String role;

    private String content;

    public static ChatMessage user(String content) {
        return new ChatMessage("user", content);
    }
}
