package com.synthgen.perftuner.benchmark;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Prompt variations used by the benchmark, one per line in a prompt file.
 */
@Slf4j
public final class PromptSource {

    public static final List<String> DEFAULT_PROMPTS = List.of(
            "Generate a short conversation between a patient and receptionist scheduling an appointment.",
            "Create a brief dialogue about rescheduling a medical appointment.",
            "Write a conversation where a patient calls to cancel their appointment.",
            "Generate a short exchange about insurance verification for an appointment.",
            "Create a dialogue about scheduling an urgent same-day appointment."
    );

    private PromptSource() {
    }

    /**
     * Loads non-blank lines from {@code promptFile}. Falls back to the
     * built-in prompts when no file is given, it does not exist or it is empty.
     *
     * @throws IllegalArgumentException if the file exists but cannot be read
     */
    public static List<String> load(String promptFile) {
        if (promptFile == null || promptFile.isBlank()) {
            return DEFAULT_PROMPTS;
        }
        Path path = Path.of(promptFile);
        if (!Files.isRegularFile(path)) {
            log.warn("Prompt file {} not found, using {} built-in prompts", promptFile, DEFAULT_PROMPTS.size());
            return DEFAULT_PROMPTS;
        }

        List<String> prompts = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    prompts.add(line.trim());
                }
            }
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read prompt file " + promptFile, e);
        }

        if (prompts.isEmpty()) {
            log.warn("Prompt file {} is empty, using built-in prompts", promptFile);
            return DEFAULT_PROMPTS;
        }
        log.info("Loaded {} prompt(s) from {}", prompts.size(), promptFile);
        return prompts;
    }
}
