package com.synthgen.perftuner.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.synthgen.perftuner.config.PerfTunerProperties;
import com.synthgen.perftuner.model.Job;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of POST /api/perf/jobs. Unset fields fall back to the upstream defaults.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class JobSubmission {

    private String prompt;

    @Valid
    private List<ChatMessage> messages;

    private String model;

    @Min(1)
    private Integer maxTokens;

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private Double temperature;

    public static JobSubmission ofPrompt(String prompt) {
        return new JobSubmission(prompt, null, null, null, null);
    }

    @JsonIgnore
    @AssertTrue(message = "either prompt or messages must be provided")
    public boolean isContentPresent() {
        return (prompt != null && !prompt.isBlank()) || (messages != null && !messages.isEmpty());
    }

    public Job toJob(PerfTunerProperties.Upstream defaults) {
        Job.JobBuilder builder = Job.builder()
                .prompt(prompt)
                .modelId(model != null && !model.isBlank() ? model : defaults.getModelId())
                .maxTokens(maxTokens != null ? maxTokens : defaults.getMaxTokens())
                .temperature(temperature != null ? temperature : defaults.getTemperature());
        if (messages != null) {
            builder.messages(messages);
        }
        return builder.build();
    }
}
