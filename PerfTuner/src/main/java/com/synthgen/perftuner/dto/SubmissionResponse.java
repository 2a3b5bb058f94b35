package com.synthgen.perftuner.dto;

import com.synthgen.perftuner.service.AdmissionResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmissionResponse {

    private String jobId;

    private AdmissionResult result;

    private int queueDepth;
}
