package com.synthgen.perftuner.dto;

import com.synthgen.perftuner.model.Run;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO returned by the /api/perf control endpoints.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LifecycleStatus {

    /** RUNNING or STOPPED. */
    private String state;

    /** Active run, or the last finished one when stopped. */
    private Run run;

    private PoolStatus pool;

    private boolean telemetryAvailable;
}
