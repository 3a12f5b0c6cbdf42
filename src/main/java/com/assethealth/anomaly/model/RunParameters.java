package com.assethealth.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Caller-supplied knobs for one run. Any null field falls back to the configured default.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunParameters {

    private Double contamination;
    private Long randomState;
    private String timestampColumn;
    private LocalDateTime trainingStart;
    private LocalDateTime trainingEnd;
    private LocalDateTime analysisStart;
    private LocalDateTime analysisEnd;

    public static RunParameters defaults() {
        return new RunParameters();
    }
}
