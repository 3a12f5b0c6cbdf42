package com.assethealth.anomaly.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A stored scoring run")
public class AnalysisRun {

    @Schema(description = "Run identifier", example = "3f6c1a5e-61a4-4a8e-9a3c-0d2b5f0b9c11")
    private String runId;

    @Schema(description = "Uploaded file name", example = "TEP_Train_Test.csv")
    private String filename;

    @Schema(description = "Completion time in epoch milliseconds", example = "1739886764000")
    private long createdAt;

    private AnalysisSummary summary;

    private ValidationReport report;

    // only present on the run that produced it, never read back from storage
    @JsonIgnore
    private AnalysisResult result;
}
