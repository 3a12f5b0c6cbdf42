package com.assethealth.anomaly.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Response of an upload-and-analyse request")
public class AnalysisResponse {

    @Schema(description = "Whether the run completed", example = "true")
    private boolean success;

    @Schema(description = "Identifier to fetch or download the stored run", example = "3f6c1a5e-61a4-4a8e-9a3c-0d2b5f0b9c11")
    private String runId;

    @Schema(description = "Uploaded file name", example = "TEP_Train_Test.csv")
    private String filename;

    @Schema(description = "Wall-clock processing time in seconds", example = "3.42")
    private double processingTime;

    private AnalysisSummary summary;

    private ValidationReport report;

    @Schema(description = "Augmented rows keyed by column name; omitted in summary responses")
    private List<Map<String, Object>> data;

    @Schema(description = "Follow-up hint", example = "Use /api/v1/analyses/{runId}/download to get full results.")
    private String message;
}
