package com.assethealth.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Success-criteria validation and non-fatal warnings of a scoring run")
public class ValidationReport {

    @Schema(description = "Mean normalised score over the training window", example = "7.46")
    private double trainingMeanScore;

    @Schema(description = "Maximum normalised score over the training window", example = "14.94")
    private double trainingMaxScore;

    @Schema(description = "Mean score at or above which the training window is flagged", example = "10.0")
    private double meanThreshold;

    @Schema(description = "Max score at or above which the training window is flagged", example = "25.0")
    private double maxThreshold;

    @Schema(description = "Whether the training window stayed under both thresholds", example = "true")
    private boolean passed;

    @Schema(description = "Non-fatal conditions detected during the run")
    private List<PipelineWarning> warnings;

    @Schema(description = "Features used by the model")
    private List<String> modeledFeatures;

    @Schema(description = "Constant features excluded from modeling but kept in the output")
    private List<String> droppedConstantFeatures;

    @Schema(description = "Training window bounds", example = "[2004-01-01T00:00 .. 2004-01-05T23:59:59]")
    private String trainingWindow;

    @Schema(description = "Analysis window bounds", example = "[2004-01-01T00:00 .. 2004-01-19T07:59:59]")
    private String analysisWindow;

    @Schema(description = "Covered training duration in hours", example = "120.0")
    private double trainingHours;

    @Schema(description = "Rows in the training window", example = "120")
    private int trainingRowCount;

    @Schema(description = "Rows in the analysis window", example = "439")
    private int analysisRowCount;

    @Schema(description = "Expected anomaly proportion used to interpret scores", example = "0.1")
    private double contamination;

    @Schema(description = "Seed of the isolation forest", example = "42")
    private long randomState;

    @Schema(description = "Normalised score of the (1 - contamination) training quantile", example = "13.5")
    private double expectedAnomalyThreshold;

    @Schema(description = "Analysis rows scoring above the expected anomaly threshold", example = "57")
    private int rowsAboveExpectedThreshold;
}
