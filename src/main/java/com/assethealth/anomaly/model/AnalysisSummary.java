package com.assethealth.anomaly.model;

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
@Schema(description = "Aggregate statistics of a scored analysis window")
public class AnalysisSummary {

    @Schema(description = "Rows in the augmented output", example = "439")
    private int totalRows;

    @Schema(description = "Lowest abnormality score", example = "0.06")
    private double scoreMin;

    @Schema(description = "Highest abnormality score", example = "99.87")
    private double scoreMax;

    @Schema(description = "Mean abnormality score", example = "31.2")
    private double scoreMean;

    @Schema(description = "Row counts per severity band: normal (<=10), slight (<=30), moderate (<=60), significant (<=90), severe (>90)")
    private Map<String, Long> scoreDistribution;

    @Schema(description = "Mean score of the training window", example = "7.46")
    private double trainingPeriodMean;

    @Schema(description = "Max score of the training window", example = "14.94")
    private double trainingPeriodMax;

    @Schema(description = "Features ranked by how often they appear in a top-feature column")
    private List<FeatureFrequency> topFeatures;

    @Schema(description = "Wall-clock processing time in seconds", example = "3.42")
    private double processingTime;
}
