package com.assethealth.anomaly.model;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class TransformedScores {

    private final double[] analysisScores;
    private final double[] trainingScores;
    private final List<List<String>> topFeatures;
    private final double expectedAnomalyThreshold;
}
