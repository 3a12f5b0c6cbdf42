package com.assethealth.anomaly.model;

import com.assethealth.anomaly.engine.isolationforest.IsolationForest;
import lombok.Builder;
import lombok.Getter;

/**
 * Raw model output: larger scores are more anomalous. {@code contributions[row][feature]}
 * is never negative.
 */
@Getter
@Builder
public class ScoringResult {

    private final IsolationForest model;
    private final double[] trainingScores;
    private final double[] analysisScores;
    private final double[][] contributions;
}
