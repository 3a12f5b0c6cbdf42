package com.assethealth.anomaly.model;

import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.util.List;

/**
 * Scaled model inputs for one run. Row indices refer to rows of the source
 * {@link TimeSeriesFrame}; matrices are row-major over {@link #getModeledFeatures()}.
 */
@Getter
@Builder
public class PreparedData {

    private final TimeSeriesFrame frame;
    private final TimeWindow trainingWindow;
    private final TimeWindow analysisWindow;
    private final Duration trainingDuration;
    private final int[] trainingRows;
    private final int[] analysisRows;
    private final List<String> modeledFeatures;
    private final List<String> droppedFeatures;
    private final FeatureScaler scaler;
    private final double[][] scaledTraining;
    private final double[][] scaledAnalysis;
    private final List<PipelineWarning> warnings;

    /** Column means of the scaled training matrix, the perturbation baseline for attribution. */
    public double[] trainingMeans() {
        int features = modeledFeatures.size();
        double[] means = new double[features];
        for (double[] row : scaledTraining) {
            for (int f = 0; f < features; f++) means[f] += row[f];
        }
        for (int f = 0; f < features; f++) means[f] /= scaledTraining.length;
        return means;
    }
}
