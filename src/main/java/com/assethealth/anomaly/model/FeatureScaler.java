package com.assethealth.anomaly.model;

import java.util.List;

/**
 * Per-feature standardisation (mean, population standard deviation) fit on training rows.
 * Callers remove zero-variance features before fitting.
 */
public final class FeatureScaler {

    private final List<String> featureNames;
    private final double[] means;
    private final double[] stdDevs;

    private FeatureScaler(List<String> featureNames, double[] means, double[] stdDevs) {
        this.featureNames = List.copyOf(featureNames);
        this.means = means;
        this.stdDevs = stdDevs;
    }

    /**
     * @param trainingRows row-major training values, one column per entry of {@code featureNames}
     */
    public static FeatureScaler fit(double[][] trainingRows, List<String> featureNames) {
        int features = featureNames.size();
        double[] means = new double[features];
        double[] stdDevs = new double[features];
        int n = trainingRows.length;

        for (int f = 0; f < features; f++) {
            double sum = 0.0;
            for (double[] row : trainingRows) sum += row[f];
            double mean = sum / n;

            double m2 = 0.0;
            for (double[] row : trainingRows) {
                double d = row[f] - mean;
                m2 += d * d;
            }
            double stdDev = Math.sqrt(m2 / n);
            if (!(stdDev > 0)) {
                throw new IllegalArgumentException("Feature " + featureNames.get(f) + " has zero variance");
            }
            means[f] = mean;
            stdDevs[f] = stdDev;
        }
        return new FeatureScaler(featureNames, means, stdDevs);
    }

    public double[][] transform(double[][] rows) {
        double[][] scaled = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            double[] row = rows[i];
            double[] out = new double[row.length];
            for (int f = 0; f < row.length; f++) {
                out[f] = (row[f] - means[f]) / stdDevs[f];
            }
            scaled[i] = out;
        }
        return scaled;
    }

    public List<String> getFeatureNames() { return featureNames; }
    public double mean(int feature) { return means[feature]; }
    public double stdDev(int feature) { return stdDevs[feature]; }
}
