package com.assethealth.anomaly.engine.isolationforest;

import java.util.Random;

public final class IsolationTree {

    private final IsolationNode root;

    public IsolationTree(IsolationNode root) {
        this.root = root;
    }

    public static IsolationTree build(double[][] data, int maxDepth, Random random) {
        return new IsolationTree(buildNode(data, 0, maxDepth, random));
    }

    private static IsolationNode buildNode(double[][] data, int depth, int maxDepth, Random random) {
        int n = data.length;

        if (depth >= maxDepth || n <= 1) {
            return IsolationNode.externalNode(n);
        }

        int featureIdx = chooseSplitFeature(data, random);

        // All samples identical
        if (featureIdx < 0) {
            return IsolationNode.externalNode(n);
        }

        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (double[] row : data) {
            if (row[featureIdx] < min) min = row[featureIdx];
            if (row[featureIdx] > max) max = row[featureIdx];
        }

        double splitValue = min + random.nextDouble() * (max - min);

        int leftCount = 0;
        for (double[] row : data) {
            if (row[featureIdx] < splitValue) leftCount++;
        }

        double[][] leftData = new double[leftCount][];
        double[][] rightData = new double[n - leftCount][];
        int li = 0, ri = 0;
        for (double[] row : data) {
            if (row[featureIdx] < splitValue) {
                leftData[li++] = row;
            } else {
                rightData[ri++] = row;
            }
        }

        IsolationNode left = buildNode(leftData, depth + 1, maxDepth, random);
        IsolationNode right = buildNode(rightData, depth + 1, maxDepth, random);

        return IsolationNode.internalNode(featureIdx, splitValue, min, max, left, right);
    }

    /**
     * Uniform draw among the features that still vary over {@code data}; -1 if none does.
     */
    static int chooseSplitFeature(double[][] data, Random random) {
        int numFeatures = data[0].length;
        int[] varying = new int[numFeatures];
        int count = 0;
        for (int f = 0; f < numFeatures; f++) {
            double first = data[0][f];
            for (double[] row : data) {
                if (row[f] != first) {
                    varying[count++] = f;
                    break;
                }
            }
        }
        return count == 0 ? -1 : varying[random.nextInt(count)];
    }

    public double pathLength(double[] point) {
        return root.pathLength(point, 0);
    }
}
