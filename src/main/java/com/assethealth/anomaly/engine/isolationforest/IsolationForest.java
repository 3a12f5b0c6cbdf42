package com.assethealth.anomaly.engine.isolationforest;

import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Ensemble of isolation trees. Immutable once fitted.
 *
 * Every tree gets its own {@link Random} seeded from a master generator drawn in tree
 * order, so building trees in parallel yields exactly the forest a sequential build does.
 * Path lengths are always summed in tree order, which keeps scores bit-identical too.
 */
public final class IsolationForest {

    private final List<IsolationTree> trees;
    private final int sampleSize;

    private IsolationForest(List<IsolationTree> trees, int sampleSize) {
        this.trees = List.copyOf(trees);
        this.sampleSize = sampleSize;
    }

    /**
     * Train the isolation forest on the given data.
     *
     * @param data       training samples, each row is a feature vector
     * @param numTrees   number of trees in the forest (typically 100)
     * @param sampleSize sub-sampling size per tree (typically 256)
     * @param seed       random seed for reproducibility
     * @param parallel   build trees concurrently
     */
    public static IsolationForest fit(double[][] data, int numTrees, int sampleSize, long seed, boolean parallel) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot fit an isolation forest on zero rows");
        }
        if (numTrees < 1 || sampleSize < 1) {
            throw new IllegalArgumentException("numTrees and sampleSize must be positive");
        }
        int effectiveSampleSize = Math.min(sampleSize, data.length);
        int maxDepth = (int) Math.ceil(Math.log(effectiveSampleSize) / Math.log(2));

        Random master = new Random(seed);
        long[] treeSeeds = new long[numTrees];
        for (int i = 0; i < numTrees; i++) {
            treeSeeds[i] = master.nextLong();
        }

        IntStream indices = IntStream.range(0, numTrees);
        if (parallel) {
            indices = indices.parallel();
        }
        List<IsolationTree> trees = indices
                .mapToObj(i -> {
                    Random random = new Random(treeSeeds[i]);
                    double[][] sample = subsample(data, effectiveSampleSize, random);
                    return IsolationTree.build(sample, maxDepth, random);
                })
                .collect(Collectors.toList());

        return new IsolationForest(trees, effectiveSampleSize);
    }

    /**
     * Compute anomaly score for a single point.
     *
     * @return s(x, n) = 2^(-E(h(x)) / c(n)), in (0, 1]; larger is more anomalous,
     *         around 0.5 is unremarkable
     */
    public double anomalyScore(double[] point) {
        double avgPathLength = 0.0;
        for (IsolationTree tree : trees) {
            avgPathLength += tree.pathLength(point);
        }
        avgPathLength /= trees.size();

        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0) return 0.0;

        return Math.pow(2.0, -avgPathLength / c);
    }

    public double[] anomalyScores(double[][] points, boolean parallel) {
        IntStream indices = IntStream.range(0, points.length);
        if (parallel) {
            indices = indices.parallel();
        }
        return indices.mapToDouble(i -> anomalyScore(points[i])).toArray();
    }

    /**
     * Per-feature responsibility for a point's score: replace one feature at a time with its
     * baseline value, rescore, and keep how much the score dropped. Never negative.
     */
    public double[] featureContributions(double[] point, double baseScore, double[] baseline) {
        double[] contributions = new double[point.length];
        double[] modified = Arrays.copyOf(point, point.length);

        for (int i = 0; i < point.length; i++) {
            modified[i] = baseline[i];
            double modifiedScore = anomalyScore(modified);
            contributions[i] = Math.max(0, baseScore - modifiedScore);
            modified[i] = point[i];
        }

        return contributions;
    }

    double[] featureContributions(double[] point, double[] baseline) {
        return featureContributions(point, anomalyScore(point), baseline);
    }

    private static double[][] subsample(double[][] data, int size, Random random) {
        if (data.length <= size) {
            return Arrays.copyOf(data, data.length);
        }
        double[][] sample = new double[size][];
        // Partial Fisher-Yates shuffle on indices
        int[] indices = new int[data.length];
        for (int i = 0; i < data.length; i++) indices[i] = i;
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }

    List<IsolationTree> getTrees() { return trees; }
    int getSampleSize() { return sampleSize; }
}
