package com.assethealth.anomaly.engine.isolationforest;

/**
 * Node of an isolation tree. Internal nodes also remember the range of their split feature
 * over the samples that reached them. A point that lies outside that range by {@code d}
 * would have been cut off here with probability {@code d / (range + d)} had it been part of
 * the sample; its path length is the expectation over ending here or continuing down.
 */
public final class IsolationNode {

    private static final double EULER_GAMMA = 0.5772156649;

    private final int splitFeature;
    private final double splitValue;
    private final double lowerBound;
    private final double upperBound;
    private final IsolationNode left;
    private final IsolationNode right;
    private final int size;
    private final boolean external;

    private IsolationNode(int splitFeature, double splitValue, double lowerBound, double upperBound,
                          IsolationNode left, IsolationNode right, int size, boolean external) {
        this.splitFeature = splitFeature;
        this.splitValue = splitValue;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.left = left;
        this.right = right;
        this.size = size;
        this.external = external;
    }

    public static IsolationNode internalNode(int splitFeature, double splitValue,
                                             double lowerBound, double upperBound,
                                             IsolationNode left, IsolationNode right) {
        return new IsolationNode(splitFeature, splitValue, lowerBound, upperBound,
                left, right, left.size + right.size, false);
    }

    public static IsolationNode externalNode(int size) {
        return new IsolationNode(-1, 0.0, 0.0, 0.0, null, null, size, true);
    }

    public double pathLength(double[] point, int currentDepth) {
        if (external) {
            return currentDepth + averagePathLength(size);
        }
        double value = point[splitFeature];
        double below = value < splitValue
                ? left.pathLength(point, currentDepth + 1)
                : right.pathLength(point, currentDepth + 1);

        double outside = value < lowerBound ? lowerBound - value
                : value > upperBound ? value - upperBound
                : 0.0;
        if (outside == 0.0) {
            return below;
        }
        double isolatedHere = outside / (upperBound - lowerBound + outside);
        return isolatedHere * (currentDepth + 1) + (1.0 - isolatedHere) * below;
    }

    /**
     * Average path length of an unsuccessful BST search over n points:
     * c(n) = 2H(n-1) - 2(n-1)/n with H(i) ~ ln(i) + Euler's constant.
     */
    public static double averagePathLength(int n) {
        if (n <= 1) return 0;
        if (n == 2) return 1;
        double harmonicNumber = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonicNumber - (2.0 * (n - 1.0) / n);
    }
}
