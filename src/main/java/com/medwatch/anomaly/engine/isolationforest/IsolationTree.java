package com.medwatch.anomaly.engine.isolationforest;

import java.util.Arrays;
import java.util.Random;

public class IsolationTree {

    private IsolationNode root;

    public IsolationTree() {}

    IsolationTree(IsolationNode root) {
        this.root = root;
    }

    static IsolationTree grow(double[][] sample, int heightLimit, Random random) {
        return new IsolationTree(grow(sample, 0, heightLimit, random));
    }

    private static IsolationNode grow(double[][] rows, int depth, int heightLimit, Random random) {
        if (depth >= heightLimit || rows.length <= 1) {
            return IsolationNode.leaf(rows.length);
        }

        int feature = random.nextInt(rows[0].length);
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double[] row : rows) {
            min = Math.min(min, row[feature]);
            max = Math.max(max, row[feature]);
        }
        // Constant on this feature, nothing left to isolate along it
        if (!(max > min)) {
            return IsolationNode.leaf(rows.length);
        }

        double splitValue = min + random.nextDouble() * (max - min);
        double[][] below = Arrays.stream(rows).filter(r -> r[feature] < splitValue).toArray(double[][]::new);
        double[][] above = Arrays.stream(rows).filter(r -> r[feature] >= splitValue).toArray(double[][]::new);

        return IsolationNode.split(feature, splitValue,
                grow(below, depth + 1, heightLimit, random),
                grow(above, depth + 1, heightLimit, random));
    }

    public double pathLength(double[] point) {
        return root.depthOf(point, 0);
    }

    public IsolationNode getRoot() { return root; }
    public void setRoot(IsolationNode root) { this.root = root; }
}
