package com.medwatch.anomaly.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Isolation Forest (Liu, Ting and Zhou, 2008). Points that are isolated after few random splits
 * score close to 1.0; points deep inside dense regions score well below 0.5.
 *
 * The forest also keeps the per-feature means of its training data so that a score can be explained
 * feature by feature (see {@link #featureContributions(double[])}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IsolationForest {

    private List<IsolationTree> trees = new ArrayList<>();
    private int sampleSize;
    private double[] featureMeans = new double[0];

    /**
     * @param data       training rows, one feature vector each
     * @param numTrees   number of trees to grow
     * @param sampleSize rows drawn (without replacement) per tree
     * @param seed       random seed, fixed so retraining on the same data is reproducible
     */
    public static IsolationForest train(double[][] data, int numTrees, int sampleSize, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot train an isolation forest without data");
        }

        IsolationForest forest = new IsolationForest();
        forest.sampleSize = Math.min(sampleSize, data.length);
        forest.featureMeans = columnMeans(data);

        int heightLimit = (int) Math.ceil(Math.log(Math.max(forest.sampleSize, 2)) / Math.log(2));
        Random random = new Random(seed);
        List<IsolationTree> grown = new ArrayList<>(numTrees);
        for (int i = 0; i < numTrees; i++) {
            grown.add(IsolationTree.grow(drawSample(data, forest.sampleSize, random), heightLimit, random));
        }
        forest.trees = grown;
        return forest;
    }

    /**
     * s(x, n) = 2^(-E[h(x)] / c(n)), in [0, 1].
     */
    public double score(double[] point) {
        if (trees.isEmpty()) return 0.0;

        double c = IsolationNode.expectedPathLength(sampleSize);
        if (c <= 0) return 0.0;

        double totalDepth = 0.0;
        for (IsolationTree tree : trees) {
            totalDepth += tree.pathLength(point);
        }
        return Math.pow(2.0, -(totalDepth / trees.size()) / c);
    }

    /**
     * How much the score drops when each feature is reset to its training mean.
     * Features that do not raise the score get 0.
     */
    public double[] featureContributions(double[] point) {
        double base = score(point);
        double[] contributions = new double[point.length];
        for (int i = 0; i < point.length && i < featureMeans.length; i++) {
            double[] neutralized = Arrays.copyOf(point, point.length);
            neutralized[i] = featureMeans[i];
            contributions[i] = Math.max(0.0, base - score(neutralized));
        }
        return contributions;
    }

    private static double[] columnMeans(double[][] data) {
        double[] means = new double[data[0].length];
        for (double[] row : data) {
            for (int i = 0; i < means.length; i++) {
                means[i] += row[i];
            }
        }
        for (int i = 0; i < means.length; i++) {
            means[i] /= data.length;
        }
        return means;
    }

    // Partial Fisher-Yates over row indices
    private static double[][] drawSample(double[][] data, int size, Random random) {
        if (size >= data.length) {
            return Arrays.copyOf(data, data.length);
        }
        int[] order = new int[data.length];
        for (int i = 0; i < order.length; i++) order[i] = i;

        double[][] sample = new double[size][];
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(order.length - i);
            int swap = order[i];
            order[i] = order[j];
            order[j] = swap;
            sample[i] = data[order[i]];
        }
        return sample;
    }

    public List<IsolationTree> getTrees() { return trees; }
    public void setTrees(List<IsolationTree> trees) { this.trees = trees; }
    public int getSampleSize() { return sampleSize; }
    public void setSampleSize(int sampleSize) { this.sampleSize = sampleSize; }
    public double[] getFeatureMeans() { return featureMeans; }
    public void setFeatureMeans(double[] featureMeans) { this.featureMeans = featureMeans; }
}
