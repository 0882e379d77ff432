package com.medwatch.anomaly.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Node of an isolation tree. Split nodes route a point left when its feature value is below the split value;
 * leaves remember how many training samples reached them.
 * Property names are kept short because a whole forest is stored as one JSON bin.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IsolationNode {

    private static final double EULER_MASCHERONI = 0.5772156649;

    @JsonProperty("f")
    private int feature;

    @JsonProperty("v")
    private double splitValue;

    @JsonProperty("l")
    private IsolationNode left;

    @JsonProperty("r")
    private IsolationNode right;

    @JsonProperty("n")
    private int size;

    @JsonProperty("leaf")
    private boolean leaf;

    public IsolationNode() {}

    static IsolationNode split(int feature, double splitValue, IsolationNode left, IsolationNode right) {
        IsolationNode node = new IsolationNode();
        node.feature = feature;
        node.splitValue = splitValue;
        node.left = left;
        node.right = right;
        return node;
    }

    static IsolationNode leaf(int size) {
        IsolationNode node = new IsolationNode();
        node.size = size;
        node.leaf = true;
        return node;
    }

    double depthOf(double[] point, int depth) {
        if (leaf) {
            return depth + expectedPathLength(size);
        }
        IsolationNode next = point[feature] < splitValue ? left : right;
        return next.depthOf(point, depth + 1);
    }

    /**
     * c(n): average path length of an unsuccessful BST search over n samples,
     * used both to normalize scores and to credit unexpanded leaves.
     */
    public static double expectedPathLength(int n) {
        if (n <= 1) return 0.0;
        if (n == 2) return 1.0;
        double harmonic = Math.log(n - 1.0) + EULER_MASCHERONI;
        return 2.0 * harmonic - (2.0 * (n - 1.0) / n);
    }

    public int countNodes() {
        return leaf ? 1 : 1 + left.countNodes() + right.countNodes();
    }

    public int getFeature() { return feature; }
    public double getSplitValue() { return splitValue; }
    public IsolationNode getLeft() { return left; }
    public IsolationNode getRight() { return right; }
    public int getSize() { return size; }
    public boolean isLeaf() { return leaf; }
}
