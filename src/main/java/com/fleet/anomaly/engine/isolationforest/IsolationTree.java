package com.fleet.anomaly.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Random;

/**
 * One randomly partitioned tree of the forest.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
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
        // constant feature in this partition: cannot be split further
        if (min >= max) {
            return IsolationNode.leaf(rows.length);
        }

        double split = min + random.nextDouble() * (max - min);

        int below = 0;
        for (double[] row : rows) {
            if (row[feature] < split) below++;
        }
        double[][] left = new double[below][];
        double[][] right = new double[rows.length - below][];
        int li = 0;
        int ri = 0;
        for (double[] row : rows) {
            if (row[feature] < split) {
                left[li++] = row;
            } else {
                right[ri++] = row;
            }
        }

        return IsolationNode.split(feature, split, rows.length,
                grow(left, depth + 1, heightLimit, random),
                grow(right, depth + 1, heightLimit, random));
    }

    /**
     * Depth at which the point is isolated, plus the expected remaining depth of the leaf
     * it lands in.
     */
    public double pathLength(double[] point) {
        IsolationNode node = root;
        int depth = 0;
        while (!node.isLeaf()) {
            node = node.childFor(point);
            depth++;
        }
        return depth + IsolationForest.averagePathLength(node.size());
    }

    public IsolationNode getRoot() { return root; }
    public void setRoot(IsolationNode root) { this.root = root; }
}
