package com.fleet.anomaly.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fleet.anomaly.model.Prediction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Isolation Forest (Liu, Ting and Zhou, 2008) with a contamination-based decision threshold.
 *
 * Anomaly scores range from 0.0 to 1.0; outliers isolate in few splits and score high.
 * After fitting, the threshold is set so that the {@code contamination} share of the
 * training data scores above it. The decision function is {@code threshold - score}:
 * negative values are anomalies.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IsolationForest {

    private static final double EULER_GAMMA = 0.5772156649;

    private List<IsolationTree> trees = new ArrayList<>();
    private int sampleSize;
    private double threshold;
    private double[] featureMeans;

    public IsolationForest() {}

    /**
     * Fit the forest.
     *
     * @param data          training vectors, one row per sample
     * @param numEstimators number of trees
     * @param maxSamples    sub-sampling size per tree, capped at the number of rows
     * @param contamination expected share of outliers in {@code data}, in (0, 0.5]
     * @param seed          random seed; equal inputs and seed give an identical forest
     */
    public void fit(double[][] data, int numEstimators, int maxSamples, double contamination, long seed) {
        if (data == null || data.length == 0) {
            throw new IllegalArgumentException("Cannot fit an isolation forest without samples");
        }
        if (contamination <= 0 || contamination > 0.5) {
            throw new IllegalArgumentException("Contamination must be in (0, 0.5], got " + contamination);
        }
        if (numEstimators < 1) {
            throw new IllegalArgumentException("At least one estimator is required, got " + numEstimators);
        }

        this.sampleSize = Math.min(maxSamples, data.length);
        int heightLimit = (int) Math.ceil(Math.log(Math.max(sampleSize, 2)) / Math.log(2));
        Random random = new Random(seed);

        List<IsolationTree> grown = new ArrayList<>(numEstimators);
        for (int i = 0; i < numEstimators; i++) {
            grown.add(IsolationTree.grow(subsample(data, sampleSize, random), heightLimit, random));
        }
        this.trees = grown;
        this.featureMeans = columnMeans(data);

        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            scores[i] = anomalyScore(data[i]);
        }
        this.threshold = quantile(scores, 1.0 - contamination);
    }

    /**
     * s(x, n) = 2^(-E(h(x)) / c(n))
     */
    public double anomalyScore(double[] point) {
        if (trees.isEmpty()) {
            throw new IllegalStateException("Isolation forest has not been fitted");
        }
        double totalPath = 0.0;
        for (IsolationTree tree : trees) {
            totalPath += tree.pathLength(point);
        }
        double c = averagePathLength(sampleSize);
        if (c <= 0) {
            return 0.0;
        }
        return Math.pow(2.0, -(totalPath / trees.size()) / c);
    }

    public double decisionFunction(double[] point) {
        return threshold - anomalyScore(point);
    }

    public Prediction predict(double[] point) {
        return decisionFunction(point) < 0 ? Prediction.ANOMALY : Prediction.NORMAL;
    }

    /**
     * How much each feature pushes the point toward anomaly: the drop in score when that
     * feature alone is replaced by its training mean.
     */
    public double[] featureContributions(double[] point) {
        double base = anomalyScore(point);
        double[] contributions = new double[point.length];
        for (int i = 0; i < point.length; i++) {
            double[] neutral = Arrays.copyOf(point, point.length);
            neutral[i] = featureMeans[i];
            contributions[i] = Math.max(0, base - anomalyScore(neutral));
        }
        return contributions;
    }

    @JsonIgnore
    public boolean isFitted() {
        return !trees.isEmpty();
    }

    /**
     * Average path length of an unsuccessful BST search over n points:
     * c(n) = 2H(n-1) - 2(n-1)/n, with H(i) ≈ ln(i) + γ.
     */
    static double averagePathLength(int n) {
        if (n <= 1) return 0;
        if (n == 2) return 1;
        return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
    }

    /** Linear-interpolated quantile, q in [0, 1]. */
    static double quantile(double[] values, double q) {
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        double position = q * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        double fraction = position - lower;
        return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
    }

    private static double[][] subsample(double[][] data, int size, Random random) {
        if (data.length <= size) {
            return Arrays.copyOf(data, data.length);
        }
        // partial Fisher-Yates over row indices
        int[] indices = new int[data.length];
        for (int i = 0; i < indices.length; i++) indices[i] = i;
        double[][] sample = new double[size][];
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
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

    // Getters/setters for serialization
    public List<IsolationTree> getTrees() { return trees; }
    public void setTrees(List<IsolationTree> trees) { this.trees = trees; }
    public int getSampleSize() { return sampleSize; }
    public void setSampleSize(int sampleSize) { this.sampleSize = sampleSize; }
    public double getThreshold() { return threshold; }
    public void setThreshold(double threshold) { this.threshold = threshold; }
    public double[] getFeatureMeans() { return featureMeans; }
    public void setFeatureMeans(double[] featureMeans) { this.featureMeans = featureMeans; }
}
