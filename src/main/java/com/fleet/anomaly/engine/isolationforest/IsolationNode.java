package com.fleet.anomaly.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A node of an isolation tree. Leaves only carry the number of training samples that
 * reached them; internal nodes carry a split on one feature.
 * Short JSON property names keep persisted forests small.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IsolationNode {

    @JsonProperty("f")
    private int feature;

    @JsonProperty("v")
    private double split;

    @JsonProperty("n")
    private int size;

    @JsonProperty("l")
    private IsolationNode left;

    @JsonProperty("r")
    private IsolationNode right;

    public IsolationNode() {}

    static IsolationNode leaf(int size) {
        IsolationNode node = new IsolationNode();
        node.size = size;
        return node;
    }

    static IsolationNode split(int feature, double split, int size, IsolationNode left, IsolationNode right) {
        IsolationNode node = new IsolationNode();
        node.feature = feature;
        node.split = split;
        node.size = size;
        node.left = left;
        node.right = right;
        return node;
    }

    @JsonIgnore
    public boolean isLeaf() {
        return left == null || right == null;
    }

    /** Child a point descends into: left when its feature value is below the split. */
    IsolationNode childFor(double[] point) {
        return point[feature] < split ? left : right;
    }

    int size() {
        return size;
    }
}
