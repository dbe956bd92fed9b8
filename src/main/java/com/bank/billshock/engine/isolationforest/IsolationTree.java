package com.bank.billshock.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Random;

@JsonIgnoreProperties(ignoreUnknown = true)
public final class IsolationTree {

    private final IsolationNode root;

    @JsonCreator
    public IsolationTree(@JsonProperty("root") IsolationNode root) {
        this.root = root;
    }

    public static IsolationTree build(double[] sample, int maxDepth, Random random) {
        IsolationNode root = buildNode(sample, 0, maxDepth, random);
        return new IsolationTree(root);
    }

    private static IsolationNode buildNode(double[] data, int depth, int maxDepth, Random random) {
        int n = data.length;

        if (depth >= maxDepth || n <= 1) {
            return IsolationNode.externalNode(n);
        }

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double value : data) {
            if (value < min) min = value;
            if (value > max) max = value;
        }

        // All values identical (or no double fits strictly between them): cannot split further
        if (Math.nextUp(min) >= max) {
            return IsolationNode.externalNode(n);
        }

        double splitValue;
        do {
            splitValue = min + random.nextDouble() * (max - min);
        } while (splitValue <= min || splitValue >= max);

        int leftCount = 0;
        for (double value : data) {
            if (value < splitValue) leftCount++;
        }

        double[] leftData = new double[leftCount];
        double[] rightData = new double[n - leftCount];
        int li = 0, ri = 0;
        for (double value : data) {
            if (value < splitValue) {
                leftData[li++] = value;
            } else {
                rightData[ri++] = value;
            }
        }

        IsolationNode left = buildNode(leftData, depth + 1, maxDepth, random);
        IsolationNode right = buildNode(rightData, depth + 1, maxDepth, random);

        return IsolationNode.internalNode(splitValue, left, right);
    }

    public double pathLength(double value) {
        return root.pathLength(value, 0);
    }

    boolean isWellFormed() {
        return root != null && root.isWellFormed();
    }

    public int depth() {
        return root.depth();
    }

    public IsolationNode getRoot() { return root; }
}
