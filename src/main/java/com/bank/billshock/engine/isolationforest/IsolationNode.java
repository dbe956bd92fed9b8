package com.bank.billshock.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class IsolationNode {

    private static final double EULER_MASCHERONI = 0.5772156649;

    @JsonProperty("v")
    private final double splitValue;

    @JsonProperty("l")
    private final IsolationNode left;

    @JsonProperty("r")
    private final IsolationNode right;

    @JsonProperty("s")
    private final int size; // number of samples that reached this node (for leaf nodes)

    @JsonProperty("e")
    private final boolean external; // true if this is a leaf node

    @JsonCreator
    IsolationNode(@JsonProperty("v") double splitValue,
                  @JsonProperty("l") IsolationNode left,
                  @JsonProperty("r") IsolationNode right,
                  @JsonProperty("s") int size,
                  @JsonProperty("e") boolean external) {
        this.splitValue = splitValue;
        this.left = left;
        this.right = right;
        this.size = size;
        this.external = external;
    }

    public static IsolationNode internalNode(double splitValue, IsolationNode left, IsolationNode right) {
        return new IsolationNode(splitValue, left, right, 0, false);
    }

    public static IsolationNode externalNode(int size) {
        return new IsolationNode(0.0, null, null, size, true);
    }

    /**
     * Depth at which {@code value} terminates below this node, plus the expected remaining depth
     * c(size) when the leaf still holds more than one sample.
     */
    public double pathLength(double value, int currentDepth) {
        if (external) {
            return currentDepth + averagePathLength(size);
        }
        if (value < splitValue) {
            return left.pathLength(value, currentDepth + 1);
        } else {
            return right.pathLength(value, currentDepth + 1);
        }
    }

    /**
     * Average path length of unsuccessful search in a BST (Equation 1 from the IF paper).
     * c(n) = 2H(n-1) - 2(n-1)/n where H(i) = ln(i) + Euler's constant (0.5772...)
     */
    public static double averagePathLength(int n) {
        if (n <= 1) return 0;
        if (n == 2) return 1;
        double harmonicNumber = Math.log(n - 1.0) + EULER_MASCHERONI;
        return 2.0 * harmonicNumber - (2.0 * (n - 1.0) / n);
    }

    boolean isWellFormed() {
        if (external) {
            return size >= 0 && left == null && right == null;
        }
        return !Double.isNaN(splitValue)
                && left != null && right != null
                && left.isWellFormed() && right.isWellFormed();
    }

    int depth() {
        return external ? 0 : 1 + Math.max(left.depth(), right.depth());
    }

    public double getSplitValue() { return splitValue; }
    public IsolationNode getLeft() { return left; }
    public IsolationNode getRight() { return right; }
    public int getSize() { return size; }
    public boolean isExternal() { return external; }
}
