package com.bank.billshock.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Ensemble of isolation trees over a single numeric attribute.
 *
 * Immutable once trained. Every tree is built from its own {@link Random} seeded from
 * (seed, tree index), so trees can be built in parallel and the forest is still
 * bit-identical for the same seed and data.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class IsolationForest {

    private static final long SEED_GAMMA = 0x9E3779B97F4A7C15L;

    private final List<IsolationTree> trees;
    private final int sampleSize;

    @JsonCreator
    public IsolationForest(@JsonProperty("trees") List<IsolationTree> trees,
                           @JsonProperty("sampleSize") int sampleSize) {
        this.trees = trees != null ? List.copyOf(trees) : List.of();
        this.sampleSize = sampleSize;
    }

    /**
     * Train the isolation forest on the given values.
     *
     * @param data       training values
     * @param numTrees   number of trees in the forest (typically 100)
     * @param sampleSize sub-sampling size per tree (typically 256), clamped to the data size
     * @param seed       random seed for reproducibility
     */
    public static IsolationForest train(double[] data, int numTrees, int sampleSize, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot train an isolation forest on no data");
        }
        if (numTrees < 1 || sampleSize < 1) {
            throw new IllegalArgumentException(
                    "numTrees and sampleSize must be positive, got " + numTrees + " and " + sampleSize);
        }
        int effectiveSampleSize = Math.min(sampleSize, data.length);
        int maxDepth = maxDepth(effectiveSampleSize);

        List<IsolationTree> trees = IntStream.range(0, numTrees)
                .parallel()
                .mapToObj(i -> {
                    Random random = new Random(treeSeed(seed, i));
                    double[] sample = subsample(data, effectiveSampleSize, random);
                    return IsolationTree.build(sample, maxDepth, random);
                })
                .collect(Collectors.toList());

        return new IsolationForest(trees, effectiveSampleSize);
    }

    static long treeSeed(long seed, int treeIndex) {
        return seed ^ (SEED_GAMMA * (treeIndex + 1L));
    }

    // ceil(log2(sampleSize)), computed on the integer so powers of two are exact
    static int maxDepth(int sampleSize) {
        return 32 - Integer.numberOfLeadingZeros(sampleSize - 1);
    }

    /**
     * Compute anomaly score for a single value.
     *
     * @return score in (0, 1]. Close to 1 is anomalous, around 0.5 is typical, well below 0.5 is
     *         clearly normal. A forest trained on a single value scores everything 0.5.
     */
    public double anomalyScore(double value) {
        if (trees.isEmpty()) return 0.5;

        double avgPathLength = 0.0;
        for (IsolationTree tree : trees) {
            avgPathLength += tree.pathLength(value);
        }
        avgPathLength /= trees.size();

        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0) return 0.5;

        // IF scoring formula: s(x, n) = 2^(-E(h(x)) / c(n))
        return Math.pow(2.0, -avgPathLength / c);
    }

    /**
     * Scores every value. Result positions match input positions.
     */
    public double[] anomalyScores(double[] values) {
        return IntStream.range(0, values.length)
                .parallel()
                .mapToDouble(i -> anomalyScore(values[i]))
                .toArray();
    }

    /**
     * Draws {@code size} values without replacement. When the data is no larger than
     * {@code size}, the whole data set is used.
     */
    private static double[] subsample(double[] data, int size, Random random) {
        if (data.length <= size) {
            return Arrays.copyOf(data, data.length);
        }
        double[] sample = new double[size];
        // Fisher-Yates shuffle on indices
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

    /**
     * True when the forest has at least one tree, a positive sample size and no dangling nodes.
     */
    @JsonIgnore
    public boolean isWellFormed() {
        return sampleSize >= 1
                && !trees.isEmpty()
                && trees.stream().allMatch(t -> t != null && t.isWellFormed());
    }

    public List<IsolationTree> getTrees() { return trees; }
    public int getSampleSize() { return sampleSize; }
}
