package com.bank.billshock.engine;

import com.bank.billshock.engine.isolationforest.IsolationForest;
import com.bank.billshock.model.AnomalyLabel;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.Objects;

/**
 * A trained bill shock detector: an isolation forest over transaction amounts plus the score
 * threshold derived from the contamination at training time.
 *
 * The threshold is the anomaly score at descending rank floor(contamination * N) over the N
 * training amounts, so scoring the training data flags (up to ties) that top fraction.
 * It is fixed here and never recomputed when scoring new data.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class BillShockModel {

    public static final int FORMAT_VERSION = 1;
    public static final int DEFAULT_NUM_TREES = 100;
    public static final int DEFAULT_SAMPLE_SIZE = 256;

    // Absorbs representation error such as 0.29 * 100 = 28.999999999999996
    private static final double RANK_EPSILON = 1e-9;

    private final int formatVersion;
    private final IsolationForest forest;
    private final double contamination;
    private final double threshold;
    private final long seed;
    private final int trainingSize;
    private final long trainedAt;

    @JsonCreator
    public BillShockModel(@JsonProperty("formatVersion") int formatVersion,
                          @JsonProperty("forest") IsolationForest forest,
                          @JsonProperty("contamination") double contamination,
                          @JsonProperty("threshold") double threshold,
                          @JsonProperty("seed") long seed,
                          @JsonProperty("trainingSize") int trainingSize,
                          @JsonProperty("trainedAt") long trainedAt) {
        this.formatVersion = formatVersion;
        this.forest = forest;
        this.contamination = contamination;
        this.threshold = threshold;
        this.seed = seed;
        this.trainingSize = trainingSize;
        this.trainedAt = trainedAt;
    }

    /**
     * Fit a model on the given amounts.
     *
     * @param amounts       training amounts, none missing
     * @param contamination target fraction of anomalies, expected in [0.01, 0.5]
     * @param numTrees      number of isolation trees
     * @param sampleSize    sub-sample size per tree, clamped to the number of amounts
     * @param seed          random seed; same seed and data give an identical model
     */
    public static BillShockModel fit(double[] amounts, double contamination,
                                     int numTrees, int sampleSize, long seed) {
        Objects.requireNonNull(amounts, "amounts");
        IsolationForest forest = IsolationForest.train(amounts, numTrees, sampleSize, seed);

        double[] scores = forest.anomalyScores(amounts);
        double threshold = thresholdAtRank(scores, contamination);

        return new BillShockModel(FORMAT_VERSION, forest, contamination, threshold, seed,
                amounts.length, System.currentTimeMillis());
    }

    public static BillShockModel fit(double[] amounts, double contamination, long seed) {
        return fit(amounts, contamination, DEFAULT_NUM_TREES, DEFAULT_SAMPLE_SIZE, seed);
    }

    static double thresholdAtRank(double[] scores, double contamination) {
        double[] sorted = Arrays.copyOf(scores, scores.length);
        Arrays.sort(sorted); // ascending
        int n = sorted.length;
        int rank = (int) Math.floor(contamination * n + RANK_EPSILON);
        rank = Math.max(0, Math.min(rank, n - 1));
        return sorted[n - 1 - rank];
    }

    public double score(double amount) {
        return forest.anomalyScore(amount);
    }

    public double[] scores(double[] amounts) {
        return forest.anomalyScores(amounts);
    }

    public AnomalyLabel classify(double amount) {
        return AnomalyLabel.fromScore(score(amount), threshold);
    }

    /**
     * True when the deserialized structure is usable for scoring.
     */
    @JsonIgnore
    public boolean isWellFormed() {
        return forest != null
                && forest.isWellFormed()
                && Double.isFinite(threshold)
                && Double.isFinite(contamination)
                && trainingSize >= 1;
    }

    @JsonIgnore
    public int getNumTrees() {
        return forest.getTrees().size();
    }

    @JsonIgnore
    public int getSampleSize() {
        return forest.getSampleSize();
    }

    public int getFormatVersion() { return formatVersion; }
    public IsolationForest getForest() { return forest; }
    public double getContamination() { return contamination; }
    public double getThreshold() { return threshold; }
    public long getSeed() { return seed; }
    public int getTrainingSize() { return trainingSize; }
    public long getTrainedAt() { return trainedAt; }
}
