package com.bank.billshock.model;

import com.bank.billshock.engine.BillShockModel;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Summary of a stored bill shock model")
public class ModelMetadata {

    @Schema(description = "Location of the model file", example = "models/anomaly_model.json")
    private String modelPath;

    @Schema(description = "Number of isolation trees in the ensemble", example = "100")
    private int treeCount;

    @Schema(description = "Sub-sample size used per tree (clamped to training size)", example = "256")
    private int sampleSize;

    @Schema(description = "Target fraction of anomalies used to derive the threshold", example = "0.05")
    private double contamination;

    @Schema(description = "Anomaly score at or above which a transaction is a bill shock", example = "0.62")
    private double threshold;

    @Schema(description = "Random seed the ensemble was built with", example = "42")
    private long seed;

    @Schema(description = "Number of transactions the model was trained on", example = "1200")
    private int trainingSamples;

    @Schema(description = "Training timestamp in epoch milliseconds", example = "1739886764000")
    private long trainedAt;

    public static ModelMetadata from(BillShockModel model, String modelPath) {
        return ModelMetadata.builder()
                .modelPath(modelPath)
                .treeCount(model.getNumTrees())
                .sampleSize(model.getSampleSize())
                .contamination(model.getContamination())
                .threshold(model.getThreshold())
                .seed(model.getSeed())
                .trainingSamples(model.getTrainingSize())
                .trainedAt(model.getTrainedAt())
                .build();
    }
}
