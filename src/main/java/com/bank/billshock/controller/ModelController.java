package com.bank.billshock.controller;

import com.bank.billshock.config.DetectionConfig;
import com.bank.billshock.engine.BillShockModel;
import com.bank.billshock.model.ModelMetadata;
import com.bank.billshock.model.PipelineResult;
import com.bank.billshock.repository.ModelStore;
import com.bank.billshock.repository.ModelStoreException;
import com.bank.billshock.service.ModelTrainingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;

@RestController
@RequestMapping("/api/v1/models")
@Tag(name = "Models", description = "Bill shock model training and metadata")
public class ModelController {

    private final ModelTrainingService trainingService;
    private final ModelStore modelStore;
    private final DetectionConfig config;

    public ModelController(ModelTrainingService trainingService,
                           ModelStore modelStore,
                           DetectionConfig config) {
        this.trainingService = trainingService;
        this.modelStore = modelStore;
        this.config = config;
    }

    @Operation(summary = "Train the bill shock model",
            description = "Fits an Isolation Forest on the amount column of a CSV file and stores it at the configured " +
                    "model path. A contamination outside 0.01-0.5 is replaced by the default (0.05).")
    @PostMapping("/train")
    public ResponseEntity<?> train(
            @Parameter(description = "CSV file with historical transactions. Defaults to billshock.data-path.",
                    example = "data/transactions.csv")
            @RequestParam(required = false) String sourcePath,
            @Parameter(description = "Expected proportion of bill shocks", example = "0.05")
            @RequestParam(required = false) Double contamination) {

        Path source = Path.of(sourcePath != null ? sourcePath : config.getDataPath());
        Path modelPath = Path.of(config.getModelPath());
        Double requested = contamination != null ? contamination : config.getDefaultContamination();

        PipelineResult<BillShockModel> result = trainingService.trainModel(source, modelPath, requested);
        if (!result.isSuccess()) {
            return FailureResponses.of(result.getErrorKind(), result.getErrorMessage());
        }
        return ResponseEntity.ok(ModelMetadata.from(result.getValue(), modelPath.toString()));
    }

    @Operation(summary = "Get model metadata",
            description = "Returns metadata about the stored model: tree count, sub-sample size, contamination, " +
                    "threshold, seed, training samples and training timestamp.")
    @GetMapping
    public ResponseEntity<?> getModelMetadata() {
        try {
            return ResponseEntity.ok(modelStore.readMetadata(Path.of(config.getModelPath())));
        } catch (ModelStoreException e) {
            return FailureResponses.of(e.getErrorKind(), e.getMessage());
        }
    }
}
