package com.bank.billshock.service;

import com.bank.billshock.config.DetectionConfig;
import com.bank.billshock.config.MetricsConfig;
import com.bank.billshock.engine.BillShockModel;
import com.bank.billshock.io.CsvDatasetReader;
import com.bank.billshock.io.DatasetParseException;
import com.bank.billshock.model.Dataset;
import com.bank.billshock.model.ErrorKind;
import com.bank.billshock.model.PipelineResult;
import com.bank.billshock.model.ValidationResult;
import com.bank.billshock.repository.ModelStore;
import com.bank.billshock.repository.ModelStoreException;
import com.bank.billshock.validation.InputValidator;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Trains a bill shock model from historical transactions and persists it.
 *
 * Flow:
 * 1. Validate the contamination; an invalid value is replaced by the configured default
 * 2. Validate the source file and the loaded table (stops on the first failing check)
 * 3. Drop rows with a missing amount
 * 4. Fit the isolation forest and derive the score threshold
 * 5. Save the model (parent directories are created)
 *
 * Success is only reported once the model is on disk. No partial model is ever written.
 */
@Service
public class ModelTrainingService {

    private final CsvDatasetReader datasetReader;
    private final ModelStore modelStore;
    private final DetectionConfig config;
    private final PipelineReporter reporter;
    private final MetricsConfig metricsConfig;

    public ModelTrainingService(CsvDatasetReader datasetReader,
                                ModelStore modelStore,
                                DetectionConfig config,
                                PipelineReporter reporter,
                                MetricsConfig metricsConfig) {
        this.datasetReader = datasetReader;
        this.modelStore = modelStore;
        this.config = config;
        this.reporter = reporter;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Train from the configured data path into the configured model path.
     */
    public PipelineResult<BillShockModel> trainModel() {
        return trainModel(Path.of(config.getDataPath()), Path.of(config.getModelPath()),
                config.getDefaultContamination());
    }

    /**
     * Train from a CSV file.
     *
     * @param contamination expected proportion of anomalies (0.01-0.5); anything else, including
     *                      null, falls back to the configured default
     */
    public PipelineResult<BillShockModel> trainModel(Path sourcePath, Path modelPath, Number contamination) {
        double effectiveContamination = effectiveContamination(contamination);

        ValidationResult fileCheck = InputValidator.validateSourceFile(sourcePath);
        if (!fileCheck.valid()) {
            return fail(fileCheck.errorKind(), fileCheck.errorMessage());
        }

        Dataset dataset;
        try {
            reporter.info("Loading data from " + sourcePath);
            dataset = datasetReader.read(sourcePath);
        } catch (DatasetParseException e) {
            return fail(ErrorKind.UNEXPECTED, "Could not parse CSV file. Check file format! " + e.getMessage());
        } catch (IOException e) {
            return fail(ErrorKind.UNEXPECTED, "Could not read CSV file " + sourcePath + ": " + e.getMessage());
        }

        return train(dataset, modelPath, effectiveContamination);
    }

    /**
     * Train from an already loaded table.
     */
    public PipelineResult<BillShockModel> trainModel(Dataset dataset, Path modelPath, Number contamination) {
        return train(dataset, modelPath, effectiveContamination(contamination));
    }

    private PipelineResult<BillShockModel> train(Dataset dataset, Path modelPath, double contamination) {
        ValidationResult datasetCheck = InputValidator.validateDataset(dataset, config.getAmountColumn());
        if (!datasetCheck.valid()) {
            return fail(datasetCheck.errorKind(), datasetCheck.errorMessage());
        }

        try {
            String column = dataset.resolveColumn(config.getAmountColumn()).orElseThrow();
            double[] amounts = dataset.getRecords().stream()
                    .map(record -> record.getNumber(column))
                    .filter(Objects::nonNull)
                    .mapToDouble(Double::doubleValue)
                    .toArray();
            if (amounts.length == 0) {
                return fail(ErrorKind.NO_VALID_DATA, "No valid data after removing missing values!");
            }

            reporter.info(String.format("Training on %d transactions (contamination=%s)...",
                    amounts.length, contamination));

            BillShockModel model = BillShockModel.fit(amounts, contamination,
                    config.getNumTrees(), config.getSampleSize(), config.getSeed());
            modelStore.save(model, modelPath);

            reporter.info("Model trained & saved successfully to " + modelPath + "!");
            metricsConfig.recordTrainingSuccess(amounts.length);
            return PipelineResult.success(model);
        } catch (ModelStoreException e) {
            return fail(e.getErrorKind(), e.getMessage());
        } catch (RuntimeException e) {
            return fail(ErrorKind.UNEXPECTED, "Unexpected error during training: " + e.getMessage());
        }
    }

    private double effectiveContamination(Number requested) {
        ValidationResult check = InputValidator.validateContamination(requested);
        if (check.valid()) {
            return requested.doubleValue();
        }
        reporter.warn(check.errorMessage() + ", using default " + config.getDefaultContamination());
        metricsConfig.recordContaminationFallback();
        return config.getDefaultContamination();
    }

    private PipelineResult<BillShockModel> fail(ErrorKind kind, String message) {
        reporter.error(message);
        metricsConfig.recordTrainingFailure(kind);
        return PipelineResult.failure(kind, message);
    }
}
