package com.bank.billshock.service;

import com.bank.billshock.config.DetectionConfig;
import com.bank.billshock.config.MetricsConfig;
import com.bank.billshock.engine.BillShockModel;
import com.bank.billshock.io.CsvDatasetReader;
import com.bank.billshock.io.DatasetParseException;
import com.bank.billshock.model.AnomalyLabel;
import com.bank.billshock.model.Dataset;
import com.bank.billshock.model.DetectionReport;
import com.bank.billshock.model.ErrorKind;
import com.bank.billshock.model.PipelineResult;
import com.bank.billshock.model.TransactionRecord;
import com.bank.billshock.model.ValidationResult;
import com.bank.billshock.repository.ModelStore;
import com.bank.billshock.repository.ModelStoreException;
import com.bank.billshock.validation.InputValidator;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Scores a batch of transactions against a trained model and returns the bill shocks.
 *
 * The returned subset keeps source order and row indices, carries every original column
 * unchanged and adds the label column. Rows without an amount are not scored. An empty subset
 * is a successful result; validation problems are failures and never produce a partial subset.
 */
@Service
public class AnomalyDetectionService {

    private final ModelStore modelStore;
    private final CsvDatasetReader datasetReader;
    private final DetectionConfig config;
    private final PipelineReporter reporter;
    private final MetricsConfig metricsConfig;

    public AnomalyDetectionService(ModelStore modelStore,
                                   CsvDatasetReader datasetReader,
                                   DetectionConfig config,
                                   PipelineReporter reporter,
                                   MetricsConfig metricsConfig) {
        this.modelStore = modelStore;
        this.datasetReader = datasetReader;
        this.config = config;
        this.reporter = reporter;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Detect against the model at the configured model path.
     */
    public PipelineResult<DetectionReport> detectAnomalies(Dataset dataset) {
        return detectAnomalies(dataset, Path.of(config.getModelPath()));
    }

    public PipelineResult<DetectionReport> detectAnomalies(Dataset dataset, Path modelPath) {
        ValidationResult modelCheck = InputValidator.validateModelFile(modelPath);
        if (!modelCheck.valid()) {
            return fail(modelCheck.errorKind(), modelCheck.errorMessage());
        }

        ValidationResult datasetCheck = InputValidator.validateDataset(dataset, config.getAmountColumn());
        if (!datasetCheck.valid()) {
            return fail(datasetCheck.errorKind(), datasetCheck.errorMessage());
        }

        BillShockModel model;
        try {
            reporter.info("Loading model from " + modelPath);
            model = modelStore.load(modelPath);
        } catch (ModelStoreException e) {
            return fail(e.getErrorKind(), e.getMessage());
        }

        return score(dataset, model);
    }

    /**
     * Detect against a model that is already in memory.
     */
    public PipelineResult<DetectionReport> detectAnomalies(Dataset dataset, BillShockModel model) {
        ValidationResult modelCheck = InputValidator.validateModel(model);
        if (!modelCheck.valid()) {
            return fail(modelCheck.errorKind(), modelCheck.errorMessage());
        }

        ValidationResult datasetCheck = InputValidator.validateDataset(dataset, config.getAmountColumn());
        if (!datasetCheck.valid()) {
            return fail(datasetCheck.errorKind(), datasetCheck.errorMessage());
        }

        return score(dataset, model);
    }

    /**
     * Detect on a CSV file against the model at {@code modelPath}.
     */
    public PipelineResult<DetectionReport> detectAnomalies(Path sourcePath, Path modelPath) {
        ValidationResult fileCheck = InputValidator.validateSourceFile(sourcePath);
        if (!fileCheck.valid()) {
            return fail(fileCheck.errorKind(), fileCheck.errorMessage());
        }

        Dataset dataset;
        try {
            dataset = datasetReader.read(sourcePath);
        } catch (DatasetParseException e) {
            return fail(ErrorKind.UNEXPECTED, "Could not parse CSV file. Check file format! " + e.getMessage());
        } catch (IOException e) {
            return fail(ErrorKind.UNEXPECTED, "Could not read CSV file " + sourcePath + ": " + e.getMessage());
        }
        return detectAnomalies(dataset, modelPath);
    }

    private PipelineResult<DetectionReport> score(Dataset dataset, BillShockModel model) {
        try {
            String column = dataset.resolveColumn(config.getAmountColumn()).orElseThrow();
            List<TransactionRecord> records = dataset.getRecords();
            int n = records.size();
            reporter.info(String.format("Detecting anomalies in %d transactions...", n));

            Double[] amounts = new Double[n];
            for (int i = 0; i < n; i++) {
                amounts[i] = records.get(i).getNumber(column);
            }

            double[] scores = IntStream.range(0, n)
                    .parallel()
                    .mapToDouble(i -> amounts[i] != null ? model.score(amounts[i]) : Double.NaN)
                    .toArray();

            String labelColumn = config.getLabelColumn();
            List<TransactionRecord> flagged = new ArrayList<>();
            int scored = 0;
            for (int i = 0; i < n; i++) {
                if (amounts[i] == null) continue;
                scored++;
                if (AnomalyLabel.fromScore(scores[i], model.getThreshold()) == AnomalyLabel.BILL_SHOCK) {
                    flagged.add(records.get(i).withValue(labelColumn, AnomalyLabel.BILL_SHOCK.getLabel()));
                }
            }

            if (scored < n) {
                reporter.warn(String.format("Skipped %d transactions with a missing amount", n - scored));
            }

            double anomalyPct = flagged.size() * 100.0 / n;
            reporter.info(String.format("Found %d anomalies (%.1f%%)", flagged.size(), anomalyPct));
            metricsConfig.recordDetection(n, flagged.size());

            return PipelineResult.success(DetectionReport.builder()
                    .anomalies(dataset.withColumn(labelColumn, flagged))
                    .totalRecords(n)
                    .scoredRecords(scored)
                    .anomalyCount(flagged.size())
                    .anomalyPct(anomalyPct)
                    .threshold(model.getThreshold())
                    .build());
        } catch (RuntimeException e) {
            return fail(ErrorKind.UNEXPECTED, "Error during anomaly detection: " + e.getMessage());
        }
    }

    private PipelineResult<DetectionReport> fail(ErrorKind kind, String message) {
        reporter.error(message);
        metricsConfig.recordDetectionFailure(kind);
        return PipelineResult.failure(kind, message);
    }
}
