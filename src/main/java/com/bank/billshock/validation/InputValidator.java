package com.bank.billshock.validation;

import com.bank.billshock.engine.BillShockModel;
import com.bank.billshock.model.Dataset;
import com.bank.billshock.model.ErrorKind;
import com.bank.billshock.model.TransactionRecord;
import com.bank.billshock.model.ValidationResult;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Checks run before any training or scoring work. Every method returns a
 * {@link ValidationResult} and none of them throws.
 */
public final class InputValidator {

    public static final String DEFAULT_AMOUNT_COLUMN = "amount";
    public static final double MIN_CONTAMINATION = 0.01;
    public static final double MAX_CONTAMINATION = 0.5;

    public static final String SOURCE_EXTENSION = ".csv";
    public static final Set<String> MODEL_EXTENSIONS = Set.of(".json");

    private InputValidator() {}

    public static ValidationResult validateSourceFile(Path path) {
        if (path == null) {
            return ValidationResult.invalid(ErrorKind.FILE_NOT_FOUND, "No source file given");
        }
        if (!Files.exists(path)) {
            return ValidationResult.invalid(ErrorKind.FILE_NOT_FOUND,
                    String.format("File '%s' does not exist", path));
        }
        if (!Files.isRegularFile(path)) {
            return ValidationResult.invalid(ErrorKind.FILE_NOT_FOUND,
                    String.format("'%s' is not a file", path));
        }
        String extension = extensionOf(path);
        if (!SOURCE_EXTENSION.equals(extension)) {
            return ValidationResult.invalid(ErrorKind.WRONG_FORMAT,
                    String.format("File must be CSV format, got %s", describe(extension)));
        }
        return ValidationResult.ok();
    }

    public static ValidationResult validateDataset(Dataset dataset) {
        return validateDataset(dataset, DEFAULT_AMOUNT_COLUMN);
    }

    /**
     * Checks, in this order: the table is not empty, the required column exists, every
     * non-missing value in it is numeric, and at least one value is not missing.
     */
    public static ValidationResult validateDataset(Dataset dataset, String requiredColumn) {
        if (dataset == null || dataset.isEmpty()) {
            return ValidationResult.invalid(ErrorKind.EMPTY_DATA, "Dataset is empty");
        }

        Optional<String> column = dataset.resolveColumn(requiredColumn);
        if (column.isEmpty()) {
            String available = String.join(", ", dataset.getColumns());
            return ValidationResult.invalid(ErrorKind.MISSING_COLUMN,
                    String.format("Required column '%s' not found. Available: %s", requiredColumn, available));
        }

        String name = column.get();
        boolean anyPresent = false;
        for (TransactionRecord record : dataset.getRecords()) {
            Object cell = record.get(name);
            if (!TransactionRecord.isNumeric(cell)) {
                return ValidationResult.invalid(ErrorKind.NON_NUMERIC_COLUMN,
                        String.format("Column '%s' must contain numeric values", name));
            }
            anyPresent |= !TransactionRecord.isMissing(cell);
        }

        if (!anyPresent) {
            return ValidationResult.invalid(ErrorKind.ALL_MISSING_VALUES,
                    String.format("Column '%s' contains only missing (NaN) values", name));
        }
        return ValidationResult.ok();
    }

    /**
     * Contamination must be a {@link Number} within [0.01, 0.5]. Callers fall back to the
     * default contamination instead of aborting when this fails.
     */
    public static ValidationResult validateContamination(Object value) {
        if (!(value instanceof Number number) || Double.isNaN(number.doubleValue())) {
            String got = value == null ? "null" : value.getClass().getSimpleName() + " " + value;
            return ValidationResult.invalid(ErrorKind.INVALID_PARAMETER,
                    String.format("Contamination must be a number, got %s", got));
        }
        double contamination = number.doubleValue();
        if (contamination < MIN_CONTAMINATION || contamination > MAX_CONTAMINATION) {
            return ValidationResult.invalid(ErrorKind.INVALID_PARAMETER,
                    String.format("Contamination must be between %s and %s, got %s",
                            MIN_CONTAMINATION, MAX_CONTAMINATION, value));
        }
        return ValidationResult.ok();
    }

    public static ValidationResult validateModelFile(Path path) {
        if (path == null) {
            return ValidationResult.invalid(ErrorKind.MODEL_NOT_FOUND, "No model file given");
        }
        if (!Files.exists(path)) {
            return ValidationResult.invalid(ErrorKind.MODEL_NOT_FOUND,
                    String.format("Model file '%s' not found. Train the model first.", path));
        }
        if (!Files.isRegularFile(path)) {
            return ValidationResult.invalid(ErrorKind.MODEL_NOT_FOUND,
                    String.format("'%s' is not a file", path));
        }
        String extension = extensionOf(path);
        if (!MODEL_EXTENSIONS.contains(extension)) {
            return ValidationResult.invalid(ErrorKind.WRONG_FORMAT,
                    String.format("Model file must be .json format, got %s", describe(extension)));
        }
        return ValidationResult.ok();
    }

    /**
     * Validates an in-memory model handed directly to the detector.
     */
    public static ValidationResult validateModel(BillShockModel model) {
        if (model == null) {
            return ValidationResult.invalid(ErrorKind.MODEL_NOT_FOUND, "No model given. Train the model first.");
        }
        if (!model.isWellFormed()) {
            return ValidationResult.invalid(ErrorKind.CORRUPT_MODEL, "Model structure is invalid");
        }
        return ValidationResult.ok();
    }

    static String extensionOf(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) return "";
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }

    private static String describe(String extension) {
        return extension.isEmpty() ? "no extension" : extension;
    }
}
