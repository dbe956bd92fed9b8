package com.bank.billshock.validation;

import com.bank.billshock.engine.BillShockModel;
import com.bank.billshock.engine.isolationforest.IsolationForest;
import com.bank.billshock.model.Dataset;
import com.bank.billshock.model.ErrorKind;
import com.bank.billshock.model.ValidationResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static com.bank.billshock.testutil.TestDataFactory.TRAINING_WITH_SHOCK;
import static com.bank.billshock.testutil.TestDataFactory.transactionRows;
import static com.bank.billshock.testutil.TestDataFactory.writeFile;
import static org.assertj.core.api.Assertions.assertThat;

class InputValidatorTest {

    @TempDir
    Path tempDir;

    // ── source file ──

    @Test
    void validateSourceFile_nonexistent() {
        ValidationResult result = InputValidator.validateSourceFile(tempDir.resolve("nonexistent.csv"));

        assertThat(result.valid()).isFalse();
        assertThat(result.errorKind()).isEqualTo(ErrorKind.FILE_NOT_FOUND);
        assertThat(result.errorMessage()).contains("does not exist");
    }

    @Test
    void validateSourceFile_wrongExtension() throws IOException {
        Path txt = writeFile(tempDir, "data.txt", "test");

        ValidationResult result = InputValidator.validateSourceFile(txt);

        assertThat(result.valid()).isFalse();
        assertThat(result.errorKind()).isEqualTo(ErrorKind.WRONG_FORMAT);
        assertThat(result.errorMessage()).contains("CSV format").contains(".txt");
    }

    @Test
    void validateSourceFile_directory() throws IOException {
        Path dir = Files.createDirectory(tempDir.resolve("folder.csv"));

        ValidationResult result = InputValidator.validateSourceFile(dir);

        assertThat(result.errorKind()).isEqualTo(ErrorKind.FILE_NOT_FOUND);
        assertThat(result.errorMessage()).contains("is not a file");
    }

    @Test
    void validateSourceFile_upperCaseExtensionAccepted() throws IOException {
        Path csv = writeFile(tempDir, "DATA.CSV", "Amount\n1\n");

        assertThat(InputValidator.validateSourceFile(csv).valid()).isTrue();
    }

    @Test
    void validateSourceFile_noExtension() throws IOException {
        Path file = writeFile(tempDir, "transactions", "Amount\n1\n");

        ValidationResult result = InputValidator.validateSourceFile(file);

        assertThat(result.errorKind()).isEqualTo(ErrorKind.WRONG_FORMAT);
        assertThat(result.errorMessage()).contains("no extension");
    }

    // ── dataset ──

    @Test
    void validateDataset_empty() {
        ValidationResult result = InputValidator.validateDataset(Dataset.empty());

        assertThat(result.valid()).isFalse();
        assertThat(result.errorKind()).isEqualTo(ErrorKind.EMPTY_DATA);
        assertThat(result.errorMessage()).contains("empty");
    }

    @Test
    void validateDataset_headerOnlyIsEmpty() {
        Dataset headerOnly = new Dataset(List.of("Amount"), List.of());

        assertThat(InputValidator.validateDataset(headerOnly).errorKind()).isEqualTo(ErrorKind.EMPTY_DATA);
    }

    @Test
    void validateDataset_missingRequiredColumn() {
        Dataset dataset = Dataset.fromRows(List.of(Map.of("Price", 100), Map.of("Price", 200)));

        ValidationResult result = InputValidator.validateDataset(dataset, "Amount");

        assertThat(result.errorKind()).isEqualTo(ErrorKind.MISSING_COLUMN);
        assertThat(result.errorMessage()).contains("Amount").contains("not found").contains("Price");
    }

    @Test
    void validateDataset_nonNumericColumn() {
        ValidationResult result = InputValidator.validateDataset(transactionRows("abc", "def", "ghi"));

        assertThat(result.errorKind()).isEqualTo(ErrorKind.NON_NUMERIC_COLUMN);
        assertThat(result.errorMessage()).contains("numeric");
    }

    @Test
    void validateDataset_singleNonNumericCellRejectsColumn() {
        ValidationResult result = InputValidator.validateDataset(transactionRows("100", "12abc", "300"));

        assertThat(result.errorKind()).isEqualTo(ErrorKind.NON_NUMERIC_COLUMN);
    }

    @Test
    void validateDataset_allMissing() {
        ValidationResult result = InputValidator.validateDataset(transactionRows(null, "NaN", ""));

        assertThat(result.errorKind()).isEqualTo(ErrorKind.ALL_MISSING_VALUES);
        assertThat(result.errorMessage()).contains("NaN");
    }

    @Test
    void validateDataset_nonNumericReportedBeforeAllMissing() {
        ValidationResult result = InputValidator.validateDataset(transactionRows(null, "abc"));

        assertThat(result.errorKind()).isEqualTo(ErrorKind.NON_NUMERIC_COLUMN);
    }

    @Test
    void validateDataset_someMissingIsValid() {
        ValidationResult result = InputValidator.validateDataset(transactionRows(100, null, "300.5"));

        assertThat(result.valid()).isTrue();
        assertThat(result.errorMessage()).isNull();
    }

    @Test
    void validateDataset_valid() {
        ValidationResult result = InputValidator.validateDataset(transactionRows(100, 200, 300));

        assertThat(result.valid()).isTrue();
        assertThat(result.errorKind()).isNull();
        assertThat(result.errorMessage()).isNull();
    }

    // ── contamination ──

    @Test
    void validateContamination_belowRange() {
        ValidationResult result = InputValidator.validateContamination(0.001);

        assertThat(result.errorKind()).isEqualTo(ErrorKind.INVALID_PARAMETER);
        assertThat(result.errorMessage()).contains("0.01 and 0.5");
    }

    @Test
    void validateContamination_aboveRange() {
        ValidationResult result = InputValidator.validateContamination(0.6);

        assertThat(result.valid()).isFalse();
        assertThat(result.errorMessage()).contains("0.01 and 0.5");
    }

    @Test
    void validateContamination_boundsInclusive() {
        assertThat(InputValidator.validateContamination(0.01).valid()).isTrue();
        assertThat(InputValidator.validateContamination(0.5).valid()).isTrue();
    }

    @Test
    void validateContamination_nonNumeric() {
        ValidationResult result = InputValidator.validateContamination("abc");

        assertThat(result.errorKind()).isEqualTo(ErrorKind.INVALID_PARAMETER);
        assertThat(result.errorMessage()).contains("must be a number");
    }

    @Test
    void validateContamination_numericTextIsNotANumber() {
        assertThat(InputValidator.validateContamination("0.1").valid()).isFalse();
    }

    @Test
    void validateContamination_nullAndNaN() {
        assertThat(InputValidator.validateContamination(null).errorMessage()).contains("must be a number");
        assertThat(InputValidator.validateContamination(Double.NaN).errorMessage()).contains("must be a number");
    }

    @Test
    void validateContamination_valid() {
        ValidationResult result = InputValidator.validateContamination(0.05);

        assertThat(result.valid()).isTrue();
        assertThat(result.errorMessage()).isNull();
    }

    // ── model file ──

    @Test
    void validateModelFile_nonexistent() {
        ValidationResult result = InputValidator.validateModelFile(tempDir.resolve("nonexistent.json"));

        assertThat(result.errorKind()).isEqualTo(ErrorKind.MODEL_NOT_FOUND);
        assertThat(result.errorMessage()).contains("not found").contains("Train the model first");
    }

    @Test
    void validateModelFile_wrongExtension() throws IOException {
        Path txt = writeFile(tempDir, "model.txt", "test");

        ValidationResult result = InputValidator.validateModelFile(txt);

        assertThat(result.errorKind()).isEqualTo(ErrorKind.WRONG_FORMAT);
        assertThat(result.errorMessage()).contains(".json");
    }

    @Test
    void validateModelFile_existingJson() throws IOException {
        Path json = writeFile(tempDir, "model.json", "{}");

        assertThat(InputValidator.validateModelFile(json).valid()).isTrue();
    }

    // ── in-memory model ──

    @Test
    void validateModel_null() {
        assertThat(InputValidator.validateModel(null).errorKind()).isEqualTo(ErrorKind.MODEL_NOT_FOUND);
    }

    @Test
    void validateModel_withoutTrees() {
        BillShockModel broken = new BillShockModel(BillShockModel.FORMAT_VERSION,
                new IsolationForest(List.of(), 8), 0.1, 0.6, 42L, 8, 0L);

        ValidationResult result = InputValidator.validateModel(broken);

        assertThat(result.errorKind()).isEqualTo(ErrorKind.CORRUPT_MODEL);
    }

    @Test
    void validateModel_trained() {
        BillShockModel model = BillShockModel.fit(TRAINING_WITH_SHOCK, 0.1, 10, 256, 42L);

        assertThat(InputValidator.validateModel(model).valid()).isTrue();
    }

    @Test
    void extensionOf_lowerCasesAndIgnoresDotFiles() {
        assertThat(InputValidator.extensionOf(Path.of("a/B.JSON"))).isEqualTo(".json");
        assertThat(InputValidator.extensionOf(Path.of(".csv"))).isEmpty();
        assertThat(InputValidator.extensionOf(Path.of("archive.tar.gz"))).isEqualTo(".gz");
    }
}
