package com.bank.billshock.model;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.bank.billshock.testutil.TestDataFactory.transactionRows;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatasetTest {

    @Test
    void fromRows_unionOfColumnsInFirstSeenOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("Date", "2024-03-01");
        first.put("Amount", 100);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("Amount", 9000);
        second.put("Category", "Roaming");

        Dataset dataset = Dataset.fromRows(List.of(first, second));

        assertThat(dataset.getColumns()).containsExactly("Date", "Amount", "Category");
        assertThat(dataset.getRecords()).extracting(TransactionRecord::getIndex).containsExactly(0, 1);
        assertThat(dataset.getRecords().get(1).get("Date")).isNull();
    }

    @Test
    void resolveColumn_prefersExactMatch() {
        Dataset dataset = Dataset.fromRows(List.of(Map.of("Amount", 1, "amount", 2)));

        assertThat(dataset.resolveColumn("amount")).hasValue("amount");
        assertThat(dataset.resolveColumn("AMOUNT")).isPresent();
        assertThat(dataset.resolveColumn("Price")).isEmpty();
    }

    @Test
    void resolveColumn_caseInsensitiveFallback() {
        assertThat(transactionRows(100).resolveColumn("amount")).hasValue("Amount");
    }

    @Test
    void isEmpty_noRowsOrNoColumns() {
        assertThat(Dataset.empty().isEmpty()).isTrue();
        assertThat(new Dataset(List.of("Amount"), List.of()).isEmpty()).isTrue();
        assertThat(Dataset.fromRows(List.of(Map.<String, Object>of(), Map.<String, Object>of())).isEmpty()).isTrue();
        assertThat(transactionRows(100).isEmpty()).isFalse();
    }

    @Test
    void withColumn_appendsOnceAndKeepsOriginal() {
        Dataset dataset = transactionRows(100, 9000);
        List<TransactionRecord> labelled = List.of(dataset.getRecords().get(1).withValue("Anomaly", "Bill Shock"));

        Dataset result = dataset.withColumn("Anomaly", labelled).withColumn("Anomaly", labelled);

        assertThat(result.getColumns()).containsExactly("Date", "Amount", "Anomaly");
        assertThat(result.getRecords()).extracting(TransactionRecord::getIndex).containsExactly(1);
        assertThat(dataset.getColumns()).containsExactly("Date", "Amount");
        assertThat(dataset.getRecords().get(1).get("Anomaly")).isNull();
    }

    @Test
    void getNumber_parsesTextAndTreatsMissingTokensAsNull() {
        Dataset dataset = transactionRows(" 120.5 ", 300, "NaN", "n/a", "None", "", null);

        assertThat(dataset.getRecords()).extracting(r -> r.getNumber("Amount"))
                .containsExactly(120.5, 300.0, null, null, null, null, null);
    }

    @Test
    void getNumber_rejectsTextAndInfinity() {
        Dataset dataset = transactionRows("abc", "Infinity");

        assertThatThrownBy(() -> dataset.getRecords().get(0).getNumber("Amount"))
                .isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> dataset.getRecords().get(1).getNumber("Amount"))
                .isInstanceOf(NumberFormatException.class);
        assertThat(TransactionRecord.isNumeric("Infinity")).isFalse();
        assertThat(TransactionRecord.isNumeric("NA")).isTrue();
    }

    @Test
    void records_areImmutable() {
        Dataset dataset = transactionRows(100);

        assertThatThrownBy(() -> dataset.getRecords().get(0).getValues().put("Amount", 5))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> dataset.getRecords().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
