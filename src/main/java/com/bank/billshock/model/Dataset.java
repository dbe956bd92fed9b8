package com.bank.billshock.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * An ordered table of {@link TransactionRecord}s with a fixed column order.
 * Immutable: operations that change the table return a new instance.
 */
public final class Dataset {

    private final List<String> columns;
    private final List<TransactionRecord> records;

    public Dataset(List<String> columns, List<TransactionRecord> records) {
        this.columns = List.copyOf(columns);
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
    }

    public static Dataset empty() {
        return new Dataset(List.of(), List.of());
    }

    /**
     * Builds a dataset from plain rows, indexing them by position. Columns are the union of the
     * row keys in first-seen order.
     */
    public static Dataset fromRows(List<? extends Map<String, ?>> rows) {
        Set<String> columns = new LinkedHashSet<>();
        List<TransactionRecord> records = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            Map<String, ?> row = rows.get(i);
            columns.addAll(row.keySet());
            records.add(new TransactionRecord(i, new LinkedHashMap<String, Object>(row)));
        }
        return new Dataset(new ArrayList<>(columns), records);
    }

    public List<String> getColumns() { return columns; }
    public List<TransactionRecord> getRecords() { return records; }

    public int size() {
        return records.size();
    }

    /**
     * A table is empty when it has no rows or no columns.
     */
    public boolean isEmpty() {
        return records.isEmpty() || columns.isEmpty();
    }

    /**
     * Finds the column matching {@code name}, preferring an exact match and otherwise
     * accepting a case-insensitive one ("amount" resolves "Amount").
     */
    public Optional<String> resolveColumn(String name) {
        if (columns.contains(name)) return Optional.of(name);
        return columns.stream().filter(c -> c.equalsIgnoreCase(name)).findFirst();
    }

    /**
     * Returns a copy with {@code column} appended to the column list (if not already present).
     * Records are kept as given, in order.
     */
    public Dataset withColumn(String column, List<TransactionRecord> newRecords) {
        List<String> newColumns = new ArrayList<>(columns);
        if (!newColumns.contains(column)) {
            newColumns.add(column);
        }
        return new Dataset(newColumns, newRecords);
    }

    @Override
    public String toString() {
        return "Dataset{columns=" + columns + ", rows=" + records.size() + '}';
    }
}
