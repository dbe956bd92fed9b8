package com.bank.billshock.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One row of a transaction table. Only the amount column is interpreted; every other cell
 * (date, id, category, ...) is carried through untouched.
 *
 * The index is the row's position in the source table and is never renumbered, so detection
 * results can always be mapped back to the input.
 */
@Schema(description = "A transaction row with its original position and column values")
public final class TransactionRecord {

    private static final Set<String> MISSING_TOKENS = Set.of("nan", "na", "n/a", "null", "none");

    @Schema(description = "Zero-based position of the row in the source table", example = "2")
    private final int index;

    @Schema(description = "Column values in source column order",
            example = "{\"Date\": \"2024-03-01\", \"Amount\": \"9000\"}")
    private final Map<String, Object> values;

    @JsonCreator
    public TransactionRecord(@JsonProperty("index") int index,
                             @JsonProperty("values") Map<String, Object> values) {
        this.index = index;
        this.values = Collections.unmodifiableMap(
                new LinkedHashMap<>(values != null ? values : Map.of()));
    }

    public int getIndex() { return index; }
    public Map<String, Object> getValues() { return values; }

    public Object get(String column) {
        return values.get(column);
    }

    /**
     * Returns the numeric value of the given column, or null if the cell is missing.
     *
     * @throws NumberFormatException if the cell holds something that is not a number
     */
    public Double getNumber(String column) {
        return toNumber(values.get(column));
    }

    /**
     * Returns a copy of this record with one cell replaced or appended. The index is kept.
     */
    public TransactionRecord withValue(String column, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(column, value);
        return new TransactionRecord(index, copy);
    }

    public static boolean isMissing(Object cell) {
        if (cell == null) return true;
        if (cell instanceof Double d) return d.isNaN();
        if (cell instanceof Float f) return f.isNaN();
        if (cell instanceof CharSequence text) {
            String trimmed = text.toString().trim();
            return trimmed.isEmpty() || MISSING_TOKENS.contains(trimmed.toLowerCase(Locale.ROOT));
        }
        return false;
    }

    public static boolean isNumeric(Object cell) {
        if (isMissing(cell)) return true;
        try {
            toNumber(cell);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    static Double toNumber(Object cell) {
        if (isMissing(cell)) return null;
        double value;
        if (cell instanceof Number n) {
            value = n.doubleValue();
        } else if (cell instanceof CharSequence text) {
            value = Double.parseDouble(text.toString().trim());
        } else {
            throw new NumberFormatException("Not a number: " + cell);
        }
        if (!Double.isFinite(value)) {
            throw new NumberFormatException("Not a finite number: " + cell);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransactionRecord that)) return false;
        return index == that.index && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, values);
    }

    @Override
    public String toString() {
        return "TransactionRecord{index=" + index + ", values=" + values + '}';
    }
}
