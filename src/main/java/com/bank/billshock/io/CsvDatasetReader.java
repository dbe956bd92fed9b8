package com.bank.billshock.io;

import com.bank.billshock.model.Dataset;
import com.bank.billshock.model.TransactionRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads header-first CSV into a {@link Dataset}. Cells are kept as the raw text found in the
 * file; column and row order follow the file.
 */
@Component
public class CsvDatasetReader {

    private final ObjectReader reader;

    public CsvDatasetReader() {
        CsvMapper mapper = new CsvMapper();
        this.reader = mapper.readerForMapOf(String.class)
                .with(CsvSchema.emptySchema().withHeader())
                .with(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    public Dataset read(Path path) throws IOException {
        try (MappingIterator<Map<String, String>> rows = reader.readValues(path.toFile())) {
            return toDataset(rows);
        } catch (JsonProcessingException e) {
            throw new DatasetParseException("Could not parse CSV file " + path + ": " + e.getOriginalMessage(), e);
        }
    }

    public Dataset read(InputStream in) throws IOException {
        try (MappingIterator<Map<String, String>> rows = reader.readValues(in)) {
            return toDataset(rows);
        } catch (JsonProcessingException e) {
            throw new DatasetParseException("Could not parse CSV input: " + e.getOriginalMessage(), e);
        }
    }

    private Dataset toDataset(MappingIterator<Map<String, String>> rows) throws IOException {
        List<TransactionRecord> records = new ArrayList<>();
        int index = 0;
        while (rows.hasNextValue()) {
            Map<String, String> row = rows.nextValue();
            records.add(new TransactionRecord(index++, new LinkedHashMap<String, Object>(row)));
        }

        List<String> columns = new ArrayList<>();
        CsvSchema schema = ((CsvParser) rows.getParser()).getSchema();
        for (CsvSchema.Column column : schema) {
            columns.add(column.getName());
        }
        return new Dataset(columns, records);
    }
}
