package com.bank.billshock.io;

import com.bank.billshock.model.Dataset;
import com.bank.billshock.model.TransactionRecord;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a {@link Dataset} as CSV with a header row, in the dataset's column order.
 */
@Component
public class CsvDatasetWriter {

    private final CsvMapper mapper = new CsvMapper();

    public void write(Dataset dataset, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(dataset, out);
        }
    }

    public void write(Dataset dataset, Writer out) throws IOException {
        CsvSchema.Builder schema = CsvSchema.builder().setUseHeader(true);
        for (String column : dataset.getColumns()) {
            schema.addColumn(column);
        }
        try (SequenceWriter rows = mapper.writer(schema.build()).writeValues(out)) {
            for (TransactionRecord record : dataset.getRecords()) {
                rows.write(record.getValues());
            }
        }
    }
}
