package com.catdb.service;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Writes a result grid to a CSV file.
 */
@Slf4j
@Service
public class CsvExportService {

    private static final char BOM = '\uFEFF';

    /**
     * Export with a header, comma delimiter and a UTF-8 BOM.
     *
     * @param columns column names
     * @param rows rows
     * @param path target path; {@code .csv} is appended when missing
     * @return path written
     */
    public Path export(List<String> columns, List<? extends List<?>> rows, String path) {
        return export(columns, rows, path, true, ',', true);
    }

    /**
     * Export a grid. Null values are written as empty fields.
     *
     * @param columns column names
     * @param rows rows
     * @param path target path; {@code .csv} is appended when missing
     * @param includeHeader write the column names first
     * @param delimiter field delimiter
     * @param utf8Bom prefix the file with a byte order mark
     * @return path written
     * @throws UncheckedIOException when the file cannot be written
     */
    public Path export(
            List<String> columns,
            List<? extends List<?>> rows,
            String path,
            boolean includeHeader,
            char delimiter,
            boolean utf8Bom
    ) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Export path is required");
        }
        Path target = Paths.get(path.toLowerCase(Locale.ROOT).endsWith(".csv") ? path : path + ".csv");
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setRecordSeparator("\r\n")
                .build();

        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
                 CSVPrinter printer = new CSVPrinter(writer, format)) {
                if (utf8Bom) {
                    writer.write(BOM);
                }
                if (includeHeader && columns != null && !columns.isEmpty()) {
                    printer.printRecord(columns);
                }
                int count = 0;
                if (rows != null) {
                    for (List<?> row : rows) {
                        printer.printRecord(toFields(row));
                        count++;
                    }
                }
                log.info("CSV exported (path={}, rows={})", target, count);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to export CSV to " + target, e);
        }
        return target;
    }

    private static List<String> toFields(List<?> row) {
        List<String> fields = new ArrayList<>(row.size());
        for (Object v : row) {
            fields.add(v == null ? "" : String.valueOf(v));
        }
        return fields;
    }
}
