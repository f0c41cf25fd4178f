package com.khoipd8.studentriskdss.service;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.khoipd8.studentriskdss.exception.DatasetLoadException;
import com.khoipd8.studentriskdss.model.StudentDataset;
import com.khoipd8.studentriskdss.model.StudentRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the student dataset from a delimited file. Semicolon is tried first
 * (the UCI student files use it), comma second.
 */
@Service
@Slf4j
public class StudentDatasetReader {

    private static final char[] SEPARATORS = {';', ','};

    private final CsvMapper csvMapper = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    public StudentDataset read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new DatasetLoadException("Data file not found at " + path.toAbsolutePath());
        }

        List<String[]> rows = List.of();
        char used = SEPARATORS[0];
        for (char separator : SEPARATORS) {
            rows = readRows(path, separator);
            used = separator;
            // a single header column means the separator did not split anything
            if (!rows.isEmpty() && rows.get(0).length > 1) {
                break;
            }
        }
        if (rows.isEmpty()) {
            throw new DatasetLoadException("Data file " + path + " is empty");
        }

        List<String> header = new ArrayList<>();
        for (String column : rows.get(0)) {
            header.add(column.trim());
        }

        List<StudentRecord> records = new ArrayList<>();
        for (String[] row : rows.subList(1, rows.size())) {
            if (isBlank(row)) {
                continue;
            }
            Map<String, String> values = new LinkedHashMap<>();
            for (int i = 0; i < header.size() && i < row.length; i++) {
                values.put(header.get(i), row[i]);
            }
            records.add(StudentRecord.of(values));
        }

        log.info("✓ Loaded {} student records from {} (sep='{}')", records.size(), path.getFileName(), used);
        return new StudentDataset(path.toString(), header, records);
    }

    private List<String[]> readRows(Path path, char separator) {
        CsvSchema schema = CsvSchema.emptySchema().withColumnSeparator(separator);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             MappingIterator<String[]> iterator = csvMapper.readerFor(String[].class).with(schema).readValues(reader)) {
            return iterator.readAll();
        } catch (IOException | RuntimeException e) {
            throw new DatasetLoadException("Error loading data from " + path + ": " + e.getMessage(), e);
        }
    }

    private static boolean isBlank(String[] row) {
        return Arrays.stream(row).allMatch(value -> value == null || value.trim().isEmpty());
    }
}
