package com.khoipd8.studentriskdss.service;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.khoipd8.studentriskdss.exception.RiskDssException;
import com.khoipd8.studentriskdss.model.AnalysisResult;
import com.khoipd8.studentriskdss.model.StudentFields;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes the analysis results of a run as a flat CSV, one row per student.
 */
@Service
@Slf4j
public class ResultCsvExporter {

    private final CsvMapper csvMapper = new CsvMapper();

    /**
     * @return number of exported rows
     */
    public int export(HybridPipeline run, Path target) {
        boolean includeG3 = run.getDataset() != null && run.getDataset().hasColumn(StudentFields.G3);
        List<Map<String, Object>> rows = toRows(run.analyzeAll(), includeG3, run.isMlEnabled());
        if (rows.isEmpty()) {
            log.warn("⚠️ No data to save. Nothing exported to {}", target);
            return 0;
        }

        CsvSchema.Builder schemaBuilder = CsvSchema.builder();
        rows.get(0).keySet().forEach(schemaBuilder::addColumn);
        CsvSchema schema = schemaBuilder.build().withHeader();

        try {
            if (target.toAbsolutePath().getParent() != null) {
                Files.createDirectories(target.toAbsolutePath().getParent());
            }
            try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
                 SequenceWriter sequence = csvMapper.writer(schema).writeValues(writer)) {
                sequence.writeAll(rows);
            }
        } catch (IOException e) {
            throw new RiskDssException("Could not write results to " + target, e);
        }

        log.info("✓ Results saved to {} ({} records, {} columns)", target, rows.size(), schema.size());
        return rows.size();
    }

    List<Map<String, Object>> toRows(List<AnalysisResult> results, boolean includeG3, boolean includeProbability) {
        return results.stream()
                .map(result -> result.toExportRow(includeG3, includeProbability))
                .collect(Collectors.toCollection(ArrayList::new));
    }
}
