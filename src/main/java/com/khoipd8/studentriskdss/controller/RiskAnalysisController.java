package com.khoipd8.studentriskdss.controller;

import com.khoipd8.studentriskdss.dto.StudentInputDto;
import com.khoipd8.studentriskdss.exception.DatasetLoadException;
import com.khoipd8.studentriskdss.exception.FieldValidationException;
import com.khoipd8.studentriskdss.exception.NoAnalysisRunException;
import com.khoipd8.studentriskdss.model.AnalysisResult;
import com.khoipd8.studentriskdss.model.ScoringRule;
import com.khoipd8.studentriskdss.model.StudentFields;
import com.khoipd8.studentriskdss.model.SummaryStatistics;
import com.khoipd8.studentriskdss.service.HybridDssService;
import com.khoipd8.studentriskdss.service.HybridPipeline;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.*;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/risk")
@Tag(name = "Risk Analysis", description = "Hybrid rule + ML student risk assessment")
@Slf4j
public class RiskAnalysisController {

    @Autowired
    private HybridDssService hybridDssService;

    /**
     * 🎯 SINGLE STUDENT PREDICTION
     */
    @PostMapping("/predict")
    @Operation(summary = "Assess one student",
               description = "Scores a hand-entered student with the rules and the ML model and returns the reconciled tier")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Assessment computed"),
        @ApiResponse(responseCode = "400", description = "G2 or absences missing, or a field is not a number"),
        @ApiResponse(responseCode = "500", description = "Server error")
    })
    public ResponseEntity<Map<String, Object>> predict(@RequestBody StudentInputDto input) {
        Map<String, Object> response = new LinkedHashMap<>();

        try {
            AnalysisResult result = hybridDssService.predictSingle(input.toFieldMap());

            response.put("status", "success");
            response.putAll(result.toExportRow(result.getFeatures().getG3() != null, result.isMlAvailable()));
            response.put("ml_available", result.isMlAvailable());
            response.put("recommendation_list", result.getRecommendations());

        } catch (FieldValidationException e) {
            response.put("status", "error");
            response.put("error", e.getMessage());
            response.put("field", e.getField());
            return ResponseEntity.badRequest().body(response);
        } catch (Exception e) {
            log.error("❌ Prediction error: {}", e.getMessage(), e);
            response.put("status", "error");
            response.put("error", "Error analyzing student: " + e.getMessage());
            return ResponseEntity.status(500).body(response);
        }

        return ResponseEntity.ok(response);
    }

    /**
     * 📊 DASHBOARD - summary + top at-risk students
     */
    @GetMapping("/dashboard")
    @Operation(summary = "Dashboard of the current run")
    public ResponseEntity<Map<String, Object>> dashboard() {
        Map<String, Object> response = new LinkedHashMap<>();

        try {
            HybridPipeline run = hybridDssService.getCurrentRun();
            int size = hybridDssService.getProperties().getDashboardSize();
            List<AnalysisResult> atRisk = run.getAtRisk();

            response.put("status", "success");
            response.put("stats", run.getSummaryStatistics().toMap());
            response.put("at_risk_total", atRisk.size());
            response.put("at_risk", toRows(atRisk.subList(0, Math.min(size, atRisk.size())), run));

        } catch (NoAnalysisRunException e) {
            return noRun(response, e);
        } catch (Exception e) {
            log.error("Error building dashboard", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(500).body(response);
        }

        return ResponseEntity.ok(response);
    }

    @GetMapping("/summary")
    @Operation(summary = "Risk distribution of the current run")
    public ResponseEntity<Map<String, Object>> summary() {
        Map<String, Object> response = new LinkedHashMap<>();

        try {
            SummaryStatistics stats = hybridDssService.getSummaryStatistics();
            response.put("status", "success");
            response.putAll(stats.toMap());
        } catch (NoAnalysisRunException e) {
            return noRun(response, e);
        }

        return ResponseEntity.ok(response);
    }

    @GetMapping("/students/{index}")
    @Operation(summary = "Assessment of one dataset row")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Success"),
        @ApiResponse(responseCode = "404", description = "No student at this row"),
        @ApiResponse(responseCode = "409", description = "No analysis run yet")
    })
    public ResponseEntity<Map<String, Object>> student(
            @Parameter(description = "Row index in the dataset", required = true)
            @PathVariable int index) {
        Map<String, Object> response = new LinkedHashMap<>();

        try {
            HybridPipeline run = hybridDssService.getCurrentRun();
            Optional<AnalysisResult> result = hybridDssService.getStudent(index);
            if (result.isEmpty()) {
                response.put("status", "error");
                response.put("message", "Student not found");
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
            }
            response.put("status", "success");
            response.putAll(toRow(result.get(), run));
            response.put("ml_available", result.get().isMlAvailable());
            response.put("recommendation_list", result.get().getRecommendations());
        } catch (NoAnalysisRunException e) {
            return noRun(response, e);
        }

        return ResponseEntity.ok(response);
    }

    @GetMapping("/at-risk")
    @Operation(summary = "All High and Moderate risk students, most severe first")
    public ResponseEntity<Map<String, Object>> atRisk() {
        Map<String, Object> response = new LinkedHashMap<>();

        try {
            HybridPipeline run = hybridDssService.getCurrentRun();
            List<AnalysisResult> students = hybridDssService.getAtRiskStudents();
            response.put("status", "success");
            response.put("total", students.size());
            response.put("students", toRows(students, run));
        } catch (NoAnalysisRunException e) {
            return noRun(response, e);
        }

        return ResponseEntity.ok(response);
    }

    /**
     * 📋 RULE CATALOG
     */
    @GetMapping("/rules")
    @Operation(summary = "Scoring rules used by the rule engine")
    public ResponseEntity<Map<String, Object>> rules() {
        Map<String, Object> catalog = new LinkedHashMap<>();
        for (ScoringRule rule : hybridDssService.getRuleCatalog()) {
            @SuppressWarnings("unchecked")
            Map<String, Object> component = (Map<String, Object>) catalog.computeIfAbsent(rule.getComponent().getCode(), code -> {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("name", rule.getComponent().getDisplayName());
                entry.put("max_points", rule.getComponent().getMaxPoints());
                entry.put("rules", new ArrayList<Map<String, Object>>());
                return entry;
            });
            @SuppressWarnings("unchecked")
            List<Map<String, Object>> componentRules = (List<Map<String, Object>>) component.get("rules");
            componentRules.add(Map.of(
                "condition", rule.getCondition(),
                "points", rule.getPoints(),
                "severity", rule.getSeverity()
            ));
        }
        return ResponseEntity.ok(catalog);
    }

    /**
     * 🔄 RE-RUN the full pipeline over the configured dataset
     */
    @PostMapping("/run")
    @Operation(summary = "Run the hybrid analysis again")
    public ResponseEntity<Map<String, Object>> run(
            @Parameter(description = "Retrain the model instead of loading the stored one")
            @RequestParam(defaultValue = "false") boolean trainNewModel) {
        Map<String, Object> response = new LinkedHashMap<>();

        try {
            HybridPipeline run = hybridDssService.runAnalysis(trainNewModel);
            response.put("status", "success");
            response.put("model_source", run.getModelSource().name().toLowerCase(Locale.ROOT));
            response.put("stats", run.getSummaryStatistics().toMap());
        } catch (DatasetLoadException e) {
            log.error("❌ Run failed: {}", e.getMessage());
            response.put("status", "error");
            response.put("error", e.getMessage());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(response);
        } catch (Exception e) {
            log.error("❌ Run failed", e);
            response.put("status", "error");
            response.put("error", e.getMessage());
            return ResponseEntity.status(500).body(response);
        }

        return ResponseEntity.ok(response);
    }

    /**
     * 💾 EXPORT results to CSV
     */
    @PostMapping("/export")
    @Operation(summary = "Write the current run to the configured CSV file")
    public ResponseEntity<Map<String, Object>> export() {
        Map<String, Object> response = new LinkedHashMap<>();

        try {
            int exported = hybridDssService.exportResults();
            response.put("status", "success");
            response.put("exported", exported);
            response.put("path", hybridDssService.getProperties().getExportPath());
        } catch (NoAnalysisRunException e) {
            return noRun(response, e);
        } catch (Exception e) {
            log.error("❌ Export failed", e);
            response.put("status", "error");
            response.put("error", e.getMessage());
            return ResponseEntity.status(500).body(response);
        }

        return ResponseEntity.ok(response);
    }

    // Helper methods
    private List<Map<String, Object>> toRows(List<AnalysisResult> results, HybridPipeline run) {
        return results.stream()
                .map(result -> toRow(result, run))
                .collect(Collectors.toList());
    }

    private Map<String, Object> toRow(AnalysisResult result, HybridPipeline run) {
        boolean includeG3 = run.getDataset() != null && run.getDataset().hasColumn(StudentFields.G3);
        return result.toExportRow(includeG3, run.isMlEnabled());
    }

    private ResponseEntity<Map<String, Object>> noRun(Map<String, Object> response, NoAnalysisRunException e) {
        response.put("status", "error");
        response.put("message", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
    }
}
