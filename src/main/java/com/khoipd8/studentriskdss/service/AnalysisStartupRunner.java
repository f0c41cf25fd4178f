package com.khoipd8.studentriskdss.service;

import com.khoipd8.studentriskdss.config.DssProperties;
import com.khoipd8.studentriskdss.exception.RiskDssException;
import com.khoipd8.studentriskdss.model.AnalysisResult;
import com.khoipd8.studentriskdss.model.SummaryStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Analyses the configured dataset at boot, exports the results and logs a short report.
 */
@Component
@Slf4j
public class AnalysisStartupRunner implements ApplicationRunner {

    @Autowired
    private HybridDssService hybridDssService;

    @Autowired
    private DssProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isRunOnStartup()) {
            return;
        }
        Path datasetPath = Path.of(properties.getDatasetPath());
        if (!Files.exists(datasetPath)) {
            log.warn("⚠️ Data file not found at {}, skipping startup analysis", datasetPath.toAbsolutePath());
            return;
        }

        try {
            HybridPipeline run = hybridDssService.runAnalysis(datasetPath, properties.isTrainNewModel());
            hybridDssService.exportResults();
            logReport(run);
        } catch (RiskDssException e) {
            log.error("❌ Startup analysis failed: {}", e.getMessage(), e);
        }
    }

    private void logReport(HybridPipeline run) {
        List<AnalysisResult> atRisk = run.getAtRisk();
        int shown = Math.min(properties.getDashboardSize(), atRisk.size());
        log.info("📊 TOP {} AT-RISK STUDENTS (out of {} total)", shown, atRisk.size());

        for (int i = 0; i < shown; i++) {
            AnalysisResult student = atRisk.get(i);
            log.info("{}. Student (Row {}) - {}, rule score {}/15{}, G2 {}, absences {}",
                    i + 1, student.getIndex(), student.getFinalTier().getLabel(), student.getTotalRiskScore(),
                    student.isMlAvailable() ? String.format(", ML probability %.1f%%", student.getMlProbability() * 100) : "",
                    student.getFeatures().getG2(), student.getFeatures().getAbsences());
            student.getRecommendations().forEach(rec -> log.info("      - {}", rec));
        }

        SummaryStatistics stats = run.getSummaryStatistics();
        log.info("📈 Total: {}, High: {} ({}%), Moderate: {} ({}%), Low: {} ({}%), ML model: {}",
                stats.getTotalStudents(),
                stats.getHighRisk(), stats.getHighRiskPct(),
                stats.getModerateRisk(), stats.getModerateRiskPct(),
                stats.getLowRisk(), stats.getLowRiskPct(),
                stats.isMlEnabled() ? "Enabled" : "Disabled");
    }
}
