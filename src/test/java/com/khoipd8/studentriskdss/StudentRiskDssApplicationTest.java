package com.khoipd8.studentriskdss;

import com.khoipd8.studentriskdss.model.AnalysisResult;
import com.khoipd8.studentriskdss.model.ModelSource;
import com.khoipd8.studentriskdss.model.SummaryStatistics;
import com.khoipd8.studentriskdss.service.HybridDssService;
import com.khoipd8.studentriskdss.service.HybridPipeline;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:dss-it;DB_CLOSE_DELAY=-1",
        "spring.jpa.hibernate.ddl-auto=create-drop",
        "dss.dataset-path=src/test/resources/students-train.csv",
        "dss.export-path=target/it/hybrid_dss_results.csv",
        "dss.train-new-model=true",
        "dss.run-on-startup=true"
})
class StudentRiskDssApplicationTest {

    @Autowired HybridDssService service;

    @Test
    void startup_run_analyses_and_exports_dataset() {
        assertTrue(service.hasRun());
        assertTrue(Files.exists(Path.of("target/it/hybrid_dss_results.csv")));

        SummaryStatistics stats = service.getSummaryStatistics();
        assertEquals(12, stats.getTotalStudents());
        assertTrue(stats.isMlEnabled());
        assertNotEquals(ModelSource.ABSENT, stats.getModelSource());
        assertEquals(stats.getTotalStudents(), stats.getHighRisk() + stats.getModerateRisk() + stats.getLowRisk());
    }

    @Test
    void rerun_loads_the_persisted_model() {
        HybridPipeline run = service.runAnalysis(false);

        assertEquals(ModelSource.LOADED, run.getModelSource());
        assertThat(service.getAtRiskStudents()).isNotEmpty()
                .allMatch(result -> result.getFinalTier().isAtRisk());
    }

    @Test
    void single_prediction_uses_current_model() {
        AnalysisResult result = service.predictSingle(Map.of("G2", 7, "absences", 18, "failures", 2));

        assertTrue(result.isMlAvailable());
        assertNull(result.getIndex());
        assertTrue(result.getFinalTier().isAtRisk());
    }
}
