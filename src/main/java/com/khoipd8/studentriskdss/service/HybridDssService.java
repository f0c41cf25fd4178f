package com.khoipd8.studentriskdss.service;

import com.khoipd8.studentriskdss.config.DssProperties;
import com.khoipd8.studentriskdss.engine.FeatureExtractor;
import com.khoipd8.studentriskdss.engine.ReconciliationPolicy;
import com.khoipd8.studentriskdss.engine.RecommendationSynthesizer;
import com.khoipd8.studentriskdss.engine.RiskClassifier;
import com.khoipd8.studentriskdss.engine.RuleScorer;
import com.khoipd8.studentriskdss.exception.NoAnalysisRunException;
import com.khoipd8.studentriskdss.model.AnalysisResult;
import com.khoipd8.studentriskdss.model.ScoringRule;
import com.khoipd8.studentriskdss.model.StudentDataset;
import com.khoipd8.studentriskdss.model.StudentRecord;
import com.khoipd8.studentriskdss.model.SummaryStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the most recent completed analysis run and answers queries against it.
 */
@Service
@Slf4j
public class HybridDssService {

    @Autowired
    private FeatureExtractor featureExtractor;

    @Autowired
    private RuleScorer ruleScorer;

    @Autowired
    private RiskClassifier riskClassifier;

    @Autowired
    private ReconciliationPolicy reconciliationPolicy;

    @Autowired
    private RecommendationSynthesizer recommendationSynthesizer;

    @Autowired
    private ModelStore modelStore;

    @Autowired
    private StudentDatasetReader datasetReader;

    @Autowired
    private ResultCsvExporter resultCsvExporter;

    @Autowired
    private DssProperties properties;

    // published only once every stage has run
    private volatile HybridPipeline currentRun;

    // model-only pipeline for single-record requests before the first run
    private volatile HybridPipeline standaloneRun;

    /**
     * 🚀 Runs the whole pipeline over the configured dataset
     */
    public HybridPipeline runAnalysis(boolean trainNewModel) {
        return runAnalysis(Path.of(properties.getDatasetPath()), trainNewModel);
    }

    public HybridPipeline runAnalysis(Path datasetPath, boolean trainNewModel) {
        StudentDataset dataset = datasetReader.read(datasetPath);
        HybridPipeline pipeline = newPipeline();
        pipeline.run(dataset, trainNewModel);

        currentRun = pipeline;
        standaloneRun = null;
        return pipeline;
    }

    /**
     * 🎯 Evaluates one student entered by hand
     */
    public AnalysisResult predictSingle(Map<String, ?> input) {
        return pipelineForSingle().analyzeSingle(StudentRecord.of(input));
    }

    public boolean hasRun() {
        return currentRun != null;
    }

    public HybridPipeline getCurrentRun() {
        HybridPipeline run = currentRun;
        if (run == null) {
            throw new NoAnalysisRunException();
        }
        return run;
    }

    public SummaryStatistics getSummaryStatistics() {
        return getCurrentRun().getSummaryStatistics();
    }

    public List<AnalysisResult> getAtRiskStudents() {
        return getCurrentRun().getAtRisk();
    }

    public Optional<AnalysisResult> getStudent(int index) {
        return getCurrentRun().analyzeStudent(index);
    }

    public List<ScoringRule> getRuleCatalog() {
        return ruleScorer.getRules();
    }

    /**
     * 💾 Writes the current run to the configured export file
     */
    public int exportResults() {
        return exportResults(Path.of(properties.getExportPath()));
    }

    public int exportResults(Path target) {
        return resultCsvExporter.export(getCurrentRun(), target);
    }

    public DssProperties getProperties() {
        return properties;
    }

    private HybridPipeline pipelineForSingle() {
        HybridPipeline run = currentRun;
        if (run != null) {
            return run;
        }
        HybridPipeline standalone = standaloneRun;
        if (standalone == null) {
            log.info("No completed run yet, evaluating with the persisted model only");
            standalone = newPipeline();
            standalone.prepareModel(false);
            standaloneRun = standalone;
        }
        return standalone;
    }

    private HybridPipeline newPipeline() {
        return new HybridPipeline(featureExtractor, ruleScorer, riskClassifier, reconciliationPolicy,
                recommendationSynthesizer, modelStore, properties.getModelHandle());
    }
}
