package com.khoipd8.studentriskdss.service;

import com.khoipd8.studentriskdss.engine.FeatureExtractor;
import com.khoipd8.studentriskdss.engine.ReconciliationPolicy;
import com.khoipd8.studentriskdss.engine.RecommendationSynthesizer;
import com.khoipd8.studentriskdss.engine.RiskClassifier;
import com.khoipd8.studentriskdss.engine.RuleScorer;
import com.khoipd8.studentriskdss.exception.FieldValidationException;
import com.khoipd8.studentriskdss.exception.MissingRequiredFieldException;
import com.khoipd8.studentriskdss.exception.ModelPersistenceException;
import com.khoipd8.studentriskdss.model.AnalysisResult;
import com.khoipd8.studentriskdss.model.ClassifierModel;
import com.khoipd8.studentriskdss.model.ModelSource;
import com.khoipd8.studentriskdss.model.PipelineStage;
import com.khoipd8.studentriskdss.model.RiskBreakdown;
import com.khoipd8.studentriskdss.model.RiskTier;
import com.khoipd8.studentriskdss.model.StudentDataset;
import com.khoipd8.studentriskdss.model.StudentFeatures;
import com.khoipd8.studentriskdss.model.StudentRecord;
import com.khoipd8.studentriskdss.model.SummaryStatistics;
import com.khoipd8.studentriskdss.model.TrainingOutcome;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * One run of the hybrid analysis over a dataset.
 *
 * <p>Stages run in order: load data, prepare model, rules, ML predictions,
 * reconciliation, recommendations. Each stage overwrites the values it derives, so
 * re-running a stage recomputes it and moves the run back to that stage. The trained
 * model is the only state shared between evaluations and is never mutated.</p>
 *
 * <p>Not thread-safe; build a run completely before publishing it.</p>
 */
@Slf4j
public class HybridPipeline {

    private static final Comparator<AnalysisResult> SEVERITY_ORDER =
            Comparator.comparing(AnalysisResult::getFinalTier).reversed()
                    .thenComparing(Comparator.comparingInt(AnalysisResult::getTotalRiskScore).reversed());

    private final FeatureExtractor featureExtractor;
    private final RuleScorer ruleScorer;
    private final RiskClassifier riskClassifier;
    private final ReconciliationPolicy reconciliationPolicy;
    private final RecommendationSynthesizer recommendationSynthesizer;
    private final ModelStore modelStore;
    private final String modelHandle;

    @Getter
    private PipelineStage stage = PipelineStage.IDLE;
    @Getter
    private StudentDataset dataset;
    @Getter
    private ClassifierModel model;
    @Getter
    private ModelSource modelSource = ModelSource.ABSENT;
    @Getter
    private int rejectedRecords;

    private List<Row> rows = new ArrayList<>();

    public HybridPipeline(FeatureExtractor featureExtractor,
                          RuleScorer ruleScorer,
                          RiskClassifier riskClassifier,
                          ReconciliationPolicy reconciliationPolicy,
                          RecommendationSynthesizer recommendationSynthesizer,
                          ModelStore modelStore,
                          String modelHandle) {
        this.featureExtractor = featureExtractor;
        this.ruleScorer = ruleScorer;
        this.riskClassifier = riskClassifier;
        this.reconciliationPolicy = reconciliationPolicy;
        this.recommendationSynthesizer = recommendationSynthesizer;
        this.modelStore = modelStore;
        this.modelHandle = modelHandle;
    }

    // ============================
    // FULL PIPELINE
    // ============================

    public List<AnalysisResult> run(StudentDataset students, boolean trainNewModel) {
        log.info("🚀 Hybrid analysis of {} ({} records)", students.getSource(), students.size());
        loadData(students);
        prepareModel(trainNewModel);
        applyRules();
        applyMlPredictions();
        reconcile();
        generateRecommendations();
        stage = PipelineStage.DONE;
        log.info("✅ Hybrid analysis complete");
        return analyzeAll();
    }

    public void loadData(StudentDataset students) {
        if (students == null) {
            throw new IllegalArgumentException("dataset must not be null");
        }
        this.dataset = students;
        this.rows = new ArrayList<>();
        this.rejectedRecords = 0;
        stage = PipelineStage.DATA_LOADED;
        log.info("✓ Loaded {} student records", students.size());
    }

    /**
     * Trains when asked to, otherwise loads the persisted model and trains only as a
     * fallback. Without a dataset (single-record use) only loading is attempted.
     */
    public void prepareModel(boolean trainNewModel) {
        if (trainNewModel) {
            log.info("🎓 Training new ML model...");
            trainAndSave();
        } else if (!loadPersistedModel()) {
            log.info("   No existing model found. Training new model...");
            trainAndSave();
        }
        stage = PipelineStage.MODEL_READY;
        log.info("✓ Model ready: {}", modelSource.name().toLowerCase(Locale.ROOT));
    }

    public void applyRules() {
        requireStage(PipelineStage.MODEL_READY);
        if (dataset == null) {
            throw new IllegalStateException("No dataset loaded");
        }
        List<Row> scored = new ArrayList<>();
        int rejected = 0;
        List<StudentRecord> records = dataset.getRecords();
        for (int i = 0; i < records.size(); i++) {
            try {
                StudentFeatures features = featureExtractor.extract(records.get(i));
                RiskBreakdown breakdown = ruleScorer.score(features);
                scored.add(new Row(i, records.get(i), features, breakdown, ruleScorer.classify(breakdown.getTotal())));
            } catch (FieldValidationException e) {
                rejected++;
                log.warn("⚠️ Skipping record {}: {}", i, e.getMessage());
            }
        }
        rows = scored;
        rejectedRecords = rejected;
        stage = PipelineStage.RULES_APPLIED;
        log.info("✓ Rules applied, rule-based distribution: {}", distribution(row -> row.ruleTier));
    }

    public void applyMlPredictions() {
        requireStage(PipelineStage.RULES_APPLIED);
        if (model == null) {
            log.warn("⚠️ No ML model available. Skipping ML predictions.");
        }
        int high = 0;
        int moderate = 0;
        for (Row row : rows) {
            OptionalDouble probability = riskClassifier.predict(model, row.features);
            row.probability = probability.isPresent() ? probability.getAsDouble() : null;
            if (row.probability != null && row.probability > ReconciliationPolicy.HIGH_RISK_PROBABILITY) {
                high++;
            } else if (row.probability != null && row.probability > ReconciliationPolicy.MODERATE_RISK_PROBABILITY) {
                moderate++;
            }
        }
        stage = PipelineStage.ML_APPLIED;
        if (model != null) {
            log.info("✓ ML predictions generated: high probability {}, moderate probability {}, low {}",
                    high, moderate, rows.size() - high - moderate);
        }
    }

    public void reconcile() {
        requireStage(PipelineStage.ML_APPLIED);
        for (Row row : rows) {
            double probability = row.probability != null ? row.probability : 0.0;
            row.finalTier = reconciliationPolicy.reconcile(row.breakdown.getTotal(), probability);
        }
        stage = PipelineStage.RECONCILED;
        log.info("✓ Hybrid decisions complete, final distribution: {}", distribution(row -> row.finalTier));
        if (model != null) {
            log.info("  Classifications changed by ML: {}", rows.stream().filter(Row::isChangedByClassifier).count());
        }
    }

    public void generateRecommendations() {
        requireStage(PipelineStage.RECONCILED);
        for (Row row : rows) {
            row.recommendations = List.copyOf(
                    recommendationSynthesizer.synthesize(row.features, row.finalTier, row.probability));
        }
        stage = PipelineStage.RECOMMENDATIONS_READY;
        log.info("✓ Recommendations generated");
    }

    // ============================
    // QUERIES
    // ============================

    /**
     * Evaluates one ad-hoc record against the current model. Does not touch the dataset.
     *
     * @throws MissingRequiredFieldException when G2 or absences is missing
     */
    public AnalysisResult analyzeSingle(StudentRecord record) {
        StudentFeatures features = featureExtractor.extract(record);
        RiskBreakdown breakdown = ruleScorer.score(features);
        OptionalDouble prediction = riskClassifier.predict(model, features);
        Double probability = prediction.isPresent() ? prediction.getAsDouble() : null;
        RiskTier finalTier = reconciliationPolicy.reconcile(breakdown.getTotal(), probability != null ? probability : 0.0);

        return AnalysisResult.builder()
                .record(record)
                .features(features)
                .breakdown(breakdown)
                .ruleTier(ruleScorer.classify(breakdown.getTotal()))
                .mlProbability(probability)
                .finalTier(finalTier)
                .recommendations(List.copyOf(recommendationSynthesizer.synthesize(features, finalTier, probability)))
                .build();
    }

    public List<AnalysisResult> analyzeAll() {
        requireStage(PipelineStage.RECOMMENDATIONS_READY);
        return rows.stream().map(Row::toResult).collect(Collectors.toList());
    }

    public Optional<AnalysisResult> analyzeStudent(int index) {
        requireStage(PipelineStage.RECOMMENDATIONS_READY);
        return rows.stream()
                .filter(row -> row.index == index)
                .findFirst()
                .map(Row::toResult);
    }

    /**
     * Moderate and High students, High first, then by descending rule score.
     */
    public List<AnalysisResult> getAtRisk() {
        return analyzeAll().stream()
                .filter(result -> result.getFinalTier().isAtRisk())
                .sorted(SEVERITY_ORDER)
                .collect(Collectors.toList());
    }

    public SummaryStatistics getSummaryStatistics() {
        requireStage(PipelineStage.RECONCILED);
        Map<RiskTier, Long> counts = rows.stream()
                .collect(Collectors.groupingBy(row -> row.finalTier, () -> new EnumMap<>(RiskTier.class), Collectors.counting()));
        return SummaryStatistics.builder()
                .totalStudents(rows.size())
                .highRisk(counts.getOrDefault(RiskTier.HIGH, 0L).intValue())
                .moderateRisk(counts.getOrDefault(RiskTier.MODERATE, 0L).intValue())
                .lowRisk(counts.getOrDefault(RiskTier.LOW, 0L).intValue())
                .mlEnabled(isMlEnabled())
                .modelSource(modelSource)
                .rejectedRecords(rejectedRecords)
                .changedByClassifier((int) rows.stream().filter(Row::isChangedByClassifier).count())
                .build();
    }

    public boolean isMlEnabled() {
        return model != null;
    }

    // ============================
    // MODEL LIFECYCLE
    // ============================

    private boolean loadPersistedModel() {
        try {
            Optional<ClassifierModel> persisted = modelStore.load(modelHandle);
            if (persisted.isPresent()) {
                model = persisted.get();
                modelSource = ModelSource.LOADED;
                log.info("✓ Loaded pre-trained model '{}'", modelHandle);
                return true;
            }
        } catch (ModelPersistenceException e) {
            log.warn("⚠️ Could not load model '{}': {}", modelHandle, e.getMessage());
        }
        return false;
    }

    private void trainAndSave() {
        model = null;
        modelSource = ModelSource.ABSENT;
        if (dataset == null) {
            log.warn("⚠️ No dataset loaded, cannot train. Using rules only.");
            return;
        }
        TrainingOutcome outcome = riskClassifier.train(dataset);
        if (!outcome.isTrained()) {
            log.warn("⚠️ ML disabled for this run: {}", outcome.getReason());
            return;
        }
        model = outcome.getModel();
        modelSource = ModelSource.TRAINED;
        try {
            modelStore.save(model, modelHandle);
            log.info("✓ Model saved as '{}'", modelHandle);
        } catch (ModelPersistenceException e) {
            log.warn("⚠️ Could not save model: {}", e.getMessage());
        }
    }

    private void requireStage(PipelineStage required) {
        if (!stage.isAtLeast(required)) {
            throw new IllegalStateException("Pipeline is at stage " + stage + ", " + required + " required");
        }
    }

    private String distribution(Function<Row, RiskTier> tierOf) {
        Map<RiskTier, Long> counts = rows.stream()
                .collect(Collectors.groupingBy(tierOf, () -> new EnumMap<>(RiskTier.class), Collectors.counting()));
        return counts.entrySet().stream()
                .map(entry -> String.format("%s: %d (%.1f%%)", entry.getKey().getLabel(), entry.getValue(),
                        entry.getValue() * 100.0 / rows.size()))
                .collect(Collectors.joining(", "));
    }

    // Derived values of one dataset row
    private static final class Row {
        private final int index;
        private final StudentRecord record;
        private final StudentFeatures features;
        private final RiskBreakdown breakdown;
        private final RiskTier ruleTier;
        private Double probability;
        private RiskTier finalTier;
        private List<String> recommendations = List.of();

        private Row(int index, StudentRecord record, StudentFeatures features, RiskBreakdown breakdown, RiskTier ruleTier) {
            this.index = index;
            this.record = record;
            this.features = features;
            this.breakdown = breakdown;
            this.ruleTier = ruleTier;
        }

        private boolean isChangedByClassifier() {
            return finalTier != ruleTier;
        }

        private AnalysisResult toResult() {
            return AnalysisResult.builder()
                    .index(index)
                    .record(record)
                    .features(features)
                    .breakdown(breakdown)
                    .ruleTier(ruleTier)
                    .mlProbability(probability)
                    .finalTier(finalTier)
                    .recommendations(recommendations)
                    .build();
        }
    }
}
