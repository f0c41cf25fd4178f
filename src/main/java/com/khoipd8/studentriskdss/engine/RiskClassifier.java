package com.khoipd8.studentriskdss.engine;

import com.khoipd8.studentriskdss.model.ClassifierModel;
import com.khoipd8.studentriskdss.model.StudentDataset;
import com.khoipd8.studentriskdss.model.StudentFeatures;
import com.khoipd8.studentriskdss.model.StudentRecord;
import com.khoipd8.studentriskdss.model.TrainingOutcome;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.springframework.stereotype.Component;
import smile.classification.LogisticRegression;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

import static com.khoipd8.studentriskdss.model.StudentFields.*;

/**
 * Logistic regression over {@code [failures, absences, studytime, G1, G2]} estimating
 * the probability that the final grade G3 ends below {@value #PASSING_GRADE}.
 *
 * <p>Neither training nor prediction ever throws: an unusable dataset yields a
 * SKIPPED outcome, any other error a FAILED outcome or an empty prediction.</p>
 */
@Component
@Slf4j
public class RiskClassifier {

    public static final List<String> FEATURES = List.of(FAILURES, ABSENCES, STUDY_TIME, G1, G2);
    public static final double PASSING_GRADE = 10.0;

    private static final double L2_PENALTY = 1.0;
    private static final double TOLERANCE = 1E-5;
    private static final int MAX_ITERATIONS = 1000;

    public TrainingOutcome train(StudentDataset dataset) {
        if (!dataset.hasColumn(G3)) {
            log.warn("⚠️ G3 column not found in {}. ML predictions disabled, using rules only.", dataset.getSource());
            return TrainingOutcome.skipped("G3 column not found");
        }
        List<String> missing = FEATURES.stream()
                .filter(feature -> !dataset.hasColumn(feature))
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            log.warn("⚠️ Missing features {}. ML predictions disabled.", missing);
            return TrainingOutcome.skipped("Missing features " + missing);
        }

        try {
            double[] medians = new double[FEATURES.size()];
            for (int i = 0; i < FEATURES.size(); i++) {
                double[] present = presentValues(dataset.getRecords(), FEATURES.get(i));
                if (present.length == 0) {
                    log.warn("⚠️ Feature {} has no values. ML predictions disabled.", FEATURES.get(i));
                    return TrainingOutcome.skipped("Feature " + FEATURES.get(i) + " has no values");
                }
                medians[i] = new Median().evaluate(present);
            }

            List<double[]> rows = new ArrayList<>();
            List<Integer> labels = new ArrayList<>();
            for (StudentRecord record : dataset.getRecords()) {
                if (!record.has(G3)) {
                    continue;
                }
                rows.add(trainingVector(record, medians));
                labels.add(FeatureExtractor.decimal(record, G3) < PASSING_GRADE ? 1 : 0);
            }
            if (rows.isEmpty()) {
                log.warn("⚠️ No record carries a final grade. ML predictions disabled.");
                return TrainingOutcome.skipped("No labelled records");
            }

            double[][] x = rows.toArray(new double[0][]);
            int[] y = labels.stream().mapToInt(Integer::intValue).toArray();
            int atRisk = (int) labels.stream().filter(label -> label == 1).count();
            if (atRisk == 0 || atRisk == x.length) {
                log.warn("⚠️ All {} labelled records share one outcome. ML predictions disabled.", x.length);
                return TrainingOutcome.skipped("Single class in training data");
            }

            LogisticRegression estimator = LogisticRegression.binomial(x, y, L2_PENALTY, TOLERANCE, MAX_ITERATIONS);

            int correct = 0;
            for (int i = 0; i < x.length; i++) {
                if (estimator.predict(x[i]) == y[i]) {
                    correct++;
                }
            }
            double accuracy = (double) correct / x.length;

            ClassifierModel model = ClassifierModel.builder()
                    .estimator(estimator)
                    .featureNames(FEATURES)
                    .medians(medians)
                    .trainingAccuracy(accuracy)
                    .atRiskCount(atRisk)
                    .notAtRiskCount(x.length - atRisk)
                    .trainedAt(Instant.now())
                    .build();

            log.info("✓ Model trained on {} records, accuracy {}%, features {}",
                    x.length, String.format("%.2f", accuracy * 100), FEATURES);
            log.info("  Training data: {} at-risk, {} not at-risk", atRisk, x.length - atRisk);
            return TrainingOutcome.trained(model);

        } catch (RuntimeException e) {
            log.error("❌ Model training failed: {}", e.getMessage(), e);
            return TrainingOutcome.failed(e.getMessage());
        }
    }

    /**
     * Failure probability for one student, or empty when no model is available or
     * the estimator fails. Missing inputs are imputed with the training medians.
     */
    public OptionalDouble predict(ClassifierModel model, StudentFeatures features) {
        if (model == null) {
            return OptionalDouble.empty();
        }
        try {
            double probability = model.failureProbability(inferenceVector(model, features));
            if (Double.isNaN(probability)) {
                throw new IllegalStateException("estimator returned NaN");
            }
            return OptionalDouble.of(Math.max(0.0, Math.min(1.0, probability)));
        } catch (RuntimeException e) {
            log.warn("⚠️ ML prediction error: {}", e.getMessage());
            return OptionalDouble.empty();
        }
    }

    double[] inferenceVector(ClassifierModel model, StudentFeatures features) {
        List<String> names = model.getFeatureNames();
        double[] vector = new double[names.size()];
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            vector[i] = features.isDefaulted(name) ? model.median(i) : featureValue(features, name);
        }
        return vector;
    }

    private static double featureValue(StudentFeatures features, String name) {
        return switch (name) {
            case FAILURES -> features.getFailures();
            case ABSENCES -> features.getAbsences();
            case STUDY_TIME -> features.getStudytime();
            case G1 -> features.getG1();
            case G2 -> features.getG2();
            default -> throw new IllegalArgumentException("Unknown feature " + name);
        };
    }

    private static double[] trainingVector(StudentRecord record, double[] medians) {
        double[] vector = new double[FEATURES.size()];
        for (int i = 0; i < FEATURES.size(); i++) {
            String feature = FEATURES.get(i);
            vector[i] = record.has(feature) ? FeatureExtractor.decimal(record, feature) : medians[i];
        }
        return vector;
    }

    private static double[] presentValues(List<StudentRecord> records, String feature) {
        return records.stream()
                .filter(record -> record.has(feature))
                .mapToDouble(record -> FeatureExtractor.decimal(record, feature))
                .toArray();
    }
}
