package com.khoipd8.studentriskdss.model;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import smile.classification.LogisticRegression;

import java.io.Serial;
import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Trained failure-probability estimator together with the imputation values it was
 * trained with. Read-only once built.
 */
@Getter
public class ClassifierModel implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private final LogisticRegression estimator;
    private final List<String> featureNames;
    // column medians of the training set, aligned with featureNames
    @Getter(AccessLevel.NONE)
    private final double[] medians;
    private final double trainingAccuracy;
    private final int atRiskCount;
    private final int notAtRiskCount;
    private final Instant trainedAt;

    @Builder
    private ClassifierModel(LogisticRegression estimator, List<String> featureNames, double[] medians,
                            double trainingAccuracy, int atRiskCount, int notAtRiskCount, Instant trainedAt) {
        this.estimator = estimator;
        this.featureNames = List.copyOf(featureNames);
        this.medians = medians.clone();
        this.trainingAccuracy = trainingAccuracy;
        this.atRiskCount = atRiskCount;
        this.notAtRiskCount = notAtRiskCount;
        this.trainedAt = trainedAt;
    }

    public double median(int featureIndex) {
        return medians[featureIndex];
    }

    public double[] getMedians() {
        return medians.clone();
    }

    /**
     * Posterior probability of the "fails" class for an already imputed vector.
     */
    public double failureProbability(double[] vector) {
        double[] posteriori = new double[2];
        estimator.predict(vector, posteriori);
        return posteriori[1];
    }
}
