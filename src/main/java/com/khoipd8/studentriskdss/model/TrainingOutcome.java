package com.khoipd8.studentriskdss.model;

import lombok.Getter;

/**
 * Result of a training attempt. Only {@link Status#TRAINED} carries a model.
 */
@Getter
public class TrainingOutcome {

    public enum Status {
        TRAINED,
        // expected: the dataset cannot be used for training
        SKIPPED,
        FAILED
    }

    private final Status status;
    private final ClassifierModel model;
    private final String reason;

    private TrainingOutcome(Status status, ClassifierModel model, String reason) {
        this.status = status;
        this.model = model;
        this.reason = reason;
    }

    public static TrainingOutcome trained(ClassifierModel model) {
        return new TrainingOutcome(Status.TRAINED, model, null);
    }

    public static TrainingOutcome skipped(String reason) {
        return new TrainingOutcome(Status.SKIPPED, null, reason);
    }

    public static TrainingOutcome failed(String reason) {
        return new TrainingOutcome(Status.FAILED, null, reason);
    }

    public boolean isTrained() {
        return status == Status.TRAINED;
    }

    @Override
    public String toString() {
        return isTrained() ? "TrainingOutcome[TRAINED]" : "TrainingOutcome[" + status + ": " + reason + "]";
    }
}
