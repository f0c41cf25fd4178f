package com.khoipd8.studentriskdss.model;

/**
 * Progress of one pipeline run, in execution order.
 */
public enum PipelineStage {
    IDLE,
    DATA_LOADED,
    MODEL_READY,
    RULES_APPLIED,
    ML_APPLIED,
    RECONCILED,
    RECOMMENDATIONS_READY,
    DONE;

    public boolean isAtLeast(PipelineStage other) {
        return compareTo(other) >= 0;
    }
}
