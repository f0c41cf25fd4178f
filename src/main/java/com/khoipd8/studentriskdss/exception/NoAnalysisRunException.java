package com.khoipd8.studentriskdss.exception;

/**
 * Thrown when dataset-level results are requested before any run completed.
 */
public class NoAnalysisRunException extends RiskDssException {

    public NoAnalysisRunException() {
        super("No analysis run has completed yet");
    }
}
