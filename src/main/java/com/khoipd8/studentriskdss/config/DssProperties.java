package com.khoipd8.studentriskdss.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "dss")
public class DssProperties {

    /** Delimited student file analysed at startup and by {@code POST /api/risk/run}. */
    private String datasetPath = "data/student-mat.csv";

    /** Name the trained classifier is stored under. */
    private String modelHandle = "trained_model";

    /** Retrain even when a persisted model exists. */
    private boolean trainNewModel = false;

    private boolean runOnStartup = true;

    private String exportPath = "hybrid_dss_results.csv";

    // at-risk students shown on the dashboard and in the startup report
    private int dashboardSize = 10;
}
