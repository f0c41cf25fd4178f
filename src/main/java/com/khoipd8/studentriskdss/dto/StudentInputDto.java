package com.khoipd8.studentriskdss.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.khoipd8.studentriskdss.model.StudentFields;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Form input for a single student. Every field is optional; G2 and absences are
 * still needed for a result.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StudentInputDto {

    @JsonProperty("G1")
    @Schema(description = "First period grade (0-20)", example = "8")
    private Double g1;

    @JsonProperty("G2")
    @Schema(description = "Second period grade (0-20)", example = "7", requiredMode = Schema.RequiredMode.REQUIRED)
    private Double g2;

    @JsonProperty("G3")
    @Schema(description = "Final grade, when already known", example = "9")
    private Double g3;

    @JsonProperty("absences")
    @Schema(description = "Number of school absences", example = "15", requiredMode = Schema.RequiredMode.REQUIRED)
    private Number absences;

    @JsonProperty("studytime")
    @Schema(description = "Weekly study time band (1-4)", example = "1")
    private Number studytime;

    @JsonProperty("failures")
    @Schema(description = "Number of past class failures", example = "2")
    private Number failures;

    @JsonProperty("famsup")
    @Schema(description = "Family educational support", example = "no", allowableValues = {"yes", "no"})
    private String famsup;

    @JsonProperty("Medu")
    @Schema(description = "Mother's education (0-4)", example = "2")
    private Number medu;

    @JsonProperty("Fedu")
    @Schema(description = "Father's education (0-4)", example = "2")
    private Number fedu;

    @JsonProperty("Dalc")
    @Schema(description = "Workday alcohol consumption (1-5)", example = "3")
    private Number dalc;

    @JsonProperty("Walc")
    @Schema(description = "Weekend alcohol consumption (1-5)", example = "4")
    private Number walc;

    @JsonProperty("goout")
    @Schema(description = "Going out with friends (1-5)", example = "4")
    private Number goout;

    /**
     * Field map holding only the values that were actually sent.
     */
    public Map<String, Object> toFieldMap() {
        Map<String, Object> fields = new LinkedHashMap<>();
        putIfPresent(fields, StudentFields.G1, g1);
        putIfPresent(fields, StudentFields.G2, g2);
        putIfPresent(fields, StudentFields.G3, g3);
        putIfPresent(fields, StudentFields.ABSENCES, absences);
        putIfPresent(fields, StudentFields.STUDY_TIME, studytime);
        putIfPresent(fields, StudentFields.FAILURES, failures);
        putIfPresent(fields, StudentFields.FAMILY_SUPPORT, famsup);
        putIfPresent(fields, StudentFields.MOTHER_EDUCATION, medu);
        putIfPresent(fields, StudentFields.FATHER_EDUCATION, fedu);
        putIfPresent(fields, StudentFields.WORKDAY_ALCOHOL, dalc);
        putIfPresent(fields, StudentFields.WEEKEND_ALCOHOL, walc);
        putIfPresent(fields, StudentFields.GOING_OUT, goout);
        return fields;
    }

    private static void putIfPresent(Map<String, Object> fields, String name, Object value) {
        if (value != null) {
            fields.put(name, value);
        }
    }
}
