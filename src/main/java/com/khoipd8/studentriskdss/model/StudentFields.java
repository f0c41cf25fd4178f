package com.khoipd8.studentriskdss.model;

import java.util.List;

/**
 * Column names of the student performance dataset, spelled exactly as in the source files.
 */
public final class StudentFields {

    public static final String G1 = "G1";
    public static final String G2 = "G2";
    public static final String G3 = "G3";
    public static final String ABSENCES = "absences";
    public static final String STUDY_TIME = "studytime";
    public static final String FAILURES = "failures";
    public static final String FAMILY_SUPPORT = "famsup";
    public static final String MOTHER_EDUCATION = "Medu";
    public static final String FATHER_EDUCATION = "Fedu";
    public static final String WORKDAY_ALCOHOL = "Dalc";
    public static final String WEEKEND_ALCOHOL = "Walc";
    public static final String GOING_OUT = "goout";

    // Required by every rule sub-score, never defaulted
    public static final List<String> REQUIRED = List.of(G2, ABSENCES);

    public static final int DEFAULT_G1 = 0;
    public static final int DEFAULT_STUDY_TIME = 2;
    public static final int DEFAULT_FAILURES = 0;
    public static final String DEFAULT_FAMILY_SUPPORT = "yes";
    public static final int DEFAULT_PARENT_EDUCATION = 2;
    public static final int DEFAULT_ALCOHOL = 1;
    public static final int DEFAULT_GOING_OUT = 2;

    private StudentFields() {
    }
}
