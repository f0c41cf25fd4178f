package com.khoipd8.studentriskdss;

import com.khoipd8.studentriskdss.model.StudentDataset;
import com.khoipd8.studentriskdss.model.StudentRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared student rows for engine and pipeline tests.
 */
public final class StudentFixtures {

    public static final List<String> LABELLED_COLUMNS = List.of(
            "G1", "G2", "G3", "absences", "studytime", "failures", "famsup", "Medu", "Fedu", "Dalc", "Walc", "goout");

    public static final List<String> UNLABELLED_COLUMNS = List.of(
            "G1", "G2", "absences", "studytime", "failures", "famsup", "Medu", "Fedu", "Dalc", "Walc", "goout");

    // G1, G2, G3, absences, studytime, failures, famsup, Medu, Fedu, Dalc, Walc, goout
    private static final Object[][] LABELLED_ROWS = {
            {5, 6, 5, 20, 1, 3, "no", 1, 1, 4, 5, 5},
            {7, 7, 6, 14, 1, 2, "no", 2, 1, 3, 4, 4},
            {8, 8, 8, 10, 2, 1, "yes", 2, 2, 2, 3, 4},
            {6, 5, 4, 16, 1, 2, "no", 1, 2, 5, 5, 5},
            {9, 9, 9, 8, 2, 1, "yes", 3, 2, 1, 2, 3},
            {10, 9, 7, 12, 1, 0, "no", 2, 2, 2, 2, 3},
            {14, 15, 15, 2, 3, 0, "yes", 4, 4, 1, 1, 2},
            {16, 17, 17, 0, 4, 0, "yes", 4, 3, 1, 1, 2},
            {12, 13, 13, 4, 2, 0, "yes", 3, 3, 1, 2, 3},
            {18, 18, 19, 0, 4, 0, "yes", 4, 4, 1, 1, 1},
            {11, 12, 12, 6, 2, 0, "yes", 2, 3, 1, 1, 2},
            {13, 14, 14, 2, 3, 0, "yes", 3, 4, 1, 1, 3},
    };

    private StudentFixtures() {
    }

    public static StudentRecord record(Object... keyValues) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            values.put((String) keyValues[i], keyValues[i + 1]);
        }
        return StudentRecord.of(values);
    }

    /**
     * Every sub-score at its maximum: 4 + 3 + 3 + 5 = 15.
     */
    public static StudentRecord worstCase() {
        return record("G1", 7, "G2", 8, "absences", 20, "studytime", 1, "failures", 2, "famsup", "no",
                "Medu", 1, "Fedu", 1, "Dalc", 4, "Walc", 5, "goout", 5);
    }

    /**
     * Every sub-score zero.
     */
    public static StudentRecord bestCase() {
        return record("G1", 15, "G2", 15, "absences", 2, "studytime", 3, "failures", 0, "famsup", "yes",
                "Medu", 4, "Fedu", 4, "Dalc", 1, "Walc", 1, "goout", 2);
    }

    /**
     * APS 2, ARS 1, FSR 3, LRS 0: total 6.
     */
    public static StudentRecord moderateSix() {
        return record("G1", 10, "G2", 10, "absences", 10, "studytime", 2, "failures", 0, "famsup", "no",
                "Medu", 2, "Fedu", 2, "Dalc", 1, "Walc", 1, "goout", 2);
    }

    /**
     * APS 4 only: total 4.
     */
    public static StudentRecord moderateFour() {
        return record("G1", 9, "G2", 8, "absences", 0, "studytime", 2, "failures", 0, "famsup", "yes",
                "Medu", 4, "Fedu", 4, "Dalc", 1, "Walc", 1, "goout", 2);
    }

    /**
     * APS 4, ARS 3, FSR 0, LRS 3: total 10.
     */
    public static StudentRecord highTen() {
        return record("G1", 9, "G2", 8, "absences", 16, "studytime", 1, "failures", 0, "famsup", "yes",
                "Medu", 4, "Fedu", 4, "Dalc", 1, "Walc", 1, "goout", 4);
    }

    public static StudentDataset labelledDataset() {
        List<StudentRecord> records = new ArrayList<>();
        for (Object[] row : LABELLED_ROWS) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (int i = 0; i < LABELLED_COLUMNS.size(); i++) {
                values.put(LABELLED_COLUMNS.get(i), String.valueOf(row[i]));
            }
            records.add(StudentRecord.of(values));
        }
        return new StudentDataset("labelled", LABELLED_COLUMNS, records);
    }

    public static StudentDataset unlabelledDataset(StudentRecord... records) {
        return new StudentDataset("unlabelled", UNLABELLED_COLUMNS, List.of(records));
    }
}
