package com.khoipd8.studentriskdss.engine;

import com.khoipd8.studentriskdss.exception.InvalidFieldValueException;
import com.khoipd8.studentriskdss.exception.MissingRequiredFieldException;
import com.khoipd8.studentriskdss.model.StudentFeatures;
import org.junit.jupiter.api.Test;

import static com.khoipd8.studentriskdss.StudentFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class FeatureExtractorTest {

    private final FeatureExtractor extractor = new FeatureExtractor();

    @Test
    void missing_optional_fields_take_defaults() {
        StudentFeatures features = extractor.extract(record("G2", 12, "absences", 3));

        assertEquals(0.0, features.getG1());
        assertEquals(12.0, features.getG2());
        assertNull(features.getG3());
        assertEquals(2, features.getStudytime());
        assertEquals(0, features.getFailures());
        assertEquals("yes", features.getFamsup());
        assertEquals(2, features.getMedu());
        assertEquals(2, features.getFedu());
        assertEquals(1, features.getDalc());
        assertEquals(1, features.getWalc());
        assertEquals(2, features.getGoout());
        assertThat(features.getDefaultedFields())
                .containsExactlyInAnyOrder("G1", "studytime", "failures", "famsup", "Medu", "Fedu", "Dalc", "Walc", "goout");
    }

    @Test
    void supplied_fields_are_not_marked_defaulted() {
        StudentFeatures features = extractor.extract(record("G1", "11", "G2", "9", "G3", "8", "absences", "6",
                "studytime", "1", "failures", "2", "famsup", " No ", "Medu", "3", "Fedu", "4",
                "Dalc", "2", "Walc", "3", "goout", "5"));

        assertThat(features.getDefaultedFields()).isEmpty();
        assertEquals(11.0, features.getG1());
        assertEquals(8.0, features.getG3());
        assertEquals("no", features.getFamsup());
        assertFalse(features.hasFamilySupport());
        assertEquals(3.5, features.parentEducationAverage());
        assertEquals(2.5, features.alcoholAverage());
    }

    @Test
    void missing_g2_is_rejected() {
        MissingRequiredFieldException e = assertThrows(MissingRequiredFieldException.class,
                () -> extractor.extract(record("G1", 10, "absences", 4)));
        assertEquals("G2", e.getField());
    }

    @Test
    void missing_absences_is_rejected() {
        MissingRequiredFieldException e = assertThrows(MissingRequiredFieldException.class,
                () -> extractor.extract(record("G2", 10)));
        assertEquals("absences", e.getField());
    }

    @Test
    void blank_value_counts_as_missing() {
        assertThrows(MissingRequiredFieldException.class,
                () -> extractor.extract(record("G2", "  ", "absences", 4)));

        StudentFeatures features = extractor.extract(record("G2", 10, "absences", 4, "famsup", ""));
        assertEquals("yes", features.getFamsup());
        assertTrue(features.isDefaulted("famsup"));
    }

    @Test
    void non_numeric_value_is_rejected() {
        InvalidFieldValueException e = assertThrows(InvalidFieldValueException.class,
                () -> extractor.extract(record("G2", "ten", "absences", 4)));
        assertEquals("G2", e.getField());

        assertThrows(InvalidFieldValueException.class,
                () -> extractor.extract(record("G2", "NaN", "absences", 4)));
    }

    @Test
    void non_finite_numbers_are_rejected() {
        InvalidFieldValueException e = assertThrows(InvalidFieldValueException.class,
                () -> extractor.extract(record("G2", Double.NaN, "absences", 0)));
        assertEquals("G2", e.getField());

        assertThrows(InvalidFieldValueException.class,
                () -> extractor.extract(record("G2", 12, "absences", 0, "G1", Double.POSITIVE_INFINITY)));
        assertThrows(InvalidFieldValueException.class,
                () -> extractor.extract(record("G2", 12, "absences", Float.NEGATIVE_INFINITY)));
    }

    @Test
    void count_beyond_int_range_is_rejected() {
        InvalidFieldValueException e = assertThrows(InvalidFieldValueException.class,
                () -> extractor.extract(record("G2", 12, "absences", 1e12)));
        assertEquals("absences", e.getField());

        assertThrows(InvalidFieldValueException.class,
                () -> extractor.extract(record("G2", 12, "absences", 0, "failures", "-3000000000")));
    }

    @Test
    void fractional_count_is_rejected() {
        InvalidFieldValueException e = assertThrows(InvalidFieldValueException.class,
                () -> extractor.extract(record("G2", 10, "absences", 4.5)));
        assertEquals("absences", e.getField());
    }

    @Test
    void grades_may_be_fractional() {
        StudentFeatures features = extractor.extract(record("G2", 10.5, "absences", "4.0"));
        assertEquals(10.5, features.getG2());
        assertEquals(4, features.getAbsences());
    }
}
