package com.khoipd8.studentriskdss.engine;

import com.khoipd8.studentriskdss.exception.InvalidFieldValueException;
import com.khoipd8.studentriskdss.exception.MissingRequiredFieldException;
import com.khoipd8.studentriskdss.model.StudentFeatures;
import com.khoipd8.studentriskdss.model.StudentRecord;
import org.springframework.stereotype.Component;

import java.util.Locale;

import static com.khoipd8.studentriskdss.model.StudentFields.*;

/**
 * Turns a loosely typed {@link StudentRecord} into {@link StudentFeatures}.
 * Missing optional fields get their documented default; G2 and absences are mandatory.
 */
@Component
public class FeatureExtractor {

    public StudentFeatures extract(StudentRecord record) {
        for (String field : REQUIRED) {
            if (!record.has(field)) {
                throw new MissingRequiredFieldException(field);
            }
        }

        StudentFeatures.StudentFeaturesBuilder builder = StudentFeatures.builder()
                .g2(decimal(record, G2))
                .absences(integer(record, ABSENCES))
                .g3(record.has(G3) ? decimal(record, G3) : null);

        if (record.has(G1)) {
            builder.g1(decimal(record, G1));
        } else {
            builder.g1(DEFAULT_G1).defaulted(G1);
        }
        builder.studytime(integerOrDefault(record, STUDY_TIME, DEFAULT_STUDY_TIME, builder));
        builder.failures(integerOrDefault(record, FAILURES, DEFAULT_FAILURES, builder));
        builder.medu(integerOrDefault(record, MOTHER_EDUCATION, DEFAULT_PARENT_EDUCATION, builder));
        builder.fedu(integerOrDefault(record, FATHER_EDUCATION, DEFAULT_PARENT_EDUCATION, builder));
        builder.dalc(integerOrDefault(record, WORKDAY_ALCOHOL, DEFAULT_ALCOHOL, builder));
        builder.walc(integerOrDefault(record, WEEKEND_ALCOHOL, DEFAULT_ALCOHOL, builder));
        builder.goout(integerOrDefault(record, GOING_OUT, DEFAULT_GOING_OUT, builder));

        if (record.has(FAMILY_SUPPORT)) {
            builder.famsup(record.get(FAMILY_SUPPORT).toString().trim().toLowerCase(Locale.ROOT));
        } else {
            builder.famsup(DEFAULT_FAMILY_SUPPORT).defaulted(FAMILY_SUPPORT);
        }
        return builder.build();
    }

    private static int integerOrDefault(StudentRecord record, String field, int defaultValue,
                                        StudentFeatures.StudentFeaturesBuilder builder) {
        if (!record.has(field)) {
            builder.defaulted(field);
            return defaultValue;
        }
        return integer(record, field);
    }

    private static int integer(StudentRecord record, String field) {
        double value = decimal(record, field);
        if (value != Math.rint(value) || value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new InvalidFieldValueException(field, record.get(field));
        }
        return (int) value;
    }

    static double decimal(StudentRecord record, String field) {
        Object raw = record.get(field);
        double value;
        if (raw instanceof Number) {
            value = ((Number) raw).doubleValue();
        } else {
            try {
                value = Double.parseDouble(raw.toString().trim());
            } catch (NumberFormatException e) {
                throw new InvalidFieldValueException(field, raw);
            }
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new InvalidFieldValueException(field, raw);
        }
        return value;
    }
}
