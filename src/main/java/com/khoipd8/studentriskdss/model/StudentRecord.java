package com.khoipd8.studentriskdss.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One student row as it arrived: a field name to raw value mapping.
 * Values may be numbers or strings; a blank string counts as absent.
 */
public final class StudentRecord {

    private final Map<String, Object> values;

    private StudentRecord(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static StudentRecord of(Map<String, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((key, value) -> {
                if (key != null) {
                    copy.put(key.trim(), value);
                }
            });
        }
        return new StudentRecord(copy);
    }

    public boolean has(String field) {
        Object value = values.get(field);
        if (value == null) {
            return false;
        }
        return !(value instanceof CharSequence) || !value.toString().trim().isEmpty();
    }

    public Object get(String field) {
        return has(field) ? values.get(field) : null;
    }

    public Set<String> fieldNames() {
        return values.keySet();
    }

    @Override
    public String toString() {
        return "StudentRecord" + values;
    }
}
