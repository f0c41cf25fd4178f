package com.khoipd8.studentriskdss.model;

import lombok.Getter;

import java.util.List;

/**
 * An ordered batch of student records plus the header they were read with.
 */
@Getter
public class StudentDataset {

    private final String source;
    private final List<String> columns;
    private final List<StudentRecord> records;

    public StudentDataset(String source, List<String> columns, List<StudentRecord> records) {
        this.source = source;
        this.columns = List.copyOf(columns);
        this.records = List.copyOf(records);
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
