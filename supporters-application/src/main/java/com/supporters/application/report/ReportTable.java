package com.supporters.application.report;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Column-ordered tabular report, rendered by infrastructure writers (CSV/JSON).
 */
public final class ReportTable {

    private final String name;
    private final List<String> columns;
    private final List<List<Object>> rows = new ArrayList<>();

    public ReportTable(String name, List<String> columns) {
        this.name = Objects.requireNonNull(name, "name");
        this.columns = List.copyOf(columns);
    }

    public void addRow(List<?> values) {
        if (values.size() != columns.size()) {
            throw new IllegalArgumentException(
                    "Row has " + values.size() + " values, table " + name + " has " + columns.size() + " columns");
        }
        rows.add(Collections.unmodifiableList(new ArrayList<Object>(values)));
    }

    public String name() {
        return name;
    }

    public List<String> columns() {
        return columns;
    }

    public List<List<Object>> rows() {
        return Collections.unmodifiableList(rows);
    }

    public Object value(int row, String column) {
        int idx = columns.indexOf(column);
        if (idx < 0) throw new IllegalArgumentException("Unknown column: " + column);
        return rows.get(row).get(idx);
    }
}
