package com.sqlgrader.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fully materialized query result: column names in driver order and rows in fetch order.
 * Rows hold plain scalars only (numbers, strings, booleans, nulls).
 */
public class ResultTable {
    private final List<String> columns;
    private final List<List<Object>> rows;

    public ResultTable(List<String> columns, List<List<Object>> rows) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException(
                        "Row has " + row.size() + " values but there are " + columns.size() + " columns");
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public static ResultTable empty() {
        return new ResultTable(Collections.emptyList(), Collections.emptyList());
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<List<Object>> getRows() {
        return rows;
    }

    public int getColumnCount() {
        return columns.size();
    }

    public int getRowCount() {
        return rows.size();
    }
}
