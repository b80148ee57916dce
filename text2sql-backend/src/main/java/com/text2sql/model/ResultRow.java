package com.text2sql.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One result row: column labels from the originating result set, in select-list order, mapped to
 * their JSON-safe values.
 */
public final class ResultRow {
    private final Map<String, Object> values;

    private ResultRow(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * Create a row from parallel column and value lists.
     *
     * <p>Duplicate labels (e.g. {@code SELECT a.id, b.id}) keep the last value, matching how a
     * keyed row lookup resolves them.
     *
     * @param columns column labels
     * @param values values, same size as {@code columns}
     * @return row
     */
    public static ResultRow of(List<String> columns, List<Object> values) {
        if (columns.size() != values.size()) {
            throw new IllegalArgumentException(
                    "Column count " + columns.size() + " does not match value count " + values.size());
        }
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            m.put(columns.get(i), values.get(i));
        }
        return new ResultRow(m);
    }

    public Object get(String column) {
        return values.get(column);
    }

    public List<String> columnNames() {
        return List.copyOf(values.keySet());
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResultRow other)) {
            return false;
        }
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
