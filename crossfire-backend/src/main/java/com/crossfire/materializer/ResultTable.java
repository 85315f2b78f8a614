package com.crossfire.materializer;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named-column table. Serializes as a JSON array of row objects; a row only carries the cells
 * that were set.
 */
public class ResultTable {
    private final List<String> columns = new ArrayList<>();
    private final List<Map<String, Object>> rows = new ArrayList<>();

    /**
     * Adds a column.
     *
     * @param name column name
     * @return column index
     * @throws IllegalArgumentException when the name is already used
     */
    public int addColumn(String name) {
        if (columns.contains(name)) {
            throw new IllegalArgumentException("Duplicate column name: " + name);
        }
        columns.add(name);
        return columns.size() - 1;
    }

    public int indexOf(String name) {
        return columns.indexOf(name);
    }

    public Map<String, Object> newRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        rows.add(row);
        return row;
    }

    public List<String> getColumns() {
        return Collections.unmodifiableList(columns);
    }

    @JsonValue
    public List<Map<String, Object>> getRows() {
        return Collections.unmodifiableList(rows);
    }
}
