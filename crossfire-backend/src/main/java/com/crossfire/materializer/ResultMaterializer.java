package com.crossfire.materializer;

import com.crossfire.api.OutputFormat;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.springframework.stereotype.Component;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Converts a {@link TabularCursor} into one of the {@link OutputFormat} shapes.
 *
 * <p>Each conversion makes a single forward pass over the cursor. Conversions are stateless and safe
 * to call concurrently on different cursors.
 */
@Component
public class ResultMaterializer {

    /**
     * Payload returned for every format when the backend produced no reader.
     */
    public static final String EMPTY_RESPONSE = "{'empty':'no data'}";

    private static final int UNPIVOT_FIELD_COUNT = 3;
    private static final int KEY_VALUE_FIELD_COUNT = 2;

    private final ObjectWriter writer;

    public ResultMaterializer(ObjectMapper objectMapper) {
        this.writer = objectMapper.writerWithDefaultPrettyPrinter();
    }

    /**
     * Materializes a cursor and serializes the result to JSON.
     *
     * @param cursor result cursor, null when the backend returned no reader
     * @param format output format
     * @return JSON payload, or {@link #EMPTY_RESPONSE}
     */
    public String materialize(TabularCursor cursor, OutputFormat format) {
        if (cursor == null) {
            return EMPTY_RESPONSE;
        }

        Object shaped;
        switch (format) {
            case TABLE:
                shaped = toTable(cursor);
                break;
            case DICTIONARY:
                shaped = toDictionary(cursor);
                break;
            case KEY_VALUE_ARRAY:
                shaped = toKeyValueArray(cursor);
                break;
            case TWO_DIMENSIONAL_ARRAY:
                shaped = toTwoDimensionalArray(cursor);
                break;
            case SIMPLE_UNPIVOTED_TABLE:
                shaped = toSimpleUnpivotedTable(cursor);
                break;
            default:
                return EMPTY_RESPONSE;
        }

        try {
            return writer.writeValueAsString(shaped);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize result as " + format, e);
        }
    }

    /**
     * Column name to the list of its string-coerced values, in row order.
     */
    public Map<String, List<String>> toDictionary(TabularCursor cursor) {
        int fieldCount = cursor.getFieldCount();
        List<List<String>> columnValues = new ArrayList<>(fieldCount);
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (int i = 0; i < fieldCount; i++) {
            String name = ColumnNames.extract(cursor.getName(i));
            if (result.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate column name: " + name);
            }
            List<String> values = new ArrayList<>();
            result.put(name, values);
            columnValues.add(values);
        }

        while (cursor.read()) {
            for (int i = 0; i < fieldCount; i++) {
                columnValues.get(i).add(asString(cursor.getValue(i)));
            }
        }
        return result;
    }

    /**
     * Table with normalized column names and cells in their native type.
     */
    public ResultTable toTable(TabularCursor cursor) {
        int fieldCount = cursor.getFieldCount();
        ResultTable table = new ResultTable();
        String[] columns = new String[fieldCount];
        for (int i = 0; i < fieldCount; i++) {
            columns[i] = ColumnNames.extract(cursor.getName(i));
            table.addColumn(columns[i]);
        }

        while (cursor.read()) {
            Map<String, Object> row = table.newRow();
            for (int i = 0; i < fieldCount; i++) {
                row.put(columns[i], cursor.getValue(i));
            }
        }
        return table;
    }

    /**
     * Key/value pairs from the first two columns. Any further columns are ignored.
     *
     * @throws IllegalArgumentException when the cursor has fewer than two fields
     */
    public List<KeyValue> toKeyValueArray(TabularCursor cursor) {
        if (cursor.getFieldCount() < KEY_VALUE_FIELD_COUNT) {
            throw new IllegalArgumentException(
                    "Key/value array requires at least 2 columns: column with keys and column with values, got "
                            + cursor.getFieldCount());
        }
        List<KeyValue> result = new ArrayList<>();
        while (cursor.read()) {
            result.add(new KeyValue(asString(cursor.getValue(0)), asString(cursor.getValue(1))));
        }
        return result;
    }

    /**
     * Header row of normalized column names followed by one string row per cursor row.
     */
    public List<List<String>> toTwoDimensionalArray(TabularCursor cursor) {
        int fieldCount = cursor.getFieldCount();
        List<List<String>> result = new ArrayList<>();

        String[] header = new String[fieldCount];
        for (int i = 0; i < fieldCount; i++) {
            header[i] = ColumnNames.extract(cursor.getName(i));
        }
        result.add(Arrays.asList(header));

        while (cursor.read()) {
            String[] row = new String[fieldCount];
            for (int i = 0; i < fieldCount; i++) {
                row[i] = asString(cursor.getValue(i));
            }
            result.add(Arrays.asList(row));
        }
        return result;
    }

    /**
     * Rebuilds a (key, label, value) result into a wide table: one row per distinct key, one column
     * per distinct label, both in first-seen order. Key/label pairs absent from the input leave the
     * cell unset.
     *
     * @throws UnpivotShapeException when the cursor does not have exactly three fields
     */
    public ResultTable toSimpleUnpivotedTable(TabularCursor cursor) {
        if (cursor.getFieldCount() != UNPIVOT_FIELD_COUNT) {
            throw new UnpivotShapeException(
                    "Simple unpivot can only be performed for a table with 3 columns: column with keys, "
                            + "column with pivoted values and column with values");
        }

        ResultTable table = new ResultTable();
        String keyColumn = ColumnNames.extract(cursor.getName(0));
        table.addColumn(keyColumn);

        Map<Map.Entry<String, String>, String> cells = new LinkedHashMap<>();
        Set<String> keys = new LinkedHashSet<>();
        Set<String> labels = new LinkedHashSet<>();
        while (cursor.read()) {
            String key = Objects.toString(cursor.getValue(0), "");
            String label = Objects.toString(cursor.getValue(1), "");
            Map.Entry<String, String> pair = new AbstractMap.SimpleImmutableEntry<>(key, label);
            if (cells.containsKey(pair)) {
                throw new UnpivotShapeException("Duplicate key/label pair: " + key + "/" + label);
            }
            cells.put(pair, asString(cursor.getValue(2)));
            keys.add(key);
            labels.add(label);
        }

        for (String label : labels) {
            table.addColumn(label);
        }

        for (String key : keys) {
            Map<String, Object> row = table.newRow();
            row.put(keyColumn, key);
            for (String label : labels) {
                Map.Entry<String, String> pair = new AbstractMap.SimpleImmutableEntry<>(key, label);
                if (cells.containsKey(pair)) {
                    row.put(label, cells.get(pair));
                }
            }
        }
        return table;
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }
}
