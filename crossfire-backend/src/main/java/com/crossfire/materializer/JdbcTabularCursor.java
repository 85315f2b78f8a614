package com.crossfire.materializer;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;

/**
 * {@link TabularCursor} over a JDBC {@link ResultSet}. The result set stays owned by the caller.
 */
public class JdbcTabularCursor implements TabularCursor {
    private final ResultSet rs;
    private final ResultSetMetaData metaData;
    private final int fieldCount;

    public JdbcTabularCursor(ResultSet rs) {
        this.rs = rs;
        try {
            this.metaData = rs.getMetaData();
            this.fieldCount = metaData.getColumnCount();
        } catch (SQLException e) {
            throw new TabularCursorException("Failed to read result set metadata", e);
        }
    }

    @Override
    public int getFieldCount() {
        return fieldCount;
    }

    @Override
    public String getName(int index) {
        try {
            return metaData.getColumnLabel(index + 1);
        } catch (SQLException e) {
            throw new TabularCursorException("Failed to read column name at index " + index, e);
        }
    }

    @Override
    public boolean read() {
        try {
            return rs.next();
        } catch (SQLException e) {
            throw new TabularCursorException("Failed to advance result set", e);
        }
    }

    @Override
    public Object getValue(int index) {
        try {
            return rs.getObject(index + 1);
        } catch (SQLException e) {
            throw new TabularCursorException("Failed to read value at index " + index, e);
        }
    }
}
