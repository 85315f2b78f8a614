package com.crossfire.materializer;

import java.util.List;

/**
 * In-memory {@link TabularCursor} over prepared rows.
 */
public class ListTabularCursor implements TabularCursor {
    private final List<String> names;
    private final List<List<Object>> rows;
    private int position = -1;

    public ListTabularCursor(List<String> names, List<List<Object>> rows) {
        this.names = List.copyOf(names);
        this.rows = rows;
    }

    @Override
    public int getFieldCount() {
        return names.size();
    }

    @Override
    public String getName(int index) {
        return names.get(index);
    }

    @Override
    public boolean read() {
        if (position + 1 >= rows.size()) {
            return false;
        }
        position++;
        return true;
    }

    @Override
    public Object getValue(int index) {
        if (position < 0 || position >= rows.size()) {
            throw new IllegalStateException("Cursor is not positioned on a row");
        }
        return rows.get(position).get(index);
    }
}
