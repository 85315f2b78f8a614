package com.crossfire.materializer;

/**
 * Forward-only, pull-based source of result rows with a fixed set of named fields.
 *
 * <p>Rows are consumed once; a cursor is never rewound.
 */
public interface TabularCursor {

    int getFieldCount();

    /**
     * Raw field name as reported by the execution backend.
     *
     * @param index 0-based field index
     * @return field name
     */
    String getName(int index);

    /**
     * Advances to the next row.
     *
     * @return false when the cursor is exhausted
     */
    boolean read();

    /**
     * Value of a field in the current row.
     *
     * @param index 0-based field index
     * @return native value, may be null
     */
    Object getValue(int index);
}
