package com.crossfire.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Response shapes a query result can be materialized into.
 *
 * <p>The numeric code is the wire value clients send and is part of the request fingerprint,
 * so codes must never be reassigned.
 */
public enum OutputFormat {
    /** JSON array of row objects, cell values kept in their native type. */
    TABLE(0),
    /** Column name to list of string values. */
    DICTIONARY(1),
    /** Array of key/value pairs built from the first two columns only. */
    KEY_VALUE_ARRAY(2),
    /** Header row followed by one string row per result row. */
    TWO_DIMENSIONAL_ARRAY(3),
    /** Table with the second column's values pivoted into columns. */
    SIMPLE_UNPIVOTED_TABLE(4);

    private final int code;

    OutputFormat(int code) {
        this.code = code;
    }

    @JsonValue
    public int getCode() {
        return code;
    }

    @JsonCreator
    public static OutputFormat fromCode(int code) {
        for (OutputFormat format : values()) {
            if (format.code == code) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown output format: " + code);
    }
}
