package com.crossfire.materializer;

/**
 * Thrown when a result cannot be unpivoted: it does not have exactly three columns
 * (key, pivoted label, value), or it repeats a key/label pair.
 */
public class UnpivotShapeException extends IllegalArgumentException {
    public UnpivotShapeException(String message) {
        super(message);
    }
}
