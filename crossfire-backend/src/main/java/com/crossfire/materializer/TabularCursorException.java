package com.crossfire.materializer;

/**
 * Thrown when a cursor cannot read from its underlying source.
 */
public class TabularCursorException extends RuntimeException {
    public TabularCursorException(String message, Throwable cause) {
        super(message, cause);
    }
}
