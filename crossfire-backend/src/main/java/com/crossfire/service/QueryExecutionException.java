package com.crossfire.service;

/**
 * Thrown when the execution backend fails to run a query.
 */
public class QueryExecutionException extends RuntimeException {
    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
