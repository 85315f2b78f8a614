package com.crossfire.service;

/**
 * Thrown when the model server cannot be reached, as opposed to a query it rejected.
 * Jobs report the server as offline when they see it.
 */
public class ModelServerConnectionException extends QueryExecutionException {
    public ModelServerConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
