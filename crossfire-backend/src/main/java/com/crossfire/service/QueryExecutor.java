package com.crossfire.service;

import com.crossfire.materializer.TabularCursor;

import java.util.function.Function;

/**
 * Execution backend for compiled query text.
 */
public interface QueryExecutor {

    /**
     * Runs a query and hands its result cursor to {@code handler}. The cursor is only valid inside
     * the handler.
     *
     * @param queryText compiled query
     * @param handler consumer of the cursor; receives null when the statement produced no result set
     * @param <R> handler result type
     * @return handler result
     */
    <R> R execute(String queryText, Function<TabularCursor, R> handler);
}
