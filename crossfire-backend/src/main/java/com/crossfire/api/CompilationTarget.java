package com.crossfire.api;

/**
 * Query languages a {@link QueryRequest} can be compiled to.
 */
public enum CompilationTarget {
    MDX,
    DAX
}
