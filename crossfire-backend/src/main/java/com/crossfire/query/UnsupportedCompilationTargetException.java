package com.crossfire.query;

import com.crossfire.api.CompilationTarget;

/**
 * Thrown when a request targets a query language that has no compiler.
 */
public class UnsupportedCompilationTargetException extends RuntimeException {
    private final CompilationTarget target;

    /**
     * Create a new exception.
     *
     * @param target requested compilation target
     */
    public UnsupportedCompilationTargetException(CompilationTarget target) {
        super("Compilation target is not implemented: " + target);
        this.target = target;
    }

    public CompilationTarget getTarget() {
        return target;
    }
}
