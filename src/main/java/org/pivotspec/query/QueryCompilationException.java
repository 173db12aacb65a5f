package org.pivotspec.query;

/**
 * Thrown when widget state cannot be compiled into a query specification.
 */
public class QueryCompilationException extends RuntimeException {

    public QueryCompilationException(String message) {
        super(message);
    }

    public QueryCompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
