package org.pivotspec.distinct;

/**
 * Thrown when a call to the query-execution backend fails.
 */
public class BackendException extends Exception {

    public BackendException(String message) {
        super(message);
    }

    public BackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
