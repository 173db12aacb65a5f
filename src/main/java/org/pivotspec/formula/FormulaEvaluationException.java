package org.pivotspec.formula;

/**
 * Thrown by a formula engine when a formula cannot be compiled or evaluated.
 */
public class FormulaEvaluationException extends Exception {

    public FormulaEvaluationException(String message) {
        super(message);
    }

    public FormulaEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
