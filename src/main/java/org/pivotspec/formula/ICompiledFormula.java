package org.pivotspec.formula;

/**
 * A formula compiled by an {@link IFormulaEngine}.
 */
public interface ICompiledFormula {

    /**
     * Evaluates the formula.
     *
     * @param context row and range values
     * @return the result, may be null
     * @throws FormulaEvaluationException if evaluation fails
     */
    Object exec(FormulaContext context) throws FormulaEvaluationException;

    /**
     * Evaluates the formula with engine diagnostics enabled. Results equal {@link #exec}.
     *
     * @param context row and range values
     * @return the result, may be null
     * @throws FormulaEvaluationException if evaluation fails
     */
    Object execDebug(FormulaContext context) throws FormulaEvaluationException;
}
