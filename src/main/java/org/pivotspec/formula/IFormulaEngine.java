package org.pivotspec.formula;

/**
 * Expression engine behind custom columns and measures.
 * <p>
 * The compiler treats the engine as a black box: it only compiles formulas and asks which
 * columns they reference.
 */
public interface IFormulaEngine {

    /**
     * Compiles a formula.
     *
     * @param formula formula text
     * @return an evaluable formula
     * @throws FormulaEvaluationException if the formula does not parse
     */
    ICompiledFormula compile(String formula) throws FormulaEvaluationException;

    /**
     * Lists the columns a formula references.
     *
     * @param formula formula text
     * @return row and range references
     */
    FormulaReferences parseReferences(String formula);
}
