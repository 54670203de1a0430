package com.payroll.engine.formula;

/**
 * Raised while parsing or evaluating a deduction formula. Never escapes {@link FormulaEvaluator}.
 */
public class FormulaException extends RuntimeException {

    public FormulaException(String message) {
        super(message);
    }
}
