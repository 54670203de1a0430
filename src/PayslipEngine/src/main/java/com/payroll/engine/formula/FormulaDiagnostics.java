package com.payroll.engine.formula;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Out-of-band channel for formulas that failed and were evaluated as 0.
 */
@FunctionalInterface
public interface FormulaDiagnostics {

    void onFailure(String formula, Map<String, Double> variables, FormulaException cause);

    static FormulaDiagnostics logging() {
        Logger log = LoggerFactory.getLogger(FormulaEvaluator.class);
        return (formula, variables, cause) ->
            log.warn("Formula '{}' evaluated as 0 ({}), variables={}", formula, cause.getMessage(), variables);
    }
}
