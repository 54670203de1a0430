package com.payroll.engine.formula;

import java.util.Map;
import java.util.Objects;

/**
 * Evaluates jurisdiction-configured deduction formulas such as
 * {@code MAX(1560000, {annualGross} * 0.333)}.
 *
 * <p>Supported syntax: numbers, {@code {variable}} placeholders, {@code + - * /},
 * parentheses and the functions {@code MAX}, {@code MIN}, {@code ROUND} and
 * {@code IF(left OP right, then, else)} with {@code OP} one of
 * {@code > < >= <= == !=}. Function names are case-insensitive.
 *
 * <p>A formula that cannot be evaluated yields {@code 0} so a misconfigured
 * jurisdiction degrades to "no deduction". Each such failure is reported to the
 * {@link FormulaDiagnostics} hook.
 */
public class FormulaEvaluator {

    private final FormulaDiagnostics diagnostics;

    public FormulaEvaluator() {
        this(FormulaDiagnostics.logging());
    }

    public FormulaEvaluator(FormulaDiagnostics diagnostics) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public double evaluate(String formula, Map<String, Double> variables) {
        try {
            if (formula == null || formula.isBlank()) {
                throw new FormulaException("empty formula");
            }
            double result = new FormulaParser(formula, variables == null ? Map.of() : variables).parse();
            if (!Double.isFinite(result)) {
                throw new FormulaException("result is not a finite number");
            }
            return result;
        } catch (FormulaException e) {
            diagnostics.onFailure(formula, variables, e);
            return 0;
        }
    }
}
