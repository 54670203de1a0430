package com.payroll.engine.tax;

import java.util.List;

public class InvalidTaxRuleException extends RuntimeException {

    private final List<String> problems;

    public InvalidTaxRuleException(String ruleDescription, List<String> problems) {
        super("Invalid " + ruleDescription + ": " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() { return problems; }
}
