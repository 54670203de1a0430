package com.payroll.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A computed payslip and the advisory warnings raised while computing it.
 */
public final class PayslipResult {
    @JsonProperty("payslip")
    private final Payslip payslip;

    @JsonProperty("warnings")
    private final List<String> warnings;

    public PayslipResult(Payslip payslip, List<String> warnings) {
        this.payslip = payslip;
        this.warnings = List.copyOf(warnings);
    }

    public Payslip getPayslip() { return payslip; }
    public List<String> getWarnings() { return warnings; }
}
