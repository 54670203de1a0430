package com.payroll.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;

/**
 * Sums of payslip amounts across every employee in a payroll run.
 */
public final class PayrollTotals {
    @JsonProperty("totalGrossEarnings")
    private final long totalGrossEarnings;

    @JsonProperty("totalNetPay")
    private final long totalNetPay;

    @JsonProperty("totalPaye")
    private final long totalPaye;

    @JsonProperty("totalNisEmployee")
    private final long totalNisEmployee;

    @JsonProperty("totalNisEmployer")
    private final long totalNisEmployer;

    @JsonProperty("totalDeductions")
    private final long totalDeductions;

    @JsonProperty("employeeCount")
    private final int employeeCount;

    public PayrollTotals(long totalGrossEarnings, long totalNetPay, long totalPaye, long totalNisEmployee,
                         long totalNisEmployer, long totalDeductions, int employeeCount) {
        this.totalGrossEarnings = totalGrossEarnings;
        this.totalNetPay = totalNetPay;
        this.totalPaye = totalPaye;
        this.totalNisEmployee = totalNisEmployee;
        this.totalNisEmployer = totalNisEmployer;
        this.totalDeductions = totalDeductions;
        this.employeeCount = employeeCount;
    }

    public static PayrollTotals of(Collection<Payslip> payslips) {
        long gross = 0, net = 0, paye = 0, nisEmployee = 0, nisEmployer = 0, deductions = 0;
        for (Payslip p : payslips) {
            gross += p.getGrossEarnings();
            net += p.getNetPay();
            paye += p.getPayeAmount();
            nisEmployee += p.getNisEmployee();
            nisEmployer += p.getNisEmployer();
            deductions += p.getTotalDeductions();
        }
        return new PayrollTotals(gross, net, paye, nisEmployee, nisEmployer, deductions, payslips.size());
    }

    public long getTotalGrossEarnings() { return totalGrossEarnings; }
    public long getTotalNetPay() { return totalNetPay; }
    public long getTotalPaye() { return totalPaye; }
    public long getTotalNisEmployee() { return totalNisEmployee; }
    public long getTotalNisEmployer() { return totalNisEmployer; }
    public long getTotalDeductions() { return totalDeductions; }
    public int getEmployeeCount() { return employeeCount; }
}
