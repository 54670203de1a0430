package com.payroll.engine.tax;

import com.payroll.engine.model.BandAllocation;

import java.util.List;

/**
 * Outcome of an annualized PAYE calculation. Rates are percentages.
 */
public final class PayeResult {
    private final long annualGross;
    private final long personalDeduction;
    private final long taxableIncome;
    private final List<BandAllocation> taxBands;
    private final long annualTax;
    private final long monthlyTax;
    private final double effectiveTaxRate;
    private final double marginalTaxRate;
    private final String jurisdictionId;
    private final int taxYear;

    public PayeResult(long annualGross, long personalDeduction, long taxableIncome, List<BandAllocation> taxBands,
                      long annualTax, long monthlyTax, double effectiveTaxRate, double marginalTaxRate,
                      String jurisdictionId, int taxYear) {
        this.annualGross = annualGross;
        this.personalDeduction = personalDeduction;
        this.taxableIncome = taxableIncome;
        this.taxBands = List.copyOf(taxBands);
        this.annualTax = annualTax;
        this.monthlyTax = monthlyTax;
        this.effectiveTaxRate = effectiveTaxRate;
        this.marginalTaxRate = marginalTaxRate;
        this.jurisdictionId = jurisdictionId;
        this.taxYear = taxYear;
    }

    public long getAnnualGross() { return annualGross; }
    public long getPersonalDeduction() { return personalDeduction; }
    public long getTaxableIncome() { return taxableIncome; }
    public List<BandAllocation> getTaxBands() { return taxBands; }
    public long getAnnualTax() { return annualTax; }
    public long getMonthlyTax() { return monthlyTax; }
    public double getEffectiveTaxRate() { return effectiveTaxRate; }
    public double getMarginalTaxRate() { return marginalTaxRate; }
    public String getJurisdictionId() { return jurisdictionId; }
    public int getTaxYear() { return taxYear; }
}
