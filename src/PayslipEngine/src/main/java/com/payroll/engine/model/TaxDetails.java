package com.payroll.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * PAYE audit trail kept on the payslip, used to rebuild retroactive-adjustment diffs.
 */
public final class TaxDetails {
    @JsonProperty("jurisdictionId")
    private final String jurisdictionId;

    @JsonProperty("taxYear")
    private final int taxYear;

    @JsonProperty("annualGross")
    private final long annualGross;

    @JsonProperty("personalDeduction")
    private final long personalDeduction;

    @JsonProperty("taxBands")
    private final List<BandAllocation> taxBands;

    @JsonProperty("annualTax")
    private final long annualTax;

    @JsonProperty("monthlyTax")
    private final long monthlyTax;

    public TaxDetails(String jurisdictionId, int taxYear, long annualGross, long personalDeduction,
                      List<BandAllocation> taxBands, long annualTax, long monthlyTax) {
        this.jurisdictionId = jurisdictionId;
        this.taxYear = taxYear;
        this.annualGross = annualGross;
        this.personalDeduction = personalDeduction;
        this.taxBands = List.copyOf(taxBands);
        this.annualTax = annualTax;
        this.monthlyTax = monthlyTax;
    }

    public String getJurisdictionId() { return jurisdictionId; }
    public int getTaxYear() { return taxYear; }
    public long getAnnualGross() { return annualGross; }
    public long getPersonalDeduction() { return personalDeduction; }
    public List<BandAllocation> getTaxBands() { return taxBands; }
    public long getAnnualTax() { return annualTax; }
    public long getMonthlyTax() { return monthlyTax; }
}
