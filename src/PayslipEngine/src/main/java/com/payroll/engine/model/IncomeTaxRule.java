package com.payroll.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.payroll.engine.rounding.RoundingMode;

import java.util.ArrayList;
import java.util.List;

/**
 * PAYE rule for one jurisdiction and tax year.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IncomeTaxRule {
    @JsonProperty("jurisdictionId")
    private String jurisdictionId;

    @JsonProperty("taxYear")
    private int taxYear;

    @JsonProperty("taxBands")
    private List<TaxBand> taxBands = new ArrayList<>();

    @JsonProperty("personalDeduction")
    private PersonalDeduction personalDeduction;

    @JsonProperty("periodization")
    private Periodization periodization = Periodization.ANNUALIZED;

    @JsonProperty("roundingMode")
    private RoundingMode roundingMode = RoundingMode.NEAREST;

    @JsonProperty("roundingPrecision")
    private int roundingPrecision = 1;

    public IncomeTaxRule() {}

    public IncomeTaxRule(String jurisdictionId, int taxYear, List<TaxBand> taxBands,
                         PersonalDeduction personalDeduction) {
        this.jurisdictionId = jurisdictionId;
        this.taxYear = taxYear;
        this.taxBands = taxBands;
        this.personalDeduction = personalDeduction;
    }

    public String getJurisdictionId() { return jurisdictionId; }
    public void setJurisdictionId(String jurisdictionId) { this.jurisdictionId = jurisdictionId; }

    public int getTaxYear() { return taxYear; }
    public void setTaxYear(int taxYear) { this.taxYear = taxYear; }

    public List<TaxBand> getTaxBands() { return taxBands; }
    public void setTaxBands(List<TaxBand> taxBands) { this.taxBands = taxBands; }

    public PersonalDeduction getPersonalDeduction() { return personalDeduction; }
    public void setPersonalDeduction(PersonalDeduction personalDeduction) { this.personalDeduction = personalDeduction; }

    public Periodization getPeriodization() { return periodization; }
    public void setPeriodization(Periodization periodization) { this.periodization = periodization; }

    public RoundingMode getRoundingMode() { return roundingMode; }
    public void setRoundingMode(RoundingMode roundingMode) { this.roundingMode = roundingMode; }

    public int getRoundingPrecision() { return roundingPrecision; }
    public void setRoundingPrecision(int roundingPrecision) { this.roundingPrecision = roundingPrecision; }
}
