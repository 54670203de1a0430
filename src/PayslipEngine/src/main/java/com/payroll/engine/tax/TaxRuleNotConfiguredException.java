package com.payroll.engine.tax;

/**
 * No income-tax or social-security rule exists for a jurisdiction and year.
 * Callers raise this before invoking the calculators.
 */
public class TaxRuleNotConfiguredException extends RuntimeException {

    private final String jurisdictionId;
    private final int year;

    public TaxRuleNotConfiguredException(String jurisdictionId, int year) {
        super("Tax rules not configured for jurisdiction " + jurisdictionId + " and year " + year);
        this.jurisdictionId = jurisdictionId;
        this.year = year;
    }

    public String getJurisdictionId() { return jurisdictionId; }
    public int getYear() { return year; }
}
