package com.payroll.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Portion of taxable income that fell into one tax band. {@code tax} is the
 * unrounded contribution; only the summed annual tax is rounded.
 */
public final class BandAllocation {
    @JsonProperty("bandName")
    private final String bandName;

    @JsonProperty("amount")
    private final long amount;

    @JsonProperty("rate")
    private final double rate;

    @JsonProperty("tax")
    private final double tax;

    public BandAllocation(String bandName, long amount, double rate, double tax) {
        this.bandName = bandName;
        this.amount = amount;
        this.rate = rate;
        this.tax = tax;
    }

    public String getBandName() { return bandName; }
    public long getAmount() { return amount; }
    public double getRate() { return rate; }
    public double getTax() { return tax; }
}
