package com.payroll.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public final class EarningsLine {
    @JsonProperty("code")
    private final String code;

    @JsonProperty("name")
    private final String name;

    @JsonProperty("amount")
    private final long amount;

    @JsonProperty("isTaxable")
    private final boolean taxable;

    @JsonProperty("isNisable")
    private final boolean nisable;

    public EarningsLine(String code, String name, long amount, boolean taxable, boolean nisable) {
        this.code = code;
        this.name = name;
        this.amount = amount;
        this.taxable = taxable;
        this.nisable = nisable;
    }

    public String getCode() { return code; }
    public String getName() { return name; }
    public long getAmount() { return amount; }
    public boolean isTaxable() { return taxable; }
    public boolean isNisable() { return nisable; }
}
