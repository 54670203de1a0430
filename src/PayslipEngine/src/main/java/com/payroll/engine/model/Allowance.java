package com.payroll.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Allowance {
    @JsonProperty("code")
    private String code;

    @JsonProperty("name")
    private String name;

    @JsonProperty("amount")
    private long amount;

    @JsonProperty("frequency")
    private PayFrequency frequency = PayFrequency.MONTHLY;

    @JsonProperty("isTaxable")
    private boolean isTaxable = true;

    public Allowance() {}

    public Allowance(String code, String name, long amount, PayFrequency frequency, boolean isTaxable) {
        this.code = code;
        this.name = name;
        this.amount = amount;
        this.frequency = frequency;
        this.isTaxable = isTaxable;
    }

    public String getCode() { return code; }
    public void setCode(String code) { this.code = code; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public long getAmount() { return amount; }
    public void setAmount(long amount) { this.amount = amount; }

    public PayFrequency getFrequency() { return frequency; }
    public void setFrequency(PayFrequency frequency) { this.frequency = frequency; }

    public boolean isTaxable() { return isTaxable; }
    public void setTaxable(boolean taxable) { isTaxable = taxable; }
}
