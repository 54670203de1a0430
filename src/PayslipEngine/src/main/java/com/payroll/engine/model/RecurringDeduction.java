package com.payroll.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Non-statutory deduction taken from every payslip (union dues, loan repayment, ...).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RecurringDeduction {
    @JsonProperty("code")
    private String code;

    @JsonProperty("name")
    private String name;

    @JsonProperty("amount")
    private long amount;

    @JsonProperty("frequency")
    private PayFrequency frequency = PayFrequency.MONTHLY;

    public RecurringDeduction() {}

    public RecurringDeduction(String code, String name, long amount, PayFrequency frequency) {
        this.code = code;
        this.name = name;
        this.amount = amount;
        this.frequency = frequency;
    }

    public String getCode() { return code; }
    public void setCode(String code) { this.code = code; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public long getAmount() { return amount; }
    public void setAmount(long amount) { this.amount = amount; }

    public PayFrequency getFrequency() { return frequency; }
    public void setFrequency(PayFrequency frequency) { this.frequency = frequency; }
}
