package com.payroll.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public final class DeductionLine {
    @JsonProperty("code")
    private final String code;

    @JsonProperty("name")
    private final String name;

    @JsonProperty("amount")
    private final long amount;

    public DeductionLine(String code, String name, long amount) {
        this.code = code;
        this.name = name;
        this.amount = amount;
    }

    public String getCode() { return code; }
    public String getName() { return name; }
    public long getAmount() { return amount; }
}
