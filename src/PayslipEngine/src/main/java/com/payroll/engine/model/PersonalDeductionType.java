package com.payroll.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum PersonalDeductionType {
    @JsonProperty("fixed") FIXED,
    @JsonProperty("percentage") PERCENTAGE,
    @JsonProperty("formula") FORMULA
}
