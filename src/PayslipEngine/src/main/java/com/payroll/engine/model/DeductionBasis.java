package com.payroll.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Whether a personal deduction amount is expressed per year or per month. */
public enum DeductionBasis {
    @JsonProperty("annual") ANNUAL,
    @JsonProperty("monthly") MONTHLY
}
