package com.payroll.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum PayFrequency {
    @JsonProperty("monthly") MONTHLY,
    @JsonProperty("biweekly") BIWEEKLY,
    @JsonProperty("weekly") WEEKLY,
    @JsonProperty("annual") ANNUAL
}
