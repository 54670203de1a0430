package com.payroll.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How an income-tax rule spreads annual tax over pay periods.
 * Only {@link #ANNUALIZED} has its own calculation path.
 */
public enum Periodization {
    @JsonProperty("annualized") ANNUALIZED,
    @JsonProperty("true_period") TRUE_PERIOD,
    @JsonProperty("cumulative") CUMULATIVE
}
