package com.payroll.engine.rounding;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Rounding policy configured per jurisdiction rule. Audits require the same
 * policy to be re-applied exactly when a payslip is recomputed.
 */
public enum RoundingMode {
    @JsonProperty("nearest") NEAREST,
    @JsonProperty("floor") FLOOR,
    @JsonProperty("ceil") CEIL,
    @JsonProperty("banker") BANKER
}
