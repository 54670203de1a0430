package com.payroll.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.payroll.engine.rounding.RoundingMode;

/**
 * NIS contribution rule for one jurisdiction and year. Floor and ceiling are per-period cents.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SocialSecurityRule {
    @JsonProperty("jurisdictionId")
    private String jurisdictionId;

    @JsonProperty("year")
    private int year;

    // Stored upstream as decimal strings; Jackson coerces "0.056" to a double.
    @JsonProperty("employeeRate")
    private double employeeRate;

    @JsonProperty("employerRate")
    private double employerRate;

    @JsonProperty("earningsFloor")
    private Long earningsFloor;

    @JsonProperty("earningsCeiling")
    private Long earningsCeiling;

    @JsonProperty("roundingMode")
    private RoundingMode roundingMode = RoundingMode.NEAREST;

    @JsonProperty("roundingPrecision")
    private int roundingPrecision = 1;

    public SocialSecurityRule() {}

    public SocialSecurityRule(String jurisdictionId, int year, double employeeRate, double employerRate) {
        this.jurisdictionId = jurisdictionId;
        this.year = year;
        this.employeeRate = employeeRate;
        this.employerRate = employerRate;
    }

    public String getJurisdictionId() { return jurisdictionId; }
    public void setJurisdictionId(String jurisdictionId) { this.jurisdictionId = jurisdictionId; }

    public int getYear() { return year; }
    public void setYear(int year) { this.year = year; }

    public double getEmployeeRate() { return employeeRate; }
    public void setEmployeeRate(double employeeRate) { this.employeeRate = employeeRate; }

    public double getEmployerRate() { return employerRate; }
    public void setEmployerRate(double employerRate) { this.employerRate = employerRate; }

    public Long getEarningsFloor() { return earningsFloor; }
    public void setEarningsFloor(Long earningsFloor) { this.earningsFloor = earningsFloor; }

    public Long getEarningsCeiling() { return earningsCeiling; }
    public void setEarningsCeiling(Long earningsCeiling) { this.earningsCeiling = earningsCeiling; }

    public RoundingMode getRoundingMode() { return roundingMode; }
    public void setRoundingMode(RoundingMode roundingMode) { this.roundingMode = roundingMode; }

    public int getRoundingPrecision() { return roundingPrecision; }
    public void setRoundingPrecision(int roundingPrecision) { this.roundingPrecision = roundingPrecision; }
}
