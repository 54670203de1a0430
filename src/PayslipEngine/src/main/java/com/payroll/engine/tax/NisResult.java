package com.payroll.engine.tax;

public final class NisResult {
    private final long grossEarnings;
    private final long nisableEarnings;
    private final long employeeContribution;
    private final long employerContribution;
    private final long totalContribution;
    private final double employeeRate;
    private final double employerRate;
    private final boolean ceilingApplied;
    private final Long earningsCeiling;
    private final String jurisdictionId;
    private final int year;

    public NisResult(long grossEarnings, long nisableEarnings, long employeeContribution, long employerContribution,
                     long totalContribution, double employeeRate, double employerRate, boolean ceilingApplied,
                     Long earningsCeiling, String jurisdictionId, int year) {
        this.grossEarnings = grossEarnings;
        this.nisableEarnings = nisableEarnings;
        this.employeeContribution = employeeContribution;
        this.employerContribution = employerContribution;
        this.totalContribution = totalContribution;
        this.employeeRate = employeeRate;
        this.employerRate = employerRate;
        this.ceilingApplied = ceilingApplied;
        this.earningsCeiling = earningsCeiling;
        this.jurisdictionId = jurisdictionId;
        this.year = year;
    }

    public long getGrossEarnings() { return grossEarnings; }
    public long getNisableEarnings() { return nisableEarnings; }
    public long getEmployeeContribution() { return employeeContribution; }
    public long getEmployerContribution() { return employerContribution; }
    public long getTotalContribution() { return totalContribution; }
    public double getEmployeeRate() { return employeeRate; }
    public double getEmployerRate() { return employerRate; }
    public boolean isCeilingApplied() { return ceilingApplied; }
    public Long getEarningsCeiling() { return earningsCeiling; }
    public String getJurisdictionId() { return jurisdictionId; }
    public int getYear() { return year; }
}
