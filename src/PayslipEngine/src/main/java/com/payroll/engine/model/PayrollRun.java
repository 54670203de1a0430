package com.payroll.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payroll run period. Dates are ISO-8601 strings copied onto the payslip as-is.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PayrollRun {
    @JsonProperty("id")
    private String id;

    @JsonProperty("periodStart")
    private String periodStart;

    @JsonProperty("periodEnd")
    private String periodEnd;

    @JsonProperty("payDate")
    private String payDate;

    public PayrollRun() {}

    public PayrollRun(String id, String periodStart, String periodEnd, String payDate) {
        this.id = id;
        this.periodStart = periodStart;
        this.periodEnd = periodEnd;
        this.payDate = payDate;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getPeriodStart() { return periodStart; }
    public void setPeriodStart(String periodStart) { this.periodStart = periodStart; }

    public String getPeriodEnd() { return periodEnd; }
    public void setPeriodEnd(String periodEnd) { this.periodEnd = periodEnd; }

    public String getPayDate() { return payDate; }
    public void setPayDate(String payDate) { this.payDate = payDate; }
}
