package com.payroll.processor.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.payroll.engine.model.Employee;
import com.payroll.engine.model.PayrollRun;

/**
 * Request to calculate one employee's payslip for a payroll run in draft.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PayslipRequest {
    @JsonProperty("employee")
    private Employee employee;

    @JsonProperty("payrollRun")
    private PayrollRun payrollRun;

    @JsonProperty("jurisdictionId")
    private String jurisdictionId;

    public PayslipRequest() {}

    public PayslipRequest(Employee employee, PayrollRun payrollRun, String jurisdictionId) {
        this.employee = employee;
        this.payrollRun = payrollRun;
        this.jurisdictionId = jurisdictionId;
    }

    public Employee getEmployee() { return employee; }
    public void setEmployee(Employee employee) { this.employee = employee; }

    public PayrollRun getPayrollRun() { return payrollRun; }
    public void setPayrollRun(PayrollRun payrollRun) { this.payrollRun = payrollRun; }

    public String getJurisdictionId() { return jurisdictionId; }
    public void setJurisdictionId(String jurisdictionId) { this.jurisdictionId = jurisdictionId; }
}
