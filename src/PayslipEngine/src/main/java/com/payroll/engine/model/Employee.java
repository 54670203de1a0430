package com.payroll.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * The employee fields payslip calculation reads. Amounts are in cents.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Employee {
    @JsonProperty("id")
    private String id;

    @JsonProperty("organizationId")
    private String organizationId;

    @JsonProperty("baseSalary")
    private long baseSalary;

    @JsonProperty("salaryFrequency")
    private PayFrequency salaryFrequency = PayFrequency.MONTHLY;

    @JsonProperty("allowances")
    private List<Allowance> allowances = new ArrayList<>();

    @JsonProperty("deductions")
    private List<RecurringDeduction> deductions = new ArrayList<>();

    @JsonProperty("taxSettings")
    private TaxSettings taxSettings;

    @JsonProperty("taxId")
    private String taxId;

    @JsonProperty("nisNumber")
    private String nisNumber;

    public Employee() {}

    public Employee(String id, long baseSalary, PayFrequency salaryFrequency) {
        this.id = id;
        this.baseSalary = baseSalary;
        this.salaryFrequency = salaryFrequency;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getOrganizationId() { return organizationId; }
    public void setOrganizationId(String organizationId) { this.organizationId = organizationId; }

    public long getBaseSalary() { return baseSalary; }
    public void setBaseSalary(long baseSalary) { this.baseSalary = baseSalary; }

    public PayFrequency getSalaryFrequency() { return salaryFrequency; }
    public void setSalaryFrequency(PayFrequency salaryFrequency) { this.salaryFrequency = salaryFrequency; }

    public List<Allowance> getAllowances() { return allowances; }
    public void setAllowances(List<Allowance> allowances) { this.allowances = allowances; }

    public List<RecurringDeduction> getDeductions() { return deductions; }
    public void setDeductions(List<RecurringDeduction> deductions) { this.deductions = deductions; }

    public TaxSettings getTaxSettings() { return taxSettings; }
    public void setTaxSettings(TaxSettings taxSettings) { this.taxSettings = taxSettings; }

    public String getTaxId() { return taxId; }
    public void setTaxId(String taxId) { this.taxId = taxId; }

    public String getNisNumber() { return nisNumber; }
    public void setNisNumber(String nisNumber) { this.nisNumber = nisNumber; }
}
