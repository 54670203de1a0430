package com.payroll.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One employee's payslip for one payroll run. All amounts are integer cents.
 *
 * <p>Instances are immutable; build them with {@link #builder()}. Persisting the
 * payslip and folding it into run totals is left to the caller.
 */
public final class Payslip {
    @JsonProperty("payrollRunId")
    private final String payrollRunId;

    @JsonProperty("employeeId")
    private final String employeeId;

    @JsonProperty("organizationId")
    private final String organizationId;

    @JsonProperty("periodStart")
    private final String periodStart;

    @JsonProperty("periodEnd")
    private final String periodEnd;

    @JsonProperty("payDate")
    private final String payDate;

    @JsonProperty("basePay")
    private final long basePay;

    @JsonProperty("allowances")
    private final long allowances;

    @JsonProperty("grossEarnings")
    private final long grossEarnings;

    @JsonProperty("earningsBreakdown")
    private final List<EarningsLine> earningsBreakdown;

    @JsonProperty("taxableIncome")
    private final long taxableIncome;

    @JsonProperty("payeAmount")
    private final long payeAmount;

    @JsonProperty("nisableEarnings")
    private final long nisableEarnings;

    @JsonProperty("nisEmployee")
    private final long nisEmployee;

    @JsonProperty("nisEmployer")
    private final long nisEmployer;

    @JsonProperty("taxDetails")
    private final TaxDetails taxDetails;

    @JsonProperty("otherDeductions")
    private final long otherDeductions;

    @JsonProperty("deductionsBreakdown")
    private final List<DeductionLine> deductionsBreakdown;

    @JsonProperty("totalDeductions")
    private final long totalDeductions;

    @JsonProperty("netPay")
    private final long netPay;

    @JsonProperty("ytdGrossEarnings")
    private final long ytdGrossEarnings;

    @JsonProperty("ytdNetPay")
    private final long ytdNetPay;

    @JsonProperty("ytdPaye")
    private final long ytdPaye;

    @JsonProperty("ytdNis")
    private final long ytdNis;

    @JsonProperty("paymentMethod")
    private final PaymentMethod paymentMethod;

    @JsonProperty("paymentStatus")
    private final PaymentStatus paymentStatus;

    @JsonProperty("hasRetroAdjustments")
    private final int hasRetroAdjustments;

    @JsonProperty("retroAdjustmentAmount")
    private final long retroAdjustmentAmount;

    private Payslip(Builder b) {
        this.payrollRunId = b.payrollRunId;
        this.employeeId = b.employeeId;
        this.organizationId = b.organizationId;
        this.periodStart = b.periodStart;
        this.periodEnd = b.periodEnd;
        this.payDate = b.payDate;
        this.basePay = b.basePay;
        this.allowances = b.allowances;
        this.grossEarnings = b.grossEarnings;
        this.earningsBreakdown = List.copyOf(b.earningsBreakdown);
        this.taxableIncome = b.taxableIncome;
        this.payeAmount = b.payeAmount;
        this.nisableEarnings = b.nisableEarnings;
        this.nisEmployee = b.nisEmployee;
        this.nisEmployer = b.nisEmployer;
        this.taxDetails = b.taxDetails;
        this.otherDeductions = b.otherDeductions;
        this.deductionsBreakdown = List.copyOf(b.deductionsBreakdown);
        this.totalDeductions = b.totalDeductions;
        this.netPay = b.netPay;
        this.ytdGrossEarnings = b.ytdGrossEarnings;
        this.ytdNetPay = b.ytdNetPay;
        this.ytdPaye = b.ytdPaye;
        this.ytdNis = b.ytdNis;
        this.paymentMethod = b.paymentMethod;
        this.paymentStatus = b.paymentStatus;
        this.hasRetroAdjustments = b.hasRetroAdjustments;
        this.retroAdjustmentAmount = b.retroAdjustmentAmount;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getPayrollRunId() { return payrollRunId; }
    public String getEmployeeId() { return employeeId; }
    public String getOrganizationId() { return organizationId; }
    public String getPeriodStart() { return periodStart; }
    public String getPeriodEnd() { return periodEnd; }
    public String getPayDate() { return payDate; }
    public long getBasePay() { return basePay; }
    public long getAllowances() { return allowances; }
    public long getGrossEarnings() { return grossEarnings; }
    public List<EarningsLine> getEarningsBreakdown() { return earningsBreakdown; }
    public long getTaxableIncome() { return taxableIncome; }
    public long getPayeAmount() { return payeAmount; }
    public long getNisableEarnings() { return nisableEarnings; }
    public long getNisEmployee() { return nisEmployee; }
    public long getNisEmployer() { return nisEmployer; }
    public TaxDetails getTaxDetails() { return taxDetails; }
    public long getOtherDeductions() { return otherDeductions; }
    public List<DeductionLine> getDeductionsBreakdown() { return deductionsBreakdown; }
    public long getTotalDeductions() { return totalDeductions; }
    public long getNetPay() { return netPay; }
    public long getYtdGrossEarnings() { return ytdGrossEarnings; }
    public long getYtdNetPay() { return ytdNetPay; }
    public long getYtdPaye() { return ytdPaye; }
    public long getYtdNis() { return ytdNis; }
    public PaymentMethod getPaymentMethod() { return paymentMethod; }
    public PaymentStatus getPaymentStatus() { return paymentStatus; }
    public int getHasRetroAdjustments() { return hasRetroAdjustments; }
    public long getRetroAdjustmentAmount() { return retroAdjustmentAmount; }

    public static final class Builder {
        private String payrollRunId;
        private String employeeId;
        private String organizationId;
        private String periodStart;
        private String periodEnd;
        private String payDate;
        private long basePay;
        private long allowances;
        private long grossEarnings;
        private List<EarningsLine> earningsBreakdown = List.of();
        private long taxableIncome;
        private long payeAmount;
        private long nisableEarnings;
        private long nisEmployee;
        private long nisEmployer;
        private TaxDetails taxDetails;
        private long otherDeductions;
        private List<DeductionLine> deductionsBreakdown = List.of();
        private long totalDeductions;
        private long netPay;
        private long ytdGrossEarnings;
        private long ytdNetPay;
        private long ytdPaye;
        private long ytdNis;
        // New payslips await payment by bank transfer and carry no retro adjustments
        private final PaymentMethod paymentMethod = PaymentMethod.BANK_TRANSFER;
        private final PaymentStatus paymentStatus = PaymentStatus.PENDING;
        private final int hasRetroAdjustments = 0;
        private final long retroAdjustmentAmount = 0;

        private Builder() {}

        public Builder payrollRunId(String payrollRunId) {
            this.payrollRunId = payrollRunId;
            return this;
        }

        public Builder employeeId(String employeeId) {
            this.employeeId = employeeId;
            return this;
        }

        public Builder organizationId(String organizationId) {
            this.organizationId = organizationId;
            return this;
        }

        public Builder periodStart(String periodStart) {
            this.periodStart = periodStart;
            return this;
        }

        public Builder periodEnd(String periodEnd) {
            this.periodEnd = periodEnd;
            return this;
        }

        public Builder payDate(String payDate) {
            this.payDate = payDate;
            return this;
        }

        public Builder basePay(long basePay) {
            this.basePay = basePay;
            return this;
        }

        public Builder allowances(long allowances) {
            this.allowances = allowances;
            return this;
        }

        public Builder grossEarnings(long grossEarnings) {
            this.grossEarnings = grossEarnings;
            return this;
        }

        public Builder earningsBreakdown(List<EarningsLine> earningsBreakdown) {
            this.earningsBreakdown = earningsBreakdown;
            return this;
        }

        public Builder taxableIncome(long taxableIncome) {
            this.taxableIncome = taxableIncome;
            return this;
        }

        public Builder payeAmount(long payeAmount) {
            this.payeAmount = payeAmount;
            return this;
        }

        public Builder nisableEarnings(long nisableEarnings) {
            this.nisableEarnings = nisableEarnings;
            return this;
        }

        public Builder nisEmployee(long nisEmployee) {
            this.nisEmployee = nisEmployee;
            return this;
        }

        public Builder nisEmployer(long nisEmployer) {
            this.nisEmployer = nisEmployer;
            return this;
        }

        public Builder taxDetails(TaxDetails taxDetails) {
            this.taxDetails = taxDetails;
            return this;
        }

        public Builder otherDeductions(long otherDeductions) {
            this.otherDeductions = otherDeductions;
            return this;
        }

        public Builder deductionsBreakdown(List<DeductionLine> deductionsBreakdown) {
            this.deductionsBreakdown = deductionsBreakdown;
            return this;
        }

        public Builder totalDeductions(long totalDeductions) {
            this.totalDeductions = totalDeductions;
            return this;
        }

        public Builder netPay(long netPay) {
            this.netPay = netPay;
            return this;
        }

        public Builder ytdGrossEarnings(long ytdGrossEarnings) {
            this.ytdGrossEarnings = ytdGrossEarnings;
            return this;
        }

        public Builder ytdNetPay(long ytdNetPay) {
            this.ytdNetPay = ytdNetPay;
            return this;
        }

        public Builder ytdPaye(long ytdPaye) {
            this.ytdPaye = ytdPaye;
            return this;
        }

        public Builder ytdNis(long ytdNis) {
            this.ytdNis = ytdNis;
            return this;
        }

        public Payslip build() {
            return new Payslip(this);
        }
    }
}
