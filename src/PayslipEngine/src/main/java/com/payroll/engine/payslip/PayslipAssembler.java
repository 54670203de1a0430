package com.payroll.engine.payslip;

import com.payroll.engine.model.Allowance;
import com.payroll.engine.model.DeductionLine;
import com.payroll.engine.model.EarningsLine;
import com.payroll.engine.model.Employee;
import com.payroll.engine.model.IncomeTaxRule;
import com.payroll.engine.model.PayFrequency;
import com.payroll.engine.model.PayrollRun;
import com.payroll.engine.model.Payslip;
import com.payroll.engine.model.PayslipResult;
import com.payroll.engine.model.Periodization;
import com.payroll.engine.model.RecurringDeduction;
import com.payroll.engine.model.SocialSecurityRule;
import com.payroll.engine.model.TaxDetails;
import com.payroll.engine.rounding.Rounding;
import com.payroll.engine.tax.NisCalculator;
import com.payroll.engine.tax.NisResult;
import com.payroll.engine.tax.PayeCalculator;
import com.payroll.engine.tax.PayeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Builds one employee's payslip for a monthly payroll run: earnings, PAYE, NIS,
 * other deductions, totals and year-to-date figures.
 *
 * <p>Stateless and safe to share across threads; a run can assemble payslips for
 * many employees in parallel against the same read-only rules.
 */
public class PayslipAssembler {

    private static final Logger log = LoggerFactory.getLogger(PayslipAssembler.class);

    private final PayeCalculator payeCalculator;
    private final NisCalculator nisCalculator;

    public PayslipAssembler() {
        this(new PayeCalculator(), new NisCalculator());
    }

    public PayslipAssembler(PayeCalculator payeCalculator, NisCalculator nisCalculator) {
        this.payeCalculator = Objects.requireNonNull(payeCalculator, "payeCalculator");
        this.nisCalculator = Objects.requireNonNull(nisCalculator, "nisCalculator");
    }

    public PayslipResult calculatePayslip(Employee employee, PayrollRun payrollRun,
                                          IncomeTaxRule incomeTaxRule, SocialSecurityRule nisRule) {
        return calculatePayslip(employee, payrollRun, incomeTaxRule, nisRule, 0, 0, 0);
    }

    /**
     * @param ytdGrossEarnings gross earnings already paid this tax year, before this run
     * @param ytdPaye          PAYE already withheld this tax year
     * @param ytdNis           employee NIS already withheld this tax year
     */
    public PayslipResult calculatePayslip(Employee employee, PayrollRun payrollRun,
                                          IncomeTaxRule incomeTaxRule, SocialSecurityRule nisRule,
                                          long ytdGrossEarnings, long ytdPaye, long ytdNis) {
        Objects.requireNonNull(employee, "employee");
        Objects.requireNonNull(payrollRun, "payrollRun");
        Objects.requireNonNull(incomeTaxRule, "incomeTaxRule");
        Objects.requireNonNull(nisRule, "nisRule");
        PayFrequency salaryFrequency = Objects.requireNonNull(employee.getSalaryFrequency(),
            "salaryFrequency of employee " + employee.getId());

        List<String> warnings = new ArrayList<>();

        // Earnings
        long basePay = PayPeriodConversion.basePay(employee.getBaseSalary(), salaryFrequency);
        List<EarningsLine> earningsBreakdown = new ArrayList<>();
        earningsBreakdown.add(new EarningsLine("BASE", "Base Salary", basePay, true, true));

        long totalAllowances = 0;
        long nisableAllowances = 0;
        if (employee.getAllowances() != null) {
            for (Allowance allowance : employee.getAllowances()) {
                long amount = PayPeriodConversion.recurringAmount(allowance.getAmount(), allowance.getFrequency());
                totalAllowances += amount;
                // NIS base ignores the allowance's taxable flag
                nisableAllowances += amount;
                earningsBreakdown.add(new EarningsLine(
                    allowance.getCode(), allowance.getName(), amount, allowance.isTaxable(), true));
            }
        }
        long grossEarnings = basePay + totalAllowances;

        // PAYE
        long annualGross = grossEarnings * PayPeriodConversion.MONTHS_PER_YEAR;
        int dependents = employee.getTaxSettings() != null && employee.getTaxSettings().getNumberOfDependents() != null
            ? employee.getTaxSettings().getNumberOfDependents()
            : 0;
        PayeResult paye = payeCalculator.calculate(annualGross, incomeTaxRule, dependents);
        long payeAmount = paye.getMonthlyTax();
        long taxableIncome = Rounding.toCents((double) paye.getTaxableIncome() / PayPeriodConversion.MONTHS_PER_YEAR);

        // NIS
        long nisableEarnings = basePay + nisableAllowances;
        NisResult nis = nisCalculator.calculate(nisableEarnings, nisRule);
        long nisEmployee = nis.getEmployeeContribution();
        long nisEmployer = nis.getEmployerContribution();

        // Other deductions
        List<DeductionLine> deductionsBreakdown = new ArrayList<>();
        long otherDeductions = 0;
        if (employee.getDeductions() != null) {
            for (RecurringDeduction deduction : employee.getDeductions()) {
                long amount = PayPeriodConversion.recurringAmount(deduction.getAmount(), deduction.getFrequency());
                otherDeductions += amount;
                deductionsBreakdown.add(new DeductionLine(deduction.getCode(), deduction.getName(), amount));
            }
        }

        // Totals
        long totalDeductions = payeAmount + nisEmployee + otherDeductions;
        long netPay = grossEarnings - totalDeductions;

        // YTD net pay is derived from the other YTD figures, never carried forward
        long newYtdGross = ytdGrossEarnings + grossEarnings;
        long newYtdPaye = ytdPaye + payeAmount;
        long newYtdNis = ytdNis + nisEmployee;
        long newYtdNetPay = newYtdGross - newYtdPaye - newYtdNis;

        if (netPay < 0) {
            warnings.add(String.format(Locale.ROOT,
                "Negative net pay (%.2f) - deductions exceed gross earnings", netPay / 100.0));
        }
        if (isBlank(employee.getTaxId())) {
            warnings.add("Employee missing Tax ID (TIN)");
        }
        if (isBlank(employee.getNisNumber())) {
            warnings.add("Employee missing NIS Number");
        }
        if (salaryFrequency == PayFrequency.WEEKLY) {
            warnings.add("Weekly salary frequency is not converted to the monthly pay period");
        }
        Periodization periodization = incomeTaxRule.getPeriodization();
        if (periodization != null && periodization != Periodization.ANNUALIZED) {
            warnings.add("Periodization " + periodization.name().toLowerCase(Locale.ROOT)
                + " is not supported; annualized method applied");
        }

        Payslip payslip = Payslip.builder()
            .payrollRunId(payrollRun.getId())
            .employeeId(employee.getId())
            .organizationId(employee.getOrganizationId())
            .periodStart(payrollRun.getPeriodStart())
            .periodEnd(payrollRun.getPeriodEnd())
            .payDate(payrollRun.getPayDate())
            .basePay(basePay)
            .allowances(totalAllowances)
            .grossEarnings(grossEarnings)
            .earningsBreakdown(earningsBreakdown)
            .taxableIncome(taxableIncome)
            .payeAmount(payeAmount)
            .nisableEarnings(nisableEarnings)
            .nisEmployee(nisEmployee)
            .nisEmployer(nisEmployer)
            .taxDetails(new TaxDetails(
                incomeTaxRule.getJurisdictionId(),
                incomeTaxRule.getTaxYear(),
                annualGross,
                paye.getPersonalDeduction(),
                paye.getTaxBands(),
                paye.getAnnualTax(),
                paye.getMonthlyTax()))
            .otherDeductions(otherDeductions)
            .deductionsBreakdown(deductionsBreakdown)
            .totalDeductions(totalDeductions)
            .netPay(netPay)
            .ytdGrossEarnings(newYtdGross)
            .ytdNetPay(newYtdNetPay)
            .ytdPaye(newYtdPaye)
            .ytdNis(newYtdNis)
            .build();

        log.debug("Payslip calculated: employee={}, run={}, gross={}, net={}, warnings={}",
            employee.getId(), payrollRun.getId(), grossEarnings, netPay, warnings.size());
        return new PayslipResult(payslip, warnings);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
