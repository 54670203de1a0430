package com.payroll.engine.payslip;

import com.payroll.engine.model.PayFrequency;
import com.payroll.engine.rounding.Rounding;

/**
 * Converts amounts stated at an employee's frequency into the monthly pay period
 * that payroll runs are calculated on.
 *
 * <p>Base pay and recurring allowances/deductions convert differently, and weekly
 * salaries are not converted at all. Both rules are kept as they are until the
 * product defines per-frequency pay periods; callers flag weekly salaries.
 */
final class PayPeriodConversion {

    static final int MONTHS_PER_YEAR = 12;

    private PayPeriodConversion() {}

    static long basePay(long baseSalary, PayFrequency frequency) {
        return switch (frequency) {
            case MONTHLY -> baseSalary;
            case ANNUAL -> Rounding.toCents((double) baseSalary / MONTHS_PER_YEAR);
            case BIWEEKLY -> baseSalary * 2;
            case WEEKLY -> baseSalary;
        };
    }

    static long recurringAmount(long amount, PayFrequency frequency) {
        return switch (frequency) {
            case ANNUAL -> Rounding.toCents((double) amount / MONTHS_PER_YEAR);
            case MONTHLY, BIWEEKLY, WEEKLY -> amount;
        };
    }
}
