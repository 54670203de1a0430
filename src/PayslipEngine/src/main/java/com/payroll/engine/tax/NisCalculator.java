package com.payroll.engine.tax;

import com.payroll.engine.model.SocialSecurityRule;
import com.payroll.engine.rounding.Rounding;

import java.util.Objects;

/**
 * Employee and employer social-security (NIS) contributions for one pay period.
 */
public class NisCalculator {

    public NisResult calculate(long grossEarnings, SocialSecurityRule nisRule) {
        Objects.requireNonNull(nisRule, "nisRule");

        long nisableEarnings = grossEarnings;
        boolean ceilingApplied = false;
        Long ceiling = nisRule.getEarningsCeiling();
        if (ceiling != null && grossEarnings > ceiling) {
            nisableEarnings = ceiling;
            ceilingApplied = true;
        }

        // Below the floor nothing is due for the period; contributions are not pro-rated.
        Long floor = nisRule.getEarningsFloor();
        if (floor != null && nisableEarnings < floor) {
            nisableEarnings = 0;
        }

        double employeeContribution = nisableEarnings * nisRule.getEmployeeRate();
        double employerContribution = nisableEarnings * nisRule.getEmployerRate();

        return new NisResult(
            grossEarnings,
            nisableEarnings,
            round(employeeContribution, nisRule),
            round(employerContribution, nisRule),
            round(employeeContribution + employerContribution, nisRule),
            nisRule.getEmployeeRate(),
            nisRule.getEmployerRate(),
            ceilingApplied,
            ceiling,
            nisRule.getJurisdictionId(),
            nisRule.getYear());
    }

    private static long round(double amount, SocialSecurityRule rule) {
        return Rounding.round(amount, rule.getRoundingMode(), rule.getRoundingPrecision());
    }
}
