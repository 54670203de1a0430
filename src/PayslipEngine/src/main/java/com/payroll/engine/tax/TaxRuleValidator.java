package com.payroll.engine.tax;

import com.payroll.engine.model.IncomeTaxRule;
import com.payroll.engine.model.PersonalDeduction;
import com.payroll.engine.model.SocialSecurityRule;
import com.payroll.engine.model.TaxBand;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Checks rule records when they are ingested. The calculators assume rules
 * have passed through here and do not re-check bands or rates.
 */
public final class TaxRuleValidator {

    private TaxRuleValidator() {}

    public static void validate(IncomeTaxRule rule) {
        List<String> problems = new ArrayList<>();
        if (rule.getJurisdictionId() == null || rule.getJurisdictionId().isBlank()) {
            problems.add("jurisdictionId is required");
        }
        validateBands(rule.getTaxBands(), problems);
        validatePersonalDeduction(rule.getPersonalDeduction(), problems);
        if (rule.getRoundingMode() == null) {
            problems.add("roundingMode is required");
        }
        if (rule.getRoundingPrecision() < 1) {
            problems.add("roundingPrecision must be at least 1");
        }
        if (rule.getPeriodization() == null) {
            problems.add("periodization is required");
        }
        if (!problems.isEmpty()) {
            throw new InvalidTaxRuleException(
                "income tax rule " + rule.getJurisdictionId() + "/" + rule.getTaxYear(), problems);
        }
    }

    public static void validate(SocialSecurityRule rule) {
        List<String> problems = new ArrayList<>();
        if (rule.getJurisdictionId() == null || rule.getJurisdictionId().isBlank()) {
            problems.add("jurisdictionId is required");
        }
        checkRate("employeeRate", rule.getEmployeeRate(), problems);
        checkRate("employerRate", rule.getEmployerRate(), problems);
        if (rule.getEarningsCeiling() != null && rule.getEarningsCeiling() <= 0) {
            problems.add("earningsCeiling must be positive");
        }
        if (rule.getEarningsFloor() != null && rule.getEarningsFloor() < 0) {
            problems.add("earningsFloor must not be negative");
        }
        if (rule.getEarningsFloor() != null && rule.getEarningsCeiling() != null
                && rule.getEarningsFloor() > rule.getEarningsCeiling()) {
            problems.add("earningsFloor exceeds earningsCeiling");
        }
        if (rule.getRoundingMode() == null) {
            problems.add("roundingMode is required");
        }
        if (rule.getRoundingPrecision() < 1) {
            problems.add("roundingPrecision must be at least 1");
        }
        if (!problems.isEmpty()) {
            throw new InvalidTaxRuleException(
                "social security rule " + rule.getJurisdictionId() + "/" + rule.getYear(), problems);
        }
    }

    private static void validateBands(List<TaxBand> taxBands, List<String> problems) {
        if (taxBands == null || taxBands.isEmpty()) {
            problems.add("at least one tax band is required");
            return;
        }
        List<TaxBand> bands = new ArrayList<>(taxBands);
        bands.sort(Comparator.comparingInt(TaxBand::getOrder));

        long expectedMin = 0;
        for (int i = 0; i < bands.size(); i++) {
            TaxBand band = bands.get(i);
            String label = band.getName() != null ? band.getName() : "band " + band.getOrder();
            boolean last = i == bands.size() - 1;

            if (band.getMinAmount() != expectedMin) {
                problems.add(label + " starts at " + band.getMinAmount() + ", expected " + expectedMin);
            }
            checkRate(label + " rate", band.getRate(), problems);

            if (band.getMaxAmount() == null) {
                if (!last) {
                    problems.add(label + " is open-ended but is not the last band");
                    return;
                }
            } else {
                if (band.getMaxAmount() <= band.getMinAmount()) {
                    problems.add(label + " has maxAmount not above minAmount");
                }
                expectedMin = band.getMaxAmount();
            }
        }
    }

    private static void validatePersonalDeduction(PersonalDeduction deduction, List<String> problems) {
        if (deduction == null) {
            problems.add("personalDeduction is required");
            return;
        }
        if (deduction.getType() == null) {
            problems.add("personalDeduction.type is required");
        } else {
            switch (deduction.getType()) {
                case FIXED -> {
                    if (deduction.getFixedAmount() == null || deduction.getFixedAmount() < 0) {
                        problems.add("fixed personal deduction needs a non-negative fixedAmount");
                    }
                }
                case PERCENTAGE -> {
                    if (deduction.getPercentage() == null) {
                        problems.add("percentage personal deduction needs a percentage");
                    } else {
                        checkRate("personalDeduction.percentage", deduction.getPercentage(), problems);
                    }
                }
                case FORMULA -> {
                    if (deduction.getFormula() == null || deduction.getFormula().isBlank()) {
                        problems.add("formula personal deduction needs a formula");
                    }
                }
            }
        }
        if (deduction.getBasis() == null) {
            problems.add("personalDeduction.basis is required");
        }
        if (deduction.getMinAmount() != null && deduction.getMaxAmount() != null
                && deduction.getMinAmount() > deduction.getMaxAmount()) {
            problems.add("personalDeduction.minAmount exceeds maxAmount");
        }
    }

    private static void checkRate(String name, double rate, List<String> problems) {
        if (!(rate >= 0 && rate <= 1)) {
            problems.add(name + " must be between 0 and 1");
        }
    }
}
