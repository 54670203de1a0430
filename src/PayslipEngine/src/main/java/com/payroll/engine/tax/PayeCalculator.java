package com.payroll.engine.tax;

import com.payroll.engine.formula.FormulaEvaluator;
import com.payroll.engine.model.BandAllocation;
import com.payroll.engine.model.DeductionBasis;
import com.payroll.engine.model.IncomeTaxRule;
import com.payroll.engine.model.PersonalDeduction;
import com.payroll.engine.model.TaxBand;
import com.payroll.engine.rounding.Rounding;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Annualized PAYE: personal deduction, progressive bands, then rounding per the rule.
 * Rule lookup and validation happen before this class is called.
 */
public class PayeCalculator {

    private static final int MONTHS_PER_YEAR = 12;

    private final FormulaEvaluator formulaEvaluator;

    public PayeCalculator() {
        this(new FormulaEvaluator());
    }

    public PayeCalculator(FormulaEvaluator formulaEvaluator) {
        this.formulaEvaluator = Objects.requireNonNull(formulaEvaluator, "formulaEvaluator");
    }

    public PayeResult calculate(long annualGrossSalary, IncomeTaxRule taxRule, int dependents) {
        return calculate(annualGrossSalary, taxRule, dependents, 0);
    }

    /**
     * @param customDeduction extra annual deduction in cents, added on top of the rule's personal deduction
     */
    public PayeResult calculate(long annualGrossSalary, IncomeTaxRule taxRule, int dependents, long customDeduction) {
        Objects.requireNonNull(taxRule, "taxRule");

        long personalDeduction = personalDeduction(annualGrossSalary, taxRule.getPersonalDeduction(), dependents)
            + customDeduction;
        long taxableIncome = Math.max(0, annualGrossSalary - personalDeduction);

        List<TaxBand> bands = new ArrayList<>(taxRule.getTaxBands());
        bands.sort(Comparator.comparingInt(TaxBand::getOrder));

        List<BandAllocation> allocations = new ArrayList<>();
        long remainingIncome = taxableIncome;
        double totalTax = 0.0;
        for (TaxBand band : bands) {
            if (remainingIncome <= 0) break;
            long bandWidth = band.getMaxAmount() == null
                ? Long.MAX_VALUE
                : band.getMaxAmount() - band.getMinAmount();
            long amountInBand = Math.min(remainingIncome, bandWidth);
            if (amountInBand <= 0) continue;

            double bandTax = amountInBand * band.getRate();
            allocations.add(new BandAllocation(band.getName(), amountInBand, band.getRate(), bandTax));
            totalTax += bandTax;
            remainingIncome -= amountInBand;
        }

        long annualTax = Rounding.round(totalTax, taxRule.getRoundingMode(), taxRule.getRoundingPrecision());
        long monthlyTax = Rounding.round((double) annualTax / MONTHS_PER_YEAR,
            taxRule.getRoundingMode(), taxRule.getRoundingPrecision());

        double effectiveTaxRate = annualGrossSalary > 0 ? (double) annualTax / annualGrossSalary * 100 : 0;
        double marginalTaxRate = allocations.isEmpty() ? 0 : allocations.get(allocations.size() - 1).getRate() * 100;

        return new PayeResult(annualGrossSalary, personalDeduction, taxableIncome, allocations,
            annualTax, monthlyTax, effectiveTaxRate, marginalTaxRate,
            taxRule.getJurisdictionId(), taxRule.getTaxYear());
    }

    /**
     * Cumulative tax owed on year-to-date gross, treating the YTD figure as the annual salary.
     */
    public long calculateYtdPaye(long ytdGrossEarnings, IncomeTaxRule taxRule, int dependents) {
        return calculate(ytdGrossEarnings, taxRule, dependents).getAnnualTax();
    }

    private long personalDeduction(long annualGrossSalary, PersonalDeduction deduction, int dependents) {
        if (deduction == null) return 0;

        double amount = switch (deduction.getType()) {
            case FIXED -> deduction.getFixedAmount() != null ? deduction.getFixedAmount() : 0;
            case PERCENTAGE -> deduction.getPercentage() != null ? annualGrossSalary * deduction.getPercentage() : 0;
            case FORMULA -> deduction.getFormula() != null
                ? formulaEvaluator.evaluate(deduction.getFormula(), Map.of(
                    "gross", (double) annualGrossSalary / MONTHS_PER_YEAR,
                    "annualGross", (double) annualGrossSalary,
                    "dependents", (double) dependents))
                : 0;
        };

        if (deduction.getMinAmount() != null && amount < deduction.getMinAmount()) {
            amount = deduction.getMinAmount();
        }
        if (deduction.getMaxAmount() != null && amount > deduction.getMaxAmount()) {
            amount = deduction.getMaxAmount();
        }
        if (deduction.getBasis() == DeductionBasis.MONTHLY) {
            amount *= MONTHS_PER_YEAR;
        }
        return Rounding.toCents(amount);
    }
}
