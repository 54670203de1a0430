package com.payroll.engine.tax;

import com.payroll.engine.model.BandAllocation;
import com.payroll.engine.model.DeductionBasis;
import com.payroll.engine.model.IncomeTaxRule;
import com.payroll.engine.model.PersonalDeduction;
import com.payroll.engine.model.TaxBand;
import com.payroll.engine.rounding.RoundingMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PayeCalculatorTest {

    private final PayeCalculator calculator = new PayeCalculator();

    private static IncomeTaxRule twoBandRule(PersonalDeduction deduction) {
        return new IncomeTaxRule("GY", 2024, List.of(
            new TaxBand(1, "First band", 0, 100_000L, 0.10),
            new TaxBand(2, "Second band", 100_000, null, 0.20)), deduction);
    }

    @Nested
    @DisplayName("Progressive bands")
    class Bands {

        @Test
        void taxEqualsSumOfBandContributions() {
            PayeResult result = calculator.calculate(150_000, twoBandRule(PersonalDeduction.fixed(0, DeductionBasis.ANNUAL)), 0);

            assertThat(result.getTaxableIncome()).isEqualTo(150_000);
            assertThat(result.getAnnualTax()).isEqualTo(20_000);
            assertThat(result.getTaxBands()).extracting(BandAllocation::getAmount).containsExactly(100_000L, 50_000L);
            assertThat(result.getTaxBands().stream().mapToDouble(BandAllocation::getTax).sum())
                .isCloseTo(20_000, within(1e-6));
            assertThat(result.getMarginalTaxRate()).isCloseTo(20, within(1e-9));
        }

        @Test
        void walksBandsInOrderRegardlessOfListPosition() {
            IncomeTaxRule rule = new IncomeTaxRule("GY", 2024, List.of(
                new TaxBand(2, "Second band", 100_000, null, 0.20),
                new TaxBand(1, "First band", 0, 100_000L, 0.10)), PersonalDeduction.fixed(0, DeductionBasis.ANNUAL));

            PayeResult result = calculator.calculate(150_000, rule, 0);

            assertThat(result.getTaxBands()).extracting(BandAllocation::getBandName)
                .containsExactly("First band", "Second band");
            assertThat(result.getAnnualTax()).isEqualTo(20_000);
        }

        @Test
        void incomeWithinFirstBandUsesOnlyThatBand() {
            PayeResult result = calculator.calculate(80_000, twoBandRule(PersonalDeduction.fixed(0, DeductionBasis.ANNUAL)), 0);

            assertThat(result.getTaxBands()).hasSize(1);
            assertThat(result.getAnnualTax()).isEqualTo(8_000);
            assertThat(result.getMarginalTaxRate()).isCloseTo(10, within(1e-9));
        }

        @Test
        void noTaxableIncomeMeansNoTax() {
            PayeResult result = calculator.calculate(50_000, twoBandRule(PersonalDeduction.fixed(80_000, DeductionBasis.ANNUAL)), 0);

            assertThat(result.getTaxableIncome()).isZero();
            assertThat(result.getAnnualTax()).isZero();
            assertThat(result.getTaxBands()).isEmpty();
            assertThat(result.getMarginalTaxRate()).isZero();
        }

        @Test
        void zeroGrossHasZeroEffectiveRate() {
            PayeResult result = calculator.calculate(0, twoBandRule(PersonalDeduction.fixed(0, DeductionBasis.ANNUAL)), 0);

            assertThat(result.getEffectiveTaxRate()).isZero();
        }
    }

    @Nested
    @DisplayName("Personal deduction")
    class PersonalDeductions {

        @Test
        void monthlyBasisIsAnnualized() {
            PayeResult result = calculator.calculate(600_000,
                twoBandRule(PersonalDeduction.fixed(10_000, DeductionBasis.MONTHLY)), 0);

            assertThat(result.getPersonalDeduction()).isEqualTo(120_000);
            assertThat(result.getTaxableIncome()).isEqualTo(480_000);
        }

        @Test
        void percentageOfAnnualGross() {
            PayeResult result = calculator.calculate(1_000_000,
                twoBandRule(PersonalDeduction.percentage(0.25, DeductionBasis.ANNUAL)), 0);

            assertThat(result.getPersonalDeduction()).isEqualTo(250_000);
        }

        @Test
        void clampsBeforeAnnualizing() {
            PersonalDeduction deduction = PersonalDeduction.percentage(0.5, DeductionBasis.MONTHLY);
            deduction.setMaxAmount(20_000L);

            PayeResult result = calculator.calculate(1_200_000, twoBandRule(deduction), 0);

            assertThat(result.getPersonalDeduction()).isEqualTo(240_000);
        }

        @Test
        void appliesMinimum() {
            PersonalDeduction deduction = PersonalDeduction.percentage(0.01, DeductionBasis.ANNUAL);
            deduction.setMinAmount(50_000L);

            PayeResult result = calculator.calculate(1_000_000, twoBandRule(deduction), 0);

            assertThat(result.getPersonalDeduction()).isEqualTo(50_000);
        }

        @Test
        void formulaSeesGrossAnnualGrossAndDependents() {
            PayeResult result = calculator.calculate(1_200_000,
                twoBandRule(PersonalDeduction.formula("{gross} + {annualGross} * 0 + {dependents} * 1000", DeductionBasis.ANNUAL)), 3);

            assertThat(result.getPersonalDeduction()).isEqualTo(103_000);
        }

        @Test
        void guyanaFormulaTakesGreaterOfFloorAndShare() {
            IncomeTaxRule rule = new IncomeTaxRule("GY", 2024, List.of(
                new TaxBand(1, "25%", 0, 3_120_000L, 0.25),
                new TaxBand(2, "35%", 3_120_000, null, 0.35)),
                PersonalDeduction.formula("MAX(1560000, {annualGross} * 0.333)", DeductionBasis.ANNUAL));

            PayeResult result = calculator.calculate(6_600_000, rule, 0);

            assertThat(result.getPersonalDeduction()).isEqualTo(2_197_800);
            assertThat(result.getTaxableIncome()).isEqualTo(4_402_200);
            // 3,120,000 * 25% + 1,282,200 * 35%
            assertThat(result.getAnnualTax()).isEqualTo(1_228_770);
            assertThat(result.getMonthlyTax()).isEqualTo(102_398);
        }

        @Test
        void brokenFormulaMeansNoDeduction() {
            PayeResult result = calculator.calculate(150_000,
                twoBandRule(PersonalDeduction.formula("{unknown} * 2", DeductionBasis.ANNUAL)), 0);

            assertThat(result.getPersonalDeduction()).isZero();
            assertThat(result.getAnnualTax()).isEqualTo(20_000);
        }

        @Test
        void customDeductionIsAddedOnTop() {
            PayeResult result = calculator.calculate(300_000,
                twoBandRule(PersonalDeduction.fixed(100_000, DeductionBasis.ANNUAL)), 0, 50_000);

            assertThat(result.getPersonalDeduction()).isEqualTo(150_000);
            assertThat(result.getTaxableIncome()).isEqualTo(150_000);
        }
    }

    @Test
    void roundsAnnualAndMonthlyTaxWithRuleMode() {
        IncomeTaxRule rule = new IncomeTaxRule("GY", 2024,
            List.of(new TaxBand(1, "Flat", 0, null, 0.10)), PersonalDeduction.fixed(100_000, DeductionBasis.ANNUAL));

        PayeResult nearest = calculator.calculate(6_600_000, rule, 0);
        assertThat(nearest.getAnnualTax()).isEqualTo(650_000);
        assertThat(nearest.getMonthlyTax()).isEqualTo(54_167);

        rule.setRoundingMode(RoundingMode.FLOOR);
        assertThat(calculator.calculate(6_600_000, rule, 0).getMonthlyTax()).isEqualTo(54_166);

        rule.setRoundingMode(RoundingMode.NEAREST);
        rule.setRoundingPrecision(100);
        assertThat(calculator.calculate(6_600_000, rule, 0).getMonthlyTax()).isEqualTo(54_200);
    }

    @Test
    void reportsSourceJurisdictionAndRates() {
        PayeResult result = calculator.calculate(150_000, twoBandRule(PersonalDeduction.fixed(0, DeductionBasis.ANNUAL)), 0);

        assertThat(result.getJurisdictionId()).isEqualTo("GY");
        assertThat(result.getTaxYear()).isEqualTo(2024);
        assertThat(result.getEffectiveTaxRate()).isCloseTo(20_000.0 / 150_000 * 100, within(1e-9));
    }

    @Test
    void ytdPayeIsAnnualTaxOnYtdGross() {
        IncomeTaxRule rule = twoBandRule(PersonalDeduction.fixed(0, DeductionBasis.ANNUAL));

        assertThat(calculator.calculateYtdPaye(150_000, rule, 0)).isEqualTo(20_000);
    }
}
