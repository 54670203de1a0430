package com.payroll.engine.tax;

import com.payroll.engine.model.DeductionBasis;
import com.payroll.engine.model.IncomeTaxRule;
import com.payroll.engine.model.PersonalDeduction;
import com.payroll.engine.model.SocialSecurityRule;
import com.payroll.engine.model.TaxBand;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaxRuleValidatorTest {

    private static IncomeTaxRule rule(List<TaxBand> bands) {
        return new IncomeTaxRule("GY", 2024, bands, PersonalDeduction.fixed(100_000, DeductionBasis.ANNUAL));
    }

    @Test
    void acceptsContiguousBands() {
        IncomeTaxRule rule = rule(List.of(
            new TaxBand(1, "First", 0, 3_120_000L, 0.25),
            new TaxBand(2, "Second", 3_120_000, null, 0.35)));

        assertThatCode(() -> TaxRuleValidator.validate(rule)).doesNotThrowAnyException();
    }

    @Test
    void rejectsGapBetweenBands() {
        IncomeTaxRule rule = rule(List.of(
            new TaxBand(1, "First", 0, 100_000L, 0.10),
            new TaxBand(2, "Second", 150_000, null, 0.20)));

        assertThatThrownBy(() -> TaxRuleValidator.validate(rule))
            .isInstanceOf(InvalidTaxRuleException.class)
            .hasMessageContaining("Second starts at 150000, expected 100000");
    }

    @Test
    void rejectsBandsNotStartingAtZero() {
        IncomeTaxRule rule = rule(List.of(new TaxBand(1, "Only", 10, null, 0.10)));

        assertThatThrownBy(() -> TaxRuleValidator.validate(rule))
            .isInstanceOf(InvalidTaxRuleException.class)
            .hasMessageContaining("expected 0");
    }

    @Test
    void rejectsOpenEndedBandBeforeLast() {
        IncomeTaxRule rule = rule(List.of(
            new TaxBand(1, "First", 0, null, 0.10),
            new TaxBand(2, "Second", 100_000, null, 0.20)));

        assertThatThrownBy(() -> TaxRuleValidator.validate(rule))
            .isInstanceOf(InvalidTaxRuleException.class)
            .hasMessageContaining("open-ended");
    }

    @Test
    void collectsEveryProblem() {
        IncomeTaxRule rule = rule(List.of(new TaxBand(1, "Only", 0, null, 1.5)));
        rule.setPersonalDeduction(PersonalDeduction.formula(" ", DeductionBasis.ANNUAL));
        rule.setRoundingPrecision(0);

        assertThatThrownBy(() -> TaxRuleValidator.validate(rule))
            .isInstanceOfSatisfying(InvalidTaxRuleException.class, e ->
                assertThat(e.getProblems()).hasSize(3));
    }

    @Test
    void rejectsFloorAboveCeiling() {
        SocialSecurityRule rule = new SocialSecurityRule("GY", 2024, 0.056, 0.084);
        rule.setEarningsFloor(500_000L);
        rule.setEarningsCeiling(400_000L);

        assertThatThrownBy(() -> TaxRuleValidator.validate(rule))
            .isInstanceOf(InvalidTaxRuleException.class)
            .hasMessageContaining("earningsFloor exceeds earningsCeiling");
    }

    @Test
    void rejectsRateOutsideUnitInterval() {
        SocialSecurityRule rule = new SocialSecurityRule("GY", 2024, 5.6, 0.084);

        assertThatThrownBy(() -> TaxRuleValidator.validate(rule))
            .isInstanceOf(InvalidTaxRuleException.class)
            .hasMessageContaining("employeeRate");
    }
}
