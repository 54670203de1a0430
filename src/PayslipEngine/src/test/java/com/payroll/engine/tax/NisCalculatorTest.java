package com.payroll.engine.tax;

import com.payroll.engine.model.SocialSecurityRule;
import com.payroll.engine.rounding.RoundingMode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NisCalculatorTest {

    private final NisCalculator calculator = new NisCalculator();

    private static SocialSecurityRule guyanaRule() {
        return new SocialSecurityRule("GY", 2024, 0.056, 0.084);
    }

    @Test
    void contributesOnFullEarningsWithoutLimits() {
        NisResult result = calculator.calculate(550_000, guyanaRule());

        assertThat(result.getNisableEarnings()).isEqualTo(550_000);
        assertThat(result.getEmployeeContribution()).isEqualTo(30_800);
        assertThat(result.getEmployerContribution()).isEqualTo(46_200);
        assertThat(result.getTotalContribution()).isEqualTo(77_000);
        assertThat(result.isCeilingApplied()).isFalse();
    }

    @Test
    void capsEarningsAtCeiling() {
        SocialSecurityRule rule = guyanaRule();
        rule.setEarningsCeiling(400_000L);

        NisResult result = calculator.calculate(500_000, rule);

        assertThat(result.getGrossEarnings()).isEqualTo(500_000);
        assertThat(result.getNisableEarnings()).isEqualTo(400_000);
        assertThat(result.getEmployeeContribution()).isEqualTo(22_400);
        assertThat(result.isCeilingApplied()).isTrue();
        assertThat(result.getEarningsCeiling()).isEqualTo(400_000L);
    }

    @Test
    void earningsAtCeilingAreNotCapped() {
        SocialSecurityRule rule = guyanaRule();
        rule.setEarningsCeiling(400_000L);

        assertThat(calculator.calculate(400_000, rule).isCeilingApplied()).isFalse();
    }

    @Test
    void belowFloorContributesNothing() {
        SocialSecurityRule rule = guyanaRule();
        rule.setEarningsFloor(100_000L);

        NisResult result = calculator.calculate(99_999, rule);

        assertThat(result.getNisableEarnings()).isZero();
        assertThat(result.getEmployeeContribution()).isZero();
        assertThat(result.getEmployerContribution()).isZero();
        assertThat(result.getTotalContribution()).isZero();
    }

    @Test
    void atFloorContributesInFull() {
        SocialSecurityRule rule = guyanaRule();
        rule.setEarningsFloor(100_000L);

        assertThat(calculator.calculate(100_000, rule).getEmployeeContribution()).isEqualTo(5_600);
    }

    @Test
    void roundsWithRuleMode() {
        SocialSecurityRule rule = guyanaRule();
        rule.setRoundingMode(RoundingMode.CEIL);
        rule.setRoundingPrecision(100);

        NisResult result = calculator.calculate(123_456, rule);

        // 6913.536 and 10370.304 cents
        assertThat(result.getEmployeeContribution()).isEqualTo(7_000);
        assertThat(result.getEmployerContribution()).isEqualTo(10_400);
        assertThat(result.getEmployeeRate()).isEqualTo(0.056);
        assertThat(result.getJurisdictionId()).isEqualTo("GY");
        assertThat(result.getYear()).isEqualTo(2024);
    }
}
