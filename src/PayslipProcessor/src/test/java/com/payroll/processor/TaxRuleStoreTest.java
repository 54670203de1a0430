package com.payroll.processor;

import com.payroll.engine.model.DeductionBasis;
import com.payroll.engine.model.IncomeTaxRule;
import com.payroll.engine.model.PersonalDeduction;
import com.payroll.engine.model.SocialSecurityRule;
import com.payroll.engine.model.TaxBand;
import com.payroll.engine.tax.InvalidTaxRuleException;
import com.payroll.engine.tax.TaxRuleNotConfiguredException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaxRuleStoreTest {

    private final TaxRuleStore store = new TaxRuleStore();

    @Test
    void returnsRuleForJurisdictionAndYear() {
        IncomeTaxRule rule = rule(2024, 0.28);
        store.put(rule);

        assertThat(store.requireIncomeTaxRule("GY", 2024)).isSameAs(rule);
    }

    @Test
    void laterRuleReplacesEarlierOne() {
        store.put(rule(2024, 0.28));
        store.put(rule(2024, 0.25));

        assertThat(store.requireIncomeTaxRule("GY", 2024).getTaxBands().get(0).getRate()).isEqualTo(0.25);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void missingRuleNamesJurisdictionAndYear() {
        store.put(rule(2024, 0.28));

        assertThatThrownBy(() -> store.requireIncomeTaxRule("GY", 2025))
            .isInstanceOf(TaxRuleNotConfiguredException.class)
            .hasMessage("Tax rules not configured for jurisdiction GY and year 2025");
        assertThatThrownBy(() -> store.requireSocialSecurityRule("GY", 2024))
            .isInstanceOf(TaxRuleNotConfiguredException.class);
    }

    @Test
    void invalidRuleIsNotStored() {
        SocialSecurityRule nis = new SocialSecurityRule("GY", 2024, 1.5, 0.084);

        assertThatThrownBy(() -> store.put(nis)).isInstanceOf(InvalidTaxRuleException.class);
        assertThat(store.size()).isZero();
    }

    @Test
    void incomeTaxAndSocialSecurityRulesAreKeptApart() {
        store.put(rule(2024, 0.28));
        store.put(new SocialSecurityRule("GY", 2024, 0.056, 0.084));

        assertThat(store.requireSocialSecurityRule("GY", 2024).getEmployeeRate()).isEqualTo(0.056);
        assertThat(store.size()).isEqualTo(2);
    }

    private static IncomeTaxRule rule(int year, double rate) {
        return new IncomeTaxRule("GY", year,
            List.of(new TaxBand(1, "Flat", 0, null, rate)),
            PersonalDeduction.fixed(100_000, DeductionBasis.ANNUAL));
    }
}
