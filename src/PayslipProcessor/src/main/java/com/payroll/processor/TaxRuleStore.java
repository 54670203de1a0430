package com.payroll.processor;

import com.payroll.engine.model.IncomeTaxRule;
import com.payroll.engine.model.SocialSecurityRule;
import com.payroll.engine.tax.TaxRuleNotConfiguredException;
import com.payroll.engine.tax.TaxRuleValidator;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest validated tax rules, keyed by jurisdiction and year.
 *
 * Shared by every processor instance so a rule ingested on one partition is
 * visible to payslip requests on any other.
 */
public class TaxRuleStore {

    private final ConcurrentHashMap<String, IncomeTaxRule> incomeTaxRules = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, SocialSecurityRule> socialSecurityRules = new ConcurrentHashMap<>();

    /**
     * @throws com.payroll.engine.tax.InvalidTaxRuleException if the rule fails validation; the previous rule is kept
     */
    public void put(IncomeTaxRule rule) {
        TaxRuleValidator.validate(rule);
        incomeTaxRules.put(key(rule.getJurisdictionId(), rule.getTaxYear()), rule);
    }

    public void put(SocialSecurityRule rule) {
        TaxRuleValidator.validate(rule);
        socialSecurityRules.put(key(rule.getJurisdictionId(), rule.getYear()), rule);
    }

    public IncomeTaxRule requireIncomeTaxRule(String jurisdictionId, int taxYear) {
        IncomeTaxRule rule = incomeTaxRules.get(key(jurisdictionId, taxYear));
        if (rule == null) {
            throw new TaxRuleNotConfiguredException(jurisdictionId, taxYear);
        }
        return rule;
    }

    public SocialSecurityRule requireSocialSecurityRule(String jurisdictionId, int year) {
        SocialSecurityRule rule = socialSecurityRules.get(key(jurisdictionId, year));
        if (rule == null) {
            throw new TaxRuleNotConfiguredException(jurisdictionId, year);
        }
        return rule;
    }

    public int size() {
        return incomeTaxRules.size() + socialSecurityRules.size();
    }

    private static String key(String jurisdictionId, int year) {
        return jurisdictionId + ":" + year;
    }
}
