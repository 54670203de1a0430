package com.payroll.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Personal allowance subtracted from annual gross before the tax bands apply.
 * Which amount field is read depends on {@link #getType()}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PersonalDeduction {
    @JsonProperty("type")
    private PersonalDeductionType type;

    @JsonProperty("fixedAmount")
    private Long fixedAmount;

    @JsonProperty("percentage")
    private Double percentage;

    @JsonProperty("formula")
    private String formula;

    @JsonProperty("minAmount")
    private Long minAmount;

    @JsonProperty("maxAmount")
    private Long maxAmount;

    @JsonProperty("basis")
    private DeductionBasis basis = DeductionBasis.ANNUAL;

    @JsonProperty("description")
    private String description;

    public PersonalDeduction() {}

    public static PersonalDeduction fixed(long amount, DeductionBasis basis) {
        PersonalDeduction pd = new PersonalDeduction();
        pd.setType(PersonalDeductionType.FIXED);
        pd.setFixedAmount(amount);
        pd.setBasis(basis);
        return pd;
    }

    public static PersonalDeduction percentage(double percentage, DeductionBasis basis) {
        PersonalDeduction pd = new PersonalDeduction();
        pd.setType(PersonalDeductionType.PERCENTAGE);
        pd.setPercentage(percentage);
        pd.setBasis(basis);
        return pd;
    }

    public static PersonalDeduction formula(String formula, DeductionBasis basis) {
        PersonalDeduction pd = new PersonalDeduction();
        pd.setType(PersonalDeductionType.FORMULA);
        pd.setFormula(formula);
        pd.setBasis(basis);
        return pd;
    }

    public PersonalDeductionType getType() { return type; }
    public void setType(PersonalDeductionType type) { this.type = type; }

    public Long getFixedAmount() { return fixedAmount; }
    public void setFixedAmount(Long fixedAmount) { this.fixedAmount = fixedAmount; }

    public Double getPercentage() { return percentage; }
    public void setPercentage(Double percentage) { this.percentage = percentage; }

    public String getFormula() { return formula; }
    public void setFormula(String formula) { this.formula = formula; }

    public Long getMinAmount() { return minAmount; }
    public void setMinAmount(Long minAmount) { this.minAmount = minAmount; }

    public Long getMaxAmount() { return maxAmount; }
    public void setMaxAmount(Long maxAmount) { this.maxAmount = maxAmount; }

    public DeductionBasis getBasis() { return basis; }
    public void setBasis(DeductionBasis basis) { this.basis = basis; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
}
