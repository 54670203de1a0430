package com.payroll.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One progressive band of an income-tax rule, in annual cents.
 * A null {@code maxAmount} means the band is open-ended.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TaxBand {
    @JsonProperty("order")
    private int order;

    @JsonProperty("name")
    private String name;

    @JsonProperty("minAmount")
    private long minAmount;

    @JsonProperty("maxAmount")
    private Long maxAmount;

    @JsonProperty("rate")
    private double rate;

    @JsonProperty("flatAmount")
    private Long flatAmount;

    public TaxBand() {}

    public TaxBand(int order, String name, long minAmount, Long maxAmount, double rate) {
        this.order = order;
        this.name = name;
        this.minAmount = minAmount;
        this.maxAmount = maxAmount;
        this.rate = rate;
    }

    public int getOrder() { return order; }
    public void setOrder(int order) { this.order = order; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public long getMinAmount() { return minAmount; }
    public void setMinAmount(long minAmount) { this.minAmount = minAmount; }

    public Long getMaxAmount() { return maxAmount; }
    public void setMaxAmount(Long maxAmount) { this.maxAmount = maxAmount; }

    public double getRate() { return rate; }
    public void setRate(double rate) { this.rate = rate; }

    public Long getFlatAmount() { return flatAmount; }
    public void setFlatAmount(Long flatAmount) { this.flatAmount = flatAmount; }
}
