package com.payroll.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class TaxSettings {
    @JsonProperty("numberOfDependents")
    private Integer numberOfDependents;

    public TaxSettings() {}

    public TaxSettings(Integer numberOfDependents) {
        this.numberOfDependents = numberOfDependents;
    }

    public Integer getNumberOfDependents() { return numberOfDependents; }
    public void setNumberOfDependents(Integer numberOfDependents) { this.numberOfDependents = numberOfDependents; }
}
