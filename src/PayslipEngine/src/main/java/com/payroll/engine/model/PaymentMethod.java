package com.payroll.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum PaymentMethod {
    @JsonProperty("bank_transfer") BANK_TRANSFER,
    @JsonProperty("cheque") CHEQUE,
    @JsonProperty("cash") CASH
}
