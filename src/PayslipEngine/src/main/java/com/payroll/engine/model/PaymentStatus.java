package com.payroll.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum PaymentStatus {
    @JsonProperty("pending") PENDING,
    @JsonProperty("paid") PAID,
    @JsonProperty("failed") FAILED,
    @JsonProperty("cancelled") CANCELLED
}
