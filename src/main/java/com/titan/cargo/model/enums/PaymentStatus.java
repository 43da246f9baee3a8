package com.titan.cargo.model.enums;

import lombok.Getter;

@Getter
public enum PaymentStatus implements CodedEnum {
    PENDING("pending"),
    PAID("paid"),
    REFUNDED("refunded");

    private final String value;

    PaymentStatus(String value) {
        this.value = value;
    }
}
