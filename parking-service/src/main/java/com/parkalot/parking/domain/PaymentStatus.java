package com.parkalot.parking.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum PaymentStatus implements CodedEnum {

    PENDING("pending"),
    SUCCEEDED("succeeded"),
    FAILED("failed"),
    REFUNDED("refunded"),
    PARTIAL_REFUND("partial_refund");

    @JsonValue
    private final String code;

    @JsonCreator
    public static PaymentStatus from(String code) {
        return CodedEnum.fromCode(PaymentStatus.class, code);
    }

    @jakarta.persistence.Converter
    public static class DbConverter extends CodedEnumConverter<PaymentStatus> {
        public DbConverter() {
            super(PaymentStatus.class);
        }
    }
}
