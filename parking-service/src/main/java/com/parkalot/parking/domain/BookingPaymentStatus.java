package com.parkalot.parking.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Payment state as tracked on a customer space booking. */
@Getter
@RequiredArgsConstructor
public enum BookingPaymentStatus implements CodedEnum {

    PENDING("pending"),
    PAID("paid"),
    PARTIAL_REFUND("partial_refund"),
    REFUNDED("refunded"),
    FAILED("failed");

    @JsonValue
    private final String code;

    @JsonCreator
    public static BookingPaymentStatus from(String code) {
        return CodedEnum.fromCode(BookingPaymentStatus.class, code);
    }

    @jakarta.persistence.Converter
    public static class DbConverter extends CodedEnumConverter<BookingPaymentStatus> {
        public DbConverter() {
            super(BookingPaymentStatus.class);
        }
    }
}
