package com.parkalot.parking.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Kind of booking a payment settles. */
@Getter
@RequiredArgsConstructor
public enum BookingType implements CodedEnum {

    GARAGE("garage"),
    CUSTOMER_SPACE("customer_space"),
    AIRPORT("airport");

    @JsonValue
    private final String code;

    @JsonCreator
    public static BookingType from(String code) {
        return CodedEnum.fromCode(BookingType.class, code);
    }

    @jakarta.persistence.Converter
    public static class DbConverter extends CodedEnumConverter<BookingType> {
        public DbConverter() {
            super(BookingType.class);
        }
    }
}
