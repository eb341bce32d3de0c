package com.parkalot.parking.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum CancelledBy implements CodedEnum {

    RENTER("renter"),
    OWNER("owner");

    @JsonValue
    private final String code;

    @JsonCreator
    public static CancelledBy from(String code) {
        return CodedEnum.fromCode(CancelledBy.class, code);
    }

    @jakarta.persistence.Converter
    public static class DbConverter extends CodedEnumConverter<CancelledBy> {
        public DbConverter() {
            super(CancelledBy.class);
        }
    }
}
