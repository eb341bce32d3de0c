package com.parkalot.parking.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum SpaceType implements CodedEnum {

    DRIVEWAY("driveway"),
    GARAGE("garage"),
    PARKING_SPOT("parking_spot"),
    CAR_PARK("car_park");

    @JsonValue
    private final String code;

    @JsonCreator
    public static SpaceType from(String code) {
        return CodedEnum.fromCode(SpaceType.class, code);
    }

    @jakarta.persistence.Converter
    public static class DbConverter extends CodedEnumConverter<SpaceType> {
        public DbConverter() {
            super(SpaceType.class);
        }
    }
}
