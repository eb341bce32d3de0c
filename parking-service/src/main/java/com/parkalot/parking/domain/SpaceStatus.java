package com.parkalot.parking.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum SpaceStatus implements CodedEnum {

    PENDING("pending"),
    ACTIVE("active"),
    PAUSED("paused"),
    REJECTED("rejected");

    @JsonValue
    private final String code;

    @JsonCreator
    public static SpaceStatus from(String code) {
        return CodedEnum.fromCode(SpaceStatus.class, code);
    }

    @jakarta.persistence.Converter
    public static class DbConverter extends CodedEnumConverter<SpaceStatus> {
        public DbConverter() {
            super(SpaceStatus.class);
        }
    }
}
