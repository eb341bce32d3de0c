package com.parkalot.parking.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a customer space booking.
 * <pre>
 * pending -> confirmed -> active -> completed
 *    \           \          \
 *     +-----------+----------+--> cancelled | disputed
 * </pre>
 * completed, cancelled and disputed accept no further transitions.
 */
@Getter
@RequiredArgsConstructor
public enum BookingStatus implements CodedEnum {

    PENDING("pending"),
    CONFIRMED("confirmed"),
    ACTIVE("active"),
    COMPLETED("completed"),
    CANCELLED("cancelled"),
    DISPUTED("disputed");

    /** Statuses that hold the space's time slot. */
    public static final Set<BookingStatus> OCCUPYING = EnumSet.of(PENDING, CONFIRMED, ACTIVE);

    @JsonValue
    private final String code;

    public boolean canTransitionTo(BookingStatus target) {
        if (isTerminal()) {
            return false;
        }
        if (target == CANCELLED || target == DISPUTED) {
            return true;
        }
        return (this == PENDING && target == CONFIRMED)
                || (this == CONFIRMED && target == ACTIVE)
                || (this == ACTIVE && target == COMPLETED);
    }

    public boolean isTerminal() {
        return !OCCUPYING.contains(this);
    }

    @JsonCreator
    public static BookingStatus from(String code) {
        return CodedEnum.fromCode(BookingStatus.class, code);
    }

    @jakarta.persistence.Converter
    public static class DbConverter extends CodedEnumConverter<BookingStatus> {
        public DbConverter() {
            super(BookingStatus.class);
        }
    }
}
