package com.parkalot.parking.dto.request;

import com.parkalot.parking.domain.BookingType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

public record CreatePaymentIntentRequest(
        @NotNull @Positive BigDecimal amount,
        @NotNull BookingType bookingType,
        Long bookingId,
        Long spaceId
) {
}
