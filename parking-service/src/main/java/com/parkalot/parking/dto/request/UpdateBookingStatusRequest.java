package com.parkalot.parking.dto.request;

import com.parkalot.parking.domain.BookingStatus;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record UpdateBookingStatusRequest(
        @NotNull BookingStatus status,
        @Size(max = 500) String reason
) {
}
