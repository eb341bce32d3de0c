package com.parkalot.parking.dto.request;

import jakarta.validation.constraints.NotNull;

public record CreateSpacePaymentRequest(@NotNull Long bookingId) {
}
