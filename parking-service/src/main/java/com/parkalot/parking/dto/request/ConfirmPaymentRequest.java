package com.parkalot.parking.dto.request;

import jakarta.validation.constraints.NotBlank;

public record ConfirmPaymentRequest(@NotBlank String paymentIntentId) {
}
